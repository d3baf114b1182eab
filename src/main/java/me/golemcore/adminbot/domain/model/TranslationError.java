package me.golemcore.adminbot.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Why a translation failed. {@code index} is the zero-based position of the
 * offending element for element-level failures and {@code null} otherwise.
 */
public record TranslationError(TranslationFailureKind kind, Integer index, String reason) {

    public static TranslationError of(TranslationFailureKind kind, String reason) {
        return new TranslationError(kind, null, reason);
    }

    public static TranslationError atIndex(TranslationFailureKind kind, int index, String reason) {
        return new TranslationError(kind, index, reason);
    }
}
