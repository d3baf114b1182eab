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

import java.util.List;

/**
 * Either a complete, validated action list or the error that prevented one.
 * A failed translation never carries a partial list.
 */
public record TranslationResult(List<AdminAction> actions, TranslationError error) {

    public static TranslationResult success(List<AdminAction> actions) {
        return new TranslationResult(List.copyOf(actions), null);
    }

    public static TranslationResult failure(TranslationError error) {
        return new TranslationResult(List.of(), error);
    }

    public static TranslationResult failure(TranslationFailureKind kind, String reason) {
        return failure(TranslationError.of(kind, reason));
    }

    public boolean isSuccess() {
        return error == null;
    }
}
