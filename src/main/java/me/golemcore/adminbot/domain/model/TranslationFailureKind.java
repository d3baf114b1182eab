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
 * Machine-readable classification of translation failures.
 */
public enum TranslationFailureKind {

    /**
     * The inference call timed out or failed in transport.
     */
    INFERENCE_UNAVAILABLE,

    /**
     * The model output contained no syntactically valid JSON array.
     */
    MALFORMED_RESPONSE,

    /**
     * The model returned an empty action array.
     */
    EMPTY_PLAN,

    /**
     * An element named a kind outside the vocabulary.
     */
    UNKNOWN_ACTION_KIND,

    /**
     * An element violated the schema of its kind.
     */
    INVALID_ACTION
}
