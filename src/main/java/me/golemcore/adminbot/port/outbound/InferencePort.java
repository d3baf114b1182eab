package me.golemcore.adminbot.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for text completion by a language model. Implementations return the
 * raw completion text; deadlines and interpretation belong to the caller.
 */
public interface InferencePort {

    /**
     * Requests a completion for a user message under a system prompt.
     *
     * @return future completing with the raw model text, or exceptionally on
     *         transport failure
     */
    CompletableFuture<String> complete(String systemPrompt, String userMessage);

    /**
     * Checks if the provider is configured.
     */
    boolean isAvailable();
}
