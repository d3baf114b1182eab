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
 * Result of executing one {@link AdminAction}.
 *
 * <p>
 * {@code resultRef} (the id of the created or modified object) is present only
 * on success, {@code errorReason} only on failure. {@code detail} is the line
 * reported to the user for either case.
 */
public record ActionOutcome(AdminAction action, boolean succeeded, String resultRef, String errorReason,
        String detail) {

    public static ActionOutcome success(AdminAction action, String resultRef, String detail) {
        return new ActionOutcome(action, true, resultRef, null, detail);
    }

    public static ActionOutcome failure(AdminAction action, String errorReason) {
        return new ActionOutcome(action, false, null, errorReason, errorReason);
    }
}
