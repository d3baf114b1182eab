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
 * Result of a confirm or decline click on a pending action list.
 */
public record ResolutionResult(Resolution resolution, List<ActionOutcome> outcomes) {

    public enum Resolution {
        EXECUTED, DISCARDED, NO_SUCH_PENDING
    }

    public static ResolutionResult executed(List<ActionOutcome> outcomes) {
        return new ResolutionResult(Resolution.EXECUTED, List.copyOf(outcomes));
    }

    public static ResolutionResult discarded() {
        return new ResolutionResult(Resolution.DISCARDED, List.of());
    }

    public static ResolutionResult noSuchPending() {
        return new ResolutionResult(Resolution.NO_SUCH_PENDING, List.of());
    }
}
