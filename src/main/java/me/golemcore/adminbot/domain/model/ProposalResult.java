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
 * What happened to a freshly proposed action list: executed right away
 * (outcomes present), parked under {@code token} awaiting confirmation, or
 * rejected because its confirmation prompt would not fit in one message.
 */
public record ProposalResult(ConfirmationState state, String token, List<ActionOutcome> outcomes) {

    public static ProposalResult executed(List<ActionOutcome> outcomes) {
        return new ProposalResult(ConfirmationState.EXECUTED, null, List.copyOf(outcomes));
    }

    public static ProposalResult awaiting(String token) {
        return new ProposalResult(ConfirmationState.AWAITING_CONFIRMATION, token, List.of());
    }

    public static ProposalResult rejected() {
        return new ProposalResult(ConfirmationState.REJECTED, null, List.of());
    }
}
