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

import java.time.Instant;
import java.util.List;

/**
 * An action list awaiting confirmation, keyed by the platform-assigned token
 * of the prompt message. Only {@code requesterId} may confirm or decline it.
 */
public record PendingEntry(String token, String requesterId, String guildId, String channelId,
        List<AdminAction> actions, Instant createdAt) {

    public PendingEntry {
        actions = List.copyOf(actions);
    }

    public boolean isOwnedBy(String userId) {
        return requesterId != null && requesterId.equals(userId);
    }
}
