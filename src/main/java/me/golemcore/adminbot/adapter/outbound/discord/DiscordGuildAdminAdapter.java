package me.golemcore.adminbot.adapter.outbound.discord;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.adminbot.port.outbound.GuildAccess;
import me.golemcore.adminbot.port.outbound.GuildAdminPort;
import org.springframework.stereotype.Component;

/**
 * {@link GuildAdminPort} over the Discord REST API.
 */
@Component
@RequiredArgsConstructor
public class DiscordGuildAdminAdapter implements GuildAdminPort {

    private final DiscordRestClient client;

    @Override
    public GuildAccess forGuild(String guildId) {
        if (guildId == null || guildId.isBlank()) {
            throw new IllegalArgumentException("guildId is required");
        }
        return new DiscordGuildAccess(client, guildId);
    }

    @Override
    public boolean isAvailable() {
        return client.isConfigured();
    }
}
