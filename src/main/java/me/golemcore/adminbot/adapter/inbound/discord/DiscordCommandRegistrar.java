package me.golemcore.adminbot.adapter.inbound.discord;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.adminbot.adapter.outbound.discord.DiscordRestClient;
import me.golemcore.adminbot.infrastructure.config.BotProperties;
import me.golemcore.adminbot.port.outbound.GuildOperationException;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Overwrites the application's global slash commands on startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DiscordCommandRegistrar {

    private final BotProperties properties;
    private final DiscordRestClient client;

    @EventListener(ApplicationReadyEvent.class)
    public void registerCommands() {
        BotProperties.DiscordProperties discord = properties.getDiscord();
        if (!discord.isRegisterCommands()) {
            log.info("[Discord] Command registration disabled");
            return;
        }
        if (!client.isConfigured() || discord.getApplicationId() == null || discord.getApplicationId().isBlank()) {
            log.warn("[Discord] Token or application id missing, skipping command registration");
            return;
        }

        try {
            client.put("/applications/" + discord.getApplicationId() + "/commands",
                    DiscordCommandCatalog.definitions());
            log.info("[Discord] Registered {} slash command(s)", DiscordCommandCatalog.definitions().size());
        } catch (GuildOperationException e) {
            log.warn("[Discord] Failed to register commands: {}", e.getMessage());
        }
    }
}
