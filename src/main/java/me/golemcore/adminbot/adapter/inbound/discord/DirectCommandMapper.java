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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import me.golemcore.adminbot.domain.model.ActionKind;
import me.golemcore.adminbot.domain.model.AdminAction;
import me.golemcore.adminbot.domain.schema.ActionSchema;
import me.golemcore.adminbot.infrastructure.i18n.MessageService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

import static me.golemcore.adminbot.adapter.inbound.discord.DiscordCommandCatalog.ASSIGN_ROLE;
import static me.golemcore.adminbot.adapter.inbound.discord.DiscordCommandCatalog.CHANNEL_PERMISSIONS;
import static me.golemcore.adminbot.adapter.inbound.discord.DiscordCommandCatalog.CREATE_CATEGORY;
import static me.golemcore.adminbot.adapter.inbound.discord.DiscordCommandCatalog.CREATE_CHANNEL;
import static me.golemcore.adminbot.adapter.inbound.discord.DiscordCommandCatalog.CREATE_ROLE;
import static me.golemcore.adminbot.adapter.inbound.discord.DiscordCommandCatalog.DELETE_CHANNEL;
import static me.golemcore.adminbot.adapter.inbound.discord.DiscordCommandCatalog.LOCK_CHANNEL;
import static me.golemcore.adminbot.adapter.inbound.discord.DiscordCommandCatalog.OPT_CATEGORY;
import static me.golemcore.adminbot.adapter.inbound.discord.DiscordCommandCatalog.OPT_CHANNEL;
import static me.golemcore.adminbot.adapter.inbound.discord.DiscordCommandCatalog.OPT_CHANNEL_TYPE;
import static me.golemcore.adminbot.adapter.inbound.discord.DiscordCommandCatalog.OPT_COLOR;
import static me.golemcore.adminbot.adapter.inbound.discord.DiscordCommandCatalog.OPT_NAME;
import static me.golemcore.adminbot.adapter.inbound.discord.DiscordCommandCatalog.OPT_ROLE;
import static me.golemcore.adminbot.adapter.inbound.discord.DiscordCommandCatalog.OPT_USER;
import static me.golemcore.adminbot.adapter.inbound.discord.DiscordCommandCatalog.PERMISSION_OPTIONS;
import static me.golemcore.adminbot.adapter.inbound.discord.DiscordCommandCatalog.REMOVE_ROLE;
import static me.golemcore.adminbot.adapter.inbound.discord.DiscordCommandCatalog.UNLOCK_CHANNEL;

/**
 * Builds the single {@link AdminAction} behind a direct slash command.
 *
 * <p>
 * Options of type user, role and channel arrive as ids, which the guild
 * access resolves like any other reference. Invalid input is reported with an
 * {@link IllegalArgumentException} whose message can be shown to the user.
 */
@Component
@RequiredArgsConstructor
public class DirectCommandMapper {

    private final MessageService messageService;

    /**
     * @param options
     *            command options keyed by option name
     */
    public AdminAction map(String command, Map<String, JsonNode> options) {
        return switch (command) {
        case CREATE_ROLE -> action(ActionKind.CREATE_ROLE, text(options, OPT_NAME),
                params(ActionSchema.COLOR, text(options, OPT_COLOR)));
        case CREATE_CHANNEL -> {
            Map<String, Object> params = params(ActionSchema.TYPE, text(options, OPT_CHANNEL_TYPE));
            params.put(ActionSchema.CATEGORY, text(options, OPT_CATEGORY));
            yield action(ActionKind.CREATE_CHANNEL, text(options, OPT_NAME), params);
        }
        case DELETE_CHANNEL -> action(ActionKind.DELETE_CHANNEL, text(options, OPT_CHANNEL), Map.of());
        case ASSIGN_ROLE -> action(ActionKind.ASSIGN_ROLE, text(options, OPT_USER),
                params(ActionSchema.ROLE, text(options, OPT_ROLE)));
        case REMOVE_ROLE -> action(ActionKind.REMOVE_ROLE, text(options, OPT_USER),
                params(ActionSchema.ROLE, text(options, OPT_ROLE)));
        case LOCK_CHANNEL -> action(ActionKind.LOCK_CHANNEL, text(options, OPT_CHANNEL), Map.of());
        case UNLOCK_CHANNEL -> action(ActionKind.UNLOCK_CHANNEL, text(options, OPT_CHANNEL), Map.of());
        case CREATE_CATEGORY -> action(ActionKind.CREATE_CATEGORY, text(options, OPT_NAME), Map.of());
        case CHANNEL_PERMISSIONS -> channelPermissions(options);
        default -> throw new IllegalArgumentException(messageService.getMessage("command.unknown", command));
        };
    }

    private AdminAction channelPermissions(Map<String, JsonNode> options) {
        String role = text(options, OPT_ROLE);
        String user = text(options, OPT_USER);
        if (role == null && user == null) {
            throw new IllegalArgumentException(messageService.getMessage("command.permissions.no-subject"));
        }
        if (role != null && user != null) {
            throw new IllegalArgumentException(messageService.getMessage("command.permissions.both-subjects"));
        }

        Map<String, Object> permissions = new LinkedHashMap<>();
        for (String permission : PERMISSION_OPTIONS) {
            JsonNode value = options.get(permission);
            if (value != null && value.isBoolean()) {
                permissions.put(permission, value.booleanValue());
            }
        }
        if (permissions.isEmpty()) {
            throw new IllegalArgumentException(messageService.getMessage("command.permissions.no-changes"));
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put(ActionSchema.SUBJECT, role != null ? role : user);
        params.put(ActionSchema.SUBJECT_TYPE,
                role != null ? ActionSchema.SUBJECT_TYPE_ROLE : ActionSchema.SUBJECT_TYPE_USER);
        params.put(ActionSchema.PERMISSIONS, permissions);
        return action(ActionKind.SET_CHANNEL_PERMISSIONS, text(options, OPT_CHANNEL), params);
    }

    private AdminAction action(ActionKind kind, String target, Map<String, Object> params) {
        try {
            return AdminAction.of(kind, target, params);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(messageService.getMessage("command.invalid", e.getMessage()), e);
        }
    }

    private static Map<String, Object> params(String name, Object value) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(name, value);
        return params;
    }

    private static String text(Map<String, JsonNode> options, String name) {
        JsonNode value = options.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }
}
