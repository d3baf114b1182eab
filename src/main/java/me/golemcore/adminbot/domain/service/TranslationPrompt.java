package me.golemcore.adminbot.domain.service;

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

import me.golemcore.adminbot.domain.model.ChannelPermission;
import me.golemcore.adminbot.domain.model.RolePermission;
import me.golemcore.adminbot.domain.schema.ActionSchema;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * System prompt that asks the model to answer with a JSON array of actions
 * drawn from the closed vocabulary.
 */
final class TranslationPrompt {

    private static final String SYSTEM_PROMPT = buildSystemPrompt();

    private TranslationPrompt() {
    }

    static String system() {
        return SYSTEM_PROMPT;
    }

    private static String buildSystemPrompt() {
        String permissions = Arrays.stream(ChannelPermission.values())
                .map(ChannelPermission::getWireName)
                .collect(Collectors.joining(", "));
        String rolePermissions = Arrays.stream(RolePermission.values())
                .map(RolePermission::getWireName)
                .collect(Collectors.joining(", "));

        return """
                You convert Discord server administration requests into a JSON array of actions.
                Respond with the JSON array only. Do not add explanations.

                Each action is an object: {"kind": "<kind>", "target": "<name or id>", "params": {...}}

                Available kinds and their fields:
                %s
                Permission names for "permissions" of set_channel_permissions: %s.
                Use true to allow, false to deny and null to reset a permission.
                Permission names for "permissions" of create_role: %s.

                Keep the order in which the user wants things done. Objects created earlier in the
                list can be referenced by name in later actions.
                If nothing in the request maps to an available kind, respond with [].

                Example request: create a category Gaming and a voice channel Lobby inside it
                Example response:
                [{"kind": "create_category", "target": "Gaming"},
                 {"kind": "create_channel", "target": "Lobby", "params": {"type": "voice", "category": "Gaming"}}]
                """.formatted(ActionSchema.describeVocabulary(), permissions, rolePermissions);
    }
}
