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

import me.golemcore.adminbot.adapter.outbound.discord.DiscordPermissionBits;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Slash commands the bot registers, in the shape of the Discord application
 * command API.
 */
final class DiscordCommandCatalog {

    static final String SERVER_AI = "server_ai";
    static final String CREATE_ROLE = "create_role";
    static final String CREATE_CHANNEL = "create_channel";
    static final String DELETE_CHANNEL = "delete_channel";
    static final String ASSIGN_ROLE = "assign_role";
    static final String REMOVE_ROLE = "remove_role";
    static final String LOCK_CHANNEL = "lock_channel";
    static final String UNLOCK_CHANNEL = "unlock_channel";
    static final String CREATE_CATEGORY = "create_category";
    static final String CHANNEL_PERMISSIONS = "channel_permissions";

    static final String OPT_INSTRUCTION = "instruction";
    static final String OPT_NAME = "name";
    static final String OPT_COLOR = "color";
    static final String OPT_CHANNEL_TYPE = "channel_type";
    static final String OPT_CATEGORY = "category";
    static final String OPT_CHANNEL = "channel";
    static final String OPT_USER = "user";
    static final String OPT_ROLE = "role";

    /**
     * Permission toggles offered by {@code /channel_permissions}.
     */
    static final List<String> PERMISSION_OPTIONS = List.of("send_messages", "view_channel", "manage_messages",
            "connect", "speak");

    private static final int OPTION_STRING = 3;
    private static final int OPTION_BOOLEAN = 5;
    private static final int OPTION_USER = 6;
    private static final int OPTION_CHANNEL = 7;
    private static final int OPTION_ROLE = 8;
    private static final int CHANNEL_TYPE_TEXT = 0;

    private DiscordCommandCatalog() {
    }

    static List<Map<String, Object>> definitions() {
        return List.of(
                command(SERVER_AI, "Give the bot a natural-language server instruction (admins only)",
                        option(OPT_INSTRUCTION, "What you want the bot to do, in plain language", OPTION_STRING,
                                true)),
                command(CREATE_ROLE, "Create a role with optional hex color",
                        option(OPT_NAME, "Role name", OPTION_STRING, true),
                        option(OPT_COLOR, "Hex color such as #ff0000", OPTION_STRING, false)),
                command(CREATE_CHANNEL, "Create a text or voice channel (optional category)",
                        option(OPT_NAME, "Channel name", OPTION_STRING, true),
                        withChoices(option(OPT_CHANNEL_TYPE, "Channel type", OPTION_STRING, false), "text", "voice"),
                        option(OPT_CATEGORY, "Category name, created if missing", OPTION_STRING, false)),
                command(DELETE_CHANNEL, "Delete a channel",
                        option(OPT_CHANNEL, "Channel to delete", OPTION_CHANNEL, true)),
                command(ASSIGN_ROLE, "Assign a role to a member",
                        option(OPT_USER, "Member", OPTION_USER, true),
                        option(OPT_ROLE, "Role", OPTION_ROLE, true)),
                command(REMOVE_ROLE, "Remove a role from a member",
                        option(OPT_USER, "Member", OPTION_USER, true),
                        option(OPT_ROLE, "Role", OPTION_ROLE, true)),
                command(LOCK_CHANNEL, "Lock a text channel for @everyone",
                        textChannelOnly(option(OPT_CHANNEL, "Text channel", OPTION_CHANNEL, true))),
                command(UNLOCK_CHANNEL, "Unlock a text channel for @everyone",
                        textChannelOnly(option(OPT_CHANNEL, "Text channel", OPTION_CHANNEL, true))),
                command(CREATE_CATEGORY, "Create a new category",
                        option(OPT_NAME, "Category name", OPTION_STRING, true)),
                command(CHANNEL_PERMISSIONS, "Set specific permissions for a role or user in a channel",
                        option(OPT_CHANNEL, "The channel to modify permissions for", OPTION_CHANNEL, true),
                        option(OPT_ROLE, "Role to set permissions for (role OR user)", OPTION_ROLE, false),
                        option(OPT_USER, "User to set permissions for (role OR user)", OPTION_USER, false),
                        option("send_messages", "Allow/deny sending messages", OPTION_BOOLEAN, false),
                        option("view_channel", "Allow/deny viewing the channel", OPTION_BOOLEAN, false),
                        option("manage_messages", "Allow/deny managing messages", OPTION_BOOLEAN, false),
                        option("connect", "Allow/deny connecting to voice", OPTION_BOOLEAN, false),
                        option("speak", "Allow/deny speaking in voice", OPTION_BOOLEAN, false)));
    }

    @SafeVarargs
    private static Map<String, Object> command(String name, String description, Map<String, Object>... options) {
        Map<String, Object> command = new LinkedHashMap<>();
        command.put("name", name);
        command.put("description", description);
        command.put("options", List.of(options));
        command.put("default_member_permissions", Long.toString(DiscordPermissionBits.MANAGE_GUILD));
        command.put("dm_permission", false);
        return command;
    }

    private static Map<String, Object> option(String name, String description, int type, boolean required) {
        Map<String, Object> option = new LinkedHashMap<>();
        option.put("name", name);
        option.put("description", description);
        option.put("type", type);
        option.put("required", required);
        return option;
    }

    private static Map<String, Object> withChoices(Map<String, Object> option, String... values) {
        option.put("choices", Arrays.stream(values)
                .map(value -> Map.of("name", value, "value", value))
                .toList());
        return option;
    }

    private static Map<String, Object> textChannelOnly(Map<String, Object> option) {
        option.put("channel_types", List.of(CHANNEL_TYPE_TEXT));
        return option;
    }
}
