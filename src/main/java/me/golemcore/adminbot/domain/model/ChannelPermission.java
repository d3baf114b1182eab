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

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Channel permissions that may appear in a permission overwrite. Wire names
 * follow the platform's snake_case permission names.
 */
public enum ChannelPermission {

    VIEW_CHANNEL("view_channel"),
    SEND_MESSAGES("send_messages"),
    MANAGE_MESSAGES("manage_messages"),
    EMBED_LINKS("embed_links"),
    ATTACH_FILES("attach_files"),
    READ_MESSAGE_HISTORY("read_message_history"),
    ADD_REACTIONS("add_reactions"),
    MENTION_EVERYONE("mention_everyone"),
    CONNECT("connect"),
    SPEAK("speak"),
    MANAGE_CHANNELS("manage_channels"),
    MANAGE_PERMISSIONS("manage_permissions");

    private static final Map<String, ChannelPermission> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ChannelPermission::getWireName, Function.identity()));

    private final String wireName;

    ChannelPermission(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<ChannelPermission> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }
}
