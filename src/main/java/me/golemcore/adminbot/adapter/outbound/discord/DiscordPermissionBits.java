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

import me.golemcore.adminbot.domain.model.AdminCapability;
import me.golemcore.adminbot.domain.model.ChannelPermission;
import me.golemcore.adminbot.domain.model.RolePermission;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Discord permission bit flags used by the bot.
 */
public final class DiscordPermissionBits {

    public static final long KICK_MEMBERS = 1L << 1;
    public static final long BAN_MEMBERS = 1L << 2;
    public static final long ADMINISTRATOR = 1L << 3;
    public static final long MANAGE_CHANNELS = 1L << 4;
    public static final long MANAGE_GUILD = 1L << 5;
    public static final long ADD_REACTIONS = 1L << 6;
    public static final long VIEW_CHANNEL = 1L << 10;
    public static final long SEND_MESSAGES = 1L << 11;
    public static final long MANAGE_MESSAGES = 1L << 13;
    public static final long EMBED_LINKS = 1L << 14;
    public static final long ATTACH_FILES = 1L << 15;
    public static final long READ_MESSAGE_HISTORY = 1L << 16;
    public static final long MENTION_EVERYONE = 1L << 17;
    public static final long CONNECT = 1L << 20;
    public static final long SPEAK = 1L << 21;
    public static final long MANAGE_ROLES = 1L << 28;

    private static final Map<ChannelPermission, Long> CHANNEL_BITS = new EnumMap<>(ChannelPermission.class);
    private static final Map<RolePermission, Long> ROLE_BITS = new EnumMap<>(RolePermission.class);

    static {
        CHANNEL_BITS.put(ChannelPermission.VIEW_CHANNEL, VIEW_CHANNEL);
        CHANNEL_BITS.put(ChannelPermission.SEND_MESSAGES, SEND_MESSAGES);
        CHANNEL_BITS.put(ChannelPermission.MANAGE_MESSAGES, MANAGE_MESSAGES);
        CHANNEL_BITS.put(ChannelPermission.EMBED_LINKS, EMBED_LINKS);
        CHANNEL_BITS.put(ChannelPermission.ATTACH_FILES, ATTACH_FILES);
        CHANNEL_BITS.put(ChannelPermission.READ_MESSAGE_HISTORY, READ_MESSAGE_HISTORY);
        CHANNEL_BITS.put(ChannelPermission.ADD_REACTIONS, ADD_REACTIONS);
        CHANNEL_BITS.put(ChannelPermission.MENTION_EVERYONE, MENTION_EVERYONE);
        CHANNEL_BITS.put(ChannelPermission.CONNECT, CONNECT);
        CHANNEL_BITS.put(ChannelPermission.SPEAK, SPEAK);
        CHANNEL_BITS.put(ChannelPermission.MANAGE_CHANNELS, MANAGE_CHANNELS);
        // Discord calls the channel-level "manage roles" bit "Manage Permissions"
        CHANNEL_BITS.put(ChannelPermission.MANAGE_PERMISSIONS, MANAGE_ROLES);

        ROLE_BITS.put(RolePermission.MANAGE_MESSAGES, MANAGE_MESSAGES);
        ROLE_BITS.put(RolePermission.KICK_MEMBERS, KICK_MEMBERS);
        ROLE_BITS.put(RolePermission.BAN_MEMBERS, BAN_MEMBERS);
        ROLE_BITS.put(RolePermission.ADMINISTRATOR, ADMINISTRATOR);
        ROLE_BITS.put(RolePermission.MANAGE_CHANNELS, MANAGE_CHANNELS);
        ROLE_BITS.put(RolePermission.MANAGE_GUILD, MANAGE_GUILD);
    }

    private DiscordPermissionBits() {
    }

    public static long bitOf(ChannelPermission permission) {
        return CHANNEL_BITS.get(permission);
    }

    /**
     * Combined bit set of role permissions, as Discord expects it in a role's
     * {@code permissions} field.
     */
    public static long bitsOf(Set<RolePermission> permissions) {
        long bits = 0;
        for (RolePermission permission : permissions) {
            bits |= ROLE_BITS.get(permission);
        }
        return bits;
    }

    /**
     * Maps a member's computed permission bit set (as sent with every
     * interaction) to the capabilities the bot checks.
     */
    public static Set<AdminCapability> capabilitiesOf(long permissions) {
        Set<AdminCapability> capabilities = EnumSet.noneOf(AdminCapability.class);
        if ((permissions & ADMINISTRATOR) != 0) {
            capabilities.add(AdminCapability.ADMINISTRATOR);
        }
        if ((permissions & MANAGE_GUILD) != 0) {
            capabilities.add(AdminCapability.MANAGE_GUILD);
        }
        if ((permissions & MANAGE_CHANNELS) != 0) {
            capabilities.add(AdminCapability.MANAGE_CHANNELS);
        }
        if ((permissions & MANAGE_ROLES) != 0) {
            capabilities.add(AdminCapability.MANAGE_ROLES);
        }
        return capabilities;
    }
}
