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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.adminbot.domain.model.ChannelPermission;
import me.golemcore.adminbot.domain.model.ObjectRef;
import me.golemcore.adminbot.domain.model.ObjectType;
import me.golemcore.adminbot.domain.model.RejectionKind;
import me.golemcore.adminbot.domain.model.RolePermission;
import me.golemcore.adminbot.port.outbound.GuildAccess;
import me.golemcore.adminbot.port.outbound.GuildOperationException;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link GuildAccess} for one Discord guild, backed by REST calls.
 *
 * <p>
 * Lookups always read the current guild state; nothing is cached between
 * calls. Channel, role and member references may be ids, mentions or names.
 */
@Slf4j
class DiscordGuildAccess implements GuildAccess {

    static final int TYPE_TEXT = 0;
    static final int TYPE_VOICE = 2;
    static final int TYPE_CATEGORY = 4;
    static final int TYPE_ANNOUNCEMENT = 5;

    private static final int OVERWRITE_ROLE = 0;
    private static final int OVERWRITE_MEMBER = 1;
    private static final int MEMBER_SEARCH_LIMIT = 10;

    private static final Pattern SNOWFLAKE = Pattern.compile("^\\d{15,21}$");
    private static final Pattern CHANNEL_MENTION = Pattern.compile("^<#(\\d+)>$");
    private static final Pattern ROLE_MENTION = Pattern.compile("^<@&(\\d+)>$");
    private static final Pattern USER_MENTION = Pattern.compile("^<@!?(\\d+)>$");
    private static final Pattern USER_TAG = Pattern.compile("^(.+)#(\\d{4})$");

    private final DiscordRestClient client;
    private final String guildId;

    DiscordGuildAccess(DiscordRestClient client, String guildId) {
        this.client = client;
        this.guildId = guildId;
    }

    @Override
    public String getGuildId() {
        return guildId;
    }

    @Override
    public Optional<ObjectRef> findChannel(String nameOrId) {
        String reference = stripMention(nameOrId.trim(), CHANNEL_MENTION);
        String name = reference.startsWith("#") ? reference.substring(1) : reference;
        JsonNode channels = client.get("/guilds/" + guildId + "/channels");
        return findByIdOrName(channels, reference, name).map(DiscordGuildAccess::toChannelRef);
    }

    @Override
    public Optional<ObjectRef> findCategory(String name) {
        JsonNode channels = client.get("/guilds/" + guildId + "/channels");
        JsonNode match = null;
        for (JsonNode channel : channels) {
            if (channel.path("type").asInt(-1) != TYPE_CATEGORY) {
                continue;
            }
            String channelName = channel.path("name").asText();
            if (channelName.equals(name)) {
                return Optional.of(toChannelRef(channel));
            }
            if (match == null && channelName.equalsIgnoreCase(name)) {
                match = channel;
            }
        }
        return Optional.ofNullable(match).map(DiscordGuildAccess::toChannelRef);
    }

    @Override
    public Optional<ObjectRef> findRole(String nameOrId) {
        String reference = stripMention(nameOrId.trim(), ROLE_MENTION);
        String name = reference.startsWith("@") && !"@everyone".equals(reference) ? reference.substring(1)
                : reference;
        JsonNode roles = client.get("/guilds/" + guildId + "/roles");
        return findByIdOrName(roles, reference, name)
                .map(role -> new ObjectRef(role.path("id").asText(), role.path("name").asText(), ObjectType.ROLE));
    }

    @Override
    public Optional<ObjectRef> findMember(String reference) {
        String value = reference.trim();
        String id = stripMention(value, USER_MENTION);
        if (SNOWFLAKE.matcher(id).matches()) {
            try {
                return Optional.of(toMemberRef(client.get("/guilds/" + guildId + "/members/" + id)));
            } catch (GuildOperationException e) {
                if (e.getKind() == RejectionKind.NOT_FOUND) {
                    return Optional.empty();
                }
                throw e;
            }
        }

        String name = value.startsWith("@") ? value.substring(1) : value;
        // Legacy "name#1234" tags match username and discriminator together
        Matcher tag = USER_TAG.matcher(name);
        String discriminator = null;
        if (tag.matches()) {
            name = tag.group(1);
            discriminator = tag.group(2);
        }
        JsonNode members = client.get("/guilds/" + guildId + "/members/search?query="
                + URLEncoder.encode(name, StandardCharsets.UTF_8) + "&limit=" + MEMBER_SEARCH_LIMIT);
        for (JsonNode member : members) {
            JsonNode user = member.path("user");
            if (discriminator != null) {
                if (name.equalsIgnoreCase(user.path("username").asText(""))
                        && discriminator.equals(user.path("discriminator").asText(""))) {
                    return Optional.of(toMemberRef(member));
                }
                continue;
            }
            if (name.equalsIgnoreCase(user.path("username").asText(""))
                    || name.equalsIgnoreCase(user.path("global_name").asText(""))
                    || name.equalsIgnoreCase(member.path("nick").asText(""))) {
                return Optional.of(toMemberRef(member));
            }
        }
        return Optional.empty();
    }

    @Override
    public ObjectRef everyoneRole() {
        // The @everyone role shares the guild's id
        return new ObjectRef(guildId, "@everyone", ObjectType.ROLE);
    }

    @Override
    public ObjectRef createCategory(String name) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("type", TYPE_CATEGORY);
        return toChannelRef(client.post("/guilds/" + guildId + "/channels", body));
    }

    @Override
    public ObjectRef createChannel(String name, ObjectType type, ObjectRef category) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("type", type == ObjectType.VOICE_CHANNEL ? TYPE_VOICE : TYPE_TEXT);
        if (category != null) {
            body.put("parent_id", category.id());
        }
        return toChannelRef(client.post("/guilds/" + guildId + "/channels", body));
    }

    @Override
    public void deleteChannel(ObjectRef channel) {
        client.delete("/channels/" + channel.id());
    }

    @Override
    public ObjectRef createRole(String name, String hexColor, Set<RolePermission> permissions) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("permissions", Long.toString(DiscordPermissionBits.bitsOf(permissions)));
        if (hexColor != null) {
            body.put("color", Integer.parseInt(hexColor, 16));
        }
        JsonNode role = client.post("/guilds/" + guildId + "/roles", body);
        return new ObjectRef(role.path("id").asText(), role.path("name").asText(), ObjectType.ROLE);
    }

    @Override
    public void deleteRole(ObjectRef role) {
        client.delete("/guilds/" + guildId + "/roles/" + role.id());
    }

    @Override
    public void addMemberRole(ObjectRef member, ObjectRef role) {
        client.put("/guilds/" + guildId + "/members/" + member.id() + "/roles/" + role.id(), null);
    }

    @Override
    public void removeMemberRole(ObjectRef member, ObjectRef role) {
        client.delete("/guilds/" + guildId + "/members/" + member.id() + "/roles/" + role.id());
    }

    @Override
    public void editPermissionOverwrite(ObjectRef channel, ObjectRef subject,
            Map<ChannelPermission, Boolean> changes) {
        long allow = 0;
        long deny = 0;
        JsonNode current = client.get("/channels/" + channel.id());
        for (JsonNode overwrite : current.path("permission_overwrites")) {
            if (subject.id().equals(overwrite.path("id").asText())) {
                allow = parseBits(overwrite.path("allow").asText("0"));
                deny = parseBits(overwrite.path("deny").asText("0"));
                break;
            }
        }

        for (Map.Entry<ChannelPermission, Boolean> change : changes.entrySet()) {
            long bit = DiscordPermissionBits.bitOf(change.getKey());
            allow &= ~bit;
            deny &= ~bit;
            if (Boolean.TRUE.equals(change.getValue())) {
                allow |= bit;
            } else if (Boolean.FALSE.equals(change.getValue())) {
                deny |= bit;
            }
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", subject.type() == ObjectType.ROLE ? OVERWRITE_ROLE : OVERWRITE_MEMBER);
        body.put("allow", Long.toString(allow));
        body.put("deny", Long.toString(deny));
        log.debug("[Discord] Overwrite for {} in {}: allow={}, deny={}", subject.id(), channel.id(), allow, deny);
        client.put("/channels/" + channel.id() + "/permissions/" + subject.id(), body);
    }

    /**
     * Finds an element by id first, then by exact name, then by name ignoring
     * case.
     */
    private static Optional<JsonNode> findByIdOrName(JsonNode elements, String id, String name) {
        JsonNode byName = null;
        JsonNode byNameIgnoringCase = null;
        for (JsonNode element : elements) {
            if (element.path("id").asText().equals(id)) {
                return Optional.of(element);
            }
            String elementName = element.path("name").asText();
            if (byName == null && elementName.equals(name)) {
                byName = element;
            } else if (byNameIgnoringCase == null && elementName.equalsIgnoreCase(name)) {
                byNameIgnoringCase = element;
            }
        }
        return Optional.ofNullable(byName != null ? byName : byNameIgnoringCase);
    }

    private static ObjectRef toChannelRef(JsonNode channel) {
        ObjectType type = switch (channel.path("type").asInt(-1)) {
        case TYPE_TEXT, TYPE_ANNOUNCEMENT -> ObjectType.TEXT_CHANNEL;
        case TYPE_VOICE -> ObjectType.VOICE_CHANNEL;
        case TYPE_CATEGORY -> ObjectType.CATEGORY;
        default -> ObjectType.OTHER_CHANNEL;
        };
        return new ObjectRef(channel.path("id").asText(), channel.path("name").asText(), type);
    }

    private static ObjectRef toMemberRef(JsonNode member) {
        JsonNode user = member.path("user");
        String name = firstNonBlank(member.path("nick").asText(null), user.path("global_name").asText(null),
                user.path("username").asText());
        return new ObjectRef(user.path("id").asText(), name, ObjectType.MEMBER);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }

    private static String stripMention(String value, Pattern mention) {
        Matcher matcher = mention.matcher(value);
        return matcher.matches() ? matcher.group(1) : value;
    }

    private static long parseBits(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("[Discord] Unexpected permission value '{}'", value);
            return 0;
        }
    }
}
