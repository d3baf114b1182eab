package me.golemcore.adminbot.port.outbound;

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
import me.golemcore.adminbot.domain.model.ObjectRef;
import me.golemcore.adminbot.domain.model.ObjectType;
import me.golemcore.adminbot.domain.model.RolePermission;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Management access to a single guild. Lookups return empty when nothing
 * matches; mutating operations throw {@link GuildOperationException} when the
 * platform rejects them.
 */
public interface GuildAccess {

    String getGuildId();

    /**
     * Finds a channel of any type by id or exact name.
     */
    Optional<ObjectRef> findChannel(String nameOrId);

    /**
     * Finds a category by exact name.
     */
    Optional<ObjectRef> findCategory(String name);

    Optional<ObjectRef> findRole(String nameOrId);

    /**
     * Finds a member by id, mention or user name.
     */
    Optional<ObjectRef> findMember(String reference);

    /**
     * The role every member implicitly holds.
     */
    ObjectRef everyoneRole();

    ObjectRef createCategory(String name);

    /**
     * Creates a text or voice channel, optionally under a category.
     *
     * @param category
     *            parent category, or {@code null}
     */
    ObjectRef createChannel(String name, ObjectType type, ObjectRef category);

    void deleteChannel(ObjectRef channel);

    /**
     * Creates a role.
     *
     * @param hexColor
     *            six hex digits without {@code #}, or {@code null} for the
     *            default color
     * @param permissions
     *            guild-wide permissions granted to the role, empty for none
     */
    ObjectRef createRole(String name, String hexColor, Set<RolePermission> permissions);

    void deleteRole(ObjectRef role);

    void addMemberRole(ObjectRef member, ObjectRef role);

    void removeMemberRole(ObjectRef member, ObjectRef role);

    /**
     * Merges permission changes into the channel overwrite of a role or
     * member. A {@code null} value resets that permission to inherited.
     */
    void editPermissionOverwrite(ObjectRef channel, ObjectRef subject, Map<ChannelPermission, Boolean> changes);
}
