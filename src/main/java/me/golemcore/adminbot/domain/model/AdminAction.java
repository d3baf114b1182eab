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

import me.golemcore.adminbot.domain.schema.ActionSchema;
import me.golemcore.adminbot.domain.schema.ActionValidation;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One typed administrative operation.
 *
 * <p>
 * Construction validates the fields against {@link ActionSchema}: an action
 * whose fields do not satisfy the schema of its kind cannot exist. Parameters
 * are normalized (defaults applied, undeclared fields dropped) and stored
 * unmodifiable, so an action never changes after creation.
 *
 * @param kind
 *            the action kind
 * @param target
 *            name or id of the object acted on; for creation kinds the name of
 *            the new object
 * @param params
 *            kind-specific parameters keyed by wire name
 */
public record AdminAction(ActionKind kind, String target, Map<String, Object> params) {

    public AdminAction {
        Objects.requireNonNull(kind, "kind");
        Map<String, Object> fields = new LinkedHashMap<>();
        if (params != null) {
            fields.putAll(params);
        }
        fields.put(ActionSchema.TARGET, target);

        ActionValidation validation = ActionSchema.validate(kind, fields);
        if (!validation.isValid()) {
            throw new IllegalArgumentException("Invalid " + kind.getWireName() + ": " + validation.describe());
        }
        target = target.trim();
        params = ActionSchema.normalizeParams(kind, fields);
    }

    /**
     * Creates an action without parameters.
     */
    public static AdminAction of(ActionKind kind, String target) {
        return new AdminAction(kind, target, Map.of());
    }

    public static AdminAction of(ActionKind kind, String target, Map<String, Object> params) {
        return new AdminAction(kind, target, params);
    }

    public boolean isDestructive() {
        return kind.isDestructive();
    }

    public Optional<String> stringParam(String name) {
        Object value = params.get(name);
        return value instanceof String text ? Optional.of(text) : Optional.empty();
    }

    /**
     * Returns the permission overwrite changes, keyed by permission. A
     * {@code null} value clears the overwrite for that permission.
     */
    public Map<ChannelPermission, Boolean> permissionChanges() {
        Map<ChannelPermission, Boolean> changes = new LinkedHashMap<>();
        Object value = params.get(ActionSchema.PERMISSIONS);
        if (value instanceof Map<?, ?> map) {
            map.forEach((name, flag) -> ChannelPermission.fromWireName((String) name)
                    .ifPresent(permission -> changes.put(permission, (Boolean) flag)));
        }
        return changes;
    }

    /**
     * Returns the guild-wide permissions requested for a new role, empty when
     * none were given.
     */
    public Set<RolePermission> rolePermissions() {
        Set<RolePermission> permissions = EnumSet.noneOf(RolePermission.class);
        if (params.get(ActionSchema.PERMISSIONS) instanceof Collection<?> names) {
            names.forEach(name -> RolePermission.fromWireName((String) name).ifPresent(permissions::add));
        }
        return permissions;
    }
}
