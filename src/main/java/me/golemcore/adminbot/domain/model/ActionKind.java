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
 * Closed vocabulary of administrative actions the bot can perform.
 *
 * <p>
 * Each kind carries its wire name (as produced by the model and used in slash
 * commands), whether it is destructive and therefore gates the whole batch
 * behind a human confirmation, whether it creates a new object (its target is
 * then the new name), and the capability a requester needs to run it.
 */
public enum ActionKind {

    CREATE_CHANNEL("create_channel", false, true, AdminCapability.MANAGE_CHANNELS),
    DELETE_CHANNEL("delete_channel", true, false, AdminCapability.MANAGE_CHANNELS),
    CREATE_ROLE("create_role", false, true, AdminCapability.MANAGE_ROLES),
    DELETE_ROLE("delete_role", true, false, AdminCapability.MANAGE_ROLES),
    ASSIGN_ROLE("assign_role", false, false, AdminCapability.MANAGE_ROLES),
    REMOVE_ROLE("remove_role", false, false, AdminCapability.MANAGE_ROLES),
    LOCK_CHANNEL("lock_channel", false, false, AdminCapability.MANAGE_CHANNELS),
    UNLOCK_CHANNEL("unlock_channel", false, false, AdminCapability.MANAGE_CHANNELS),
    CREATE_CATEGORY("create_category", false, true, AdminCapability.MANAGE_CHANNELS),
    SET_CHANNEL_PERMISSIONS("set_channel_permissions", false, false, AdminCapability.MANAGE_ROLES);

    private static final Map<String, ActionKind> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ActionKind::getWireName, Function.identity()));

    private final String wireName;
    private final boolean destructive;
    private final boolean creation;
    private final AdminCapability requiredCapability;

    ActionKind(String wireName, boolean destructive, boolean creation, AdminCapability requiredCapability) {
        this.wireName = wireName;
        this.destructive = destructive;
        this.creation = creation;
        this.requiredCapability = requiredCapability;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isDestructive() {
        return destructive;
    }

    public boolean isCreation() {
        return creation;
    }

    public AdminCapability getRequiredCapability() {
        return requiredCapability;
    }

    /**
     * Looks up a kind by its wire name, ignoring case and surrounding
     * whitespace.
     */
    public static Optional<ActionKind> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }
}
