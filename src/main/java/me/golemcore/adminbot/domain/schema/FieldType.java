package me.golemcore.adminbot.domain.schema;

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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Value constraints for action fields. Each type can check a raw value (as
 * projected from the model's JSON) and normalize an accepted value into its
 * canonical form.
 */
public enum FieldType {

    TEXT {
        @Override
        Optional<String> check(String field, Object value) {
            if (value instanceof String) {
                return Optional.empty();
            }
            return Optional.of(field + " must be a string");
        }

        @Override
        Object normalize(Object value) {
            return ((String) value).trim();
        }
    },

    CHANNEL_TYPE {
        @Override
        Optional<String> check(String field, Object value) {
            return checkOneOf(field, value, CHANNEL_TYPES);
        }

        @Override
        Object normalize(Object value) {
            return ((String) value).trim().toLowerCase(Locale.ROOT);
        }
    },

    SUBJECT_TYPE {
        @Override
        Optional<String> check(String field, Object value) {
            return checkOneOf(field, value, SUBJECT_TYPES);
        }

        @Override
        Object normalize(Object value) {
            return ((String) value).trim().toLowerCase(Locale.ROOT);
        }
    },

    HEX_COLOR {
        @Override
        Optional<String> check(String field, Object value) {
            if (value instanceof String text && HEX_COLOR_PATTERN.matcher(text.trim()).matches()) {
                return Optional.empty();
            }
            return Optional.of(field + " must be a 6-digit hex color such as #ff0000");
        }

        @Override
        Object normalize(Object value) {
            String text = ((String) value).trim();
            if (text.startsWith("#")) {
                text = text.substring(1);
            }
            return text.toLowerCase(Locale.ROOT);
        }
    },

    PERMISSION_MAP {
        @Override
        Optional<String> check(String field, Object value) {
            if (!(value instanceof Map<?, ?> map)) {
                return Optional.of(field + " must be an object of permission name to boolean");
            }
            if (map.isEmpty()) {
                return Optional.of(field + " must name at least one permission");
            }
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                Object key = entry.getKey();
                if (!(key instanceof String name) || ChannelPermission.fromWireName(name).isEmpty()) {
                    return Optional.of(field + " contains unknown permission '" + key + "'");
                }
                Object flag = entry.getValue();
                if (flag != null && !(flag instanceof Boolean)) {
                    return Optional.of(field + "." + name + " must be true, false or null");
                }
            }
            return Optional.empty();
        }

        @Override
        Object normalize(Object value) {
            Map<String, Boolean> normalized = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((key, flag) -> normalized.put(
                    ChannelPermission.fromWireName((String) key).orElseThrow().getWireName(),
                    (Boolean) flag));
            return Collections.unmodifiableMap(normalized);
        }
    },

    ROLE_PERMISSION_LIST {
        @Override
        Optional<String> check(String field, Object value) {
            if (!(value instanceof Collection<?> names)) {
                return Optional.of(field + " must be a list of permission names");
            }
            for (Object name : names) {
                if (!(name instanceof String text) || RolePermission.fromWireName(text).isEmpty()) {
                    return Optional.of(field + " contains unknown permission '" + name + "'");
                }
            }
            return Optional.empty();
        }

        @Override
        Object normalize(Object value) {
            Set<String> normalized = new LinkedHashSet<>();
            for (Object name : (Collection<?>) value) {
                normalized.add(RolePermission.fromWireName((String) name).orElseThrow().getWireName());
            }
            return List.copyOf(normalized);
        }
    };

    private static final Pattern HEX_COLOR_PATTERN = Pattern.compile("^#?[0-9a-fA-F]{6}$");
    private static final Set<String> CHANNEL_TYPES = Set.of("text", "voice");
    private static final Set<String> SUBJECT_TYPES = Set.of("role", "user");

    /**
     * Returns an error description when the value does not satisfy this type.
     */
    abstract Optional<String> check(String field, Object value);

    /**
     * Converts an accepted value into its canonical form.
     */
    abstract Object normalize(Object value);

    private static Optional<String> checkOneOf(String field, Object value, Set<String> allowed) {
        if (value instanceof String text && allowed.contains(text.trim().toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        return Optional.of(field + " must be one of " + allowed.stream().sorted().toList());
    }
}
