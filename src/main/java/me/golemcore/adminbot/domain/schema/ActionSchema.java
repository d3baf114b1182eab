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

import me.golemcore.adminbot.domain.model.ActionKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Field schema of every {@link ActionKind}.
 *
 * <p>
 * Fields are addressed by wire name in one flat map: {@code target} plus the
 * kind-specific parameters. Validation is pure and reports missing required
 * fields and type violations together so a caller can surface them in one
 * message. Fields not declared for a kind are ignored.
 */
public final class ActionSchema {

    public static final String TARGET = "target";
    public static final String TYPE = "type";
    public static final String CATEGORY = "category";
    public static final String COLOR = "color";
    public static final String ROLE = "role";
    public static final String SUBJECT = "subject";
    public static final String SUBJECT_TYPE = "subject_type";
    public static final String PERMISSIONS = "permissions";

    public static final String CHANNEL_TYPE_TEXT = "text";
    public static final String CHANNEL_TYPE_VOICE = "voice";
    public static final String SUBJECT_TYPE_ROLE = "role";
    public static final String SUBJECT_TYPE_USER = "user";

    private static final Map<ActionKind, List<FieldSpec>> SCHEMAS = new EnumMap<>(ActionKind.class);

    static {
        define(ActionKind.CREATE_CHANNEL,
                FieldSpec.required(TARGET, FieldType.TEXT, "name of the new channel"),
                FieldSpec.optional(TYPE, FieldType.CHANNEL_TYPE, CHANNEL_TYPE_TEXT, "\"text\" or \"voice\""),
                FieldSpec.optional(CATEGORY, FieldType.TEXT, null, "name of the parent category"));
        define(ActionKind.DELETE_CHANNEL,
                FieldSpec.required(TARGET, FieldType.TEXT, "channel name or id"));
        define(ActionKind.CREATE_ROLE,
                FieldSpec.required(TARGET, FieldType.TEXT, "name of the new role"),
                FieldSpec.optional(COLOR, FieldType.HEX_COLOR, null, "hex color such as \"#ff0000\""),
                FieldSpec.optional(PERMISSIONS, FieldType.ROLE_PERMISSION_LIST, null,
                        "list of role permission names such as [\"kick_members\"]"));
        define(ActionKind.DELETE_ROLE,
                FieldSpec.required(TARGET, FieldType.TEXT, "role name or id"));
        define(ActionKind.ASSIGN_ROLE,
                FieldSpec.required(TARGET, FieldType.TEXT, "user name, mention or id"),
                FieldSpec.required(ROLE, FieldType.TEXT, "role name or id"));
        define(ActionKind.REMOVE_ROLE,
                FieldSpec.required(TARGET, FieldType.TEXT, "user name, mention or id"),
                FieldSpec.required(ROLE, FieldType.TEXT, "role name or id"));
        define(ActionKind.LOCK_CHANNEL,
                FieldSpec.required(TARGET, FieldType.TEXT, "text channel name or id"));
        define(ActionKind.UNLOCK_CHANNEL,
                FieldSpec.required(TARGET, FieldType.TEXT, "text channel name or id"));
        define(ActionKind.CREATE_CATEGORY,
                FieldSpec.required(TARGET, FieldType.TEXT, "name of the new category"));
        define(ActionKind.SET_CHANNEL_PERMISSIONS,
                FieldSpec.required(TARGET, FieldType.TEXT, "channel name or id"),
                FieldSpec.required(SUBJECT, FieldType.TEXT, "role or user the overwrite applies to"),
                FieldSpec.required(PERMISSIONS, FieldType.PERMISSION_MAP,
                        "object such as {\"send_messages\": false}"),
                FieldSpec.optional(SUBJECT_TYPE, FieldType.SUBJECT_TYPE, null, "\"role\" or \"user\""));
    }

    private ActionSchema() {
    }

    private static void define(ActionKind kind, FieldSpec... fields) {
        SCHEMAS.put(kind, List.of(fields));
    }

    /**
     * Returns the declared fields of a kind, {@code target} first.
     */
    public static List<FieldSpec> fieldsOf(ActionKind kind) {
        return SCHEMAS.get(kind);
    }

    /**
     * Validates fields against the schema of a kind given by wire name. Unknown
     * kinds are reported, never skipped.
     */
    public static ActionValidation validate(String kindName, Map<String, ?> fields) {
        Optional<ActionKind> kind = ActionKind.fromWireName(kindName);
        if (kind.isEmpty()) {
            return ActionValidation.unknownKind(kindName);
        }
        return validate(kind.get(), fields);
    }

    public static ActionValidation validate(ActionKind kind, Map<String, ?> fields) {
        Map<String, ?> values = fields != null ? fields : Map.of();
        List<String> missing = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (FieldSpec spec : SCHEMAS.get(kind)) {
            Object value = values.get(spec.name());
            if (isAbsent(value)) {
                if (spec.required()) {
                    missing.add(spec.name());
                }
                continue;
            }
            spec.type().check(spec.name(), value).ifPresent(errors::add);
        }
        return ActionValidation.of(missing, errors);
    }

    /**
     * Builds the canonical parameter map of a kind: declared optional fields
     * only, values normalized, defaults applied for absent fields. The
     * {@code target} field is not part of the result. Callers must validate
     * first.
     */
    public static Map<String, Object> normalizeParams(ActionKind kind, Map<String, ?> fields) {
        Map<String, ?> values = fields != null ? fields : Map.of();
        Map<String, Object> params = new LinkedHashMap<>();
        for (FieldSpec spec : SCHEMAS.get(kind)) {
            if (TARGET.equals(spec.name())) {
                continue;
            }
            Object value = values.get(spec.name());
            if (!isAbsent(value)) {
                params.put(spec.name(), spec.type().normalize(value));
            } else if (spec.defaultValue() != null) {
                params.put(spec.name(), spec.defaultValue());
            }
        }
        return Collections.unmodifiableMap(params);
    }

    /**
     * Describes the vocabulary as one line per kind, for the translation
     * prompt.
     */
    public static String describeVocabulary() {
        StringBuilder sb = new StringBuilder();
        for (ActionKind kind : ActionKind.values()) {
            sb.append("- ").append(kind.getWireName()).append(": ");
            List<String> parts = new ArrayList<>();
            for (FieldSpec spec : SCHEMAS.get(kind)) {
                parts.add("\"" + spec.name() + "\"" + (spec.required() ? " (required)" : " (optional)")
                        + " " + spec.hint());
            }
            sb.append(String.join("; ", parts));
            if (kind.isDestructive()) {
                sb.append(" [destructive]");
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static boolean isAbsent(Object value) {
        return value == null || (value instanceof String text && text.isBlank());
    }
}
