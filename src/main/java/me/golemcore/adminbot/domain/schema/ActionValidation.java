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

import java.util.List;

/**
 * Outcome of checking an action's fields against the schema of its kind.
 *
 * @param unknownKind
 *            the offending kind name when the kind is not part of the
 *            vocabulary, otherwise {@code null}
 * @param missingFields
 *            required fields that are absent, null or blank
 * @param fieldErrors
 *            type constraint violations of present fields
 */
public record ActionValidation(String unknownKind, List<String> missingFields, List<String> fieldErrors) {

    private static final ActionValidation OK = new ActionValidation(null, List.of(), List.of());

    public ActionValidation {
        missingFields = List.copyOf(missingFields);
        fieldErrors = List.copyOf(fieldErrors);
    }

    public static ActionValidation ok() {
        return OK;
    }

    public static ActionValidation unknownKind(String kind) {
        return new ActionValidation(kind == null ? "" : kind, List.of(), List.of());
    }

    public static ActionValidation of(List<String> missingFields, List<String> fieldErrors) {
        if (missingFields.isEmpty() && fieldErrors.isEmpty()) {
            return OK;
        }
        return new ActionValidation(null, missingFields, fieldErrors);
    }

    public boolean isValid() {
        return unknownKind == null && missingFields.isEmpty() && fieldErrors.isEmpty();
    }

    public boolean isUnknownKind() {
        return unknownKind != null;
    }

    /**
     * Human-readable summary of every problem found, or {@code "ok"}.
     */
    public String describe() {
        if (isUnknownKind()) {
            return "unknown action kind '" + unknownKind + "'";
        }
        StringBuilder sb = new StringBuilder();
        if (!missingFields.isEmpty()) {
            sb.append("missing required field(s): ").append(String.join(", ", missingFields));
        }
        for (String error : fieldErrors) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(error);
        }
        return sb.length() == 0 ? "ok" : sb.toString();
    }
}
