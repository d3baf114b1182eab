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

/**
 * Declaration of a single action field: its wire name, value type, whether it
 * must be present, the default applied when an optional field is absent, and
 * a short hint used when describing the vocabulary to the model.
 */
public record FieldSpec(String name, FieldType type, boolean required, Object defaultValue, String hint) {

    static FieldSpec required(String name, FieldType type, String hint) {
        return new FieldSpec(name, type, true, null, hint);
    }

    static FieldSpec optional(String name, FieldType type, Object defaultValue, String hint) {
        return new FieldSpec(name, type, false, defaultValue, hint);
    }
}
