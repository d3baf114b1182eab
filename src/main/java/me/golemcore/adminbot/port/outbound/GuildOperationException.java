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

import me.golemcore.adminbot.domain.model.RejectionKind;

/**
 * Thrown by {@link GuildAccess} when the platform rejects an operation.
 */
public class GuildOperationException extends RuntimeException {

    private final RejectionKind kind;

    public GuildOperationException(RejectionKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GuildOperationException(RejectionKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public RejectionKind getKind() {
        return kind;
    }
}
