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

import me.golemcore.adminbot.domain.model.PendingEntry;
import me.golemcore.adminbot.domain.model.TakeResult;

/**
 * Store of action lists awaiting confirmation, keyed by confirmation token.
 * Safe for concurrent use. Entries are not persisted.
 */
public interface PendingActionStore {

    /**
     * Stores an entry, replacing any entry with the same token.
     */
    void put(PendingEntry entry);

    /**
     * Atomically removes and returns the entry if {@code requesterId} owns it.
     * A non-owner receives {@code NOT_OWNER} and the entry stays in place.
     */
    TakeResult takeIfOwner(String token, String requesterId);

    /**
     * Removes the entry if present, without an owner check and without an
     * expiry notification.
     *
     * <p>
     * The confirmation flow never calls this: a decline must pass the owner
     * check of {@link #takeIfOwner}, and expired entries are evicted by the
     * store itself, which notifies the prompt owner. It is meant for callers
     * outside that flow that must drop a prompt unconditionally, such as
     * operator cleanup or a prompt message deleted on the platform.
     */
    void discard(String token);

    int size();
}
