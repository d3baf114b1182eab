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

/**
 * Result of an atomic take-if-owner on the pending action store. The entry is
 * present only when the status is {@link Status#FOUND}.
 */
public record TakeResult(Status status, PendingEntry entry) {

    public enum Status {
        FOUND, NOT_FOUND, NOT_OWNER
    }

    public static TakeResult found(PendingEntry entry) {
        return new TakeResult(Status.FOUND, entry);
    }

    public static TakeResult notFound() {
        return new TakeResult(Status.NOT_FOUND, null);
    }

    public static TakeResult notOwner() {
        return new TakeResult(Status.NOT_OWNER, null);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }
}
