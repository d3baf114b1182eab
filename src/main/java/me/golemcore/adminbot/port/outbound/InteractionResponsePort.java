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

import me.golemcore.adminbot.domain.model.InteractionContext;

/**
 * Port for answering user interactions on the chat platform.
 */
public interface InteractionResponsePort {

    /**
     * Replaces the deferred reply of an interaction with a confirmation prompt
     * carrying Confirm and Cancel buttons.
     *
     * @return the platform id of the prompt message, used as confirmation token
     */
    String sendConfirmationPrompt(InteractionContext context, String text);

    /**
     * Replaces the deferred reply of an interaction with plain text.
     */
    void sendReply(InteractionContext context, String text);

    /**
     * Sends a reply visible only to the requester.
     */
    void sendPrivateReply(InteractionContext context, String text);

    /**
     * Replaces a message's text and removes its buttons.
     */
    void closeMessage(String channelId, String messageId, String text);
}
