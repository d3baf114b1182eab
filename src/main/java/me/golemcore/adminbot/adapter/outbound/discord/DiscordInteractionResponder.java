package me.golemcore.adminbot.adapter.outbound.discord;

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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.adminbot.domain.model.InteractionContext;
import me.golemcore.adminbot.infrastructure.i18n.MessageService;
import me.golemcore.adminbot.port.outbound.InteractionResponsePort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Answers Discord interactions through the webhook endpoints of the
 * application.
 *
 * <p>
 * Every interaction is first acknowledged with a deferred response by the
 * inbound controller; this adapter then edits that original response. The
 * confirmation prompt carries two buttons whose custom ids are
 * {@link #CONFIRM_ID} and {@link #CANCEL_ID}.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class DiscordInteractionResponder implements InteractionResponsePort {

    public static final String CONFIRM_ID = "admin-confirm:yes";
    public static final String CANCEL_ID = "admin-confirm:no";

    private static final int COMPONENT_ACTION_ROW = 1;
    private static final int COMPONENT_BUTTON = 2;
    private static final int BUTTON_SECONDARY = 2;
    private static final int BUTTON_DANGER = 4;
    private static final int FLAG_EPHEMERAL = 1 << 6;

    private final DiscordRestClient client;
    private final MessageService messageService;

    public DiscordInteractionResponder(DiscordRestClient client, MessageService messageService) {
        this.client = client;
        this.messageService = messageService;
    }

    @Override
    public String sendConfirmationPrompt(InteractionContext context, String text) {
        Map<String, Object> body = message(text);
        body.put("components", List.of(Map.of(
                "type", COMPONENT_ACTION_ROW,
                "components", List.of(
                        button(CONFIRM_ID, messageService.getMessage("button.confirm"), BUTTON_DANGER),
                        button(CANCEL_ID, messageService.getMessage("button.cancel"), BUTTON_SECONDARY)))));

        JsonNode sent = client.patch(originalResponsePath(context), body);
        String messageId = sent.path("id").asText(null);
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalStateException("Discord did not return the confirmation message id");
        }
        log.debug("[Discord] Confirmation prompt {} sent to user {}", messageId, context.requesterId());
        return messageId;
    }

    @Override
    public void sendReply(InteractionContext context, String text) {
        Map<String, Object> body = message(text);
        body.put("components", List.of());
        client.patch(originalResponsePath(context), body);
    }

    @Override
    public void sendPrivateReply(InteractionContext context, String text) {
        Map<String, Object> body = message(text);
        body.put("flags", FLAG_EPHEMERAL);
        client.post("/webhooks/" + context.applicationId() + "/" + context.interactionToken(), body);
    }

    @Override
    public void closeMessage(String channelId, String messageId, String text) {
        Map<String, Object> body = message(text);
        body.put("components", List.of());
        client.patch("/channels/" + channelId + "/messages/" + messageId, body);
    }

    private static String originalResponsePath(InteractionContext context) {
        return "/webhooks/" + context.applicationId() + "/" + context.interactionToken() + "/messages/@original";
    }

    private static Map<String, Object> message(String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", text);
        // Never ping anyone from bot output
        body.put("allowed_mentions", Map.of("parse", List.of()));
        return body;
    }

    private static Map<String, Object> button(String customId, String label, int style) {
        Map<String, Object> button = new LinkedHashMap<>();
        button.put("type", COMPONENT_BUTTON);
        button.put("style", style);
        button.put("label", label);
        button.put("custom_id", customId);
        return button;
    }
}
