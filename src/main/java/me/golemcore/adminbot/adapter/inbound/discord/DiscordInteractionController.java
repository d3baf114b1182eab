package me.golemcore.adminbot.adapter.inbound.discord;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.adminbot.adapter.outbound.discord.DiscordInteractionResponder;
import me.golemcore.adminbot.adapter.outbound.discord.DiscordPermissionBits;
import me.golemcore.adminbot.domain.model.AdminAction;
import me.golemcore.adminbot.domain.model.AdminCapability;
import me.golemcore.adminbot.domain.model.InteractionContext;
import me.golemcore.adminbot.domain.service.AdminCommandWorkflow;
import me.golemcore.adminbot.infrastructure.i18n.MessageService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Discord interactions endpoint (WebFlux).
 *
 * <p>
 * Discord delivers slash commands and button clicks as signed HTTP requests to
 * {@code POST /api/discord/interactions}. Every request is verified first.
 * Commands and clicks are acknowledged immediately with a deferred response;
 * the real answer follows from {@link AdminCommandWorkflow} once the work is
 * done.
 *
 * <ul>
 * <li>PING (1) - answered with PONG</li>
 * <li>APPLICATION_COMMAND (2) - {@code /server_ai} or a direct command</li>
 * <li>MESSAGE_COMPONENT (3) - Confirm / Cancel on a confirmation prompt</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/discord")
@Slf4j
public class DiscordInteractionController {

    static final String SIGNATURE_HEADER = "X-Signature-Ed25519";
    static final String TIMESTAMP_HEADER = "X-Signature-Timestamp";

    private static final int TYPE_PING = 1;
    private static final int TYPE_APPLICATION_COMMAND = 2;
    private static final int TYPE_MESSAGE_COMPONENT = 3;

    private static final int RESPONSE_PONG = 1;
    private static final int RESPONSE_CHANNEL_MESSAGE = 4;
    private static final int RESPONSE_DEFERRED_CHANNEL_MESSAGE = 5;
    private static final int RESPONSE_DEFERRED_UPDATE_MESSAGE = 6;
    private static final int FLAG_EPHEMERAL = 1 << 6;

    private final DiscordSignatureVerifier signatureVerifier;
    private final AdminCommandWorkflow workflow;
    private final DirectCommandMapper commandMapper;
    private final MessageService messageService;
    private final ObjectMapper objectMapper;

    public DiscordInteractionController(DiscordSignatureVerifier signatureVerifier, AdminCommandWorkflow workflow,
            DirectCommandMapper commandMapper, MessageService messageService, ObjectMapper objectMapper) {
        this.signatureVerifier = signatureVerifier;
        this.workflow = workflow;
        this.commandMapper = commandMapper;
        this.messageService = messageService;
        this.objectMapper = objectMapper;
    }

    @PostMapping(value = "/interactions", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> interactions(
            @RequestBody byte[] body,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestHeader(value = TIMESTAMP_HEADER, required = false) String timestamp) {

        return Mono.fromCallable(() -> {
            if (!signatureVerifier.verify(signature, timestamp, body)) {
                log.warn("[Discord] Rejected interaction with invalid signature");
                return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                        .body(Map.<String, Object>of("error", "invalid request signature"));
            }

            JsonNode payload = parse(body);
            int type = payload.path("type").asInt(-1);
            return switch (type) {
            case TYPE_PING -> ResponseEntity.ok(Map.<String, Object>of("type", RESPONSE_PONG));
            case TYPE_APPLICATION_COMMAND -> ResponseEntity.ok(handleCommand(payload));
            case TYPE_MESSAGE_COMPONENT -> ResponseEntity.ok(handleComponent(payload));
            default -> {
                log.warn("[Discord] Unsupported interaction type: {}", type);
                yield ResponseEntity.badRequest()
                        .body(Map.<String, Object>of("error", "unsupported interaction type"));
            }
            };
        });
    }

    private Map<String, Object> handleCommand(JsonNode payload) {
        if (!payload.hasNonNull("guild_id")) {
            return ephemeral(messageService.getMessage("command.guild-only"));
        }
        InteractionContext context = toContext(payload);
        JsonNode data = payload.path("data");
        String command = data.path("name").asText();
        Map<String, JsonNode> options = new LinkedHashMap<>();
        for (JsonNode option : data.path("options")) {
            options.put(option.path("name").asText(), option.path("value"));
        }
        log.debug("[Discord] Command /{} from user {}", command, context.requesterId());

        if (DiscordCommandCatalog.SERVER_AI.equals(command)) {
            JsonNode instruction = options.get(DiscordCommandCatalog.OPT_INSTRUCTION);
            if (instruction == null || instruction.asText().isBlank()) {
                return ephemeral(messageService.getMessage("command.instruction-required"));
            }
            workflow.handleInstruction(context, instruction.asText());
            return Map.of("type", RESPONSE_DEFERRED_CHANNEL_MESSAGE);
        }

        AdminAction action;
        try {
            action = commandMapper.map(command, options);
        } catch (IllegalArgumentException e) {
            log.info("[Discord] Rejected /{}: {}", command, e.getMessage());
            return ephemeral(e.getMessage());
        }
        workflow.handleDirectCommand(context, action);
        return Map.of("type", RESPONSE_DEFERRED_CHANNEL_MESSAGE);
    }

    private Map<String, Object> handleComponent(JsonNode payload) {
        String customId = payload.path("data").path("custom_id").asText();
        boolean accepted;
        if (DiscordInteractionResponder.CONFIRM_ID.equals(customId)) {
            accepted = true;
        } else if (DiscordInteractionResponder.CANCEL_ID.equals(customId)) {
            accepted = false;
        } else {
            log.debug("[Discord] Ignoring component {}", customId);
            return Map.of("type", RESPONSE_DEFERRED_UPDATE_MESSAGE);
        }

        String token = payload.path("message").path("id").asText();
        workflow.handleConfirmation(toContext(payload), token, accepted);
        return Map.of("type", RESPONSE_DEFERRED_UPDATE_MESSAGE);
    }

    private InteractionContext toContext(JsonNode payload) {
        JsonNode member = payload.path("member");
        JsonNode user = member.isMissingNode() ? payload.path("user") : member.path("user");
        String channelId = payload.hasNonNull("channel_id")
                ? payload.path("channel_id").asText()
                : payload.path("channel").path("id").asText(null);

        return new InteractionContext(
                payload.path("application_id").asText(),
                payload.path("token").asText(),
                payload.path("guild_id").asText(null),
                channelId,
                user.path("id").asText(),
                capabilities(member.path("permissions").asText("0")));
    }

    private static Set<AdminCapability> capabilities(String permissions) {
        try {
            return DiscordPermissionBits.capabilitiesOf(Long.parseLong(permissions));
        } catch (NumberFormatException e) {
            log.warn("[Discord] Unparseable member permissions: {}", permissions);
            return Set.of();
        }
    }

    private JsonNode parse(byte[] body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed interaction payload", e);
        }
    }

    private static Map<String, Object> ephemeral(String content) {
        return Map.of("type", RESPONSE_CHANNEL_MESSAGE,
                "data", Map.of("content", content, "flags", FLAG_EPHEMERAL));
    }
}
