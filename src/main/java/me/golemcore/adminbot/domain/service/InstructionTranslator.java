package me.golemcore.adminbot.domain.service;

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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.adminbot.domain.model.ActionKind;
import me.golemcore.adminbot.domain.model.AdminAction;
import me.golemcore.adminbot.domain.model.TranslationError;
import me.golemcore.adminbot.domain.model.TranslationFailureKind;
import me.golemcore.adminbot.domain.model.TranslationResult;
import me.golemcore.adminbot.domain.schema.ActionSchema;
import me.golemcore.adminbot.domain.schema.ActionValidation;
import me.golemcore.adminbot.infrastructure.config.BotProperties;
import me.golemcore.adminbot.port.outbound.InferencePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Translates a free-text instruction into a validated action list.
 *
 * <p>
 * The model is asked for a JSON array of actions. The first syntactically
 * valid JSON array in its answer is taken, so surrounding prose, markdown
 * fences and a wrapping {@code {"actions": [...]}} object are tolerated. Every
 * element is projected onto an {@link AdminAction} and validated against
 * {@link ActionSchema}; the first failing element fails the whole translation.
 *
 * <p>
 * The model call runs under a deadline of {@code bot.llm.timeout-seconds} and
 * is never retried.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class InstructionTranslator {

    private static final String KIND_FIELD = "kind";
    private static final String PARAMS_FIELD = "params";

    private final InferencePort inferencePort;
    private final ObjectMapper objectMapper;
    private final BotProperties properties;

    public InstructionTranslator(InferencePort inferencePort, ObjectMapper objectMapper, BotProperties properties) {
        this.inferencePort = inferencePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public CompletableFuture<TranslationResult> translate(String instruction) {
        if (instruction == null || instruction.isBlank()) {
            return CompletableFuture.completedFuture(
                    TranslationResult.failure(TranslationFailureKind.EMPTY_PLAN, "instruction is empty"));
        }
        if (!inferencePort.isAvailable()) {
            log.warn("[Translate] Inference provider is not configured");
            return CompletableFuture.completedFuture(
                    TranslationResult.failure(TranslationFailureKind.INFERENCE_UNAVAILABLE,
                            "inference provider is not configured"));
        }

        CompletableFuture<String> completion;
        try {
            completion = inferencePort.complete(TranslationPrompt.system(), instruction.trim());
        } catch (RuntimeException e) {
            completion = CompletableFuture.failedFuture(e);
        }

        int timeoutSeconds = properties.getLlm().getTimeoutSeconds();
        return completion
                .orTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .handle((raw, error) -> {
                    if (error != null) {
                        Throwable cause = unwrap(error);
                        log.warn("[Translate] Inference failed: {}", describe(cause, timeoutSeconds));
                        return TranslationResult.failure(TranslationFailureKind.INFERENCE_UNAVAILABLE,
                                describe(cause, timeoutSeconds));
                    }
                    return interpret(raw);
                });
    }

    /**
     * Interprets raw model output. Deterministic for a given text.
     */
    public TranslationResult interpret(String raw) {
        Optional<JsonNode> array = findFirstArray(raw);
        if (array.isEmpty()) {
            log.debug("[Translate] No JSON array in model output: {}", abbreviate(raw));
            return TranslationResult.failure(TranslationFailureKind.MALFORMED_RESPONSE,
                    "model response contains no JSON array");
        }
        JsonNode elements = array.get();
        if (elements.isEmpty()) {
            return TranslationResult.failure(TranslationFailureKind.EMPTY_PLAN, "AI returned no actions to perform");
        }

        List<AdminAction> actions = new ArrayList<>();
        for (int index = 0; index < elements.size(); index++) {
            JsonNode element = elements.get(index);
            if (!element.isObject()) {
                return invalid(index, "action must be a JSON object");
            }
            JsonNode kindNode = element.get(KIND_FIELD);
            if (kindNode == null || !kindNode.isTextual()) {
                return invalid(index, "action has no \"kind\"");
            }

            Map<String, Object> fields = collectFields(element);
            String kindName = kindNode.asText();
            ActionValidation validation = ActionSchema.validate(kindName, fields);
            if (validation.isUnknownKind()) {
                log.info("[Translate] Unknown action kind '{}' at index {}", kindName, index);
                return TranslationResult.failure(TranslationError.atIndex(
                        TranslationFailureKind.UNKNOWN_ACTION_KIND, index, validation.describe()));
            }
            if (!validation.isValid()) {
                return invalid(index, validation.describe());
            }

            ActionKind kind = ActionKind.fromWireName(kindName).orElseThrow();
            Object target = fields.remove(ActionSchema.TARGET);
            actions.add(AdminAction.of(kind, (String) target, fields));
        }

        log.info("[Translate] Translated instruction into {} action(s)", actions.size());
        return TranslationResult.success(actions);
    }

    private TranslationResult invalid(int index, String reason) {
        log.info("[Translate] Invalid action at index {}: {}", index, reason);
        return TranslationResult.failure(
                TranslationError.atIndex(TranslationFailureKind.INVALID_ACTION, index, reason));
    }

    /**
     * Flattens an element into one field map. Keys of a nested {@code params}
     * object are merged in; top-level keys take precedence.
     */
    private Map<String, Object> collectFields(JsonNode element) {
        Map<String, Object> fields = new LinkedHashMap<>();
        JsonNode params = element.get(PARAMS_FIELD);
        if (params != null && params.isObject()) {
            copyFields(params, fields);
        }
        copyFields(element, fields);
        fields.remove(KIND_FIELD);
        fields.remove(PARAMS_FIELD);
        return fields;
    }

    private void copyFields(JsonNode node, Map<String, Object> fields) {
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            fields.put(field.getKey(), toValue(field.getValue()));
        }
    }

    private Object toValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isNumber()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isObject()) {
            Map<String, Object> map = new LinkedHashMap<>();
            node.fields().forEachRemaining(entry -> map.put(entry.getKey(), toValue(entry.getValue())));
            return map;
        }
        return objectMapper.convertValue(node, Object.class);
    }

    private Optional<JsonNode> findFirstArray(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        int start = raw.indexOf('[');
        while (start >= 0) {
            try (JsonParser parser = objectMapper.getFactory().createParser(raw.substring(start))) {
                JsonNode node = objectMapper.readTree(parser);
                if (node != null && node.isArray()) {
                    return Optional.of(node);
                }
            } catch (IOException e) {
                log.trace("[Translate] No valid array at offset {}: {}", start, e.getMessage());
            }
            start = raw.indexOf('[', start + 1);
        }
        return Optional.empty();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause, int timeoutSeconds) {
        if (cause instanceof TimeoutException) {
            return "no answer within " + timeoutSeconds + "s";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "null";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
