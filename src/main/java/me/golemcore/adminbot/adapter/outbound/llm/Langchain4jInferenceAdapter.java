package me.golemcore.adminbot.adapter.outbound.llm;

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

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.adminbot.infrastructure.config.AppConfiguration;
import me.golemcore.adminbot.infrastructure.config.BotProperties;
import me.golemcore.adminbot.port.outbound.InferencePort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Inference adapter using the langchain4j library.
 *
 * <p>
 * Supports Anthropic and any OpenAI compatible endpoint (OpenAI itself, the
 * Hugging Face router, local servers), selected by {@code bot.llm.provider}.
 * The model is built lazily on first use. Blocking model calls run on the
 * dedicated inference pool. Requests are never retried; the translator owns
 * the deadline.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class Langchain4jInferenceAdapter implements InferencePort {

    static final String PROVIDER_ANTHROPIC = "anthropic";

    private final BotProperties properties;
    private final ExecutorService inferenceExecutor;
    private volatile ChatModel chatModel;

    public Langchain4jInferenceAdapter(BotProperties properties,
            @Qualifier(AppConfiguration.INFERENCE_EXECUTOR) ExecutorService inferenceExecutor) {
        this.properties = properties;
        this.inferenceExecutor = inferenceExecutor;
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public CompletableFuture<String> complete(String systemPrompt, String userMessage) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = getModel();
            List<ChatMessage> messages = List.of(SystemMessage.from(systemPrompt), UserMessage.from(userMessage));
            try {
                ChatResponse response = model.chat(messages);
                String text = response.aiMessage() != null ? response.aiMessage().text() : null;
                log.debug("[LLM] Received {} chars", text != null ? text.length() : 0);
                return text != null ? text : "";
            } catch (RuntimeException e) {
                log.warn("[LLM] Completion failed: {}", e.getMessage());
                throw new IllegalStateException("LLM completion failed: " + e.getMessage(), e);
            }
        }, inferenceExecutor);
    }

    private ChatModel getModel() {
        ChatModel model = chatModel;
        if (model == null) {
            synchronized (this) {
                if (chatModel == null) {
                    if (!isAvailable()) {
                        throw new IllegalStateException("LLM provider not configured. Set bot.llm.api-key");
                    }
                    chatModel = createModel();
                    log.info("[LLM] Initialized {} model {}", properties.getLlm().getProvider(),
                            properties.getLlm().getModel());
                }
                model = chatModel;
            }
        }
        return model;
    }

    ChatModel createModel() {
        BotProperties.LlmProperties llm = properties.getLlm();
        if (PROVIDER_ANTHROPIC.equalsIgnoreCase(llm.getProvider())) {
            return createAnthropicModel(llm);
        }
        return createOpenAiModel(llm);
    }

    private ChatModel createAnthropicModel(BotProperties.LlmProperties llm) {
        var builder = AnthropicChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(0)
                .maxTokens(llm.getMaxTokens())
                .temperature(llm.getTemperature())
                .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()));

        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(BotProperties.LlmProperties llm) {
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(0)
                .maxTokens(llm.getMaxTokens())
                .temperature(llm.getTemperature())
                .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()));

        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }
}
