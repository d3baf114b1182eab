package me.golemcore.adminbot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link DiscordProperties} - bot credentials and interaction
 * settings</li>
 * <li>{@link LlmProperties} - language model provider used for
 * translation</li>
 * <li>{@link ConfirmationProperties} - lifetime of pending confirmations</li>
 * <li>{@link WorkersProperties} - interaction worker pool</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private String language = "en";
    private DiscordProperties discord = new DiscordProperties();
    private LlmProperties llm = new LlmProperties();
    private ConfirmationProperties confirmation = new ConfirmationProperties();
    private WorkersProperties workers = new WorkersProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class DiscordProperties {
        private String token;
        private String applicationId;
        private String publicKey;
        private String apiBaseUrl = "https://discord.com/api/v10";
        private boolean registerCommands = true;
        private boolean verifySignatures = true;
    }

    @Data
    public static class LlmProperties {
        /**
         * {@code openai} for any OpenAI compatible endpoint, or
         * {@code anthropic}.
         */
        private String provider = "openai";
        private String apiKey;
        private String baseUrl;
        private String model = "mistralai/Mistral-7B-Instruct-v0.3";
        private double temperature = 0.1;
        private int maxTokens = 800;
        private int timeoutSeconds = 20;
    }

    @Data
    public static class ConfirmationProperties {
        private long ttlSeconds = 120;
        private long sweepIntervalSeconds = 15;
    }

    @Data
    public static class WorkersProperties {
        private int poolSize = 4;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
