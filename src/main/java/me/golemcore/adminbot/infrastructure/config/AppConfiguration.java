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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.adminbot.infrastructure.i18n.MessageService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core beans of the bot and startup logging.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AppConfiguration {

    public static final String INTERACTION_EXECUTOR = "interactionExecutor";
    public static final String INFERENCE_EXECUTOR = "inferenceExecutor";

    private final BotProperties properties;
    private final MessageService messageService;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Worker pool running interaction handling off the web server threads.
     */
    @Bean(name = INTERACTION_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService interactionExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getWorkers().getPoolSize()), runnable -> {
            Thread thread = new Thread(runnable, "admin-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Threads blocked on model calls. Unbounded so a call starts as soon as it
     * is submitted and the translation deadline never covers queueing time;
     * every call is bounded by the model timeout.
     */
    @Bean(name = INFERENCE_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService inferenceExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "llm-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void init() {
        messageService.setLanguage(properties.getLanguage());
        log.info("GolemCore admin bot starting...");
        log.info("LLM Provider: {}, model: {}", properties.getLlm().getProvider(), properties.getLlm().getModel());
        log.info("Confirmation TTL: {}s, workers: {}", properties.getConfirmation().getTtlSeconds(),
                properties.getWorkers().getPoolSize());
    }
}
