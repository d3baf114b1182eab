package me.golemcore.adminbot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main application class for the GolemCore admin bot.
 *
 * <p>
 * The bot turns free-text server administration requests into typed actions
 * with the help of a language model, asks for confirmation before anything
 * destructive happens and then applies the actions through the Discord REST
 * API.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → DiscordInteractionController, SystemController
 * Domain Layer       → AdminCommandWorkflow, InstructionTranslator,
 *                      ConfirmationCoordinator, ActionExecutor
 * Infrastructure     → langchain4j inference, Discord REST, pending store
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class AdminBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdminBotApplication.class, args);
    }

}
