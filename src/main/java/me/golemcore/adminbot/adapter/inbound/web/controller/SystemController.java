package me.golemcore.adminbot.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.adminbot.adapter.inbound.web.dto.SystemHealthResponse;
import me.golemcore.adminbot.port.outbound.GuildAdminPort;
import me.golemcore.adminbot.port.outbound.InferencePort;
import me.golemcore.adminbot.port.outbound.PendingActionStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.lang.management.ManagementFactory;

/**
 * Liveness endpoint, also used by uptime pingers to keep the bot awake.
 */
@RestController
@RequestMapping("/api/system")
@RequiredArgsConstructor
public class SystemController {

    private final InferencePort inferencePort;
    private final GuildAdminPort guildAdminPort;
    private final PendingActionStore pendingActionStore;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @GetMapping("/health")
    public Mono<ResponseEntity<SystemHealthResponse>> health() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();

        SystemHealthResponse response = SystemHealthResponse.builder()
                .status("UP")
                .version(buildProps != null ? buildProps.getVersion() : "dev")
                .uptimeMs(ManagementFactory.getRuntimeMXBean().getUptime())
                .inferenceConfigured(inferencePort.isAvailable())
                .discordConfigured(guildAdminPort.isAvailable())
                .pendingConfirmations(pendingActionStore.size())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }
}
