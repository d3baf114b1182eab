package me.golemcore.adminbot.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemHealthResponse {
    private String status;
    private String version;
    private long uptimeMs;
    private boolean inferenceConfigured;
    private boolean discordConfigured;
    private int pendingConfirmations;
}
