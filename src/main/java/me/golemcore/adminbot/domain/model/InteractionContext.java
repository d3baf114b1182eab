package me.golemcore.adminbot.domain.model;

import java.util.Set;

/**
 * Where an interaction came from and who issued it. {@code interactionToken}
 * lets the response adapter edit the deferred reply.
 */
public record InteractionContext(String applicationId, String interactionToken, String guildId,
        String channelId, String requesterId, Set<AdminCapability> capabilities) {

    public InteractionContext {
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
    }
}
