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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.adminbot.domain.model.ActionOutcome;
import me.golemcore.adminbot.domain.model.AdminAction;
import me.golemcore.adminbot.domain.model.InteractionContext;
import me.golemcore.adminbot.domain.model.PendingEntry;
import me.golemcore.adminbot.domain.model.ProposalResult;
import me.golemcore.adminbot.domain.model.ResolutionResult;
import me.golemcore.adminbot.domain.model.TakeResult;
import me.golemcore.adminbot.infrastructure.config.BotProperties;
import me.golemcore.adminbot.port.outbound.GuildAdminPort;
import me.golemcore.adminbot.port.outbound.InteractionResponsePort;
import me.golemcore.adminbot.port.outbound.PendingActionStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Gates destructive action lists behind a human confirmation.
 *
 * <p>
 * A list without destructive actions is executed right away. A list with at
 * least one destructive action is rendered as a confirmation prompt and parked
 * in the {@link PendingActionStore} under the prompt's message id. Only the
 * requester can confirm or decline it; confirming executes the whole list,
 * declining drops it. Either way no entry is left behind.
 *
 * <pre>
 * PROPOSED ──no destructive──▶ EXECUTED
 *    │
 *    ├──destructive, prompt too long──▶ REJECTED
 *    │
 *    └──destructive──▶ AWAITING_CONFIRMATION ──confirm──▶ EXECUTED
 *                               │
 *                               └──decline / expiry──▶ DISCARDED
 * </pre>
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ConfirmationCoordinator {

    private final PendingActionStore pendingStore;
    private final GuildAdminPort guildAdminPort;
    private final InteractionResponsePort responsePort;
    private final ActionExecutor executor;
    private final ActionSummaryFormatter formatter;
    private final BotProperties properties;
    private final Clock clock;

    public ConfirmationCoordinator(PendingActionStore pendingStore, GuildAdminPort guildAdminPort,
            InteractionResponsePort responsePort, ActionExecutor executor, ActionSummaryFormatter formatter,
            BotProperties properties, Clock clock) {
        this.pendingStore = pendingStore;
        this.guildAdminPort = guildAdminPort;
        this.responsePort = responsePort;
        this.executor = executor;
        this.formatter = formatter;
        this.properties = properties;
        this.clock = clock;
    }

    public ProposalResult propose(InteractionContext context, List<AdminAction> actions) {
        boolean destructive = actions.stream().anyMatch(AdminAction::isDestructive);
        if (!destructive) {
            log.info("[Confirm] {} action(s) from user {} need no confirmation, executing", actions.size(),
                    context.requesterId());
            List<ActionOutcome> outcomes = executor.execute(actions, guildAdminPort.forGuild(context.guildId()));
            return ProposalResult.executed(outcomes);
        }

        Optional<String> summary = formatter.formatProposal(actions, properties.getConfirmation().getTtlSeconds());
        if (summary.isEmpty()) {
            log.warn("[Confirm] {} action(s) from user {} do not fit in one confirmation prompt, rejecting",
                    actions.size(), context.requesterId());
            return ProposalResult.rejected();
        }
        String token = responsePort.sendConfirmationPrompt(context, summary.get());
        pendingStore.put(new PendingEntry(token, context.requesterId(), context.guildId(), context.channelId(),
                actions, clock.instant()));
        log.info("[Confirm] {} action(s) from user {} awaiting confirmation (token: {})", actions.size(),
                context.requesterId(), token);
        return ProposalResult.awaiting(token);
    }

    /**
     * Applies a confirm or decline click. A click by anyone but the requester
     * is answered as if nothing were pending and leaves the entry in place.
     */
    public ResolutionResult resolve(String token, String requesterId, boolean accepted) {
        TakeResult taken = pendingStore.takeIfOwner(token, requesterId);
        if (!taken.isFound()) {
            log.info("[Confirm] No pending actions for token {} and user {} ({})", token, requesterId,
                    taken.status());
            return ResolutionResult.noSuchPending();
        }

        PendingEntry entry = taken.entry();
        if (!accepted) {
            log.info("[Confirm] User {} declined {} action(s) (token: {})", requesterId, entry.actions().size(),
                    token);
            return ResolutionResult.discarded();
        }

        log.info("[Confirm] User {} confirmed {} action(s) (token: {})", requesterId, entry.actions().size(), token);
        List<ActionOutcome> outcomes = executor.execute(entry.actions(), guildAdminPort.forGuild(entry.guildId()));
        return ResolutionResult.executed(outcomes);
    }
}
