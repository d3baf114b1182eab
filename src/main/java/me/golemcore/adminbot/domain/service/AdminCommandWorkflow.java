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
import me.golemcore.adminbot.domain.model.AuthorizationDecision;
import me.golemcore.adminbot.domain.model.ConfirmationState;
import me.golemcore.adminbot.domain.model.InteractionContext;
import me.golemcore.adminbot.domain.model.PendingActionExpiredEvent;
import me.golemcore.adminbot.domain.model.PendingEntry;
import me.golemcore.adminbot.domain.model.ProposalResult;
import me.golemcore.adminbot.domain.model.ResolutionResult;
import me.golemcore.adminbot.domain.model.TranslationResult;
import me.golemcore.adminbot.infrastructure.config.AppConfiguration;
import me.golemcore.adminbot.infrastructure.i18n.MessageService;
import me.golemcore.adminbot.port.outbound.GuildAdminPort;
import me.golemcore.adminbot.port.outbound.InteractionResponsePort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for everything users do with the bot: natural-language
 * instructions, direct slash commands and clicks on confirmation prompts.
 *
 * <p>
 * All handling runs on the interaction worker pool. The caller has already
 * acknowledged the interaction with a deferred response; every path here ends
 * by replacing that deferred response or editing the prompt message.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class AdminCommandWorkflow {

    private final AdminAuthorizationGuard guard;
    private final InstructionTranslator translator;
    private final ConfirmationCoordinator coordinator;
    private final ActionExecutor executor;
    private final GuildAdminPort guildAdminPort;
    private final InteractionResponsePort responsePort;
    private final ActionSummaryFormatter formatter;
    private final MessageService messageService;
    private final ExecutorService workers;

    public AdminCommandWorkflow(AdminAuthorizationGuard guard, InstructionTranslator translator,
            ConfirmationCoordinator coordinator, ActionExecutor executor, GuildAdminPort guildAdminPort,
            InteractionResponsePort responsePort, ActionSummaryFormatter formatter, MessageService messageService,
            @Qualifier(AppConfiguration.INTERACTION_EXECUTOR) ExecutorService workers) {
        this.guard = guard;
        this.translator = translator;
        this.coordinator = coordinator;
        this.executor = executor;
        this.guildAdminPort = guildAdminPort;
        this.responsePort = responsePort;
        this.formatter = formatter;
        this.messageService = messageService;
        this.workers = workers;
    }

    /**
     * Translates an instruction and proposes the resulting actions.
     */
    public CompletableFuture<Void> handleInstruction(InteractionContext context, String instruction) {
        AuthorizationDecision entry = guard.checkEntry(context.capabilities());
        if (!entry.allowed()) {
            return CompletableFuture.runAsync(
                    () -> responsePort.sendReply(context, formatter.formatDenied(entry.missing())), workers)
                    .exceptionally(error -> failed(context, error));
        }

        log.info("[Workflow] Instruction from user {} in guild {}", context.requesterId(), context.guildId());
        return CompletableFuture.supplyAsync(() -> translator.translate(instruction), workers)
                .thenCompose(future -> future)
                .thenAcceptAsync(result -> propose(context, result), workers)
                .exceptionally(error -> failed(context, error));
    }

    /**
     * Executes one explicitly issued action without translation or
     * confirmation.
     */
    public CompletableFuture<Void> handleDirectCommand(InteractionContext context, AdminAction action) {
        return CompletableFuture.runAsync(() -> {
            AuthorizationDecision decision = guard.check(context.capabilities(), List.of(action));
            if (!decision.allowed()) {
                responsePort.sendReply(context, formatter.formatDenied(decision.missing()));
                return;
            }
            log.info("[Workflow] Direct command {} from user {}", action.kind().getWireName(),
                    context.requesterId());
            List<ActionOutcome> outcomes = executor.execute(List.of(action),
                    guildAdminPort.forGuild(context.guildId()));
            responsePort.sendReply(context, formatter.formatResults(outcomes));
        }, workers).exceptionally(error -> failed(context, error));
    }

    /**
     * Applies a Confirm or Cancel click on the prompt identified by
     * {@code token}.
     */
    public CompletableFuture<Void> handleConfirmation(InteractionContext context, String token, boolean accepted) {
        return CompletableFuture.runAsync(() -> {
            ResolutionResult result = coordinator.resolve(token, context.requesterId(), accepted);
            switch (result.resolution()) {
            case EXECUTED -> responsePort.closeMessage(context.channelId(), token,
                    formatter.formatConfirmed(result.outcomes()));
            case DISCARDED -> responsePort.closeMessage(context.channelId(), token,
                    messageService.getMessage("confirmation.cancelled"));
            case NO_SUCH_PENDING -> responsePort.sendPrivateReply(context,
                    messageService.getMessage("confirmation.no-such-pending"));
            }
        }, workers).exceptionally(error -> {
            log.error("[Workflow] Failed to resolve confirmation {}", token, error);
            return null;
        });
    }

    @EventListener
    public void onPendingExpired(PendingActionExpiredEvent event) {
        PendingEntry entry = event.entry();
        try {
            responsePort.closeMessage(entry.channelId(), entry.token(),
                    messageService.getMessage("confirmation.expired"));
        } catch (RuntimeException e) {
            log.warn("[Workflow] Failed to mark prompt {} expired: {}", entry.token(), e.getMessage());
        }
    }

    private void propose(InteractionContext context, TranslationResult result) {
        if (!result.isSuccess()) {
            responsePort.sendReply(context, formatter.formatTranslationError(result.error()));
            return;
        }
        AuthorizationDecision decision = guard.check(context.capabilities(), result.actions());
        if (!decision.allowed()) {
            log.info("[Workflow] User {} lacks {} for the proposed actions", context.requesterId(),
                    decision.missing());
            responsePort.sendReply(context, formatter.formatDenied(decision.missing()));
            return;
        }

        ProposalResult proposal = coordinator.propose(context, result.actions());
        if (proposal.state() == ConfirmationState.EXECUTED) {
            responsePort.sendReply(context, formatter.formatResults(proposal.outcomes()));
        } else if (proposal.state() == ConfirmationState.REJECTED) {
            responsePort.sendReply(context, formatter.formatProposalTooLarge(result.actions().size()));
        }
    }

    private Void failed(InteractionContext context, Throwable error) {
        log.error("[Workflow] Interaction from user {} failed", context.requesterId(), error);
        try {
            responsePort.sendReply(context, messageService.getMessage("error.internal"));
        } catch (RuntimeException e) {
            log.warn("[Workflow] Failed to report error to user {}: {}", context.requesterId(), e.getMessage());
        }
        return null;
    }
}
