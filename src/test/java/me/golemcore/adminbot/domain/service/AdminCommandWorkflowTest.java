package me.golemcore.adminbot.domain.service;

import me.golemcore.adminbot.domain.model.ActionKind;
import me.golemcore.adminbot.domain.model.ActionOutcome;
import me.golemcore.adminbot.domain.model.AdminAction;
import me.golemcore.adminbot.domain.model.AdminCapability;
import me.golemcore.adminbot.domain.model.InteractionContext;
import me.golemcore.adminbot.domain.model.ObjectRef;
import me.golemcore.adminbot.domain.model.ObjectType;
import me.golemcore.adminbot.domain.model.PendingActionExpiredEvent;
import me.golemcore.adminbot.domain.model.PendingEntry;
import me.golemcore.adminbot.domain.model.ProposalResult;
import me.golemcore.adminbot.domain.model.ResolutionResult;
import me.golemcore.adminbot.domain.model.TranslationFailureKind;
import me.golemcore.adminbot.domain.model.TranslationResult;
import me.golemcore.adminbot.infrastructure.i18n.MessageService;
import me.golemcore.adminbot.port.outbound.GuildAccess;
import me.golemcore.adminbot.port.outbound.GuildAdminPort;
import me.golemcore.adminbot.port.outbound.InteractionResponsePort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AdminCommandWorkflowTest {

    private static final String GUILD_ID = "900";
    private static final String CHANNEL_ID = "300";
    private static final String INSTRUCTION = "lock general";

    private InstructionTranslator translator;
    private ConfirmationCoordinator coordinator;
    private GuildAccess access;
    private InteractionResponsePort responsePort;
    private MessageService messageService;
    private ExecutorService workers;
    private AdminCommandWorkflow workflow;

    @BeforeEach
    void setUp() {
        translator = mock(InstructionTranslator.class);
        coordinator = mock(ConfirmationCoordinator.class);
        access = mock(GuildAccess.class);
        when(access.getGuildId()).thenReturn(GUILD_ID);
        GuildAdminPort guildAdminPort = mock(GuildAdminPort.class);
        when(guildAdminPort.forGuild(GUILD_ID)).thenReturn(access);
        responsePort = mock(InteractionResponsePort.class);
        messageService = new MessageService();
        workers = Executors.newSingleThreadExecutor();

        workflow = new AdminCommandWorkflow(new AdminAuthorizationGuard(), translator, coordinator,
                new ActionExecutor(messageService), guildAdminPort, responsePort,
                new ActionSummaryFormatter(messageService), messageService, workers);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        workers.shutdownNow();
        workers.awaitTermination(1, TimeUnit.SECONDS);
    }

    private static InteractionContext context(AdminCapability... capabilities) {
        return new InteractionContext("app", "interaction-token", GUILD_ID, CHANNEL_ID, "111", Set.of(capabilities));
    }

    private static void await(CompletableFuture<Void> future) throws Exception {
        future.get(5, TimeUnit.SECONDS);
    }

    // ===== instructions =====

    @Test
    void shouldReplyWithResultsWhenExecutedImmediately() throws Exception {
        InteractionContext context = context(AdminCapability.ADMINISTRATOR);
        AdminAction lock = AdminAction.of(ActionKind.LOCK_CHANNEL, "general");
        when(translator.translate(INSTRUCTION))
                .thenReturn(CompletableFuture.completedFuture(TranslationResult.success(List.of(lock))));
        when(coordinator.propose(context, List.of(lock))).thenReturn(ProposalResult.executed(List.of(
                ActionOutcome.success(lock, "200", "Locked channel general"))));

        await(workflow.handleInstruction(context, INSTRUCTION));

        verify(responsePort).sendReply(context, "Executed 1 action(s): 1 succeeded, 0 failed\n✅ Locked channel general");
    }

    @Test
    void shouldNotReplyAgainWhileAwaitingConfirmation() throws Exception {
        InteractionContext context = context(AdminCapability.ADMINISTRATOR);
        AdminAction delete = AdminAction.of(ActionKind.DELETE_CHANNEL, "general");
        when(translator.translate(INSTRUCTION))
                .thenReturn(CompletableFuture.completedFuture(TranslationResult.success(List.of(delete))));
        when(coordinator.propose(context, List.of(delete))).thenReturn(ProposalResult.awaiting("msg-1"));

        await(workflow.handleInstruction(context, INSTRUCTION));

        verify(coordinator).propose(context, List.of(delete));
        verify(responsePort, never()).sendReply(any(), anyString());
    }

    @Test
    void shouldExplainWhenPlanIsTooLongToConfirm() throws Exception {
        InteractionContext context = context(AdminCapability.ADMINISTRATOR);
        List<AdminAction> deletes = List.of(
                AdminAction.of(ActionKind.DELETE_CHANNEL, "one"),
                AdminAction.of(ActionKind.DELETE_CHANNEL, "two"));
        when(translator.translate(INSTRUCTION))
                .thenReturn(CompletableFuture.completedFuture(TranslationResult.success(deletes)));
        when(coordinator.propose(context, deletes)).thenReturn(ProposalResult.rejected());

        await(workflow.handleInstruction(context, INSTRUCTION));

        verify(responsePort).sendReply(context, messageService.getMessage("confirmation.too-large", 2));
        verify(responsePort, never()).sendConfirmationPrompt(any(), anyString());
    }

    @Test
    void shouldReplyWithTranslationError() throws Exception {
        InteractionContext context = context(AdminCapability.MANAGE_GUILD);
        when(translator.translate(INSTRUCTION)).thenReturn(CompletableFuture.completedFuture(
                TranslationResult.failure(TranslationFailureKind.MALFORMED_RESPONSE, "no array")));

        await(workflow.handleInstruction(context, INSTRUCTION));

        verify(responsePort).sendReply(context, messageService.getMessage("translate.malformed"));
        verify(coordinator, never()).propose(any(), anyList());
    }

    @Test
    void shouldDenyBeforeTranslating() throws Exception {
        InteractionContext context = context(AdminCapability.MANAGE_CHANNELS);

        await(workflow.handleInstruction(context, INSTRUCTION));

        verify(responsePort).sendReply(context, "❌ You need the Manage Server permission to do this.");
        verifyNoInteractions(translator);
    }

    @Test
    void shouldDenyWhenActionNeedsMissingCapability() throws Exception {
        InteractionContext context = context(AdminCapability.MANAGE_GUILD, AdminCapability.MANAGE_CHANNELS);
        AdminAction assign = AdminAction.of(ActionKind.ASSIGN_ROLE, "alice", Map.of("role", "VIP"));
        when(translator.translate(INSTRUCTION))
                .thenReturn(CompletableFuture.completedFuture(TranslationResult.success(List.of(assign))));

        await(workflow.handleInstruction(context, INSTRUCTION));

        verify(responsePort).sendReply(context, "❌ You need the Manage Roles permission to do this.");
        verify(coordinator, never()).propose(any(), anyList());
    }

    @Test
    void shouldReportInternalErrorWhenProposalFails() throws Exception {
        InteractionContext context = context(AdminCapability.ADMINISTRATOR);
        AdminAction delete = AdminAction.of(ActionKind.DELETE_CHANNEL, "general");
        when(translator.translate(INSTRUCTION))
                .thenReturn(CompletableFuture.completedFuture(TranslationResult.success(List.of(delete))));
        when(coordinator.propose(any(), anyList())).thenThrow(new IllegalStateException("prompt failed"));

        await(workflow.handleInstruction(context, INSTRUCTION));

        verify(responsePort).sendReply(context, messageService.getMessage("error.internal"));
    }

    // ===== direct commands =====

    @Test
    void shouldExecuteDirectCommandWithoutConfirmation() throws Exception {
        InteractionContext context = context(AdminCapability.ADMINISTRATOR);
        ObjectRef general = new ObjectRef("200", "general", ObjectType.TEXT_CHANNEL);
        when(access.findChannel("general")).thenReturn(Optional.of(general));

        await(workflow.handleDirectCommand(context, AdminAction.of(ActionKind.DELETE_CHANNEL, "general")));

        verify(access).deleteChannel(general);
        verify(responsePort).sendReply(context, "Executed 1 action(s): 1 succeeded, 0 failed\n✅ Deleted channel general");
        verifyNoInteractions(coordinator);
    }

    @Test
    void shouldDenyDirectCommandWithoutCapability() throws Exception {
        InteractionContext context = context(AdminCapability.MANAGE_GUILD);

        await(workflow.handleDirectCommand(context, AdminAction.of(ActionKind.CREATE_ROLE, "VIP")));

        verify(access, never()).createRole(anyString(), any(), any());
        verify(responsePort).sendReply(context, "❌ You need the Manage Roles permission to do this.");
    }

    // ===== confirmation clicks =====

    @Test
    void shouldCloseApprovedPromptWithResults() throws Exception {
        InteractionContext context = context();
        when(coordinator.resolve("msg-1", "111", true)).thenReturn(ResolutionResult.executed(List.of()));

        await(workflow.handleConfirmation(context, "msg-1", true));

        verify(responsePort).closeMessage(eq(CHANNEL_ID), eq("msg-1"),
                startsWith(messageService.getMessage("confirmation.confirmed")));
    }

    @Test
    void shouldCloseDeclinedPrompt() throws Exception {
        InteractionContext context = context();
        when(coordinator.resolve("msg-1", "111", false)).thenReturn(ResolutionResult.discarded());

        await(workflow.handleConfirmation(context, "msg-1", false));

        verify(responsePort).closeMessage(CHANNEL_ID, "msg-1", messageService.getMessage("confirmation.cancelled"));
    }

    @Test
    void shouldAnswerPrivatelyWhenNothingPending() throws Exception {
        InteractionContext context = context();
        when(coordinator.resolve(anyString(), anyString(), anyBoolean())).thenReturn(ResolutionResult.noSuchPending());

        await(workflow.handleConfirmation(context, "msg-1", true));

        verify(responsePort).sendPrivateReply(context, messageService.getMessage("confirmation.no-such-pending"));
        verify(responsePort, never()).closeMessage(anyString(), anyString(), anyString());
    }

    // ===== expiry =====

    @Test
    void shouldMarkExpiredPrompt() {
        PendingEntry entry = new PendingEntry("msg-1", "111", GUILD_ID, CHANNEL_ID,
                List.of(AdminAction.of(ActionKind.DELETE_ROLE, "Muted")), Instant.EPOCH);

        workflow.onPendingExpired(new PendingActionExpiredEvent(entry));

        verify(responsePort).closeMessage(CHANNEL_ID, "msg-1", messageService.getMessage("confirmation.expired"));
    }

    @Test
    void shouldSurviveFailedExpiryEdit() {
        PendingEntry entry = new PendingEntry("msg-1", "111", GUILD_ID, CHANNEL_ID,
                List.of(AdminAction.of(ActionKind.DELETE_ROLE, "Muted")), Instant.EPOCH);
        doThrow(new IllegalStateException("gone")).when(responsePort).closeMessage(anyString(), anyString(),
                anyString());

        assertDoesNotThrow(() -> workflow.onPendingExpired(new PendingActionExpiredEvent(entry)));
    }
}
