package me.golemcore.adminbot.domain.service;

import me.golemcore.adminbot.adapter.outbound.pending.InMemoryPendingActionStore;
import me.golemcore.adminbot.domain.model.ActionKind;
import me.golemcore.adminbot.domain.model.ActionOutcome;
import me.golemcore.adminbot.domain.model.AdminAction;
import me.golemcore.adminbot.domain.model.AdminCapability;
import me.golemcore.adminbot.domain.model.ConfirmationState;
import me.golemcore.adminbot.domain.model.InteractionContext;
import me.golemcore.adminbot.domain.model.ObjectRef;
import me.golemcore.adminbot.domain.model.ObjectType;
import me.golemcore.adminbot.domain.model.PendingEntry;
import me.golemcore.adminbot.domain.model.ProposalResult;
import me.golemcore.adminbot.domain.model.ResolutionResult;
import me.golemcore.adminbot.infrastructure.config.BotProperties;
import me.golemcore.adminbot.infrastructure.i18n.MessageService;
import me.golemcore.adminbot.port.outbound.GuildAccess;
import me.golemcore.adminbot.port.outbound.GuildAdminPort;
import me.golemcore.adminbot.port.outbound.InteractionResponsePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ConfirmationCoordinatorTest {

    private static final String GUILD_ID = "900";
    private static final String OWNER_ID = "111";
    private static final String OTHER_ID = "222";
    private static final String TOKEN = "msg-1";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final ObjectRef GENERAL = new ObjectRef("200", "general", ObjectType.TEXT_CHANNEL);

    private InMemoryPendingActionStore store;
    private GuildAccess access;
    private InteractionResponsePort responsePort;
    private ConfirmationCoordinator coordinator;
    private InteractionContext context;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        BotProperties properties = new BotProperties();
        store = spy(new InMemoryPendingActionStore(properties, mock(ApplicationEventPublisher.class), clock));

        access = mock(GuildAccess.class);
        when(access.getGuildId()).thenReturn(GUILD_ID);
        when(access.findChannel("general")).thenReturn(Optional.of(GENERAL));
        GuildAdminPort guildAdminPort = mock(GuildAdminPort.class);
        when(guildAdminPort.forGuild(GUILD_ID)).thenReturn(access);

        responsePort = mock(InteractionResponsePort.class);
        when(responsePort.sendConfirmationPrompt(any(), anyString())).thenReturn(TOKEN);

        MessageService messageService = new MessageService();
        coordinator = new ConfirmationCoordinator(store, guildAdminPort, responsePort,
                new ActionExecutor(messageService), new ActionSummaryFormatter(messageService), properties, clock);
        context = new InteractionContext("app", "interaction-token", GUILD_ID, "300", OWNER_ID,
                Set.of(AdminCapability.ADMINISTRATOR));
    }

    // ===== propose =====

    @Test
    void shouldExecuteNonDestructiveListImmediately() {
        ProposalResult result = coordinator.propose(context, List.of(
                AdminAction.of(ActionKind.LOCK_CHANNEL, "general")));

        assertEquals(ConfirmationState.EXECUTED, result.state());
        assertEquals(1, result.outcomes().size());
        assertTrue(result.outcomes().get(0).succeeded());
        verify(store, never()).put(any());
        verify(responsePort, never()).sendConfirmationPrompt(any(), anyString());
    }

    @Test
    void shouldParkDestructiveListWithoutExecuting() {
        List<AdminAction> actions = List.of(
                AdminAction.of(ActionKind.LOCK_CHANNEL, "general"),
                AdminAction.of(ActionKind.DELETE_CHANNEL, "general"));

        ProposalResult result = coordinator.propose(context, actions);

        assertEquals(ConfirmationState.AWAITING_CONFIRMATION, result.state());
        assertEquals(TOKEN, result.token());
        ArgumentCaptor<PendingEntry> entry = ArgumentCaptor.forClass(PendingEntry.class);
        verify(store, times(1)).put(entry.capture());
        assertEquals(OWNER_ID, entry.getValue().requesterId());
        assertEquals(GUILD_ID, entry.getValue().guildId());
        assertEquals(actions, entry.getValue().actions());
        assertEquals(NOW, entry.getValue().createdAt());
        verifyNoInteractions(access);
    }

    @Test
    void shouldShowWholeListInPrompt() {
        coordinator.propose(context, List.of(
                AdminAction.of(ActionKind.CREATE_ROLE, "VIP"),
                AdminAction.of(ActionKind.DELETE_ROLE, "Muted")));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(responsePort).sendConfirmationPrompt(eq(context), prompt.capture());
        assertTrue(prompt.getValue().contains("1. create_role \"VIP\""));
        assertTrue(prompt.getValue().contains("2. ⚠️ delete_role \"Muted\""));
        assertTrue(prompt.getValue().contains("120 seconds"));
    }

    @Test
    void shouldRejectListWhosePromptWouldBeCut() {
        List<AdminAction> actions = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            actions.add(AdminAction.of(ActionKind.DELETE_CHANNEL, "channel-with-a-rather-long-name-" + i));
        }

        ProposalResult result = coordinator.propose(context, actions);

        assertEquals(ConfirmationState.REJECTED, result.state());
        assertNull(result.token());
        verify(responsePort, never()).sendConfirmationPrompt(any(), anyString());
        verify(store, never()).put(any());
        assertEquals(0, store.size());
        verifyNoInteractions(access);
    }

    // ===== resolve =====

    @Test
    void shouldExecuteWhenOwnerConfirms() {
        coordinator.propose(context, List.of(AdminAction.of(ActionKind.DELETE_CHANNEL, "general")));

        ResolutionResult result = coordinator.resolve(TOKEN, OWNER_ID, true);

        assertEquals(ResolutionResult.Resolution.EXECUTED, result.resolution());
        List<ActionOutcome> outcomes = result.outcomes();
        assertEquals(1, outcomes.size());
        assertTrue(outcomes.get(0).succeeded());
        verify(access).deleteChannel(GENERAL);
        assertEquals(0, store.size());
    }

    @Test
    void shouldDiscardWhenOwnerDeclines() {
        coordinator.propose(context, List.of(AdminAction.of(ActionKind.DELETE_CHANNEL, "general")));

        ResolutionResult result = coordinator.resolve(TOKEN, OWNER_ID, false);

        assertEquals(ResolutionResult.Resolution.DISCARDED, result.resolution());
        verify(access, never()).deleteChannel(any());
        assertEquals(0, store.size());
    }

    @Test
    void shouldIgnoreOtherUserAndKeepEntry() {
        coordinator.propose(context, List.of(AdminAction.of(ActionKind.DELETE_CHANNEL, "general")));

        ResolutionResult result = coordinator.resolve(TOKEN, OTHER_ID, true);

        assertEquals(ResolutionResult.Resolution.NO_SUCH_PENDING, result.resolution());
        verify(access, never()).deleteChannel(any());
        assertEquals(1, store.size());

        assertEquals(ResolutionResult.Resolution.EXECUTED, coordinator.resolve(TOKEN, OWNER_ID, true).resolution());
    }

    @Test
    void shouldExecuteOnlyOnceForRepeatedConfirm() {
        coordinator.propose(context, List.of(AdminAction.of(ActionKind.DELETE_CHANNEL, "general")));

        coordinator.resolve(TOKEN, OWNER_ID, true);
        ResolutionResult second = coordinator.resolve(TOKEN, OWNER_ID, true);

        assertEquals(ResolutionResult.Resolution.NO_SUCH_PENDING, second.resolution());
        verify(access, times(1)).deleteChannel(GENERAL);
    }

    @Test
    void shouldReportUnknownToken() {
        assertEquals(ResolutionResult.Resolution.NO_SUCH_PENDING,
                coordinator.resolve("missing", OWNER_ID, true).resolution());
    }
}
