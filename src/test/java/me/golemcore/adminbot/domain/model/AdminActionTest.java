package me.golemcore.adminbot.domain.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AdminActionTest {

    @Test
    void shouldTrimTargetAndApplyDefaults() {
        AdminAction action = AdminAction.of(ActionKind.CREATE_CHANNEL, "  lobby ");

        assertEquals("lobby", action.target());
        assertEquals("text", action.stringParam("type").orElseThrow());
        assertTrue(action.stringParam("category").isEmpty());
    }

    @Test
    void shouldRejectActionFailingSchema() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> AdminAction.of(ActionKind.ASSIGN_ROLE, "alice"));

        assertEquals("Invalid assign_role: missing required field(s): role", error.getMessage());
    }

    @Test
    void shouldRejectNullTarget() {
        assertThrows(IllegalArgumentException.class, () -> AdminAction.of(ActionKind.DELETE_CHANNEL, null));
    }

    @Test
    void shouldDropUndeclaredParams() {
        AdminAction action = AdminAction.of(ActionKind.CREATE_ROLE, "VIP", Map.of("color", "#00FF00", "hoist", "yes"));

        assertEquals(Map.of("color", "00ff00"), action.params());
    }

    @Test
    void shouldExposeUnmodifiableParams() {
        AdminAction action = AdminAction.of(ActionKind.CREATE_CHANNEL, "lobby", Map.of("type", "voice"));

        assertThrows(UnsupportedOperationException.class, () -> action.params().put("type", "text"));
    }

    @Test
    void shouldNotShareCallerParams() {
        Map<String, Object> params = new HashMap<>();
        params.put("role", "Member");
        AdminAction action = AdminAction.of(ActionKind.ASSIGN_ROLE, "alice", params);

        params.put("role", "Admin");

        assertEquals("Member", action.stringParam("role").orElseThrow());
    }

    @Test
    void shouldMapPermissionChangesIncludingReset() {
        Map<String, Object> permissions = new HashMap<>();
        permissions.put("send_messages", false);
        permissions.put("view_channel", null);
        AdminAction action = AdminAction.of(ActionKind.SET_CHANNEL_PERMISSIONS, "general",
                Map.of("subject", "Members", "permissions", permissions));

        Map<ChannelPermission, Boolean> changes = action.permissionChanges();

        assertEquals(2, changes.size());
        assertEquals(Boolean.FALSE, changes.get(ChannelPermission.SEND_MESSAGES));
        assertTrue(changes.containsKey(ChannelPermission.VIEW_CHANNEL));
        assertNull(changes.get(ChannelPermission.VIEW_CHANNEL));
    }

    @Test
    void shouldExposeRequestedRolePermissions() {
        AdminAction action = AdminAction.of(ActionKind.CREATE_ROLE, "Mods",
                Map.of("permissions", List.of("ban_members", "manage_guild")));

        assertEquals(Set.of(RolePermission.BAN_MEMBERS, RolePermission.MANAGE_GUILD), action.rolePermissions());
        assertTrue(action.permissionChanges().isEmpty());
        assertTrue(AdminAction.of(ActionKind.CREATE_ROLE, "VIP").rolePermissions().isEmpty());
    }

    @Test
    void shouldFlagOnlyDeletionsAsDestructive() {
        assertTrue(AdminAction.of(ActionKind.DELETE_CHANNEL, "old").isDestructive());
        assertTrue(AdminAction.of(ActionKind.DELETE_ROLE, "old").isDestructive());
        assertFalse(AdminAction.of(ActionKind.LOCK_CHANNEL, "general").isDestructive());
        assertFalse(AdminAction.of(ActionKind.CREATE_CATEGORY, "Gaming").isDestructive());
    }
}
