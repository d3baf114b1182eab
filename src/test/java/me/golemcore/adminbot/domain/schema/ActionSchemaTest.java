package me.golemcore.adminbot.domain.schema;

import me.golemcore.adminbot.domain.model.ActionKind;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionSchemaTest {

    private static final String TARGET = "target";

    // ===== validate =====

    @Test
    void shouldAcceptChannelWithTargetOnly() {
        ActionValidation validation = ActionSchema.validate(ActionKind.CREATE_CHANNEL, Map.of(TARGET, "general"));

        assertTrue(validation.isValid());
    }

    @Test
    void shouldReportMissingTarget() {
        ActionValidation validation = ActionSchema.validate(ActionKind.DELETE_ROLE, Map.of());

        assertFalse(validation.isValid());
        assertEquals(List.of(TARGET), validation.missingFields());
        assertEquals("missing required field(s): target", validation.describe());
    }

    @Test
    void shouldTreatBlankStringAsMissing() {
        ActionValidation validation = ActionSchema.validate(ActionKind.ASSIGN_ROLE,
                Map.of(TARGET, "alice", "role", "   "));

        assertEquals(List.of("role"), validation.missingFields());
    }

    @Test
    void shouldReportUnknownKindByName() {
        ActionValidation validation = ActionSchema.validate("ban_member", Map.of(TARGET, "bob"));

        assertTrue(validation.isUnknownKind());
        assertEquals("unknown action kind 'ban_member'", validation.describe());
    }

    @Test
    void shouldResolveKindNameIgnoringCase() {
        assertTrue(ActionSchema.validate(" Create_Category ", Map.of(TARGET, "Gaming")).isValid());
    }

    @Test
    void shouldRejectUnsupportedChannelType() {
        ActionValidation validation = ActionSchema.validate(ActionKind.CREATE_CHANNEL,
                Map.of(TARGET, "stage", "type", "stage"));

        assertFalse(validation.isValid());
        assertTrue(validation.fieldErrors().get(0).startsWith("type must be one of"));
    }

    @Test
    void shouldRejectMalformedColor() {
        ActionValidation validation = ActionSchema.validate(ActionKind.CREATE_ROLE,
                Map.of(TARGET, "VIP", "color", "red"));

        assertEquals(1, validation.fieldErrors().size());
    }

    @Test
    void shouldReportMissingAndInvalidFieldsTogether() {
        Map<String, Object> fields = Map.of(TARGET, "general", "permissions", Map.of("fly", true));

        ActionValidation validation = ActionSchema.validate(ActionKind.SET_CHANNEL_PERMISSIONS, fields);

        assertEquals(List.of("subject"), validation.missingFields());
        assertEquals(1, validation.fieldErrors().size());
        assertTrue(validation.describe().contains("unknown permission 'fly'"));
    }

    @Test
    void shouldRejectEmptyPermissionMap() {
        ActionValidation validation = ActionSchema.validate(ActionKind.SET_CHANNEL_PERMISSIONS,
                Map.of(TARGET, "general", "subject", "Members", "permissions", Map.of()));

        assertTrue(validation.describe().contains("at least one permission"));
    }

    @Test
    void shouldRejectNonBooleanPermissionValue() {
        ActionValidation validation = ActionSchema.validate(ActionKind.SET_CHANNEL_PERMISSIONS,
                Map.of(TARGET, "general", "subject", "Members", "permissions", Map.of("send_messages", "no")));

        assertFalse(validation.isValid());
    }

    @Test
    void shouldAcceptNullPermissionValueAsReset() {
        Map<String, Object> permissions = new HashMap<>();
        permissions.put("send_messages", null);

        ActionValidation validation = ActionSchema.validate(ActionKind.SET_CHANNEL_PERMISSIONS,
                Map.of(TARGET, "general", "subject", "Members", "permissions", permissions));

        assertTrue(validation.isValid());
    }

    @Test
    void shouldIgnoreUndeclaredFields() {
        ActionValidation validation = ActionSchema.validate(ActionKind.LOCK_CHANNEL,
                Map.of(TARGET, "general", "reason", 42));

        assertTrue(validation.isValid());
    }

    // ===== normalizeParams =====

    @Test
    void shouldApplyDefaultChannelType() {
        Map<String, Object> params = ActionSchema.normalizeParams(ActionKind.CREATE_CHANNEL,
                Map.of(TARGET, "general"));

        assertEquals(Map.of("type", "text"), params);
    }

    @Test
    void shouldNormalizeColorWithoutHash() {
        Map<String, Object> params = ActionSchema.normalizeParams(ActionKind.CREATE_ROLE,
                Map.of(TARGET, "VIP", "color", "#FF00aa"));

        assertEquals("ff00aa", params.get("color"));
    }

    @Test
    void shouldKeepPermissionOrder() {
        Map<String, Object> permissions = new LinkedHashMap<>();
        permissions.put("view_channel", true);
        permissions.put("send_messages", false);

        Map<String, Object> params = ActionSchema.normalizeParams(ActionKind.SET_CHANNEL_PERMISSIONS,
                Map.of(TARGET, "general", "subject", "Members", "permissions", permissions));

        @SuppressWarnings("unchecked")
        Map<String, Boolean> normalized = (Map<String, Boolean>) params.get("permissions");
        assertEquals(List.of("view_channel", "send_messages"), List.copyOf(normalized.keySet()));
        assertFalse(params.containsKey(TARGET));
    }

    @Test
    void shouldRejectUnknownRolePermission() {
        ActionValidation validation = ActionSchema.validate(ActionKind.CREATE_ROLE,
                Map.of(TARGET, "Mods", "permissions", List.of("kick_members", "fly")));

        assertFalse(validation.isValid());
        assertTrue(validation.describe().contains("unknown permission 'fly'"));
    }

    @Test
    void shouldRejectRolePermissionsGivenAsObject() {
        ActionValidation validation = ActionSchema.validate(ActionKind.CREATE_ROLE,
                Map.of(TARGET, "Mods", "permissions", Map.of("kick_members", true)));

        assertFalse(validation.isValid());
    }

    @Test
    void shouldNormalizeRolePermissionNames() {
        Map<String, Object> params = ActionSchema.normalizeParams(ActionKind.CREATE_ROLE,
                Map.of(TARGET, "Mods", "permissions", List.of(" Kick_Members", "ban_members", "kick_members")));

        assertEquals(List.of("kick_members", "ban_members"), params.get("permissions"));
    }

    // ===== describeVocabulary =====

    @Test
    void shouldDescribeEveryKind() {
        String vocabulary = ActionSchema.describeVocabulary();

        for (ActionKind kind : ActionKind.values()) {
            assertTrue(vocabulary.contains("- " + kind.getWireName() + ":"), kind.getWireName());
        }
        assertTrue(vocabulary.lines().filter(line -> line.endsWith("[destructive]"))
                .allMatch(line -> line.startsWith("- delete_")));
    }
}
