package me.golemcore.adminbot.adapter.inbound.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.TextNode;
import me.golemcore.adminbot.domain.model.ActionKind;
import me.golemcore.adminbot.domain.model.AdminAction;
import me.golemcore.adminbot.domain.model.ChannelPermission;
import me.golemcore.adminbot.infrastructure.i18n.MessageService;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DirectCommandMapperTest {

    private final MessageService messageService = new MessageService();
    private final DirectCommandMapper mapper = new DirectCommandMapper(messageService);

    private static Map<String, JsonNode> options(Object... pairs) {
        Map<String, JsonNode> options = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            Object value = pairs[i + 1];
            options.put((String) pairs[i],
                    value instanceof Boolean flag ? BooleanNode.valueOf(flag) : TextNode.valueOf((String) value));
        }
        return options;
    }

    @Test
    void shouldMapCreateChannelWithDefaults() {
        AdminAction action = mapper.map("create_channel", options("name", "lobby"));

        assertEquals(ActionKind.CREATE_CHANNEL, action.kind());
        assertEquals("lobby", action.target());
        assertEquals(Map.of("type", "text"), action.params());
    }

    @Test
    void shouldMapCreateRoleColor() {
        AdminAction action = mapper.map("create_role", options("name", "VIP", "color", "#00FF00"));

        assertEquals("00ff00", action.stringParam("color").orElseThrow());
    }

    @Test
    void shouldMapAssignRoleIds() {
        AdminAction action = mapper.map("assign_role", options("user", "123456789012345678", "role", "555"));

        assertEquals(AdminAction.of(ActionKind.ASSIGN_ROLE, "123456789012345678", Map.of("role", "555")), action);
    }

    @Test
    void shouldMapRoleOverwrite() {
        AdminAction action = mapper.map("channel_permissions",
                options("channel", "200", "role", "555", "send_messages", false, "view_channel", true));

        assertEquals(ActionKind.SET_CHANNEL_PERMISSIONS, action.kind());
        assertEquals("role", action.stringParam("subject_type").orElseThrow());
        assertEquals(Map.of(ChannelPermission.SEND_MESSAGES, false, ChannelPermission.VIEW_CHANNEL, true),
                action.permissionChanges());
    }

    @Test
    void shouldRequireExactlyOneSubject() {
        IllegalArgumentException none = assertThrows(IllegalArgumentException.class,
                () -> mapper.map("channel_permissions", options("channel", "200", "connect", true)));
        IllegalArgumentException both = assertThrows(IllegalArgumentException.class,
                () -> mapper.map("channel_permissions",
                        options("channel", "200", "role", "555", "user", "666", "connect", true)));

        assertEquals(messageService.getMessage("command.permissions.no-subject"), none.getMessage());
        assertEquals(messageService.getMessage("command.permissions.both-subjects"), both.getMessage());
    }

    @Test
    void shouldRequireAtLeastOnePermission() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> mapper.map("channel_permissions", options("channel", "200", "user", "666")));

        assertEquals(messageService.getMessage("command.permissions.no-changes"), error.getMessage());
    }

    @Test
    void shouldReportInvalidInput() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> mapper.map("create_role", options("name", "VIP", "color", "green")));

        assertTrue(error.getMessage().startsWith("❌ Invalid create_role"));
    }

    @Test
    void shouldRejectUnknownCommand() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> mapper.map("ban", options()));

        assertEquals(messageService.getMessage("command.unknown", "ban"), error.getMessage());
    }
}
