package me.golemcore.adminbot.adapter.inbound.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.adminbot.adapter.outbound.discord.DiscordRestClient;
import me.golemcore.adminbot.infrastructure.config.BotProperties;
import me.golemcore.adminbot.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DiscordCommandRegistrarTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OkHttpMockEngine engine;
    private BotProperties properties;
    private DiscordCommandRegistrar registrar;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new BotProperties();
        properties.getDiscord().setToken("secret-token");
        properties.getDiscord().setApplicationId("app-1");
        properties.getDiscord().setApiBaseUrl("http://discord.test/api/v10");
        OkHttpClient httpClient = new OkHttpClient.Builder().addInterceptor(engine).build();
        registrar = new DiscordCommandRegistrar(properties,
                new DiscordRestClient(properties, httpClient, objectMapper));
    }

    @Test
    void shouldOverwriteGlobalCommands() throws Exception {
        engine.enqueueJson(200, "[]");

        registrar.registerCommands();

        assertEquals("PUT", engine.lastRequest().method());
        assertEquals("/api/v10/applications/app-1/commands", engine.lastRequest().target());
        JsonNode commands = objectMapper.readTree(engine.lastRequest().body());
        Set<String> names = new HashSet<>();
        for (JsonNode command : commands) {
            names.add(command.path("name").asText());
            assertEquals("32", command.path("default_member_permissions").asText());
            assertFalse(command.path("dm_permission").asBoolean());
        }
        assertEquals(Set.of("server_ai", "create_role", "create_channel", "delete_channel", "assign_role",
                "remove_role", "lock_channel", "unlock_channel", "create_category", "channel_permissions"), names);
    }

    @Test
    void shouldSkipWhenDisabled() {
        properties.getDiscord().setRegisterCommands(false);

        registrar.registerCommands();

        assertEquals(0, engine.getRequestCount());
    }

    @Test
    void shouldSkipWithoutApplicationId() {
        properties.getDiscord().setApplicationId(null);

        registrar.registerCommands();

        assertEquals(0, engine.getRequestCount());
    }

    @Test
    void shouldSurviveRejectedRegistration() {
        engine.enqueueDiscordError(401, "401: Unauthorized");

        assertDoesNotThrow(() -> registrar.registerCommands());
        assertEquals(1, engine.getRequestCount());
    }
}
