package me.golemcore.adminbot.adapter.outbound.discord;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.adminbot.domain.model.RejectionKind;
import me.golemcore.adminbot.infrastructure.config.BotProperties;
import me.golemcore.adminbot.port.outbound.GuildOperationException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Thin client for the Discord REST API (v10) over OkHttp.
 *
 * <p>
 * Requests are authenticated with the bot token. A non-2xx answer is turned
 * into a {@link GuildOperationException} whose kind follows the HTTP status and
 * whose message is Discord's own error text. Rate limits are reported, never
 * waited out.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class DiscordRestClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String USER_AGENT = "DiscordBot (golemcore-adminbot, 1.0)";

    private final BotProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public DiscordRestClient(BotProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public boolean isConfigured() {
        String token = properties.getDiscord().getToken();
        return token != null && !token.isBlank();
    }

    public JsonNode get(String path) {
        return execute("GET", path, null);
    }

    public JsonNode post(String path, Object body) {
        return execute("POST", path, body);
    }

    public JsonNode patch(String path, Object body) {
        return execute("PATCH", path, body);
    }

    public JsonNode put(String path, Object body) {
        return execute("PUT", path, body);
    }

    public void delete(String path) {
        execute("DELETE", path, null);
    }

    private JsonNode execute(String method, String path, Object body) {
        Request request = new Request.Builder()
                .url(properties.getDiscord().getApiBaseUrl() + path)
                .header("Authorization", "Bot " + properties.getDiscord().getToken())
                .header("User-Agent", USER_AGENT)
                .method(method, toRequestBody(method, body))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                RejectionKind kind = rejectionKind(response.code());
                String message = errorMessage(response.code(), text);
                log.warn("[Discord] {} {} failed: HTTP {} {}", method, path, response.code(), message);
                throw new GuildOperationException(kind, message);
            }
            log.trace("[Discord] {} {} -> HTTP {}", method, path, response.code());
            return text.isBlank() ? MissingNode.getInstance() : objectMapper.readTree(text);
        } catch (IOException e) {
            log.warn("[Discord] {} {} error: {}", method, path, e.getMessage());
            throw new GuildOperationException(RejectionKind.UNAVAILABLE, "Discord API unreachable: " + e.getMessage(),
                    e);
        }
    }

    private RequestBody toRequestBody(String method, Object body) {
        if (body == null) {
            if ("GET".equals(method) || "DELETE".equals(method)) {
                return null;
            }
            return RequestBody.create(new byte[0], null);
        }
        try {
            return RequestBody.create(objectMapper.writeValueAsString(body), JSON);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize request body", e);
        }
    }

    static RejectionKind rejectionKind(int status) {
        return switch (status) {
        case 400 -> RejectionKind.INVALID;
        case 401, 403 -> RejectionKind.PERMISSION_DENIED;
        case 404 -> RejectionKind.NOT_FOUND;
        case 409 -> RejectionKind.DUPLICATE;
        case 429 -> RejectionKind.RATE_LIMITED;
        default -> RejectionKind.UNAVAILABLE;
        };
    }

    private String errorMessage(int status, String body) {
        if (body != null && !body.isBlank()) {
            try {
                JsonNode node = objectMapper.readTree(body);
                JsonNode message = node.path("message");
                if (message.isTextual() && !message.asText().isBlank()) {
                    return message.asText() + " (HTTP " + status + ")";
                }
            } catch (JsonProcessingException e) {
                log.trace("[Discord] Error body is not JSON: {}", e.getMessage());
            }
        }
        return "Discord API error (HTTP " + status + ")";
    }
}
