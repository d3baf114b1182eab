package me.golemcore.adminbot.adapter.inbound.web;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapIllegalArgumentToBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("Malformed interaction payload")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals(400, response.getBody().getStatus());
                    assertEquals("Malformed interaction payload", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldKeepResponseStatus() {
        StepVerifier.create(handler.handleResponseStatus(new ResponseStatusException(HttpStatus.NOT_FOUND, "gone")))
                .assertNext(response -> assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldHideInternalErrors() {
        StepVerifier.create(handler.handleGeneric(new IllegalStateException("secret detail")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
