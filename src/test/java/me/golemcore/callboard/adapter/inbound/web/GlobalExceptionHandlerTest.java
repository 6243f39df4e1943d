package me.golemcore.callboard.adapter.inbound.web;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapResponseStatusException() {
        StepVerifier.create(handler.handleResponseStatus(
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Chat not found")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    assertEquals(404, response.getBody().getStatus());
                    assertEquals("Chat not found", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalArgumentToBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("path is required")))
                .assertNext(response -> assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldHideInternalErrorDetails() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("secret")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
