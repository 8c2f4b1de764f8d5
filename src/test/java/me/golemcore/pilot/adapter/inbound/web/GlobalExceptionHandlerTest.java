package me.golemcore.pilot.adapter.inbound.web;

import me.golemcore.pilot.domain.service.BrowserSessionService.SessionNotRenewableException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldKeepStatusOfResponseStatusException() {
        StepVerifier.create(handler.handleResponseStatus(
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found")))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.NOT_FOUND, resp.getStatusCode());
                    assertEquals(404, resp.getBody().getStatus());
                    assertEquals("Run not found", resp.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalArgumentToBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("Task prompt is missing")))
                .assertNext(resp -> assertEquals(HttpStatus.BAD_REQUEST, resp.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldMapRenewalRefusalToConflict() {
        StepVerifier.create(handler.handleIllegalState(
                new SessionNotRenewableException("Browser session has not started yet", "pbs_1")))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.CONFLICT, resp.getStatusCode());
                    assertEquals("Browser session has not started yet", resp.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("secret stack detail")))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, resp.getStatusCode());
                    assertEquals("Internal server error", resp.getBody().getMessage());
                })
                .verifyComplete();
    }
}
