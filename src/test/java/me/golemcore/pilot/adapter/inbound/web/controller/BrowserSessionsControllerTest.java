package me.golemcore.pilot.adapter.inbound.web.controller;

import me.golemcore.pilot.adapter.inbound.web.dto.CreateBrowserSessionRequest;
import me.golemcore.pilot.domain.model.BrowserSession;
import me.golemcore.pilot.domain.model.BrowserSessionStatus;
import me.golemcore.pilot.domain.service.BrowserSessionService;
import me.golemcore.pilot.domain.service.BrowserSessionService.SessionNotRenewableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BrowserSessionsControllerTest {

    private static final String ORG = "org_1";
    private static final String SESSION_ID = "pbs_1";

    private BrowserSessionService browserSessionService;
    private BrowserSessionsController controller;

    @BeforeEach
    void setUp() {
        browserSessionService = mock(BrowserSessionService.class);
        controller = new BrowserSessionsController(browserSessionService);
    }

    private static BrowserSession session(BrowserSessionStatus status) {
        return BrowserSession.builder()
                .id(SESSION_ID)
                .organizationId(ORG)
                .status(status)
                .timeoutMinutes(60)
                .createdAt(Instant.parse("2026-03-01T10:00:00Z"))
                .startedAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build();
    }

    @Test
    void shouldCreateSessionWithDefaults() {
        when(browserSessionService.create(ORG, null, null)).thenReturn(session(BrowserSessionStatus.CREATED));

        StepVerifier.create(controller.createSession(ORG, null))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.CREATED, resp.getStatusCode());
                    assertEquals("created", resp.getBody().getStatus());
                    assertEquals(Instant.parse("2026-03-01T11:00:00Z"), resp.getBody().getExpiresAt());
                })
                .verifyComplete();
    }

    @Test
    void shouldPassRequestedTimeout() {
        when(browserSessionService.create(ORG, "RESIDENTIAL", 30)).thenReturn(session(BrowserSessionStatus.CREATED));

        controller.createSession(ORG, new CreateBrowserSessionRequest("RESIDENTIAL", 30)).block();

        verify(browserSessionService).create(ORG, "RESIDENTIAL", 30);
    }

    @Test
    void shouldListActiveSessions() {
        when(browserSessionService.getActiveSessions(ORG)).thenReturn(List.of(session(BrowserSessionStatus.RUNNING)));

        StepVerifier.create(controller.listActiveSessions(ORG))
                .assertNext(resp -> assertEquals("running", resp.getBody().get(0).getStatus()))
                .verifyComplete();
    }

    @Test
    void shouldRenewSession() {
        BrowserSession renewed = session(BrowserSessionStatus.RUNNING);
        renewed.setTimeoutMinutes(120);
        when(browserSessionService.renewOrClose(ORG, SESSION_ID)).thenReturn(renewed);

        StepVerifier.create(controller.renewSession(ORG, SESSION_ID))
                .assertNext(resp -> assertEquals(120, resp.getBody().getTimeoutMinutes()))
                .verifyComplete();
    }

    @Test
    void shouldPropagateRenewalRefusal() {
        when(browserSessionService.renewOrClose(ORG, SESSION_ID)).thenThrow(
                new SessionNotRenewableException("Browser session has already completed", SESSION_ID));

        assertThrows(SessionNotRenewableException.class, () -> controller.renewSession(ORG, SESSION_ID));
    }

    @Test
    void shouldCloseSession() {
        when(browserSessionService.requireSession(ORG, SESSION_ID)).thenReturn(session(BrowserSessionStatus.RUNNING));
        when(browserSessionService.close(ORG, SESSION_ID)).thenReturn(session(BrowserSessionStatus.CLOSED));

        StepVerifier.create(controller.closeSession(ORG, SESSION_ID))
                .assertNext(resp -> assertEquals("closed", resp.getBody().getStatus()))
                .verifyComplete();
    }

    @Test
    void shouldNotCloseSessionOfOtherOrganization() {
        when(browserSessionService.requireSession("org_2", SESSION_ID))
                .thenThrow(new IllegalArgumentException("Browser session not found: " + SESSION_ID));

        assertThrows(IllegalArgumentException.class, () -> controller.closeSession("org_2", SESSION_ID));
        verify(browserSessionService, never()).close("org_2", SESSION_ID);
    }
}
