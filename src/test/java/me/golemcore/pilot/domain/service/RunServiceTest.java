package me.golemcore.pilot.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.pilot.domain.model.Run;
import me.golemcore.pilot.domain.model.RunStatus;
import me.golemcore.pilot.testsupport.InMemoryStoragePort;
import me.golemcore.pilot.testsupport.MutableClock;
import me.golemcore.pilot.testsupport.TestObjects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunServiceTest {

    private static final String ORG = "org_1";
    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private InMemoryStoragePort storage;
    private ObjectMapper objectMapper;
    private MutableClock clock;
    private RunService service;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStoragePort();
        objectMapper = TestObjects.objectMapper();
        clock = new MutableClock(START);
        service = new RunService(storage, objectMapper, clock);
    }

    private Run newRun() {
        return service.createRun(ORG, Run.builder().prompt("Find the cheapest flight").url("https://example.com")
                .build());
    }

    @Test
    void shouldCreateRunInCreatedStatus() {
        Run run = newRun();

        assertTrue(run.getId().startsWith("run_"));
        assertEquals(RunStatus.CREATED, run.getStatus());
        assertEquals(ORG, run.getOrganizationId());
        assertEquals(START, run.getCreatedAt());
        assertNotNull(storage.read("runs", run.getId() + ".json"));
    }

    @Test
    void shouldHandOutSnapshotsThatDoNotChangeStoredRun() {
        Run run = newRun();
        Run snapshot = service.getRun(run.getId()).orElseThrow();

        snapshot.setStatus(RunStatus.COMPLETED);
        snapshot.setCancelRequested(true);
        run.setPrompt("changed");

        Run stored = service.getRun(run.getId()).orElseThrow();
        assertEquals(RunStatus.CREATED, stored.getStatus());
        assertFalse(stored.isCancelRequested());
        assertEquals("Find the cheapest flight", stored.getPrompt());
    }

    @Test
    void shouldReturnSnapshotThatMissesLaterTransitions() {
        Run run = newRun();
        Run before = service.getRun(run.getId()).orElseThrow();

        service.queueRun(run.getId());

        assertEquals(RunStatus.CREATED, before.getStatus());
        assertEquals(RunStatus.QUEUED, service.getRun(run.getId()).orElseThrow().getStatus());
    }

    @Test
    void shouldRejectRunWithoutPrompt() {
        Run template = Run.builder().prompt("  ").build();

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> service.createRun(ORG, template));
        assertEquals(RunService.TASK_PROMPT_MISSING, ex.getMessage());
    }

    @Test
    void shouldRejectNonPositiveMaxSteps() {
        Run template = Run.builder().prompt("p").maxSteps(0).build();

        assertThrows(IllegalArgumentException.class, () -> service.createRun(ORG, template));
    }

    @Test
    void shouldStampTimestampsAlongTheLifecycle() {
        Run run = newRun();
        clock.advance(Duration.ofSeconds(1));
        service.queueRun(run.getId());
        clock.advance(Duration.ofSeconds(1));
        assertTrue(service.tryMarkRunning(run.getId()));
        clock.advance(Duration.ofSeconds(1));
        Run finished = service.finishIfActive(run.getId(), RunStatus.COMPLETED, null, "out", "done");

        assertEquals(START.plusSeconds(1), finished.getQueuedAt());
        assertEquals(START.plusSeconds(2), finished.getStartedAt());
        assertEquals(START.plusSeconds(3), finished.getFinishedAt());
        assertEquals("out", finished.getOutput());
        assertEquals("done", finished.getSummary());
        assertNull(finished.getFailureReason());
    }

    @Test
    void shouldStartQueuedRunOnlyOnce() {
        Run run = newRun();
        service.queueRun(run.getId());

        assertTrue(service.tryMarkRunning(run.getId()));
        assertFalse(service.tryMarkRunning(run.getId()));
    }

    @Test
    void shouldRejectIllegalTransition() {
        Run run = newRun();

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> service.transition(run.getId(), RunStatus.COMPLETED, r -> {
                }));
        assertTrue(ex.getMessage().contains("CREATED"));
    }

    @Test
    void shouldIgnoreFinishOnFinalRun() {
        Run run = newRun();
        service.queueRun(run.getId());
        service.tryMarkRunning(run.getId());
        service.finishIfActive(run.getId(), RunStatus.CANCELED, "Run was canceled", null, null);

        Run after = service.finishIfActive(run.getId(), RunStatus.FAILED, "late failure", null, null);

        assertEquals(RunStatus.CANCELED, after.getStatus());
        assertEquals("Run was canceled", after.getFailureReason());
    }

    @Test
    void shouldFlagCancelBeforeStart() {
        Run run = newRun();
        service.queueRun(run.getId());

        Run flagged = service.requestCancel(ORG, run.getId());

        assertEquals(RunStatus.QUEUED, flagged.getStatus());
        assertTrue(flagged.isCancelRequested());
    }

    @Test
    void shouldCancelRunningRunImmediately() {
        Run run = newRun();
        service.queueRun(run.getId());
        service.tryMarkRunning(run.getId());

        Run canceled = service.requestCancel(ORG, run.getId());

        assertEquals(RunStatus.CANCELED, canceled.getStatus());
        assertEquals(RunService.CANCELED_REASON, canceled.getFailureReason());
    }

    @Test
    void shouldRejectCancelOfFinishedRun() {
        Run run = newRun();
        service.queueRun(run.getId());
        service.tryMarkRunning(run.getId());
        service.finishIfActive(run.getId(), RunStatus.COMPLETED, null, null, "ok");

        assertThrows(IllegalStateException.class, () -> service.requestCancel(ORG, run.getId()));
    }

    @Test
    void shouldTerminateOnlyRunningRuns() {
        Run run = newRun();
        assertThrows(IllegalStateException.class, () -> service.requestTerminate(ORG, run.getId(), "stop"));

        service.queueRun(run.getId());
        service.tryMarkRunning(run.getId());
        Run terminated = service.requestTerminate(ORG, run.getId(), "stop");

        assertEquals(RunStatus.TERMINATED, terminated.getStatus());
        assertEquals("stop", terminated.getFailureReason());
    }

    @Test
    void shouldHideRunsOfOtherOrganizations() {
        Run run = newRun();

        assertThrows(IllegalArgumentException.class, () -> service.requireRun("org_2", run.getId()));
        assertTrue(service.listRuns("org_2").isEmpty());
        assertEquals(1, service.listRuns(ORG).size());
    }

    @Test
    void shouldTrackVerificationCodeWaitingState() {
        Run run = newRun();

        service.markWaitingForVerificationCode(run.getId(), "user@example.com", START);
        Run waiting = service.getRun(run.getId()).orElseThrow();
        assertTrue(waiting.isWaitingForVerificationCode());
        assertEquals("user@example.com", waiting.getVerificationCodeIdentifier());

        service.clearWaitingForVerificationCode(run.getId());
        Run cleared = service.getRun(run.getId()).orElseThrow();
        assertFalse(cleared.isWaitingForVerificationCode());
        assertNull(cleared.getVerificationCodeIdentifier());
        assertNull(cleared.getVerificationCodePollingStartedAt());
    }

    @Test
    void shouldFailRunsInterruptedByRestart() {
        Run run = newRun();
        service.queueRun(run.getId());
        service.tryMarkRunning(run.getId());

        RunService restarted = new RunService(storage, objectMapper, clock);
        Run recovered = restarted.getRun(run.getId()).orElseThrow();

        assertEquals(RunStatus.FAILED, recovered.getStatus());
        assertEquals(RunService.RECOVERY_INTERRUPTED_MSG, recovered.getFailureReason());
        assertNotNull(recovered.getFinishedAt());
    }

    @Test
    void shouldKeepQueuedRunsAcrossRestart() {
        Run run = newRun();
        service.queueRun(run.getId());

        RunService restarted = new RunService(storage, objectMapper, clock);

        List<Run> runs = restarted.listRuns(ORG);
        assertEquals(1, runs.size());
        assertEquals(RunStatus.QUEUED, runs.get(0).getStatus());
    }

    @Test
    void shouldRecordWebhookFailureWithoutChangingStatus() {
        Run run = newRun();

        service.recordWebhookResult(run.getId(), "Webhook failed with status code 500, error message: boom");

        Run updated = service.getRun(run.getId()).orElseThrow();
        assertEquals(RunStatus.CREATED, updated.getStatus());
        assertEquals("Webhook failed with status code 500, error message: boom", updated.getWebhookFailureReason());
    }
}
