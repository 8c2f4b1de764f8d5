package me.golemcore.pilot.domain.service;

import me.golemcore.pilot.domain.model.BlockExecutionRequest;
import me.golemcore.pilot.domain.model.BlockResult;
import me.golemcore.pilot.domain.model.BlockSpec;
import me.golemcore.pilot.domain.model.BlockStatus;
import me.golemcore.pilot.domain.model.ExtractBlockSpec;
import me.golemcore.pilot.domain.model.IterateBlockSpec;
import me.golemcore.pilot.domain.model.NavigateBlockSpec;
import me.golemcore.pilot.domain.model.Run;
import me.golemcore.pilot.domain.model.StepRecord;
import me.golemcore.pilot.domain.model.TaskType;
import me.golemcore.pilot.domain.service.BlockExecutor.BlockExecution;
import me.golemcore.pilot.domain.service.BlockExecutor.LoopDetails;
import me.golemcore.pilot.domain.service.BlockExecutor.Propagation;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.BlockRunnerPort;
import me.golemcore.pilot.testsupport.InMemoryStoragePort;
import me.golemcore.pilot.testsupport.MutableClock;
import me.golemcore.pilot.testsupport.TestObjects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BlockExecutorTest {

    private BlockRunnerPort blockRunner;
    private ExecutionContextService contextService;
    private PilotProperties properties;
    private BlockExecutor executor;
    private Run run;

    @BeforeEach
    void setUp() {
        blockRunner = mock(BlockRunnerPort.class);
        contextService = new ExecutionContextService(new InMemoryStoragePort(), TestObjects.objectMapper(),
                new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));
        properties = new PilotProperties();
        properties.getPlanner().setBlockTimeoutSeconds(1);
        properties.getOtp().setPollingTimeoutMinutes(0);
        executor = new BlockExecutor(blockRunner, contextService, properties);
        run = Run.builder().id("run_1").organizationId("org_1").browserSessionId("pbs_1").totpSecret("SECRET")
                .build();
    }

    private static NavigateBlockSpec navigation(boolean continueOnFailure) {
        return NavigateBlockSpec.builder().label("navigation_a").continueOnFailure(continueOnFailure).build();
    }

    @Test
    void shouldMapStatusesToLoopReactions() {
        BlockSpec strict = navigation(false);
        BlockSpec lenient = navigation(true);

        assertEquals(Propagation.CANCEL_RUN, BlockExecutor.propagate(
                BlockResult.failure("a", BlockStatus.CANCELED, "stop", List.of()), lenient, false));
        assertEquals(Propagation.STOP, BlockExecutor.propagate(
                BlockResult.failure("a", BlockStatus.FAILED, "x", List.of()), strict, false));
        assertEquals(Propagation.STOP, BlockExecutor.propagate(
                BlockResult.failure("a", BlockStatus.TERMINATED, "x", List.of()), strict, false));
        assertEquals(Propagation.CONTINUE, BlockExecutor.propagate(
                BlockResult.failure("a", BlockStatus.FAILED, "x", List.of()), lenient, false));
        assertEquals(Propagation.STOP, BlockExecutor.propagate(
                BlockResult.failure("a", BlockStatus.FAILED, "x", List.of()), lenient, true));
        assertEquals(Propagation.CHECK_COMPLETION, BlockExecutor.propagate(
                BlockResult.success("a", null, List.of()), strict, false));
    }

    @Test
    void shouldRecordBlockStepsAndHistory() {
        StepRecord step = StepRecord.builder().taskId("navigation_a").blockLabel("navigation_a").order(0).build();
        when(blockRunner.run(any())).thenReturn(CompletableFuture.completedFuture(
                BlockResult.success("navigation_a", Map.of(BlockResult.EXTRACTED_INFORMATION, "price: 10"),
                        List.of(step))));

        BlockExecution execution = executor.execute(run, TaskType.NAVIGATE, "Open pricing", navigation(false));

        assertEquals(1, execution.historySize());
        assertEquals("success", execution.historyEntry().getStatus());
        assertEquals("navigate", execution.historyEntry().getType());
        assertEquals("price: 10", execution.historyEntry().getExtractedData());
        assertEquals(1, contextService.countDistinctSteps("run_1"));
        assertEquals(1, contextService.getContext("run_1").getBlocks().size());

        ArgumentCaptor<BlockExecutionRequest> request = ArgumentCaptor.forClass(BlockExecutionRequest.class);
        verify(blockRunner).run(request.capture());
        assertEquals("pbs_1", request.getValue().getBrowserSessionId());
        assertEquals("SECRET", request.getValue().getTotpSecret());
    }

    @Test
    void shouldTurnCrashIntoFailedResult() {
        when(blockRunner.run(any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("browser crashed")));

        BlockExecution execution = executor.execute(run, TaskType.NAVIGATE, "Open pricing", navigation(false));

        assertEquals(BlockStatus.FAILED, execution.result().getStatus());
        assertEquals("browser crashed", execution.result().getFailureReason());
        assertEquals("failed", execution.historyEntry().getStatus());
        assertEquals("browser crashed", execution.historyEntry().getReason());
    }

    @Test
    void shouldFailAndStopBlockThatTimesOut() {
        CompletableFuture<BlockResult> pending = new CompletableFuture<>();
        when(blockRunner.run(any())).thenReturn(pending);

        BlockExecution execution = executor.execute(run, TaskType.NAVIGATE, "Open pricing", navigation(false));

        assertEquals(BlockStatus.FAILED, execution.result().getStatus());
        assertEquals("Block timed out after 1s", execution.result().getFailureReason());
        assertTrue(pending.isCancelled());
        ArgumentCaptor<BlockExecutionRequest> request = ArgumentCaptor.forClass(BlockExecutionRequest.class);
        verify(blockRunner).run(request.capture());
        assertTrue(request.getValue().isAbandoned());
    }

    @Test
    void shouldNotAbandonBlockThatFinishesInTime() {
        when(blockRunner.run(any())).thenReturn(CompletableFuture.completedFuture(
                BlockResult.success("navigation_a", null, List.of())));

        executor.execute(run, TaskType.NAVIGATE, "Open pricing", navigation(false));

        ArgumentCaptor<BlockExecutionRequest> request = ArgumentCaptor.forClass(BlockExecutionRequest.class);
        verify(blockRunner).run(request.capture());
        assertFalse(request.getValue().isAbandoned());
    }

    @Test
    void shouldGiveCodeWaitingBlocksTheCodePollingWindow() {
        properties.getPlanner().setBlockTimeoutSeconds(900);
        properties.getOtp().setPollingTimeoutMinutes(15);
        IterateBlockSpec loop = IterateBlockSpec.builder().label("loop_a").loopBody(navigation(true)).build();

        assertEquals(1800, executor.timeoutSeconds(navigation(false)));
        assertEquals(1800, executor.timeoutSeconds(loop));
        assertEquals(900, executor.timeoutSeconds(ExtractBlockSpec.builder().label("extract_a").build()));
    }

    @Test
    void shouldRecordLoopValuesInHistory() {
        IterateBlockSpec loop = IterateBlockSpec.builder()
                .label("loop_a")
                .loopOverKey("loop_values_a")
                .valueParameterKey("target")
                .loopBody(NavigateBlockSpec.builder().label("task_in_loop_a").build())
                .build();
        List<Object> iterations = List.of(
                List.of(Map.of(BlockResult.EXTRACTED_INFORMATION, "first")),
                List.of(Map.of(BlockResult.EXTRACTED_INFORMATION, "second")));
        when(blockRunner.run(any())).thenReturn(CompletableFuture.completedFuture(
                BlockResult.success("loop_a", iterations, List.of())));

        BlockExecution execution = executor.execute(run, TaskType.LOOP, "Open each result", loop,
                Map.of("loop_values_a", List.of("a", "b")),
                new LoopDetails(List.of("a", "b"), Map.of("navigation_goal", "open")));

        assertEquals(List.of("a", "b"), execution.historyEntry().getLoopOverValues());
        assertEquals(List.of(List.of("first"), List.of("second")), execution.historyEntry().getExtractedData());
        assertEquals("open", execution.historyEntry().getTaskInsideTheLoop().get("navigation_goal"));
    }

    @Test
    void shouldRecordLoopGenerationFailure() {
        executor.recordLoopGenerationFailure(run, "Open each result", null);

        var history = contextService.getTaskHistory("run_1");
        assertEquals(1, history.size());
        assertEquals("loop", history.get(0).getType());
        assertEquals("failed", history.get(0).getStatus());
        assertEquals(BlockExecutor.LOOP_GENERATION_FAILED, history.get(0).getReason());
    }

    @Test
    void shouldHaveNoExtractedDataForFailedBlocks() {
        ExtractBlockSpec block = ExtractBlockSpec.builder().label("extract_a").build();

        assertNull(BlockExecutor.extractData(block, BlockResult.failure("extract_a", BlockStatus.FAILED, "x",
                List.of())));
    }
}
