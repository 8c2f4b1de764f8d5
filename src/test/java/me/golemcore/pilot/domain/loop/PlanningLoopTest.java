package me.golemcore.pilot.domain.loop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.pilot.domain.model.BlockExecutionRequest;
import me.golemcore.pilot.domain.model.BlockResult;
import me.golemcore.pilot.domain.model.BlockStatus;
import me.golemcore.pilot.domain.model.BlockType;
import me.golemcore.pilot.domain.model.BrowserPage;
import me.golemcore.pilot.domain.model.BrowserSession;
import me.golemcore.pilot.domain.model.BrowserSessionStatus;
import me.golemcore.pilot.domain.model.LlmPrompt;
import me.golemcore.pilot.domain.model.Run;
import me.golemcore.pilot.domain.model.RunStatus;
import me.golemcore.pilot.domain.model.ScrapedPage;
import me.golemcore.pilot.domain.model.StepRecord;
import me.golemcore.pilot.domain.model.TaskHistoryEntry;
import me.golemcore.pilot.domain.service.ArtifactSyncService;
import me.golemcore.pilot.domain.service.BlockExecutor;
import me.golemcore.pilot.domain.service.BlockGenerator;
import me.golemcore.pilot.domain.service.BrowserSessionService;
import me.golemcore.pilot.domain.service.ExecutionContextService;
import me.golemcore.pilot.domain.service.ModelCallService;
import me.golemcore.pilot.domain.service.RunMetadataService;
import me.golemcore.pilot.domain.service.RunService;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.BlockRunnerPort;
import me.golemcore.pilot.port.outbound.BrowserDriverPort;
import me.golemcore.pilot.port.outbound.LlmPort;
import me.golemcore.pilot.port.outbound.RunWebhookPort;
import me.golemcore.pilot.testsupport.InMemoryStoragePort;
import me.golemcore.pilot.testsupport.MutableClock;
import me.golemcore.pilot.testsupport.TestObjects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlanningLoopTest {

    private static final String ORG = "org_1";
    private static final String START_URL = "https://shop.test";

    private MutableClock clock;
    private PilotProperties properties;
    private RunService runService;
    private ExecutionContextService contextService;
    private BrowserSessionService sessionService;
    private BrowserDriverPort browserDriver;
    private BlockRunnerPort blockRunner;
    private LlmPort llmPort;
    private RunWebhookPort webhookPort;
    private PlanningLoop loop;

    private final Map<String, Deque<Map<String, Object>>> answers = new HashMap<>();
    private Function<BlockExecutionRequest, BlockResult> blockBehavior;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        properties = new PilotProperties();
        properties.getPlanner().setMaxIterations(10);
        properties.getPlanner().setMaxStepsPerRun(25);
        ObjectMapper objectMapper = TestObjects.objectMapper();
        InMemoryStoragePort storage = new InMemoryStoragePort();

        browserDriver = mock(BrowserDriverPort.class);
        when(browserDriver.getOrCreatePage(anyString(), anyString())).thenAnswer(invocation -> CompletableFuture
                .completedFuture(BrowserPage.builder().url(invocation.getArgument(1)).loaded(true).build()));
        when(browserDriver.navigate(anyString(), anyString())).thenAnswer(invocation -> CompletableFuture
                .completedFuture(BrowserPage.builder().url(invocation.getArgument(1)).loaded(true).build()));
        when(browserDriver.scrape(anyString())).thenReturn(CompletableFuture.completedFuture(
                ScrapedPage.builder().url(START_URL).title("Shop").build()));
        when(browserDriver.closeSession(anyString())).thenReturn(CompletableFuture.completedFuture(List.of()));

        blockRunner = mock(BlockRunnerPort.class);
        blockBehavior = request -> BlockResult.success(request.getBlock().getLabel(),
                request.getBlock().getBlockType() == BlockType.EXTRACT
                        ? Map.of(BlockResult.EXTRACTED_INFORMATION, Map.of("price", "10"))
                        : null,
                List.of(step(request.getBlock().getLabel())));
        when(blockRunner.run(any())).thenAnswer(invocation -> CompletableFuture.completedFuture(
                blockBehavior.apply(invocation.getArgument(0))));

        llmPort = mock(LlmPort.class);
        when(llmPort.complete(any())).thenAnswer(invocation -> {
            LlmPrompt prompt = invocation.getArgument(0);
            Deque<Map<String, Object>> queue = answers.get(prompt.getName());
            if (queue == null || queue.isEmpty()) {
                return CompletableFuture.failedFuture(new IllegalStateException("No answer for " + prompt.getName()));
            }
            Map<String, Object> answer = queue.size() > 1 ? queue.poll() : queue.peek();
            return CompletableFuture.completedFuture(answer);
        });

        webhookPort = mock(RunWebhookPort.class);

        runService = new RunService(storage, objectMapper, clock);
        contextService = new ExecutionContextService(storage, objectMapper, clock);
        sessionService = new BrowserSessionService(storage, objectMapper, browserDriver,
                new ArtifactSyncService(storage), properties, clock);
        ModelCallService modelCallService = new ModelCallService(llmPort, contextService, properties);
        BlockGenerator blockGenerator = new BlockGenerator(modelCallService, blockRunner, contextService, properties);
        BlockExecutor blockExecutor = new BlockExecutor(blockRunner, contextService, properties);
        RunMetadataService metadataService = new RunMetadataService(modelCallService, runService, clock);

        loop = new PlanningLoop(runService, contextService, sessionService, browserDriver, modelCallService,
                blockGenerator, blockExecutor, metadataService, webhookPort, properties, objectMapper, clock);
    }

    @SafeVarargs
    private void answer(String promptName, Map<String, Object>... responses) {
        answers.put(promptName, new ArrayDeque<>(List.of(responses)));
    }

    private static StepRecord step(String label) {
        return StepRecord.builder().taskId(label).blockLabel(label).order(0).action("click").build();
    }

    private Run queuedRun(Run.RunBuilder template) {
        Run run = runService.createRun(ORG, template.prompt("Find the laptop price").url(START_URL)
                .title("Laptop price").build());
        return runService.queueRun(run.getId());
    }

    private Run queuedRun() {
        return queuedRun(Run.builder());
    }

    @Test
    void shouldCompleteAfterGotoAndExtraction() {
        answer("check-completion", Map.of("user_goal_achieved", false), Map.of("user_goal_achieved", true));
        answer("plan", Map.of("user_goal_achieved", false, "plan", "Extract the laptop price",
                "task_type", "extract"));
        answer("generate-extraction-schema", Map.of("schema", Map.of("type", "object")));
        answer("summarize", Map.of("description", "The laptop costs 10", "output", Map.of("price", "10")));
        Run run = queuedRun();

        Run finished = loop.execute(run.getId());

        assertEquals(RunStatus.COMPLETED, finished.getStatus());
        assertEquals("The laptop costs 10", finished.getSummary());
        assertEquals(Map.of("price", "10"), finished.getOutput());
        List<TaskHistoryEntry> history = contextService.getTaskHistory(run.getId());
        assertEquals(List.of("goto_url", "extract"), history.stream().map(TaskHistoryEntry::getType).toList());
        assertEquals("Go to this website: " + START_URL, history.get(0).getTask());
        assertEquals(Map.of("price", "10"), history.get(1).getExtractedData());
        verify(webhookPort).send(finished);

        BrowserSession session = sessionService.getSession(finished.getBrowserSessionId()).orElseThrow();
        assertEquals(BrowserSessionStatus.CLOSED, session.getStatus());
    }

    @Test
    void shouldCompleteWhenPlannerReportsGoalAchieved() {
        answer("check-completion", Map.of("user_goal_achieved", false));
        answer("plan", Map.of("user_goal_achieved", true));
        answer("summarize", Map.of("description", "Already there"));
        Run run = queuedRun();

        Run finished = loop.execute(run.getId());

        assertEquals(RunStatus.COMPLETED, finished.getStatus());
        assertEquals("Already there", finished.getSummary());
        assertEquals(1, contextService.getTaskHistory(run.getId()).size());
    }

    @Test
    void shouldFallBackWhenStartPageFailsToLoad() {
        when(browserDriver.getOrCreatePage(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(
                BrowserPage.builder().loaded(false).build()));
        answer("check-completion", Map.of("user_goal_achieved", true));
        answer("summarize", Map.of("description", "done"));
        Run run = queuedRun();

        loop.execute(run.getId());

        TaskHistoryEntry first = contextService.getTaskHistory(run.getId()).get(0);
        assertEquals("Go to Google because the intended website (" + START_URL + ") failed to load properly.",
                first.getTask());
        verify(browserDriver).navigate(anyString(), anyString());
    }

    @Test
    void shouldFailWhenStepBudgetIsExhausted() {
        answer("check-completion", Map.of("user_goal_achieved", false));
        answer("summarize-failure", Map.of("reasoning", "The page needs a login."));
        Run run = queuedRun(Run.builder().maxSteps(1));

        Run finished = loop.execute(run.getId());

        assertEquals(RunStatus.FAILED, finished.getStatus());
        assertEquals("Reached the max number of 1 steps. Possible failure reasons: The page needs a login."
                + " If you need more steps, update the max steps override of the run.", finished.getFailureReason());
    }

    @Test
    void shouldStopOnBlockFailureAndExplainIt() {
        blockBehavior = request -> request.getBlock().getBlockType() == BlockType.NAVIGATE
                ? BlockResult.failure(request.getBlock().getLabel(), BlockStatus.FAILED,
                        "No verification code found within 15 minutes", List.of(step(request.getBlock().getLabel())))
                : BlockResult.success(request.getBlock().getLabel(), null,
                        List.of(step(request.getBlock().getLabel())));
        answer("check-completion", Map.of("user_goal_achieved", false));
        answer("plan", Map.of("plan", "Log in", "task_type", "navigate"));
        answer("summarize-failure", Map.of("reasoning", "Nobody submitted the code."));
        Run run = queuedRun();

        Run finished = loop.execute(run.getId());

        assertEquals(RunStatus.FAILED, finished.getStatus());
        assertTrue(finished.getFailureReason().startsWith("Block navigation_"));
        assertTrue(finished.getFailureReason().contains(
                "failed: No verification code found within 15 minutes. Possible failure reasons: "
                        + "Nobody submitted the code."));
        assertEquals("failed", contextService.getTaskHistory(run.getId()).get(1).getStatus());
    }

    @Test
    void shouldContinueAfterFailureWhenConfigured() {
        properties.getPlanner().setContinueOnBlockFailure(true);
        properties.getPlanner().setMaxIterations(3);
        blockBehavior = request -> request.getBlock().getBlockType() == BlockType.NAVIGATE
                ? BlockResult.failure(request.getBlock().getLabel(), BlockStatus.FAILED, "Element not found",
                        List.of(step(request.getBlock().getLabel())))
                : BlockResult.success(request.getBlock().getLabel(), null,
                        List.of(step(request.getBlock().getLabel())));
        answer("check-completion", Map.of("user_goal_achieved", false));
        answer("plan", Map.of("plan", "Click buy", "task_type", "navigate"));
        Run run = queuedRun();

        Run finished = loop.execute(run.getId());

        assertEquals(RunStatus.FAILED, finished.getStatus());
        assertEquals("Task exceeded maximum of 3 planning iterations. Consider simplifying the task or breaking it"
                + " into smaller steps.", finished.getFailureReason());
        assertEquals(3, contextService.getTaskHistory(run.getId()).size());
    }

    @Test
    void shouldFailAfterMaxIterationsWhenPlannerKeepsReturningNoPlan() {
        properties.getPlanner().setMaxIterations(4);
        answer("check-completion", Map.of("user_goal_achieved", false));
        answer("plan", Map.of("user_goal_achieved", false));
        Run run = queuedRun();

        Run finished = loop.execute(run.getId());

        assertEquals(RunStatus.FAILED, finished.getStatus());
        assertEquals("Task exceeded maximum of 4 planning iterations. Consider simplifying the task or breaking it"
                + " into smaller steps.", finished.getFailureReason());
        verify(llmPort, times(3)).complete(argThat(prompt -> "plan".equals(prompt.getName())));
        assertEquals(1, contextService.getTaskHistory(run.getId()).size());
        verify(blockRunner, times(1)).run(any());
    }

    @Test
    void shouldCancelRunFlaggedBeforeStart() {
        Run run = queuedRun();
        runService.requestCancel(ORG, run.getId());

        Run finished = loop.execute(run.getId());

        assertEquals(RunStatus.CANCELED, finished.getStatus());
        verify(browserDriver, never()).getOrCreatePage(anyString(), anyString());
        verify(blockRunner, never()).run(any());
        verify(webhookPort).send(finished);
    }

    @Test
    void shouldStopWhenCanceledDuringBlock() {
        answer("check-completion", Map.of("user_goal_achieved", false));
        blockBehavior = request -> {
            runService.requestCancel(ORG, request.getRunId());
            return BlockResult.success(request.getBlock().getLabel(), null, List.of());
        };
        Run run = queuedRun();

        Run finished = loop.execute(run.getId());

        assertEquals(RunStatus.CANCELED, finished.getStatus());
        verify(blockRunner, times(1)).run(any());
        verify(llmPort, never()).complete(any());
    }

    @Test
    void shouldCancelRunWhenBlockIsCanceled() {
        blockBehavior = request -> BlockResult.failure(request.getBlock().getLabel(), BlockStatus.CANCELED,
                "Stopped", List.of());
        Run run = queuedRun();

        Run finished = loop.execute(run.getId());

        assertEquals(RunStatus.CANCELED, finished.getStatus());
        assertTrue(finished.getFailureReason().endsWith(" was canceled"));
    }

    @Test
    void shouldRejectUnsupportedTaskType() {
        answer("check-completion", Map.of("user_goal_achieved", false));
        answer("plan", Map.of("plan", "Go somewhere", "task_type", "goto_url"));
        Run run = queuedRun();

        Run finished = loop.execute(run.getId());

        assertEquals(RunStatus.FAILED, finished.getStatus());
        assertEquals(PlanningLoop.UNSUPPORTED_TASK_TYPE + "goto_url", finished.getFailureReason());
    }

    @Test
    void shouldFailWhenPlannerGivesNoTaskType() {
        answer("check-completion", Map.of("user_goal_achieved", false));
        answer("plan", Map.of("plan", "Do something"));
        Run run = queuedRun();

        Run finished = loop.execute(run.getId());

        assertEquals(RunStatus.FAILED, finished.getStatus());
        assertEquals(PlanningLoop.NO_TASK_GENERATED, finished.getFailureReason());
    }

    @Test
    void shouldFailRunWhenLoopCannotBeGenerated() {
        answer("check-completion", Map.of("user_goal_achieved", false));
        answer("plan", Map.of("plan", "Open every laptop", "task_type", "loop"));
        blockBehavior = request -> BlockResult.success(request.getBlock().getLabel(),
                request.getBlock().getBlockType() == BlockType.EXTRACT
                        ? Map.of(BlockResult.EXTRACTED_INFORMATION, Map.of("unexpected", true))
                        : null,
                List.of(step(request.getBlock().getLabel())));
        Run run = queuedRun();

        Run finished = loop.execute(run.getId());

        assertEquals(RunStatus.FAILED, finished.getStatus());
        assertEquals(PlanningLoop.LOOP_GENERATION_FAILED, finished.getFailureReason());
        TaskHistoryEntry last = contextService.getTaskHistory(run.getId()).get(1);
        assertEquals("loop", last.getType());
        assertEquals("failed", last.getStatus());
    }

    @Test
    void shouldTimeOutWhenSessionExpires() {
        answer("check-completion", Map.of("user_goal_achieved", false));
        blockBehavior = request -> {
            clock.advance(Duration.ofMinutes(61));
            return BlockResult.success(request.getBlock().getLabel(), null, List.of(step("goto")));
        };
        Run run = queuedRun();

        Run finished = loop.execute(run.getId());

        assertEquals(RunStatus.TIMED_OUT, finished.getStatus());
        assertEquals(PlanningLoop.SESSION_TIMED_OUT, finished.getFailureReason());
    }

    @Test
    void shouldOnlyReleaseCallerSuppliedSession() {
        BrowserSession session = sessionService.create(ORG, null, null);
        answer("check-completion", Map.of("user_goal_achieved", true));
        answer("summarize", Map.of("description", "done"));
        Run run = queuedRun(Run.builder().browserSessionId(session.getId()));

        Run finished = loop.execute(run.getId());

        assertEquals(RunStatus.COMPLETED, finished.getStatus());
        BrowserSession after = sessionService.getSession(session.getId()).orElseThrow();
        assertEquals(BrowserSessionStatus.RUNNING, after.getStatus());
        assertNull(after.getRunnableId());
        assertNotNull(after.getStartedAt());
        verify(browserDriver, never()).closeSession(session.getId());
    }

    @Test
    void shouldFailWhenSuppliedSessionIsOccupied() {
        BrowserSession session = sessionService.create(ORG, null, null);
        sessionService.occupy(ORG, session.getId(), BrowserSessionService.RUNNABLE_TYPE_RUN, "run_other");
        Run run = queuedRun(Run.builder().browserSessionId(session.getId()));

        Run finished = loop.execute(run.getId());

        assertEquals(RunStatus.FAILED, finished.getStatus());
        assertTrue(finished.getFailureReason().contains("occupied"));
        assertEquals("run_other", sessionService.getSession(session.getId()).orElseThrow().getRunnableId());
    }

    @Test
    void shouldIgnoreRunThatIsNotQueued() {
        Run run = runService.createRun(ORG, Run.builder().prompt("p").url(START_URL).build());

        Run result = loop.execute(run.getId());

        assertEquals(RunStatus.CREATED, result.getStatus());
        verify(webhookPort, never()).send(any());
    }
}
