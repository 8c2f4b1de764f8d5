package me.golemcore.pilot.domain.loop;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.domain.model.BlockResult;
import me.golemcore.pilot.domain.model.BlockSpec;
import me.golemcore.pilot.domain.model.BrowserPage;
import me.golemcore.pilot.domain.model.BrowserSession;
import me.golemcore.pilot.domain.model.LlmPrompt;
import me.golemcore.pilot.domain.model.PlannerDecision;
import me.golemcore.pilot.domain.model.Run;
import me.golemcore.pilot.domain.model.RunStatus;
import me.golemcore.pilot.domain.model.ScrapedPage;
import me.golemcore.pilot.domain.model.TaskHistoryEntry;
import me.golemcore.pilot.domain.model.TaskType;
import me.golemcore.pilot.domain.model.ThoughtScenario;
import me.golemcore.pilot.domain.service.BlockExecutor;
import me.golemcore.pilot.domain.service.BlockExecutor.BlockExecution;
import me.golemcore.pilot.domain.service.BlockExecutor.LoopDetails;
import me.golemcore.pilot.domain.service.BlockExecutor.Propagation;
import me.golemcore.pilot.domain.service.BlockGenerator;
import me.golemcore.pilot.domain.service.BlockGenerator.GeneratedLoop;
import me.golemcore.pilot.domain.service.BlockGenerator.LoopGenerationException;
import me.golemcore.pilot.domain.service.BrowserSessionService;
import me.golemcore.pilot.domain.service.ExecutionContextService;
import me.golemcore.pilot.domain.service.ModelCallService;
import me.golemcore.pilot.domain.service.PromptTemplates;
import me.golemcore.pilot.domain.service.RunMetadataService;
import me.golemcore.pilot.domain.service.RunService;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.BrowserDriverPort;
import me.golemcore.pilot.port.outbound.RunWebhookPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Top-level state machine of one run.
 *
 * <p>
 * Each iteration re-reads the run, makes sure the browser page is alive, asks
 * the planner for the next task, generates and executes exactly one block, then
 * checks completion and the step budget. The loop is bounded by
 * {@code pilot.planner.max-iterations}; exhausting it fails the run.
 *
 * <p>
 * Only one loop runs per run: {@link #execute(String)} starts only from
 * {@code QUEUED} and rejects every other state.
 */
@Service
@Slf4j
public class PlanningLoop {

    static final String NO_TASK_GENERATED = "Pilot failed to generate a task. Please try again later.";
    static final String UNSUPPORTED_TASK_TYPE = "Unsupported task block type gets generated: ";
    static final String SESSION_TIMED_OUT = "Browser session timed out";
    static final String LOOP_GENERATION_FAILED = "Failed to generate the loop.";

    private final RunService runService;
    private final ExecutionContextService contextService;
    private final BrowserSessionService sessionService;
    private final BrowserDriverPort browserDriver;
    private final ModelCallService modelCallService;
    private final BlockGenerator blockGenerator;
    private final BlockExecutor blockExecutor;
    private final RunMetadataService metadataService;
    private final RunWebhookPort webhookPort;
    private final PilotProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @SuppressWarnings("java:S107") // the loop coordinates every collaborator of a run
    public PlanningLoop(RunService runService, ExecutionContextService contextService,
            BrowserSessionService sessionService, BrowserDriverPort browserDriver,
            ModelCallService modelCallService, BlockGenerator blockGenerator, BlockExecutor blockExecutor,
            RunMetadataService metadataService, RunWebhookPort webhookPort, PilotProperties properties,
            ObjectMapper objectMapper, Clock clock) {
        this.runService = runService;
        this.contextService = contextService;
        this.sessionService = sessionService;
        this.browserDriver = browserDriver;
        this.modelCallService = modelCallService;
        this.blockGenerator = blockGenerator;
        this.blockExecutor = blockExecutor;
        this.metadataService = metadataService;
        this.webhookPort = webhookPort;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Runs the loop of a queued run to a terminal state and returns the final
     * run. Runs in any other state are returned untouched.
     */
    public Run execute(String runId) {
        if (!runService.tryMarkRunning(runId)) {
            return runService.getRun(runId).orElse(null);
        }
        SessionLease lease = null;
        try {
            Run run = runService.getRun(runId).orElseThrow();
            if (run.isCancelRequested()) {
                runService.finishIfActive(runId, RunStatus.CANCELED, "Run was canceled", null, null);
                return runService.getRun(runId).orElseThrow();
            }
            run = metadataService.ensureMetadata(run);
            lease = acquireSession(run);
            run = runService.attachBrowserSession(runId, lease.sessionId());
            iterate(run);
        } catch (Exception e) { // NOSONAR - any crash is a terminal failure of the run
            log.error("[PlanLoop] Run '{}' crashed: {}", runId, e.getMessage(), e);
            runService.finishIfActive(runId, RunStatus.FAILED, e.getMessage(), null, null);
        } finally {
            releaseSession(lease);
        }
        Run finished = runService.getRun(runId).orElseThrow();
        if (finished.getStatus().isFinal()) {
            webhookPort.send(finished);
        }
        return finished;
    }

    private void iterate(Run initial) {
        String runId = initial.getId();
        String sessionId = initial.getBrowserSessionId();
        String url = initial.getUrl();
        int maxIterations = properties.getPlanner().getMaxIterations();
        int maxSteps = initial.getMaxSteps() != null
                ? initial.getMaxSteps()
                : properties.getPlanner().getMaxStepsPerRun();

        for (int i = 0; i < maxIterations; i++) {
            Optional<Run> refreshed = runService.getRun(runId);
            if (refreshed.isEmpty()) {
                log.error("[PlanLoop] Run '{}' disappeared", runId);
                return;
            }
            Run run = refreshed.get();
            if (run.isCancelRequested()) {
                runService.finishIfActive(runId, RunStatus.CANCELED, "Run was canceled", null, null);
                return;
            }
            if (run.getStatus() != RunStatus.RUNNING) {
                log.info("[PlanLoop] Run '{}' is {}, stopping", runId, run.getStatus());
                return;
            }
            if (sessionService.isExpired(sessionId)) {
                runService.finishIfActive(runId, RunStatus.TIMED_OUT, SESSION_TIMED_OUT, null, null);
                return;
            }
            log.info("[PlanLoop] Run '{}' iteration {}", runId, i);

            IterationOutcome outcome = i == 0
                    ? firstIteration(run, sessionId, url)
                    : plannedIteration(run, sessionId, url);
            if (outcome == IterationOutcome.STOP) {
                return;
            }
            if (outcome == IterationOutcome.SKIP) {
                continue;
            }

            int stepsUsed = contextService.countDistinctSteps(runId);
            if (stepsUsed >= maxSteps) {
                log.info("[PlanLoop] Run '{}' used {} of {} steps", runId, stepsUsed, maxSteps);
                String reasoning = summarizeFailure(run, sessionId,
                        "reached the max number of " + maxSteps + " steps", maxSteps);
                runService.finishIfActive(runId, RunStatus.FAILED, "Reached the max number of " + maxSteps
                        + " steps. Possible failure reasons: " + reasoning
                        + " If you need more steps, update the max steps override of the run.", null, null);
                return;
            }
        }
        runService.finishIfActive(runId, RunStatus.FAILED, "Task exceeded maximum of " + maxIterations
                + " planning iterations. Consider simplifying the task or breaking it into smaller steps.",
                null, null);
    }

    private enum IterationOutcome {
        /** Block executed; check the step budget. */
        EXECUTED,
        /** Nothing executed; plan again. */
        SKIP,
        /** The run left the running state. */
        STOP
    }

    // ==================== Iterations ====================

    private IterationOutcome firstIteration(Run run, String sessionId, String url) {
        boolean fallbackOccurred = false;
        if (!openStartPage(sessionId, url)) {
            String fallbackUrl = properties.getPlanner().getFallbackUrl();
            try {
                browserDriver.navigate(sessionId, fallbackUrl).join();
                fallbackOccurred = true;
                log.warn("[PlanLoop] {} failed to load, fell back to {}", url, fallbackUrl);
            } catch (RuntimeException e) { // NOSONAR - the goto block retries the navigation
                log.warn("[PlanLoop] Fallback to {} failed: {}", fallbackUrl, e.getMessage());
            }
        }
        String plan = fallbackOccurred
                ? "Go to Google because the intended website (" + url + ") failed to load properly."
                : "Go to this website: " + url;
        BlockSpec block = blockGenerator.generateGotoUrl(fallbackOccurred
                ? properties.getPlanner().getFallbackUrl()
                : url);
        return runBlock(run, TaskType.GOTO_URL, plan, block, Map.of(), null);
    }

    private IterationOutcome plannedIteration(Run run, String sessionId, String url) {
        ScrapedPage page;
        try {
            browserDriver.getOrCreatePage(sessionId, url).join();
            page = browserDriver.scrape(sessionId).join();
        } catch (RuntimeException e) { // NOSONAR - a failed scrape costs one iteration
            log.warn("[PlanLoop] Failed to scrape page for run '{}': {}", run.getId(), e.getMessage());
            return IterationOutcome.SKIP;
        }
        List<TaskHistoryEntry> history = contextService.getTaskHistory(run.getId());

        Map<String, Object> response = modelCallService.call(run.getId(), ThoughtScenario.GENERATE_PLAN,
                LlmPrompt.builder()
                        .name("plan")
                        .text(PromptTemplates.plan(run.getPrompt(), page.getUrl(), page.renderElementTree(),
                                renderHistory(history), Instant.now(clock)))
                        .screenshots(page.getScreenshots())
                        .build());
        PlannerDecision decision = PlannerDecision.fromResponse(response);

        if (decision.isUserGoalAchieved()) {
            log.info("[PlanLoop] Planner reports goal achieved for run '{}'", run.getId());
            complete(run, page);
            return IterationOutcome.STOP;
        }
        if (decision.getPlan().isBlank()) {
            log.warn("[PlanLoop] No plan in planner response for run '{}'", run.getId());
            return IterationOutcome.SKIP;
        }
        if (decision.getTaskType().isBlank()) {
            runService.finishIfActive(run.getId(), RunStatus.FAILED, NO_TASK_GENERATED, null, null);
            return IterationOutcome.STOP;
        }
        Optional<TaskType> taskType = TaskType.fromValue(decision.getTaskType())
                .filter(type -> type != TaskType.GOTO_URL);
        if (taskType.isEmpty()) {
            runService.finishIfActive(run.getId(), RunStatus.FAILED,
                    UNSUPPORTED_TASK_TYPE + decision.getTaskType(), null, null);
            return IterationOutcome.STOP;
        }

        String plan = decision.getPlan();
        return switch (taskType.get()) {
        case NAVIGATE -> runBlock(run, TaskType.NAVIGATE, plan, blockGenerator.generateNavigation(run, plan),
                Map.of(), null);
        case EXTRACT -> runBlock(run, TaskType.EXTRACT, plan,
                blockGenerator.generateExtraction(run, plan, page), Map.of(), null);
        case LOOP -> runLoop(run, plan, page);
        case GOTO_URL -> throw new IllegalStateException("goto_url is never planned");
        };
    }

    private IterationOutcome runLoop(Run run, String plan, ScrapedPage page) {
        GeneratedLoop loop;
        try {
            loop = blockGenerator.generateLoop(run, plan, page);
        } catch (LoopGenerationException e) {
            log.error("[PlanLoop] Loop generation failed for run '{}': {}", run.getId(), e.getMessage());
            blockExecutor.recordLoopGenerationFailure(run, plan, null);
            runService.finishIfActive(run.getId(), RunStatus.FAILED, LOOP_GENERATION_FAILED, null, null);
            return IterationOutcome.STOP;
        }
        Map<String, Object> parameters = Map.of(loop.loopBlock().getLoopOverKey(), loop.loopValues());
        return runBlock(run, TaskType.LOOP, plan, loop.loopBlock(), parameters,
                new LoopDetails(loop.loopValues(), loop.taskInsideTheLoop()));
    }

    private IterationOutcome runBlock(Run run, TaskType taskType, String plan, BlockSpec block,
            Map<String, Object> parameters, LoopDetails loopDetails) {
        BlockExecution execution = blockExecutor.execute(run, taskType, plan, block, parameters, loopDetails);
        BlockResult result = execution.result();

        int maxSteps = run.getMaxSteps() != null ? run.getMaxSteps() : properties.getPlanner().getMaxStepsPerRun();
        boolean lastStep = contextService.countDistinctSteps(run.getId()) >= maxSteps;
        Propagation propagation = BlockExecutor.propagate(result, block, lastStep);

        Run current = runService.getRun(run.getId()).orElseThrow();
        if (current.getStatus() != RunStatus.RUNNING) {
            log.info("[PlanLoop] Run '{}' became {} during block '{}'", run.getId(), current.getStatus(),
                    block.getLabel());
            return IterationOutcome.STOP;
        }

        switch (propagation) {
        case CANCEL_RUN -> {
            runService.finishIfActive(run.getId(), RunStatus.CANCELED, "Block " + block.getLabel()
                    + " was canceled", null, null);
            return IterationOutcome.STOP;
        }
        case CONTINUE -> {
            log.warn("[PlanLoop] Block '{}' {} but run '{}' continues: {}", block.getLabel(), result.getStatus(),
                    run.getId(), result.getFailureReason());
            return IterationOutcome.EXECUTED;
        }
        case STOP -> {
            String failure = "Block " + block.getLabel() + " " + result.getStatus().name().toLowerCase(Locale.ROOT)
                    + (result.getFailureReason() != null ? ": " + result.getFailureReason() : "");
            String reasoning = summarizeFailure(current, current.getBrowserSessionId(), failure, maxSteps);
            runService.finishIfActive(run.getId(), RunStatus.FAILED, failure + ". Possible failure reasons: "
                    + reasoning, null, null);
            return IterationOutcome.STOP;
        }
        case CHECK_COMPLETION -> {
            return checkCompletion(current) ? IterationOutcome.STOP : IterationOutcome.EXECUTED;
        }
        default -> throw new IllegalStateException("Unknown propagation " + propagation);
        }
    }

    // ==================== Completion ====================

    private boolean checkCompletion(Run run) {
        ScrapedPage page = scrapeQuietly(run.getBrowserSessionId());
        List<TaskHistoryEntry> history = contextService.getTaskHistory(run.getId());
        Map<String, Object> response = modelCallService.call(run.getId(), ThoughtScenario.USER_GOAL_CHECK,
                LlmPrompt.builder()
                        .name("check-completion")
                        .text(PromptTemplates.goalCheck(run.getPrompt(), page.getUrl(), page.renderElementTree(),
                                renderHistory(history), Instant.now(clock)))
                        .screenshots(page.getScreenshots())
                        .build());
        if (!Boolean.TRUE.equals(response.get("user_goal_achieved"))) {
            return false;
        }
        log.info("[PlanLoop] Completion check reports goal achieved for run '{}'", run.getId());
        complete(run, page);
        return true;
    }

    private void complete(Run run, ScrapedPage page) {
        List<TaskHistoryEntry> history = contextService.getTaskHistory(run.getId());
        Map<String, Object> response = modelCallService.call(run.getId(), ThoughtScenario.SUMMARIZATION,
                LlmPrompt.builder()
                        .name("summarize")
                        .text(PromptTemplates.summary(run.getPrompt(), page.getUrl(), renderHistory(history),
                                toJson(run.getOutputSchema()), Instant.now(clock)))
                        .screenshots(page.getScreenshots())
                        .build());
        Object summary = response.get("description");
        runService.finishIfActive(run.getId(), RunStatus.COMPLETED, null, response.get("output"),
                summary != null ? summary.toString() : "");
    }

    /**
     * Best-effort explanation of why the run failed. Returns an empty string when
     * the model call fails.
     */
    private String summarizeFailure(Run run, String sessionId, String failure, int maxSteps) {
        try {
            ScrapedPage page = scrapeQuietly(sessionId);
            Map<String, Object> response = modelCallService.call(run.getId(), ThoughtScenario.MAX_STEPS_FAILURE,
                    LlmPrompt.builder()
                            .name("summarize-failure")
                            .text(PromptTemplates.failureReasoning(run.getPrompt(),
                                    renderHistory(contextService.getTaskHistory(run.getId())), failure, maxSteps))
                            .screenshots(page.getScreenshots())
                            .build());
            Object reasoning = response.get("reasoning");
            return reasoning != null ? reasoning.toString() : "";
        } catch (RuntimeException e) { // NOSONAR - the failure reason is optional
            log.warn("[PlanLoop] Failed to summarize failure of run '{}': {}", run.getId(), e.getMessage());
            return "";
        }
    }

    // ==================== Browser ====================

    private boolean openStartPage(String sessionId, String url) {
        try {
            BrowserPage page = browserDriver.getOrCreatePage(sessionId, url).join();
            return page != null && page.isLoaded();
        } catch (RuntimeException e) { // NOSONAR - fall back to the neutral page
            log.warn("[PlanLoop] Failed to open {}: {}", url, e.getMessage());
            return false;
        }
    }

    private ScrapedPage scrapeQuietly(String sessionId) {
        try {
            ScrapedPage page = browserDriver.scrape(sessionId).join();
            if (page != null) {
                return page;
            }
        } catch (RuntimeException e) { // NOSONAR - prompts work without a fresh page
            log.warn("[PlanLoop] Failed to scrape page: {}", e.getMessage());
        }
        return ScrapedPage.builder().build();
    }

    private SessionLease acquireSession(Run run) {
        String runnableType = BrowserSessionService.RUNNABLE_TYPE_RUN;
        if (run.getBrowserSessionId() != null) {
            BrowserSession session = sessionService.requireSession(run.getOrganizationId(),
                    run.getBrowserSessionId());
            sessionService.occupy(run.getOrganizationId(), session.getId(), runnableType, run.getId());
            if (session.getStartedAt() == null) {
                sessionService.beginSession(run.getOrganizationId(), session.getId(), null);
            }
            return new SessionLease(run.getOrganizationId(), session.getId(), false);
        }
        BrowserSession session = sessionService.create(run.getOrganizationId(), null, null);
        sessionService.beginSession(run.getOrganizationId(), session.getId(), null);
        sessionService.occupy(run.getOrganizationId(), session.getId(), runnableType, run.getId());
        return new SessionLease(run.getOrganizationId(), session.getId(), true);
    }

    private void releaseSession(SessionLease lease) {
        if (lease == null) {
            return;
        }
        try {
            if (lease.owned()) {
                sessionService.close(lease.organizationId(), lease.sessionId());
            } else {
                sessionService.release(lease.organizationId(), lease.sessionId());
            }
        } catch (RuntimeException e) { // NOSONAR - the run outcome is already recorded
            log.warn("[PlanLoop] Failed to release session '{}': {}", lease.sessionId(), e.getMessage());
        }
    }

    /**
     * Browser session held by a run. Sessions the loop created are closed when the
     * run ends; sessions supplied by the caller are only released.
     */
    private record SessionLease(String organizationId, String sessionId, boolean owned) {
    }

    // ==================== Rendering ====================

    private String renderHistory(List<TaskHistoryEntry> history) {
        return toJson(history);
    }

    private String toJson(Object value) {
        if (value == null) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("[PlanLoop] Failed to render JSON: {}", e.getMessage());
            return String.valueOf(value);
        }
    }
}
