package me.golemcore.pilot.adapter.outbound.runner;

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
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.domain.model.BlockExecutionRequest;
import me.golemcore.pilot.domain.model.BlockResult;
import me.golemcore.pilot.domain.model.BlockSpec;
import me.golemcore.pilot.domain.model.BlockStatus;
import me.golemcore.pilot.domain.model.BrowserAction;
import me.golemcore.pilot.domain.model.BrowserAction.ActionType;
import me.golemcore.pilot.domain.model.BrowserPage;
import me.golemcore.pilot.domain.model.ExtractBlockSpec;
import me.golemcore.pilot.domain.model.GotoUrlBlockSpec;
import me.golemcore.pilot.domain.model.IterateBlockSpec;
import me.golemcore.pilot.domain.model.LlmPrompt;
import me.golemcore.pilot.domain.model.NavigateBlockSpec;
import me.golemcore.pilot.domain.model.OtpPollRequest;
import me.golemcore.pilot.domain.model.OtpType;
import me.golemcore.pilot.domain.model.OtpValue;
import me.golemcore.pilot.domain.model.RunStatus;
import me.golemcore.pilot.domain.model.ScrapedPage;
import me.golemcore.pilot.domain.model.StepRecord;
import me.golemcore.pilot.domain.service.OtpCoordinator;
import me.golemcore.pilot.domain.service.OtpCoordinator.NoVerificationCodeFoundException;
import me.golemcore.pilot.domain.service.PromptTemplates;
import me.golemcore.pilot.domain.service.RunService;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.BlockRunnerPort;
import me.golemcore.pilot.port.outbound.BrowserDriverPort;
import me.golemcore.pilot.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes blocks with a model-driven browser agent.
 *
 * <p>
 * Navigation is a step loop: scrape the page, ask the model for one action,
 * perform it, repeat until the model completes or terminates or the per-block
 * step limit is reached. Every step is reported as a {@link StepRecord}.
 * Iterate blocks run their body once per loop value; a body that allows
 * failure does not stop the iteration.
 */
@Component
@Slf4j
public class BrowserAgentBlockRunner implements BlockRunnerPort {

    private final BrowserDriverPort browserDriver;
    private final LlmPort llmPort;
    private final OtpCoordinator otpCoordinator;
    private final RunService runService;
    private final ObjectMapper objectMapper;
    private final PilotProperties properties;
    private final Clock clock;
    private final ExecutorService executor;

    public BrowserAgentBlockRunner(BrowserDriverPort browserDriver, LlmPort llmPort, OtpCoordinator otpCoordinator,
            RunService runService, ObjectMapper objectMapper, PilotProperties properties, Clock clock) {
        this.browserDriver = browserDriver;
        this.llmPort = llmPort;
        this.otpCoordinator = otpCoordinator;
        this.runService = runService;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "pilot-block-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<BlockResult> run(BlockExecutionRequest request) {
        return CompletableFuture.supplyAsync(() -> execute(request), executor);
    }

    BlockResult execute(BlockExecutionRequest request) {
        BlockSpec block = request.getBlock();
        try {
            return switch (block.getBlockType()) {
            case GOTO_URL -> gotoUrl(request, (GotoUrlBlockSpec) block);
            case EXTRACT -> extract(request, (ExtractBlockSpec) block);
            case NAVIGATE -> navigate(request, (NavigateBlockSpec) block);
            case ITERATE -> iterate(request, (IterateBlockSpec) block);
            };
        } catch (Exception e) { // NOSONAR - block crashes are reported as failed results
            log.warn("[Runner] Block '{}' failed: {}", block.getLabel(), e.getMessage());
            return BlockResult.failure(block.getLabel(), BlockStatus.FAILED, e.getMessage(), List.of());
        }
    }

    // ==================== Block types ====================

    private BlockResult gotoUrl(BlockExecutionRequest request, GotoUrlBlockSpec block) {
        String taskId = newTaskId();
        String url = resolveUrl(block.getUrl(), request.getParameters());
        BrowserPage page = browserDriver.navigate(request.getBrowserSessionId(), url).join();
        List<StepRecord> steps = List.of(step(taskId, block, 0, "goto_url"));
        if (page == null || !page.isLoaded()) {
            return BlockResult.failure(block.getLabel(), BlockStatus.FAILED, "Failed to load " + url, steps);
        }
        return BlockResult.success(block.getLabel(), singleton("url", page.getUrl()), steps);
    }

    private BlockResult extract(BlockExecutionRequest request, ExtractBlockSpec block) {
        String taskId = newTaskId();
        navigateIfNeeded(request, block.getUrl());
        Object extracted = extractFromPage(request.getBrowserSessionId(), block.getDataExtractionGoal(),
                block.getDataSchema());
        return BlockResult.success(block.getLabel(), singleton(BlockResult.EXTRACTED_INFORMATION, extracted),
                List.of(step(taskId, block, 0, "extract")));
    }

    private BlockResult navigate(BlockExecutionRequest request, NavigateBlockSpec block) {
        String taskId = newTaskId();
        String sessionId = request.getBrowserSessionId();
        navigateIfNeeded(request, block.getUrl());

        List<StepRecord> steps = new ArrayList<>();
        List<String> previousActions = new ArrayList<>();
        int maxSteps = properties.getPlanner().getMaxStepsPerBlock();
        String parameters = toJson(request.getParameters());

        for (int order = 0; order < maxSteps; order++) {
            if (isStopped(request)) {
                return stopped(block, steps);
            }
            ScrapedPage page = browserDriver.scrape(sessionId).join();
            Map<String, Object> response = callModel(LlmPrompt.builder()
                    .name("navigation-step")
                    .text(PromptTemplates.navigationStep(block.getNavigationGoal(), page.getUrl(),
                            page.renderElementTree(), String.join("\n", previousActions), parameters))
                    .screenshots(page.getScreenshots())
                    .build());
            BrowserAction action = BrowserAction.fromResponse(response);
            steps.add(step(taskId, block, order, action.getType().name().toLowerCase(Locale.ROOT)));
            previousActions.add(action.getType() + " " + nullToEmpty(action.getElementId()) + " "
                    + nullToEmpty(action.getText()) + " : " + nullToEmpty(action.getReasoning()));
            log.debug("[Runner] Block '{}' step {}: {}", block.getLabel(), order, action.getType());
            if (request.isAbandoned()) {
                return stopped(block, steps);
            }

            switch (action.getType()) {
            case COMPLETE -> {
                return completeNavigation(request, block, steps);
            }
            case TERMINATE -> {
                return BlockResult.failure(block.getLabel(), BlockStatus.TERMINATED, action.getReasoning(), steps);
            }
            case INPUT_VERIFICATION_CODE -> {
                try {
                    enterVerificationCode(request, block, taskId, action);
                } catch (NoVerificationCodeFoundException e) {
                    if (isStopped(request)) {
                        return stopped(block, steps);
                    }
                    log.warn("[Runner] Block '{}' got no verification code: {}", block.getLabel(), e.getMessage());
                    return BlockResult.failure(block.getLabel(), BlockStatus.FAILED, e.getMessage(), steps);
                }
            }
            default -> browserDriver.perform(sessionId, action).join();
            }
        }
        return BlockResult.failure(block.getLabel(), BlockStatus.FAILED,
                "Reached the max number of " + maxSteps + " steps for block " + block.getLabel(), steps);
    }

    private BlockResult iterate(BlockExecutionRequest request, IterateBlockSpec block) {
        Object rawValues = request.getParameters().get(block.getLoopOverKey());
        if (!(rawValues instanceof List<?> values)) {
            return BlockResult.failure(block.getLabel(), BlockStatus.FAILED,
                    "No loop values bound to " + block.getLoopOverKey(), List.of());
        }
        BlockSpec body = block.getLoopBody();
        List<StepRecord> steps = new ArrayList<>();
        List<List<Object>> outputs = new ArrayList<>();
        for (int index = 0; index < values.size(); index++) {
            if (isStopped(request)) {
                return stopped(block, steps);
            }
            Object value = values.get(index);
            BlockResult result = execute(request.toBuilder()
                    .block(body)
                    .parameter(block.getValueParameterKey(), value)
                    .build());
            steps.addAll(result.getSteps());
            List<Object> iterationOutputs = new ArrayList<>();
            iterationOutputs.add(result.getOutput());
            outputs.add(iterationOutputs);

            if (result.getStatus() == BlockStatus.CANCELED) {
                return BlockResult.failure(block.getLabel(), BlockStatus.CANCELED, result.getFailureReason(), steps);
            }
            if (!result.isSuccess()) {
                if (!body.isContinueOnFailure()) {
                    return BlockResult.failure(block.getLabel(), result.getStatus(),
                            "Loop iteration " + index + " failed: " + result.getFailureReason(), steps);
                }
                log.info("[Runner] Loop '{}' iteration {} failed, continuing: {}", block.getLabel(), index,
                        result.getFailureReason());
            }
        }
        return BlockResult.success(block.getLabel(), outputs, steps);
    }

    // ==================== Helpers ====================

    private BlockResult completeNavigation(BlockExecutionRequest request, NavigateBlockSpec block,
            List<StepRecord> steps) {
        if (block.getDataExtractionGoal() == null || block.getDataExtractionGoal().isBlank()) {
            return BlockResult.success(block.getLabel(), null, steps);
        }
        Object extracted = extractFromPage(request.getBrowserSessionId(), block.getDataExtractionGoal(),
                block.getDataSchema());
        return BlockResult.success(block.getLabel(), singleton(BlockResult.EXTRACTED_INFORMATION, extracted), steps);
    }

    private void enterVerificationCode(BlockExecutionRequest request, NavigateBlockSpec block, String taskId,
            BrowserAction action) {
        OtpValue code = otpCoordinator.awaitVerificationCode(OtpPollRequest.builder()
                .organizationId(request.getOrganizationId())
                .runId(request.getRunId())
                .taskId(taskId)
                .totpVerificationUrl(block.getTotpVerificationUrl())
                .totpIdentifier(block.getTotpIdentifier())
                .totpSecret(request.getTotpSecret())
                .cancellation(() -> isStopped(request))
                .build());
        if (code.getType() == OtpType.MAGIC_LINK) {
            browserDriver.navigate(request.getBrowserSessionId(), code.getValue()).join();
            return;
        }
        browserDriver.perform(request.getBrowserSessionId(), BrowserAction.builder()
                .type(ActionType.INPUT_TEXT)
                .elementId(action.getElementId())
                .text(code.getValue())
                .reasoning("verification code")
                .build()).join();
    }

    private Object extractFromPage(String sessionId, String goal, Map<String, Object> schema) {
        ScrapedPage page = browserDriver.scrape(sessionId).join();
        Map<String, Object> response = callModel(LlmPrompt.builder()
                .name("extract-data")
                .text(PromptTemplates.extractData(goal, toJson(schema), page.getUrl(), page.renderElementTree()))
                .screenshots(page.getScreenshots())
                .build());
        return response.get(BlockResult.EXTRACTED_INFORMATION);
    }

    private void navigateIfNeeded(BlockExecutionRequest request, String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            return;
        }
        String url = resolveUrl(rawUrl, request.getParameters());
        BrowserPage page = browserDriver.navigate(request.getBrowserSessionId(), url).join();
        if (page == null || !page.isLoaded()) {
            throw new IllegalStateException("Failed to load " + url);
        }
    }

    /**
     * A block URL naming a bound parameter resolves to that parameter's value.
     */
    static String resolveUrl(String url, Map<String, Object> parameters) {
        if (url != null && parameters.containsKey(url) && parameters.get(url) != null) {
            return parameters.get(url).toString();
        }
        return url;
    }

    private boolean isStopped(BlockExecutionRequest request) {
        if (request.isAbandoned()) {
            return true;
        }
        if (request.getRunId() == null) {
            return false;
        }
        return runService.getRun(request.getRunId())
                .map(run -> run.isCancelRequested() || run.getStatus() != RunStatus.RUNNING)
                .orElse(true);
    }

    private static BlockResult stopped(BlockSpec block, List<StepRecord> steps) {
        return BlockResult.failure(block.getLabel(), BlockStatus.CANCELED, "Block execution was stopped", steps);
    }

    private Map<String, Object> callModel(LlmPrompt prompt) {
        long timeoutSeconds = properties.getPlanner().getLlmTimeoutSeconds();
        try {
            Map<String, Object> response = llmPort.complete(prompt).get(timeoutSeconds, TimeUnit.SECONDS);
            if (response == null) {
                throw new IllegalStateException("Model call " + prompt.getName() + " returned no JSON");
            }
            return response;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during model call " + prompt.getName(), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Model call " + prompt.getName() + " failed: " + e.getMessage(), e);
        }
    }

    private StepRecord step(String taskId, BlockSpec block, int order, String action) {
        return StepRecord.builder()
                .taskId(taskId)
                .blockLabel(block.getLabel())
                .order(order)
                .retryIndex(0)
                .action(action)
                .createdAt(Instant.now(clock))
                .build();
    }

    private String toJson(Object value) {
        if (value == null) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static Map<String, Object> singleton(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return map;
    }

    private static String newTaskId() {
        return "tsk_" + UUID.randomUUID();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
