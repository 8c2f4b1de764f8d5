package me.golemcore.pilot.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.domain.model.BlockExecutionRequest;
import me.golemcore.pilot.domain.model.BlockResult;
import me.golemcore.pilot.domain.model.ExtractBlockSpec;
import me.golemcore.pilot.domain.model.GotoUrlBlockSpec;
import me.golemcore.pilot.domain.model.IterateBlockSpec;
import me.golemcore.pilot.domain.model.LlmPrompt;
import me.golemcore.pilot.domain.model.NavigateBlockSpec;
import me.golemcore.pilot.domain.model.Run;
import me.golemcore.pilot.domain.model.ScrapedPage;
import me.golemcore.pilot.domain.model.ThoughtScenario;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.BlockRunnerPort;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns a planner decision into an executable {@code BlockSpec}.
 *
 * <p>
 * Loop generation is the only generator with a side effect: it executes an
 * extraction block to discover the values to iterate over, and fails with
 * {@link LoopGenerationException} when that extraction does not return both
 * the values and the link flag.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BlockGenerator {

    static final String IS_LOOP_VALUE_LINK = "is_loop_value_link";
    static final String LOOP_VALUES_PREFIX = "loop_values_";
    static final String LOOP_URL_PREFIX = "task_in_loop_url_";
    static final String LOOP_TARGET_KEY = "target";

    private static final String RANDOM_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int RANDOM_LENGTH = 5;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final ModelCallService modelCallService;
    private final BlockRunnerPort blockRunner;
    private final ExecutionContextService contextService;
    private final PilotProperties properties;

    public GotoUrlBlockSpec generateGotoUrl(String url) {
        return GotoUrlBlockSpec.builder()
                .label("goto_url_" + randomSuffix())
                .url(url)
                .continueOnFailure(continueOnFailure())
                .build();
    }

    /**
     * Wraps the step plan into a mini goal with the run goal as context.
     */
    public NavigateBlockSpec generateNavigation(Run run, String plan) {
        return NavigateBlockSpec.builder()
                .label("navigation_" + randomSuffix())
                .navigationGoal(PromptTemplates.miniGoal(plan, run.getPrompt()))
                .totpVerificationUrl(run.getTotpVerificationUrl())
                .totpIdentifier(run.getTotpIdentifier())
                .continueOnFailure(continueOnFailure())
                .build();
    }

    /**
     * Builds an extraction block whose schema the model infers from the current
     * page.
     */
    @SuppressWarnings("unchecked")
    public ExtractBlockSpec generateExtraction(Run run, String plan, ScrapedPage page) {
        Map<String, Object> response = modelCallService.call(run.getId(),
                ThoughtScenario.GENERATE_EXTRACTION_SCHEMA,
                LlmPrompt.builder()
                        .name("generate-extraction-schema")
                        .text(PromptTemplates.extractionSchema(plan, page.getUrl(), page.renderElementTree()))
                        .screenshots(page.getScreenshots())
                        .build());
        Object schema = response.get("schema");
        return ExtractBlockSpec.builder()
                .label("extract_" + randomSuffix())
                .dataExtractionGoal(plan)
                .dataSchema(schema instanceof Map<?, ?> map ? (Map<String, Object>) map : null)
                .continueOnFailure(continueOnFailure())
                .build();
    }

    /**
     * Discovers the loop values, then builds an iterate block whose body is a
     * navigation task bound to one value per iteration.
     *
     * @throws LoopGenerationException
     *             when the value extraction fails or its result lacks the values
     *             or the link flag
     */
    @SuppressWarnings("unchecked")
    public GeneratedLoop generateLoop(Run run, String plan, ScrapedPage page) {
        String loopRandom = randomSuffix();
        String loopValuesKey = LOOP_VALUES_PREFIX + loopRandom;

        ExtractBlockSpec extraction = ExtractBlockSpec.builder()
                .label("extraction_task_for_loop_" + randomSuffix())
                .dataExtractionGoal(PromptTemplates.loopValuesGoal(plan))
                .dataSchema(loopValuesSchema(loopValuesKey))
                .build();
        contextService.appendBlock(run.getId(), extraction);

        BlockResult extractionResult = runBlock(BlockExecutionRequest.builder()
                .runId(run.getId())
                .organizationId(run.getOrganizationId())
                .browserSessionId(run.getBrowserSessionId())
                .block(extraction)
                .build());
        contextService.recordSteps(run.getId(), extractionResult.getSteps());
        if (!extractionResult.isSuccess()) {
            throw new LoopGenerationException("Failed to execute the extraction block for the loop task: "
                    + extractionResult.getFailureReason(), extractionResult);
        }

        Object extracted = extractionResult.getOutput() instanceof Map<?, ?> output
                ? output.get(BlockResult.EXTRACTED_INFORMATION)
                : null;
        if (!(extracted instanceof Map<?, ?> values)) {
            throw new LoopGenerationException("Invalid output of the extraction block for the loop task",
                    extractionResult);
        }
        if (!values.containsKey(loopValuesKey)) {
            throw new LoopGenerationException(loopValuesKey + " not found in the output of the extraction block",
                    extractionResult);
        }
        if (!values.containsKey(IS_LOOP_VALUE_LINK)) {
            throw new LoopGenerationException(IS_LOOP_VALUE_LINK
                    + " not found in the output of the extraction block", extractionResult);
        }
        List<String> loopValues = toStringList(values.get(loopValuesKey));
        boolean isLink = Boolean.TRUE.equals(values.get(IS_LOOP_VALUE_LINK));
        contextService.recordThought(run.getId(), ThoughtScenario.EXTRACT_LOOP_VALUES, null, null, null,
                (Map<String, Object>) values);

        String valueKey = isLink ? LOOP_URL_PREFIX + loopRandom : LOOP_TARGET_KEY;
        log.info("[Blocks] Loop over {} value(s), links: {}", loopValues.size(), isLink);

        Map<String, Object> taskInLoop = modelCallService.call(run.getId(), ThoughtScenario.GENERATE_TASK_IN_LOOP,
                LlmPrompt.builder()
                        .name("generate-task-in-loop")
                        .text(PromptTemplates.taskInLoop(plan, run.getPrompt(), loopValues.toString(), isLink))
                        .screenshots(page.getScreenshots())
                        .build());
        String navigationGoal = asText(taskInLoop.get("navigation_goal"));
        String dataExtractionGoal = asText(taskInLoop.get("data_extraction_goal"));
        if (navigationGoal != null && dataExtractionGoal != null) {
            navigationGoal = navigationGoal + PromptTemplates.EXTRACT_DATA_OPTIMIZATION;
        }
        Object dataSchema = taskInLoop.get("data_schema");

        NavigateBlockSpec body = NavigateBlockSpec.builder()
                .label("task_in_loop_" + randomSuffix())
                .url(isLink ? valueKey : null)
                .navigationGoal(navigationGoal)
                .dataExtractionGoal(dataExtractionGoal)
                .dataSchema(dataSchema instanceof Map<?, ?> map ? (Map<String, Object>) map : null)
                .parameterKeys(new ArrayList<>(List.of(valueKey)))
                .totpVerificationUrl(run.getTotpVerificationUrl())
                .totpIdentifier(run.getTotpIdentifier())
                .continueOnFailure(true)
                .completeVerification(false)
                .build();
        IterateBlockSpec loop = IterateBlockSpec.builder()
                .label("loop_" + randomSuffix())
                .loopOverKey(loopValuesKey)
                .valueParameterKey(valueKey)
                .loopBody(body)
                .continueOnFailure(continueOnFailure())
                .build();

        Map<String, Object> taskInsideTheLoop = new LinkedHashMap<>();
        taskInsideTheLoop.put("navigation_goal", navigationGoal);
        taskInsideTheLoop.put("data_extraction_goal", dataExtractionGoal);
        taskInsideTheLoop.put("data_schema", dataSchema);
        taskInsideTheLoop.put("url", body.getUrl());
        return new GeneratedLoop(extraction, loop, loopValues, isLink, taskInsideTheLoop);
    }

    private BlockResult runBlock(BlockExecutionRequest request) {
        long timeoutSeconds = properties.getPlanner().getBlockTimeoutSeconds();
        CompletableFuture<BlockResult> future = blockRunner.run(request);
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            request.abandon();
            future.cancel(true);
            throw new IllegalStateException("Interrupted while running block " + request.getBlock().getLabel(), e);
        } catch (ExecutionException | TimeoutException e) {
            request.abandon();
            future.cancel(true);
            throw new LoopGenerationException("Failed to execute the extraction block for the loop task: "
                    + e.getMessage(), null);
        }
    }

    private boolean continueOnFailure() {
        return properties.getPlanner().isContinueOnBlockFailure();
    }

    private static Map<String, Object> loopValuesSchema(String loopValuesKey) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("type", "array");
        values.put("items", Map.of("type", "string", "description", "One value to loop over"));
        values.put("description", "Values to repeat the task for. Links when each value leads to its own page.");

        Map<String, Object> isLink = new LinkedHashMap<>();
        isLink.put("type", "boolean");
        isLink.put("description", "True when every loop value is a link to open");

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(loopValuesKey, values);
        fields.put(IS_LOOP_VALUE_LINK, isLink);

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", fields);
        schema.put("required", List.of(loopValuesKey, IS_LOOP_VALUE_LINK));
        return schema;
    }

    private static List<String> toStringList(Object raw) {
        List<String> result = new ArrayList<>();
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }

    private static String asText(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    static String randomSuffix() {
        StringBuilder sb = new StringBuilder(RANDOM_LENGTH);
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            sb.append(RANDOM_ALPHABET.charAt(RANDOM.nextInt(RANDOM_ALPHABET.length())));
        }
        return sb.toString();
    }

    /**
     * Result of loop generation: the value extraction block that already ran,
     * the iterate block to execute and the values it will loop over.
     */
    public record GeneratedLoop(ExtractBlockSpec extractionBlock, IterateBlockSpec loopBlock,
            List<String> loopValues, boolean link, Map<String, Object> taskInsideTheLoop) {
    }

    /**
     * Loop values could not be determined. Never degrades into an empty loop.
     */
    public static class LoopGenerationException extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        private final transient BlockResult extractionResult;

        public LoopGenerationException(String message, BlockResult extractionResult) {
            super(message);
            this.extractionResult = extractionResult;
        }

        public BlockResult getExtractionResult() {
            return extractionResult;
        }
    }
}
