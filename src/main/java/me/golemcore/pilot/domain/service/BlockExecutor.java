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
import me.golemcore.pilot.domain.model.BlockSpec;
import me.golemcore.pilot.domain.model.BlockStatus;
import me.golemcore.pilot.domain.model.IterateBlockSpec;
import me.golemcore.pilot.domain.model.NavigateBlockSpec;
import me.golemcore.pilot.domain.model.Run;
import me.golemcore.pilot.domain.model.TaskHistoryEntry;
import me.golemcore.pilot.domain.model.TaskType;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.BlockRunnerPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes one generated block for a run and records it in the run's planner
 * memory.
 *
 * <p>
 * Every execution appends the block to the run definition before it runs and
 * appends exactly one task-history entry after it finishes, so history order
 * always matches execution order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BlockExecutor {

    static final String LOOP_GENERATION_FAILED = "Failed to generate the loop.";

    private final BlockRunnerPort blockRunner;
    private final ExecutionContextService contextService;
    private final PilotProperties properties;

    /**
     * What the planning loop does with a finished block.
     */
    public enum Propagation {
        /** Move the run to canceled. */
        CANCEL_RUN,
        /** Absorb the failure and plan the next step. */
        CONTINUE,
        /** Stop planning; the failure decides the run outcome. */
        STOP,
        /** Ask the model whether the goal is now achieved. */
        CHECK_COMPLETION
    }

    public record BlockExecution(BlockResult result, TaskHistoryEntry historyEntry, int historySize) {
    }

    public BlockExecution execute(Run run, TaskType taskType, String plan, BlockSpec block) {
        return execute(run, taskType, plan, block, Map.of(), null);
    }

    /**
     * Runs {@code block} and appends its history entry.
     *
     * @param parameters
     *            values visible to the block, such as loop values
     * @param loopValues
     *            the values an iterate block loops over, recorded in history
     */
    public BlockExecution execute(Run run, TaskType taskType, String plan, BlockSpec block,
            Map<String, Object> parameters, LoopDetails loopValues) {
        contextService.appendBlock(run.getId(), block);
        log.info("[Blocks] Run '{}' executing {} block '{}'", run.getId(), block.getBlockType(), block.getLabel());

        BlockResult result = runBlock(BlockExecutionRequest.builder()
                .runId(run.getId())
                .organizationId(run.getOrganizationId())
                .browserSessionId(run.getBrowserSessionId())
                .block(block)
                .parameters(parameters)
                .totpSecret(run.getTotpSecret())
                .build());
        contextService.recordSteps(run.getId(), result.getSteps());

        TaskHistoryEntry.TaskHistoryEntryBuilder entry = TaskHistoryEntry.builder()
                .type(taskType.getValue())
                .task(plan)
                .status(statusText(result.getStatus()))
                .reason(result.getFailureReason())
                .extractedData(extractData(block, result));
        if (loopValues != null) {
            entry.loopOverValues(loopValues.values()).taskInsideTheLoop(loopValues.taskInsideTheLoop());
        }
        TaskHistoryEntry historyEntry = entry.build();
        int size = contextService.appendHistory(run.getId(), historyEntry);
        log.info("[Blocks] Block '{}' finished with status {}", block.getLabel(), result.getStatus());
        return new BlockExecution(result, historyEntry, size);
    }

    /**
     * Records a loop whose generation failed. No block ran, but the attempt is
     * part of the planner memory.
     */
    public TaskHistoryEntry recordLoopGenerationFailure(Run run, String plan, List<String> loopValues) {
        TaskHistoryEntry entry = TaskHistoryEntry.builder()
                .type(TaskType.LOOP.getValue())
                .task(plan)
                .status(statusText(BlockStatus.FAILED))
                .reason(LOOP_GENERATION_FAILED)
                .loopOverValues(loopValues)
                .build();
        contextService.appendHistory(run.getId(), entry);
        return entry;
    }

    /**
     * Maps a block status to the planning loop reaction. A failure is absorbed
     * only when the block allows it and the run still has steps left.
     */
    public static Propagation propagate(BlockResult result, BlockSpec block, boolean lastStep) {
        BlockStatus status = result.getStatus() != null ? result.getStatus() : BlockStatus.FAILED;
        return switch (status) {
        case CANCELED -> Propagation.CANCEL_RUN;
        case FAILED, TERMINATED -> block.isContinueOnFailure() && !lastStep
                ? Propagation.CONTINUE
                : Propagation.STOP;
        case SUCCESS -> Propagation.CHECK_COMPLETION;
        case SKIPPED -> Propagation.CONTINUE;
        };
    }

    private BlockResult runBlock(BlockExecutionRequest request) {
        long timeoutSeconds = timeoutSeconds(request.getBlock());
        String label = request.getBlock().getLabel();
        CompletableFuture<BlockResult> future = blockRunner.run(request);
        try {
            BlockResult result = future.get(timeoutSeconds, TimeUnit.SECONDS);
            if (result == null) {
                return BlockResult.failure(label, BlockStatus.FAILED, "Block runner returned no result", List.of());
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop(request, future);
            return BlockResult.failure(label, BlockStatus.CANCELED, "Interrupted", List.of());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Blocks] Block '{}' crashed: {}", label, cause.getMessage());
            return BlockResult.failure(label, BlockStatus.FAILED, cause.getMessage(), List.of());
        } catch (TimeoutException e) {
            log.warn("[Blocks] Block '{}' timed out after {}s, stopping it", label, timeoutSeconds);
            stop(request, future);
            return BlockResult.failure(label, BlockStatus.FAILED,
                    "Block timed out after " + timeoutSeconds + "s", List.of());
        }
    }

    private static void stop(BlockExecutionRequest request, CompletableFuture<BlockResult> future) {
        request.abandon();
        future.cancel(true);
    }

    /**
     * Time a block may run. Blocks that can ask for a one-time code get the code
     * polling window on top, so a missing code fails with its own reason.
     */
    long timeoutSeconds(BlockSpec block) {
        long seconds = properties.getPlanner().getBlockTimeoutSeconds();
        if (mayWaitForVerificationCode(block)) {
            seconds += TimeUnit.MINUTES.toSeconds(properties.getOtp().getPollingTimeoutMinutes());
        }
        return seconds;
    }

    private static boolean mayWaitForVerificationCode(BlockSpec block) {
        if (block instanceof IterateBlockSpec loop) {
            return mayWaitForVerificationCode(loop.getLoopBody());
        }
        return block instanceof NavigateBlockSpec;
    }

    /**
     * Extraction payload of a block: the extracted information of single blocks,
     * or one list of extracted information per loop value for iterate blocks.
     */
    static Object extractData(BlockSpec block, BlockResult result) {
        if (!result.isSuccess() || result.getOutput() == null) {
            return null;
        }
        if (block instanceof IterateBlockSpec) {
            if (!(result.getOutput() instanceof List<?> iterations)) {
                return null;
            }
            List<List<Object>> extracted = new ArrayList<>();
            for (Object iteration : iterations) {
                List<Object> values = new ArrayList<>();
                if (iteration instanceof List<?> outputs) {
                    for (Object output : outputs) {
                        values.add(extractedInformation(output));
                    }
                }
                extracted.add(values);
            }
            return extracted;
        }
        return extractedInformation(result.getOutput());
    }

    private static Object extractedInformation(Object output) {
        if (output instanceof Map<?, ?> map) {
            return map.get(BlockResult.EXTRACTED_INFORMATION);
        }
        return null;
    }

    private static String statusText(BlockStatus status) {
        return status != null ? status.name().toLowerCase(Locale.ROOT) : null;
    }

    /**
     * Loop values and the per-value task, recorded alongside iterate blocks.
     */
    public record LoopDetails(List<String> values, Map<String, Object> taskInsideTheLoop) {
    }
}
