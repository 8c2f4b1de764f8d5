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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.domain.model.BlockSpec;
import me.golemcore.pilot.domain.model.IterateBlockSpec;
import me.golemcore.pilot.domain.model.PlannerThought;
import me.golemcore.pilot.domain.model.RunExecutionContext;
import me.golemcore.pilot.domain.model.StepRecord;
import me.golemcore.pilot.domain.model.TaskHistoryEntry;
import me.golemcore.pilot.domain.model.ThoughtScenario;
import me.golemcore.pilot.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Persists the per-run execution context incrementally, so a crash mid-run can
 * be inspected from the last committed block.
 *
 * <p>
 * Storage layout:
 * <ul>
 * <li>contexts/{runId}.json - blocks, task history, thoughts and steps</li>
 * </ul>
 *
 * <p>
 * Task history is append-only. Step budget accounting re-reads the persisted
 * document instead of trusting in-memory counters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExecutionContextService {

    private static final String CONTEXTS_DIR = "contexts";
    private static final String JSON_SUFFIX = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, RunExecutionContext> contexts = new ConcurrentHashMap<>();

    public synchronized RunExecutionContext getContext(String runId) {
        return contexts.computeIfAbsent(runId, this::loadOrCreate);
    }

    public synchronized List<TaskHistoryEntry> getTaskHistory(String runId) {
        return List.copyOf(getContext(runId).getTaskHistory());
    }

    /**
     * Appends a block to the run definition.
     *
     * @throws IllegalArgumentException
     *             if any label of the block (loop bodies included) is already
     *             used by this run
     */
    public synchronized void appendBlock(String runId, BlockSpec block) {
        RunExecutionContext context = getContext(runId);
        Set<String> existing = new HashSet<>();
        for (BlockSpec attached : context.getBlocks()) {
            collectLabels(attached, existing);
        }
        Set<String> incoming = new HashSet<>();
        collectLabels(block, incoming);
        for (String label : incoming) {
            if (existing.contains(label)) {
                throw new IllegalArgumentException("Duplicate block label for run " + runId + ": " + label);
            }
        }
        context.getBlocks().add(block);
        save(context);
        log.debug("[Context] Run '{}' block appended: {} ({})", runId, block.getLabel(), block.getBlockType());
    }

    /**
     * Appends one planner memory entry and returns the new history length.
     */
    public synchronized int appendHistory(String runId, TaskHistoryEntry entry) {
        RunExecutionContext context = getContext(runId);
        context.getTaskHistory().add(entry);
        save(context);
        return context.getTaskHistory().size();
    }

    public synchronized PlannerThought recordThought(String runId, ThoughtScenario scenario, String thought,
            String observation, String answer, Map<String, Object> output) {
        RunExecutionContext context = getContext(runId);
        PlannerThought record = PlannerThought.builder()
                .id(UUID.randomUUID().toString())
                .scenario(scenario)
                .thought(thought)
                .observation(observation)
                .answer(answer)
                .output(output)
                .createdAt(Instant.now(clock))
                .build();
        context.getThoughts().add(record);
        save(context);
        return record;
    }

    public synchronized void recordSteps(String runId, List<StepRecord> steps) {
        if (steps == null || steps.isEmpty()) {
            return;
        }
        RunExecutionContext context = getContext(runId);
        context.getSteps().addAll(steps);
        save(context);
    }

    /**
     * Counts distinct {@code (taskId, order)} pairs in the persisted context. Read
     * from storage so the count survives process restarts.
     */
    public int countDistinctSteps(String runId) {
        RunExecutionContext persisted = load(runId);
        if (persisted == null) {
            return 0;
        }
        Set<String> unique = new HashSet<>();
        for (StepRecord step : persisted.getSteps()) {
            unique.add(step.getTaskId() + "#" + step.getOrder());
        }
        return unique.size();
    }

    private void collectLabels(BlockSpec block, Set<String> labels) {
        if (block == null) {
            return;
        }
        labels.add(block.getLabel());
        if (block instanceof IterateBlockSpec iterate) {
            collectLabels(iterate.getLoopBody(), labels);
        }
    }

    // ==================== Persistence ====================

    private RunExecutionContext loadOrCreate(String runId) {
        RunExecutionContext loaded = load(runId);
        if (loaded != null) {
            return loaded;
        }
        return RunExecutionContext.builder().runId(runId).updatedAt(Instant.now(clock)).build();
    }

    private RunExecutionContext load(String runId) {
        try {
            String json = storagePort.getText(CONTEXTS_DIR, runId + JSON_SUFFIX).join();
            if (json != null && !json.isBlank()) {
                return objectMapper.readValue(json, RunExecutionContext.class);
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - missing or unreadable context starts empty
            log.debug("[Context] No context for run '{}' or failed to parse: {}", runId, e.getMessage());
        }
        return null;
    }

    private void save(RunExecutionContext context) {
        context.setUpdatedAt(Instant.now(clock));
        try {
            String json = objectMapper.writeValueAsString(context);
            storagePort.putTextAtomic(CONTEXTS_DIR, context.getRunId() + JSON_SUFFIX, json, false).join();
        } catch (Exception e) {
            log.error("[Context] Failed to save context for run '{}'", context.getRunId(), e);
            throw new IllegalStateException("Failed to persist execution context " + context.getRunId(), e);
        }
    }
}
