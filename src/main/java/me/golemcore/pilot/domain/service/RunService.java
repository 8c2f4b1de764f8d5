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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.domain.model.Run;
import me.golemcore.pilot.domain.model.RunStatus;
import me.golemcore.pilot.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Owns {@link Run} records and their status state machine.
 *
 * <p>
 * Storage layout:
 * <ul>
 * <li>runs/{runId}.json - one document per run</li>
 * </ul>
 *
 * <p>
 * Every status change goes through {@link #transition}, which rejects any move
 * not allowed by {@link RunStatus#canTransitionTo}. Runs found in
 * {@code RUNNING} when the store is first loaded belong to a dead process and
 * are failed.
 */
@Service
@Slf4j
public class RunService {

    private static final String RUNS_DIR = "runs";
    private static final String JSON_SUFFIX = ".json";
    private static final String RUN_NOT_FOUND = "Run not found: ";
    static final String RECOVERY_INTERRUPTED_MSG = "Interrupted by restart/crash during execution";
    static final String CANCELED_REASON = "Run was canceled";
    static final String TASK_PROMPT_MISSING = "Task prompt is missing";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, Run> runs = new ConcurrentHashMap<>();
    private volatile boolean loaded = false;

    public RunService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ==================== Queries ====================

    /**
     * Returns a snapshot of the run. Later changes are only visible through a new
     * call.
     */
    public Optional<Run> getRun(String runId) {
        ensureLoaded();
        return Optional.ofNullable(runs.get(runId)).map(RunService::snapshot);
    }

    /**
     * Returns the run if it exists, belongs to {@code organizationId} and is not
     * soft-deleted.
     */
    public Run requireRun(String organizationId, String runId) {
        return snapshot(requireOwned(organizationId, runId));
    }

    public List<Run> listRuns(String organizationId) {
        ensureLoaded();
        return runs.values().stream()
                .filter(run -> run.getDeletedAt() == null)
                .filter(run -> organizationId.equals(run.getOrganizationId()))
                .sorted(Comparator.comparing(Run::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .map(RunService::snapshot)
                .toList();
    }

    // ==================== Creation ====================

    /**
     * Creates a run from a request template. Only caller-owned fields of the
     * template are copied.
     */
    public synchronized Run createRun(String organizationId, Run request) {
        ensureLoaded();
        if (organizationId == null || organizationId.isBlank()) {
            throw new IllegalArgumentException("Organization id is required");
        }
        if (request.getPrompt() == null || request.getPrompt().isBlank()) {
            throw new IllegalArgumentException(TASK_PROMPT_MISSING);
        }
        if (request.getMaxSteps() != null && request.getMaxSteps() <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive");
        }
        Instant now = Instant.now(clock);
        Run run = Run.builder()
                .id("run_" + UUID.randomUUID())
                .organizationId(organizationId)
                .status(RunStatus.CREATED)
                .prompt(request.getPrompt())
                .url(request.getUrl())
                .title(request.getTitle())
                .outputSchema(request.getOutputSchema())
                .webhookUrl(request.getWebhookUrl())
                .totpVerificationUrl(request.getTotpVerificationUrl())
                .totpIdentifier(request.getTotpIdentifier())
                .totpSecret(request.getTotpSecret())
                .maxSteps(request.getMaxSteps())
                .browserSessionId(request.getBrowserSessionId())
                .createdAt(now)
                .updatedAt(now)
                .build();
        runs.put(run.getId(), run);
        save(run);
        log.info("[Runs] Created run '{}' for organization '{}'", run.getId(), organizationId);
        return snapshot(run);
    }

    // ==================== Status transitions ====================

    public Run queueRun(String runId) {
        return transition(runId, RunStatus.QUEUED, run -> {
        });
    }

    /**
     * Atomically moves a queued run to {@code RUNNING}.
     *
     * @return {@code false} when the run is not queued, which is how duplicate
     *         starts are rejected
     */
    public synchronized boolean tryMarkRunning(String runId) {
        Run run = find(runId);
        if (run.getStatus() != RunStatus.QUEUED) {
            log.info("[Runs] Run '{}' is {} instead of QUEUED, not starting", runId, run.getStatus());
            return false;
        }
        transition(runId, RunStatus.RUNNING, r -> {
        });
        return true;
    }

    /**
     * Cancels a run. A running run is canceled immediately and its loop notices
     * at the top of its next iteration; a run that has not started yet is
     * flagged and canceled as soon as its loop starts.
     */
    public synchronized Run requestCancel(String organizationId, String runId) {
        Run run = requireOwned(organizationId, runId);
        if (run.getStatus().isFinal()) {
            throw new IllegalStateException("Run " + runId + " is already " + run.getStatus());
        }
        if (run.getStatus() == RunStatus.RUNNING) {
            return transition(runId, RunStatus.CANCELED, r -> r.setFailureReason(CANCELED_REASON));
        }
        run.setCancelRequested(true);
        run.setUpdatedAt(Instant.now(clock));
        save(run);
        log.info("[Runs] Cancel requested for run '{}' before start", runId);
        return snapshot(run);
    }

    /**
     * Terminates a running run from outside the loop.
     */
    public synchronized Run requestTerminate(String organizationId, String runId, String reason) {
        Run run = requireOwned(organizationId, runId);
        if (run.getStatus() != RunStatus.RUNNING) {
            throw new IllegalStateException("Only running runs can be terminated, current: " + run.getStatus());
        }
        return transition(runId, RunStatus.TERMINATED,
                r -> r.setFailureReason(reason != null && !reason.isBlank() ? reason : "Run was terminated"));
    }

    /**
     * Applies a terminal transition unless the run already reached a final state,
     * in which case the current run is returned untouched. Used by the planning
     * loop, which races with external cancellation.
     */
    public synchronized Run finishIfActive(String runId, RunStatus target, String reason, Object output,
            String summary) {
        Run run = find(runId);
        if (run.getStatus().isFinal()) {
            log.warn("[Runs] Run '{}' already {}, ignoring transition to {}", runId, run.getStatus(), target);
            return snapshot(run);
        }
        return transition(runId, target, r -> {
            if (target == RunStatus.COMPLETED) {
                r.setOutput(output);
                r.setSummary(summary);
            } else {
                r.setFailureReason(reason);
            }
        });
    }

    public synchronized Run transition(String runId, RunStatus target, Consumer<Run> mutator) {
        Run run = find(runId);
        RunStatus current = run.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException("Cannot transition run " + runId + " from " + current + " to " + target);
        }
        Instant now = Instant.now(clock);
        run.setStatus(target);
        run.setUpdatedAt(now);
        if (target == RunStatus.QUEUED) {
            run.setQueuedAt(now);
        } else if (target == RunStatus.RUNNING) {
            run.setStartedAt(now);
        } else if (target.isFinal()) {
            run.setFinishedAt(now);
        }
        mutator.accept(run);
        save(run);
        log.info("[Runs] Run '{}' {} -> {}", runId, current, target);
        return snapshot(run);
    }

    // ==================== Field updates ====================

    public synchronized Run updateMetadata(String runId, String url, String title) {
        Run run = find(runId);
        run.setUrl(url);
        if (title != null && !title.isBlank()) {
            run.setTitle(title);
        }
        run.setUpdatedAt(Instant.now(clock));
        save(run);
        return snapshot(run);
    }

    public synchronized Run attachBrowserSession(String runId, String browserSessionId) {
        Run run = find(runId);
        run.setBrowserSessionId(browserSessionId);
        run.setUpdatedAt(Instant.now(clock));
        save(run);
        return snapshot(run);
    }

    public synchronized void markWaitingForVerificationCode(String runId, String identifier, Instant startedAt) {
        Run run = find(runId);
        run.setWaitingForVerificationCode(true);
        run.setVerificationCodeIdentifier(identifier);
        run.setVerificationCodePollingStartedAt(startedAt);
        run.setUpdatedAt(Instant.now(clock));
        save(run);
    }

    @SuppressWarnings("PMD.NullAssignment") // clearing the waiting state means no identifier and no start time
    public synchronized void clearWaitingForVerificationCode(String runId) {
        Run run = find(runId);
        run.setWaitingForVerificationCode(false);
        run.setVerificationCodeIdentifier(null);
        run.setVerificationCodePollingStartedAt(null);
        run.setUpdatedAt(Instant.now(clock));
        save(run);
    }

    /**
     * Records the outcome of webhook delivery. A {@code null} reason clears a
     * previous failure. The run status is never touched.
     */
    public synchronized void recordWebhookResult(String runId, String failureReason) {
        Run run = find(runId);
        run.setWebhookFailureReason(failureReason);
        run.setUpdatedAt(Instant.now(clock));
        save(run);
    }

    private Run find(String runId) {
        ensureLoaded();
        Run run = runs.get(runId);
        if (run == null) {
            throw new IllegalArgumentException(RUN_NOT_FOUND + runId);
        }
        return run;
    }

    private Run requireOwned(String organizationId, String runId) {
        Run run = find(runId);
        if (run.getDeletedAt() != null
                || (organizationId != null && !organizationId.equals(run.getOrganizationId()))) {
            throw new IllegalArgumentException(RUN_NOT_FOUND + runId);
        }
        return run;
    }

    private static Run snapshot(Run run) {
        return run.toBuilder().build();
    }

    // ==================== Persistence ====================

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (this) {
            if (loaded) {
                return;
            }
            loadRuns();
            loaded = true;
        }
    }

    private void loadRuns() {
        List<String> files;
        try {
            files = storagePort.listObjects(RUNS_DIR, "").join();
        } catch (RuntimeException e) { // NOSONAR - empty store on first start
            log.debug("[Runs] No runs found: {}", e.getMessage());
            return;
        }
        if (files == null) {
            return;
        }
        for (String file : files) {
            if (!file.endsWith(JSON_SUFFIX)) {
                continue;
            }
            try {
                String json = storagePort.getText(RUNS_DIR, file).join();
                if (json == null || json.isBlank()) {
                    continue;
                }
                Run run = objectMapper.readValue(json, Run.class);
                runs.put(run.getId(), run);
                recoverInterruptedRun(run);
            } catch (IOException | RuntimeException e) { // NOSONAR - one corrupt record must not hide the rest
                log.warn("[Runs] Failed to load run '{}': {}", file, e.getMessage());
            }
        }
        log.info("[Runs] Loaded {} runs", runs.size());
    }

    private void recoverInterruptedRun(Run run) {
        if (run.getStatus() != RunStatus.RUNNING) {
            return;
        }
        Instant now = Instant.now(clock);
        run.setStatus(RunStatus.FAILED);
        run.setFailureReason(RECOVERY_INTERRUPTED_MSG);
        run.setWaitingForVerificationCode(false);
        run.setFinishedAt(now);
        run.setUpdatedAt(now);
        save(run);
        log.warn("[Runs] Recovered stale RUNNING run '{}' as FAILED", run.getId());
    }

    private void save(Run run) {
        try {
            String json = objectMapper.writeValueAsString(run);
            storagePort.putTextAtomic(RUNS_DIR, run.getId() + JSON_SUFFIX, json, false).join();
        } catch (Exception e) {
            log.error("[Runs] Failed to save run '{}'", run.getId(), e);
            throw new IllegalStateException("Failed to persist run " + run.getId(), e);
        }
    }
}
