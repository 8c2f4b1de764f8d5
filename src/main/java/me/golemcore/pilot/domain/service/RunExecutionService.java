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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.domain.loop.PlanningLoop;
import me.golemcore.pilot.domain.model.Run;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs planning loops in the background, one task per run.
 *
 * <p>
 * Runs execute fully concurrently up to {@code pilot.executor.max-concurrent-runs};
 * further runs wait in the pool queue while their record stays {@code QUEUED}.
 * Cancellation is cooperative: it only changes the run record, which the loop
 * observes at the top of its next iteration.
 */
@Service
@Slf4j
public class RunExecutionService {

    private final RunService runService;
    private final PlanningLoop planningLoop;
    private final ExecutorService executor;
    private final Map<String, CompletableFuture<Run>> inFlight = new ConcurrentHashMap<>();

    public RunExecutionService(RunService runService, PlanningLoop planningLoop, PilotProperties properties) {
        this.runService = runService;
        this.planningLoop = planningLoop;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(properties.getExecutor().getMaxConcurrentRuns(), r -> {
            Thread t = new Thread(r, "pilot-run-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Creates, queues and starts a run.
     */
    public Run submit(String organizationId, Run request) {
        Run created = runService.createRun(organizationId, request);
        Run queued = runService.queueRun(created.getId());
        start(queued.getId());
        return queued;
    }

    /**
     * Schedules the loop of a queued run. A run already scheduled in this process
     * keeps its existing task.
     */
    public synchronized CompletableFuture<Run> start(String runId) {
        CompletableFuture<Run> existing = inFlight.get(runId);
        if (existing != null) {
            return existing;
        }
        CompletableFuture<Run> future = CompletableFuture.supplyAsync(() -> planningLoop.execute(runId), executor);
        inFlight.put(runId, future);
        future.whenComplete((run, error) -> {
            inFlight.remove(runId, future);
            if (error != null) {
                log.error("[Runs] Loop task for run '{}' failed: {}", runId, error.getMessage());
            }
        });
        return future;
    }

    public Run cancel(String organizationId, String runId) {
        return runService.requestCancel(organizationId, runId);
    }

    public Run terminate(String organizationId, String runId, String reason) {
        return runService.requestTerminate(organizationId, runId, reason);
    }

    public boolean isExecuting(String runId) {
        return inFlight.containsKey(runId);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Runs] Executor shut down ({} run(s) still in flight)", inFlight.size());
    }
}
