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
import me.golemcore.pilot.domain.model.LlmPrompt;
import me.golemcore.pilot.domain.model.ThoughtScenario;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking structured model calls made on behalf of a run. Every call is
 * recorded as a planner thought in the run's execution context.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelCallService {

    private final LlmPort llmPort;
    private final ExecutionContextService contextService;
    private final PilotProperties properties;

    /**
     * Calls the model and waits for the JSON answer.
     *
     * @throws IllegalStateException
     *             when the call fails or exceeds the configured timeout
     */
    public Map<String, Object> call(String runId, ThoughtScenario scenario, LlmPrompt prompt) {
        long timeoutSeconds = properties.getPlanner().getLlmTimeoutSeconds();
        long startMs = System.currentTimeMillis();
        Map<String, Object> response;
        try {
            response = llmPort.complete(prompt).get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during model call " + prompt.getName(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("Model call " + prompt.getName() + " failed: " + cause.getMessage(),
                    cause);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Model call " + prompt.getName() + " timed out after "
                    + timeoutSeconds + "s", e);
        }
        log.debug("[LLM] {} answered in {}ms", prompt.getName(), System.currentTimeMillis() - startMs);
        if (response == null) {
            throw new IllegalStateException("Model call " + prompt.getName() + " returned no JSON");
        }
        if (runId != null) {
            contextService.recordThought(runId, scenario, text(response.get("thoughts")),
                    text(response.get("page_info")), text(response.get("plan")), response);
        }
        return response;
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }
}
