package me.golemcore.pilot.adapter.inbound.web.controller;

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
import me.golemcore.pilot.adapter.inbound.web.dto.CreateRunRequest;
import me.golemcore.pilot.adapter.inbound.web.dto.RunDto;
import me.golemcore.pilot.adapter.inbound.web.dto.TerminateRunRequest;
import me.golemcore.pilot.domain.model.Run;
import me.golemcore.pilot.domain.model.RunExecutionContext;
import me.golemcore.pilot.domain.service.ExecutionContextService;
import me.golemcore.pilot.domain.service.RunExecutionService;
import me.golemcore.pilot.domain.service.RunService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Run submission, inspection and stop endpoints.
 */
@RestController
@RequestMapping("/api/runs")
@RequiredArgsConstructor
@Slf4j
public class RunsController {

    static final String ORGANIZATION_HEADER = "X-Organization-Id";
    private static final String DEFAULT_TERMINATE_REASON = "Terminated by user";

    private final RunService runService;
    private final RunExecutionService runExecutionService;
    private final ExecutionContextService executionContextService;

    @PostMapping
    public Mono<ResponseEntity<RunDto>> createRun(
            @RequestHeader(ORGANIZATION_HEADER) String organizationId,
            @RequestBody CreateRunRequest request) {
        Run template = Run.builder()
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
                .build();
        Run run = runExecutionService.submit(organizationId, template);
        log.info("[API] Run '{}' submitted", run.getId());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDto(run)));
    }

    @GetMapping
    public Mono<ResponseEntity<List<RunDto>>> listRuns(@RequestHeader(ORGANIZATION_HEADER) String organizationId) {
        List<RunDto> dtos = runService.listRuns(organizationId).stream()
                .map(RunsController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @GetMapping("/{runId}")
    public Mono<ResponseEntity<RunDto>> getRun(
            @RequestHeader(ORGANIZATION_HEADER) String organizationId,
            @PathVariable String runId) {
        return Mono.just(ResponseEntity.ok(toDto(findRun(organizationId, runId))));
    }

    @GetMapping("/{runId}/context")
    public Mono<ResponseEntity<RunExecutionContext>> getContext(
            @RequestHeader(ORGANIZATION_HEADER) String organizationId,
            @PathVariable String runId) {
        findRun(organizationId, runId);
        return Mono.just(ResponseEntity.ok(executionContextService.getContext(runId)));
    }

    @PostMapping("/{runId}/cancel")
    public Mono<ResponseEntity<RunDto>> cancelRun(
            @RequestHeader(ORGANIZATION_HEADER) String organizationId,
            @PathVariable String runId) {
        findRun(organizationId, runId);
        return Mono.just(ResponseEntity.ok(toDto(runExecutionService.cancel(organizationId, runId))));
    }

    @PostMapping("/{runId}/terminate")
    public Mono<ResponseEntity<RunDto>> terminateRun(
            @RequestHeader(ORGANIZATION_HEADER) String organizationId,
            @PathVariable String runId,
            @RequestBody(required = false) TerminateRunRequest request) {
        findRun(organizationId, runId);
        String reason = request != null && request.getReason() != null && !request.getReason().isBlank()
                ? request.getReason()
                : DEFAULT_TERMINATE_REASON;
        return Mono.just(ResponseEntity.ok(toDto(runExecutionService.terminate(organizationId, runId, reason))));
    }

    private Run findRun(String organizationId, String runId) {
        return runService.getRun(runId)
                .filter(run -> run.getDeletedAt() == null)
                .filter(run -> organizationId.equals(run.getOrganizationId()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found"));
    }

    static RunDto toDto(Run run) {
        return RunDto.builder()
                .id(run.getId())
                .status(run.getStatus().name().toLowerCase(Locale.ROOT))
                .prompt(run.getPrompt())
                .url(run.getUrl())
                .title(run.getTitle())
                .webhookUrl(run.getWebhookUrl())
                .maxSteps(run.getMaxSteps())
                .browserSessionId(run.getBrowserSessionId())
                .waitingForVerificationCode(run.isWaitingForVerificationCode())
                .verificationCodeIdentifier(run.getVerificationCodeIdentifier())
                .verificationCodePollingStartedAt(run.getVerificationCodePollingStartedAt())
                .output(run.getOutput())
                .summary(run.getSummary())
                .failureReason(run.getFailureReason())
                .webhookFailureReason(run.getWebhookFailureReason())
                .createdAt(run.getCreatedAt())
                .queuedAt(run.getQueuedAt())
                .startedAt(run.getStartedAt())
                .finishedAt(run.getFinishedAt())
                .build();
    }
}
