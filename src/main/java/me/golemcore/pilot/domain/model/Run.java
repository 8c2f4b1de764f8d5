package me.golemcore.pilot.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One autonomous execution of a natural-language goal. Mutated only through
 * {@link me.golemcore.pilot.domain.service.RunService} status operations and
 * never physically deleted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Run {

    private String id;
    private String organizationId;

    @Builder.Default
    private RunStatus status = RunStatus.CREATED;

    private String prompt;
    private String url;
    private String title;
    private Map<String, Object> outputSchema;
    private String webhookUrl;

    private String totpVerificationUrl;
    private String totpIdentifier;
    private String totpSecret;
    private Integer maxSteps;
    private String browserSessionId;

    /**
     * Set when cancellation is requested before the loop started; the loop
     * honors it on its first iteration.
     */
    private boolean cancelRequested;

    private boolean waitingForVerificationCode;
    private String verificationCodeIdentifier;
    private Instant verificationCodePollingStartedAt;

    private Object output;
    private String summary;
    private String failureReason;
    private String webhookFailureReason;

    private Instant createdAt;
    private Instant queuedAt;
    private Instant startedAt;
    private Instant finishedAt;
    private Instant updatedAt;
    private Instant deletedAt;

    @JsonIgnore
    public boolean isExecutable() {
        return status == RunStatus.QUEUED || status == RunStatus.RUNNING;
    }
}
