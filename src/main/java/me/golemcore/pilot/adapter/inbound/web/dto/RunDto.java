package me.golemcore.pilot.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Public view of a run. The TOTP secret never leaves the server.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunDto {
    private String id;
    private String status;
    private String prompt;
    private String url;
    private String title;
    private String webhookUrl;
    private Integer maxSteps;
    private String browserSessionId;
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
}
