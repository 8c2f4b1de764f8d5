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
import dev.samstevens.totp.code.CodeGenerator;
import dev.samstevens.totp.code.DefaultCodeGenerator;
import dev.samstevens.totp.exceptions.CodeGenerationException;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.domain.model.LlmPrompt;
import me.golemcore.pilot.domain.model.OtpCode;
import me.golemcore.pilot.domain.model.OtpPollRequest;
import me.golemcore.pilot.domain.model.OtpType;
import me.golemcore.pilot.domain.model.OtpValue;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.infrastructure.http.WebhookSigner;
import me.golemcore.pilot.port.outbound.LlmPort;
import me.golemcore.pilot.port.outbound.NotificationBus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Waits for a one-time code on behalf of a navigation block.
 *
 * <p>
 * A pre-configured TOTP secret resolves immediately. Otherwise the coordinator
 * enters the waiting state and polls, in this order, until a code is found or
 * the polling deadline passes:
 * <ol>
 * <li>the verification webhook of the run, when configured</li>
 * <li>stored codes matching the configured identifier</li>
 * <li>stored codes explicitly correlated to the run or task</li>
 * </ol>
 * Each source is consulted only when every higher-priority source is absent or
 * returned nothing. Waiting state changes are announced on the
 * {@link NotificationBus}, keyed by organization id.
 */
@Service
@Slf4j
public class OtpCoordinator {

    public static final String EVENT_CODE_REQUIRED = "verification_code_required";
    public static final String EVENT_CODE_RESOLVED = "verification_code_resolved";

    private static final int MAX_SHORT_CODE_LENGTH = 10;
    private static final long TOTP_PERIOD_SECONDS = 30;
    private static final Pattern CODE_PATTERN = Pattern.compile("\\b\\d{4,10}\\b");
    private static final String VERIFICATION_CODE_KEY = "verification_code";

    private final OtpCodeService otpCodeService;
    private final RunService runService;
    private final NotificationBus notificationBus;
    private final LlmPort llmPort;
    private final WebhookSigner webhookSigner;
    private final ObjectMapper objectMapper;
    private final PilotProperties properties;
    private final Clock clock;
    private final WebClient webClient;
    private final CodeGenerator codeGenerator = new DefaultCodeGenerator();

    @Autowired
    public OtpCoordinator(OtpCodeService otpCodeService, RunService runService, NotificationBus notificationBus,
            LlmPort llmPort, WebhookSigner webhookSigner, ObjectMapper objectMapper, PilotProperties properties,
            Clock clock) {
        this(otpCodeService, runService, notificationBus, llmPort, webhookSigner, objectMapper, properties, clock,
                WebClient.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(256 * 1024))
                        .build());
    }

    OtpCoordinator(OtpCodeService otpCodeService, RunService runService, NotificationBus notificationBus,
            LlmPort llmPort, WebhookSigner webhookSigner, ObjectMapper objectMapper, PilotProperties properties,
            Clock clock, WebClient webClient) {
        this.otpCodeService = otpCodeService;
        this.runService = runService;
        this.notificationBus = notificationBus;
        this.llmPort = llmPort;
        this.webhookSigner = webhookSigner;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.webClient = webClient;
    }

    /**
     * Resolves a one-time code, blocking the calling run until one is found.
     *
     * @throws NoVerificationCodeFoundException
     *             when the deadline passes or the wait is canceled
     */
    public OtpValue awaitVerificationCode(OtpPollRequest request) {
        if (hasText(request.getTotpSecret())) {
            return generateTotp(request.getTotpSecret());
        }

        Optional<OtpValue> immediate = resolveOnce(request);
        if (immediate.isPresent()) {
            return immediate.get();
        }

        Instant startedAt = Instant.now(clock);
        Instant deadline = startedAt.plus(Duration.ofMinutes(properties.getOtp().getPollingTimeoutMinutes()));
        enterWaiting(request, startedAt);
        try {
            Optional<OtpValue> found = pollUntil(() -> resolveOnce(request), deadline, request.getCancellation());
            return found.orElseThrow(() -> new NoVerificationCodeFoundException(
                    "No verification code found within " + properties.getOtp().getPollingTimeoutMinutes()
                            + " minutes",
                    request.getRunId()));
        } finally {
            leaveWaiting(request);
        }
    }

    /**
     * Runs {@code attempt} every poll interval until it yields a value, the
     * deadline passes or {@code cancellation} reports true.
     */
    <T> Optional<T> pollUntil(Supplier<Optional<T>> attempt, Instant deadline, BooleanSupplier cancellation) {
        Duration interval = Duration.ofMillis(properties.getOtp().getPollIntervalMs());
        while (!cancellation.getAsBoolean()) {
            Instant now = Instant.now(clock);
            if (!now.isBefore(deadline)) {
                return Optional.empty();
            }
            Duration remaining = Duration.between(now, deadline);
            if (!sleep(remaining.compareTo(interval) < 0 ? remaining : interval)) {
                return Optional.empty();
            }
            if (cancellation.getAsBoolean()) {
                break;
            }
            Optional<T> result = attempt.get();
            if (result.isPresent()) {
                return result;
            }
        }
        log.info("[OTP] Verification code wait canceled");
        return Optional.empty();
    }

    /**
     * Sleeps for {@code duration}. Returns {@code false} when interrupted.
     */
    protected boolean sleep(Duration duration) {
        try {
            TimeUnit.MILLISECONDS.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ==================== Sources ====================

    Optional<OtpValue> resolveOnce(OtpPollRequest request) {
        if (hasText(request.getTotpVerificationUrl())) {
            Optional<OtpValue> fromWebhook = fromWebhook(request);
            if (fromWebhook.isPresent()) {
                return fromWebhook;
            }
        }
        if (hasText(request.getTotpIdentifier())) {
            List<OtpCode> codes = otpCodeService.findByIdentifier(request.getOrganizationId(),
                    request.getTotpIdentifier(), request.getRunId(), request.getTaskId());
            if (!codes.isEmpty()) {
                log.info("[OTP] Found code for identifier '{}'", request.getTotpIdentifier());
                return Optional.of(toValue(codes.get(0)));
            }
        }
        return otpCodeService.findLatestForRun(request.getOrganizationId(), request.getRunId(), request.getTaskId())
                .map(code -> {
                    log.info("[OTP] Found code submitted for run '{}'", request.getRunId());
                    return toValue(code);
                });
    }

    private Optional<OtpValue> fromWebhook(OtpPollRequest request) {
        String apiKey = properties.getWebhook().getApiKey();
        if (!hasText(apiKey)) {
            log.warn("[OTP] Verification webhook configured but pilot.webhook.api-key is not set");
            return Optional.empty();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("run_id", request.getRunId());
        body.put("task_id", request.getTaskId());
        try {
            String json = objectMapper.writeValueAsString(body);
            WebhookSigner.SignedPayload signed = webhookSigner.sign(json, apiKey);
            Map<String, Object> response = webClient.post()
                    .uri(request.getTotpVerificationUrl())
                    .headers(headers -> signed.getHeaders().forEach(headers::set))
                    .bodyValue(signed.getBody())
                    .retrieve()
                    .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {
                    })
                    .timeout(Duration.ofSeconds(properties.getWebhook().getRequestTimeoutSeconds()))
                    .retryWhen(Retry.backoff(properties.getWebhook().getMaxRetries(),
                            Duration.ofMillis(properties.getWebhook().getFirstBackoffMs())))
                    .block();
            Object code = response != null ? response.get(VERIFICATION_CODE_KEY) : null;
            if (code == null || code.toString().isBlank()) {
                return Optional.empty();
            }
            return Optional.ofNullable(interpret(code.toString().trim()));
        } catch (Exception e) { // NOSONAR - a failed poll is retried on the next interval
            log.warn("[OTP] Verification webhook {} failed: {}", request.getTotpVerificationUrl(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Short values are codes as-is. Longer content (an email body, an SMS) is
     * parsed by the model, falling back to a digit pattern when no model is
     * available.
     */
    OtpValue interpret(String content) {
        if (content.length() <= MAX_SHORT_CODE_LENGTH) {
            return OtpValue.of(content);
        }
        if (OtpValue.detectType(content) == OtpType.MAGIC_LINK && !content.contains(" ")) {
            return new OtpValue(content, OtpType.MAGIC_LINK);
        }
        if (llmPort.isAvailable()) {
            try {
                Map<String, Object> parsed = llmPort.complete(LlmPrompt.builder()
                        .name("parse-verification-code")
                        .text(PromptTemplates.parseVerificationCode(content, Instant.now(clock)))
                        .build())
                        .get(properties.getPlanner().getLlmTimeoutSeconds(), TimeUnit.SECONDS);
                if (Boolean.TRUE.equals(parsed.get("otp_value_found")) && parsed.get("otp_value") != null) {
                    String value = parsed.get("otp_value").toString();
                    OtpType type = "magic_link".equals(parsed.get("otp_type")) ? OtpType.MAGIC_LINK : OtpType.TOTP;
                    return new OtpValue(value, type);
                }
                return null;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while parsing verification code", e);
            } catch (Exception e) { // NOSONAR - fall back to the digit pattern
                log.warn("[OTP] Model failed to parse verification content: {}", e.getMessage());
            }
        }
        Matcher matcher = CODE_PATTERN.matcher(content);
        return matcher.find() ? new OtpValue(matcher.group(), OtpType.TOTP) : null;
    }

    private OtpValue generateTotp(String secret) {
        long counter = Math.floorDiv(Instant.now(clock).getEpochSecond(), TOTP_PERIOD_SECONDS);
        try {
            return new OtpValue(codeGenerator.generate(secret, counter), OtpType.TOTP);
        } catch (CodeGenerationException e) {
            throw new IllegalStateException("Failed to generate TOTP code from configured secret", e);
        }
    }

    private static OtpValue toValue(OtpCode code) {
        return new OtpValue(code.getCode(), code.getType() != null ? code.getType() : OtpValue.detectType(
                code.getCode()));
    }

    // ==================== Waiting state ====================

    private void enterWaiting(OtpPollRequest request, Instant startedAt) {
        log.info("[OTP] Waiting for verification code (run: {}, identifier: {})", request.getRunId(),
                request.getTotpIdentifier());
        if (request.getRunId() != null) {
            runService.markWaitingForVerificationCode(request.getRunId(), request.getTotpIdentifier(), startedAt);
        }
        Map<String, Object> event = baseEvent(EVENT_CODE_REQUIRED, request);
        event.put("identifier", request.getTotpIdentifier());
        event.put("polling_started_at", startedAt.toString());
        notificationBus.publish(request.getOrganizationId(), event);
    }

    private void leaveWaiting(OtpPollRequest request) {
        try {
            if (request.getRunId() != null) {
                runService.clearWaitingForVerificationCode(request.getRunId());
            }
        } catch (RuntimeException e) { // NOSONAR - the resolved event must still go out
            log.warn("[OTP] Failed to clear waiting flag for run '{}': {}", request.getRunId(), e.getMessage());
        }
        notificationBus.publish(request.getOrganizationId(), baseEvent(EVENT_CODE_RESOLVED, request));
    }

    private static Map<String, Object> baseEvent(String type, OtpPollRequest request) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", type);
        event.put("run_id", request.getRunId());
        event.put("task_id", request.getTaskId());
        return event;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * No one-time code arrived before the polling deadline. Fails the navigation
     * block that asked for it.
     */
    public static class NoVerificationCodeFoundException extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        public NoVerificationCodeFoundException(String message, String runId) {
            super(message + (runId != null ? " (run " + runId + ")" : ""));
        }
    }
}
