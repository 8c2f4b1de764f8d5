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
import me.golemcore.pilot.domain.model.OtpCode;
import me.golemcore.pilot.domain.model.OtpValue;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable store of submitted one-time codes.
 *
 * <p>
 * Storage layout:
 * <ul>
 * <li>otp/{codeId}.json - one immutable record per submission</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OtpCodeService {

    private static final String OTP_DIR = "otp";
    private static final String JSON_SUFFIX = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final PilotProperties properties;
    private final Clock clock;

    /**
     * Stores a new code. The type is detected from the value and the expiry
     * defaults to the configured lifespan.
     */
    public OtpCode submit(OtpCode request) {
        if (request.getOrganizationId() == null || request.getOrganizationId().isBlank()) {
            throw new IllegalArgumentException("organizationId is required");
        }
        String value = request.getCode() != null ? request.getCode() : request.getContent();
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Verification code content is required");
        }
        Instant now = Instant.now(clock);
        OtpCode code = OtpCode.builder()
                .id("otp_" + UUID.randomUUID())
                .organizationId(request.getOrganizationId())
                .identifier(request.getIdentifier())
                .runId(request.getRunId())
                .taskId(request.getTaskId())
                .content(request.getContent() != null ? request.getContent() : value)
                .code(value.trim())
                .type(OtpValue.detectType(value))
                .source(request.getSource())
                .expiredAt(request.getExpiredAt() != null
                        ? request.getExpiredAt()
                        : now.plus(Duration.ofMinutes(properties.getOtp().getCodeLifespanMinutes())))
                .createdAt(now)
                .build();
        save(code);
        log.info("[OTP] Stored {} code '{}' (identifier: {}, run: {})", code.getType(), code.getId(),
                code.getIdentifier(), code.getRunId());
        return code;
    }

    /**
     * Unexpired codes submitted under {@code identifier}, restricted to the given
     * run or task scope. Generic codes (no correlation) sort after correlated
     * ones; within each group newest first.
     */
    public List<OtpCode> findByIdentifier(String organizationId, String identifier, String runId, String taskId) {
        Instant now = Instant.now(clock);
        return loadAll().stream()
                .filter(c -> organizationId.equals(c.getOrganizationId()))
                .filter(c -> identifier.equals(c.getIdentifier()))
                .filter(c -> !c.isExpiredAt(now))
                .filter(c -> inScope(c, runId, taskId))
                .sorted(Comparator.comparing(OtpCode::hasCorrelation).reversed()
                        .thenComparing(OtpCode::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    /**
     * Most recent unexpired code explicitly correlated to the run or the task,
     * regardless of identifier.
     */
    public Optional<OtpCode> findLatestForRun(String organizationId, String runId, String taskId) {
        if (runId == null && taskId == null) {
            return Optional.empty();
        }
        Instant now = Instant.now(clock);
        return loadAll().stream()
                .filter(c -> organizationId.equals(c.getOrganizationId()))
                .filter(c -> !c.isExpiredAt(now))
                .filter(c -> (runId != null && runId.equals(c.getRunId()))
                        || (taskId != null && taskId.equals(c.getTaskId())))
                .max(Comparator.comparing(OtpCode::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
    }

    private static boolean inScope(OtpCode code, String runId, String taskId) {
        if (!code.hasCorrelation()) {
            return true;
        }
        return (code.getRunId() != null && Objects.equals(code.getRunId(), runId))
                || (code.getTaskId() != null && Objects.equals(code.getTaskId(), taskId));
    }

    private List<OtpCode> loadAll() {
        List<OtpCode> codes = new ArrayList<>();
        try {
            List<String> files = storagePort.listObjects(OTP_DIR, "").join();
            if (files == null) {
                return codes;
            }
            for (String file : files) {
                if (!file.endsWith(JSON_SUFFIX)) {
                    continue;
                }
                String json = storagePort.getText(OTP_DIR, file).join();
                if (json != null && !json.isBlank()) {
                    codes.add(objectMapper.readValue(json, OtpCode.class));
                }
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - a missing code only extends the wait
            log.warn("[OTP] Failed to load verification codes: {}", e.getMessage());
        }
        return codes;
    }

    private void save(OtpCode code) {
        try {
            String json = objectMapper.writeValueAsString(code);
            storagePort.putTextAtomic(OTP_DIR, code.getId() + JSON_SUFFIX, json, false).join();
        } catch (Exception e) {
            log.error("[OTP] Failed to save verification code '{}'", code.getId(), e);
            throw new IllegalStateException("Failed to persist verification code " + code.getId(), e);
        }
    }
}
