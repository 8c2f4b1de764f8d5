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
import me.golemcore.pilot.domain.model.BrowserSession;
import me.golemcore.pilot.domain.model.BrowserSessionStatus;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.BrowserDriverPort;
import me.golemcore.pilot.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pool of leasable, timeout-renewable browser sessions.
 *
 * <p>
 * Storage layout:
 * <ul>
 * <li>browser_sessions/{sessionId}.json - one record per session</li>
 * </ul>
 *
 * <p>
 * The pool, not its callers, enforces that a session has at most one occupant.
 * All mutating operations are serialized on the pool.
 */
@Service
@Slf4j
public class BrowserSessionService {

    private static final String SESSIONS_DIR = "browser_sessions";
    private static final String JSON_SUFFIX = ".json";
    private static final Set<BrowserSessionStatus> RENEWABLE_STATES = EnumSet.of(BrowserSessionStatus.CREATED,
            BrowserSessionStatus.RETRY, BrowserSessionStatus.RUNNING);
    public static final String RUNNABLE_TYPE_RUN = "workflow_run";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final BrowserDriverPort browserDriver;
    private final ArtifactSyncService artifactSyncService;
    private final PilotProperties properties;
    private final Clock clock;

    private final Map<String, BrowserSession> sessions = new ConcurrentHashMap<>();
    private volatile boolean loaded = false;

    public BrowserSessionService(StoragePort storagePort, ObjectMapper objectMapper,
            BrowserDriverPort browserDriver, ArtifactSyncService artifactSyncService,
            PilotProperties properties, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.browserDriver = browserDriver;
        this.artifactSyncService = artifactSyncService;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== Lifecycle ====================

    public synchronized BrowserSession create(String organizationId, String proxyLocation, Integer timeoutMinutes) {
        ensureLoaded();
        if (timeoutMinutes != null && timeoutMinutes <= 0) {
            throw new IllegalArgumentException("timeoutMinutes must be positive");
        }
        Instant now = Instant.now(clock);
        BrowserSession session = BrowserSession.builder()
                .id("pbs_" + UUID.randomUUID())
                .organizationId(organizationId)
                .status(BrowserSessionStatus.CREATED)
                .proxyLocation(proxyLocation)
                .timeoutMinutes(timeoutMinutes != null
                        ? timeoutMinutes
                        : properties.getSessions().getDefaultTimeoutMinutes())
                .createdAt(now)
                .updatedAt(now)
                .build();
        sessions.put(session.getId(), session);
        save(session);
        log.info("[Sessions] Created browser session '{}' (timeout {} min)", session.getId(),
                session.getTimeoutMinutes());
        return session;
    }

    /**
     * Marks the live browser as started; the timeout counts from this moment.
     */
    public synchronized BrowserSession beginSession(String organizationId, String sessionId, String ipAddress) {
        BrowserSession session = requireSession(organizationId, sessionId);
        if (session.isCompleted()) {
            throw new IllegalStateException("Browser session " + sessionId + " has already completed");
        }
        Instant now = Instant.now(clock);
        session.setStatus(BrowserSessionStatus.RUNNING);
        if (session.getStartedAt() == null) {
            session.setStartedAt(now);
        }
        session.setIpAddress(ipAddress);
        session.setUpdatedAt(now);
        save(session);
        return session;
    }

    /**
     * Binds the session exclusively to a runnable. Re-occupying by the same
     * runnable is a no-op.
     */
    public synchronized BrowserSession occupy(String organizationId, String sessionId, String runnableType,
            String runnableId) {
        BrowserSession session = requireSession(organizationId, sessionId);
        if (session.isCompleted()) {
            throw new IllegalStateException("Browser session " + sessionId + " has already completed");
        }
        if (session.isOccupied()) {
            if (runnableId.equals(session.getRunnableId())) {
                return session;
            }
            throw new IllegalStateException("Browser session " + sessionId + " is occupied by "
                    + session.getRunnableType() + " " + session.getRunnableId());
        }
        session.setRunnableType(runnableType);
        session.setRunnableId(runnableId);
        session.setUpdatedAt(Instant.now(clock));
        save(session);
        log.info("[Sessions] Session '{}' occupied by {} '{}'", sessionId, runnableType, runnableId);
        return session;
    }

    /**
     * Clears the occupant; the session stays open for reuse.
     */
    @SuppressWarnings("PMD.NullAssignment") // no occupant is represented as null
    public synchronized BrowserSession release(String organizationId, String sessionId) {
        BrowserSession session = requireSession(organizationId, sessionId);
        session.setRunnableType(null);
        session.setRunnableId(null);
        session.setUpdatedAt(Instant.now(clock));
        save(session);
        log.info("[Sessions] Session '{}' released", sessionId);
        return session;
    }

    /**
     * Extends the timeout when at least the configured threshold of minutes is
     * left before it.
     *
     * @throws SessionNotRenewableException
     *             when the session is missing, completed, not started, in a
     *             non-renewable state or about to expire
     */
    public synchronized BrowserSession renew(String organizationId, String sessionId) {
        BrowserSession session = validateForRenewal(organizationId, sessionId);
        Instant now = Instant.now(clock);
        Instant currentTimeout = session.getExpiresAt();
        long secondsLeft = Duration.between(now, currentTimeout).getSeconds();
        long thresholdSeconds = properties.getSessions().getRenewalThresholdMinutes() * 60L;

        if (secondsLeft < thresholdSeconds) {
            throw new SessionNotRenewableException("Session has expired", sessionId);
        }

        Instant newTimeout = now.plus(Duration.ofMinutes(properties.getSessions().getRenewalIncrementMinutes()));
        long extraMinutes = Math.max(0, Duration.between(currentTimeout, newTimeout).toMinutes());
        session.setTimeoutMinutes(session.getTimeoutMinutes() + (int) extraMinutes);
        session.setUpdatedAt(now);
        save(session);
        log.info("[Sessions] Renewed session '{}' by {} min (timeout now {} min)", sessionId, extraMinutes,
                session.getTimeoutMinutes());
        return session;
    }

    /**
     * Renews the session, closing it when renewal is refused. The refusal is
     * rethrown after closing.
     */
    public BrowserSession renewOrClose(String organizationId, String sessionId) {
        try {
            return renew(organizationId, sessionId);
        } catch (SessionNotRenewableException e) {
            log.warn("[Sessions] Session '{}' not renewable ({}), closing", sessionId, e.getMessage());
            if (getSession(sessionId).isPresent()) {
                close(organizationId, sessionId);
            }
            throw e;
        }
    }

    /**
     * Closes the session: flushes recordings to durable storage, frees the
     * occupant slot and marks the record closed. Closing a closed session is a
     * logged no-op.
     */
    @SuppressWarnings("PMD.NullAssignment") // closed sessions have no occupant
    public synchronized BrowserSession close(String organizationId, String sessionId) {
        BrowserSession session = requireSession(organizationId, sessionId);
        if (session.getStatus() == BrowserSessionStatus.CLOSED) {
            log.info("[Sessions] Session '{}' already closed", sessionId);
            return session;
        }

        List<Path> artifacts = List.of();
        try {
            artifacts = browserDriver.closeSession(sessionId).join();
        } catch (RuntimeException e) { // NOSONAR - driver failure must not keep the session open
            log.warn("[Sessions] Failed to close browser for session '{}': {}", sessionId, e.getMessage());
        }
        artifactSyncService.syncSessionArtifacts(session.getOrganizationId(), sessionId, artifacts);

        Instant now = Instant.now(clock);
        session.setStatus(BrowserSessionStatus.CLOSED);
        session.setCompletedAt(now);
        session.setRunnableType(null);
        session.setRunnableId(null);
        session.setUpdatedAt(now);
        save(session);
        log.info("[Sessions] Session '{}' closed", sessionId);
        return session;
    }

    /**
     * Sets a status directly. A move from one final status to another is ignored.
     */
    public synchronized BrowserSession updateStatus(String sessionId, BrowserSessionStatus status) {
        BrowserSession session = getSession(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Browser session not found: " + sessionId));
        if (session.getStatus().isFinal() && status.isFinal()) {
            log.warn("[Sessions] Ignoring status update of session '{}' from {} to {}", sessionId,
                    session.getStatus(), status);
            return session;
        }
        Instant now = Instant.now(clock);
        session.setStatus(status);
        if (status.isFinal()) {
            session.setCompletedAt(now);
        }
        session.setUpdatedAt(now);
        save(session);
        return session;
    }

    public int closeAllSessions(String organizationId) {
        List<BrowserSession> active = getActiveSessions(organizationId);
        for (BrowserSession session : active) {
            close(organizationId, session.getId());
        }
        return active.size();
    }

    // ==================== Queries ====================

    public Optional<BrowserSession> getSession(String sessionId) {
        ensureLoaded();
        return Optional.ofNullable(sessions.get(sessionId)).filter(s -> s.getDeletedAt() == null);
    }

    public BrowserSession requireSession(String organizationId, String sessionId) {
        return getSession(sessionId)
                .filter(s -> organizationId == null || organizationId.equals(s.getOrganizationId()))
                .orElseThrow(() -> new IllegalArgumentException("Browser session not found: " + sessionId));
    }

    public List<BrowserSession> getActiveSessions(String organizationId) {
        ensureLoaded();
        return sessions.values().stream()
                .filter(s -> s.getDeletedAt() == null)
                .filter(s -> organizationId.equals(s.getOrganizationId()))
                .filter(s -> !s.isCompleted())
                .toList();
    }

    public boolean isExpired(String sessionId) {
        return getSession(sessionId)
                .map(s -> s.isExpiredAt(Instant.now(clock)))
                .orElse(false);
    }

    private BrowserSession validateForRenewal(String organizationId, String sessionId) {
        BrowserSession session = getSession(sessionId)
                .filter(s -> organizationId == null || organizationId.equals(s.getOrganizationId()))
                .orElseThrow(() -> new SessionNotRenewableException("Browser session does not exist", sessionId));
        if (session.getCompletedAt() != null) {
            throw new SessionNotRenewableException("Browser session has already completed", sessionId);
        }
        if (session.getStartedAt() == null) {
            throw new SessionNotRenewableException("Browser session has not started yet", sessionId);
        }
        if (!RENEWABLE_STATES.contains(session.getStatus())) {
            throw new SessionNotRenewableException(
                    "Browser session is not in the 'created', 'retry' or 'running' state", sessionId);
        }
        return session;
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
            loadSessions();
            loaded = true;
        }
    }

    private void loadSessions() {
        try {
            List<String> files = storagePort.listObjects(SESSIONS_DIR, "").join();
            if (files == null) {
                return;
            }
            for (String file : files) {
                if (!file.endsWith(JSON_SUFFIX)) {
                    continue;
                }
                String json = storagePort.getText(SESSIONS_DIR, file).join();
                if (json != null && !json.isBlank()) {
                    BrowserSession session = objectMapper.readValue(json, BrowserSession.class);
                    sessions.put(session.getId(), session);
                }
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - start with whatever was readable
            log.warn("[Sessions] Failed to load browser sessions: {}", e.getMessage());
        }
    }

    private void save(BrowserSession session) {
        try {
            String json = objectMapper.writeValueAsString(session);
            storagePort.putTextAtomic(SESSIONS_DIR, session.getId() + JSON_SUFFIX, json, false).join();
        } catch (Exception e) {
            log.error("[Sessions] Failed to save session '{}'", session.getId(), e);
            throw new IllegalStateException("Failed to persist browser session " + session.getId(), e);
        }
    }

    /**
     * A renewal request the session cannot honor. Callers must close the
     * session.
     */
    public static class SessionNotRenewableException extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        private final String sessionId;

        public SessionNotRenewableException(String message, String sessionId) {
            super(message + ": " + sessionId);
            this.sessionId = sessionId;
        }

        public String getSessionId() {
            return sessionId;
        }
    }
}
