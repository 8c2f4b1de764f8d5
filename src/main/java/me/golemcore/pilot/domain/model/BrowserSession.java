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

import java.time.Duration;
import java.time.Instant;

/**
 * Leasable, timeout-bound live browser resource. Holds at most one occupant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrowserSession {

    private String id;
    private String organizationId;

    @Builder.Default
    private BrowserSessionStatus status = BrowserSessionStatus.CREATED;

    private String proxyLocation;
    private Integer timeoutMinutes;
    private String runnableType;
    private String runnableId;
    private String ipAddress;

    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant updatedAt;
    private Instant deletedAt;

    @JsonIgnore
    public boolean isOccupied() {
        return runnableId != null;
    }

    @JsonIgnore
    public boolean isCompleted() {
        return completedAt != null || status.isFinal();
    }

    /**
     * Moment the session times out, or {@code null} when it has not started or
     * has no timeout.
     */
    @JsonIgnore
    public Instant getExpiresAt() {
        if (startedAt == null || timeoutMinutes == null) {
            return null;
        }
        return startedAt.plus(Duration.ofMinutes(timeoutMinutes));
    }

    @JsonIgnore
    public boolean isExpiredAt(Instant now) {
        Instant expiresAt = getExpiresAt();
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
