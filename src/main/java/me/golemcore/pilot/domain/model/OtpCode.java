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

/**
 * A submitted one-time code. Written once by whoever submits it and read-only
 * afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OtpCode {

    private String id;
    private String organizationId;
    private String identifier;
    private String runId;
    private String taskId;
    private String content;
    private String code;

    @Builder.Default
    private OtpType type = OtpType.TOTP;

    private String source;
    private Instant expiredAt;
    private Instant createdAt;

    @JsonIgnore
    public boolean hasCorrelation() {
        return runId != null || taskId != null;
    }

    @JsonIgnore
    public boolean isExpiredAt(Instant now) {
        return expiredAt != null && !now.isBefore(expiredAt);
    }
}
