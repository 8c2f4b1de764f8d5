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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One agent step consumed while executing a block. A step is identified by
 * {@code (taskId, order)}; retries of the same order do not count twice against
 * the step budget.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepRecord {

    private String taskId;
    private String blockLabel;
    private int order;
    private int retryIndex;
    private String action;
    private Instant createdAt;
}
