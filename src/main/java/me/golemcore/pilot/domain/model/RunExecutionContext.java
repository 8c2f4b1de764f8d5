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
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted per-run execution state: the growing block definition, planner
 * memory, model-call audit and consumed steps.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunExecutionContext {

    private String runId;

    @Builder.Default
    private List<BlockSpec> blocks = new ArrayList<>();

    @Builder.Default
    private List<TaskHistoryEntry> taskHistory = new ArrayList<>();

    @Builder.Default
    private List<PlannerThought> thoughts = new ArrayList<>();

    @Builder.Default
    private List<StepRecord> steps = new ArrayList<>();

    private Instant updatedAt;
}
