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

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Parsed planner response for one iteration.
 */
@Value
@Builder
public class PlannerDecision {

    boolean userGoalAchieved;
    String pageInfo;
    String thoughts;
    String plan;
    String taskType;

    public static PlannerDecision fromResponse(Map<String, Object> response) {
        return PlannerDecision.builder()
                .userGoalAchieved(Boolean.TRUE.equals(response.get("user_goal_achieved")))
                .pageInfo(asText(response.get("page_info")))
                .thoughts(asText(response.get("thoughts")))
                .plan(asText(response.get("plan")))
                .taskType(asText(response.get("task_type")))
                .build();
    }

    private static String asText(Object value) {
        return value != null ? value.toString() : "";
    }
}
