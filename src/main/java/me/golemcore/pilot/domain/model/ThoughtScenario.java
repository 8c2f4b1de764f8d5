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

/**
 * Why a planner model call was made.
 */
public enum ThoughtScenario {
    GENERATE_METADATA, GENERATE_PLAN, EXTRACT_LOOP_VALUES, GENERATE_TASK_IN_LOOP, GENERATE_EXTRACTION_SCHEMA,
    USER_GOAL_CHECK, SUMMARIZATION, MAX_STEPS_FAILURE
}
