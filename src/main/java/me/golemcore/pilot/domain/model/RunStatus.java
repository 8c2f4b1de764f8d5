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

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an autonomous run. Transitions only move forward:
 * {@code CREATED -> QUEUED -> RUNNING -> terminal}. Every terminal state is
 * reached from {@code RUNNING}.
 */
public enum RunStatus {
    CREATED, QUEUED, RUNNING, COMPLETED, FAILED, TERMINATED, CANCELED, TIMED_OUT;

    private static final Set<RunStatus> FINAL_STATES = EnumSet.of(COMPLETED, FAILED, TERMINATED, CANCELED,
            TIMED_OUT);

    public boolean isFinal() {
        return FINAL_STATES.contains(this);
    }

    public boolean canTransitionTo(RunStatus target) {
        if (target == null || isFinal()) {
            return false;
        }
        return switch (this) {
        case CREATED -> target == QUEUED;
        case QUEUED -> target == RUNNING;
        case RUNNING -> target.isFinal();
        default -> false;
        };
    }
}
