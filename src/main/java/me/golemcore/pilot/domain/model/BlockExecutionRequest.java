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
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A block bound to the run and browser session it executes in.
 */
@Value
@Builder(toBuilder = true)
public class BlockExecutionRequest {

    String runId;
    String organizationId;
    String browserSessionId;
    BlockSpec block;

    /** Parameter values visible to the block, such as loop values. */
    @Singular
    Map<String, Object> parameters;

    /** Pre-configured TOTP secret of the run, if any. */
    String totpSecret;

    /**
     * Raised when the caller stopped waiting for the block. Shared with the
     * requests derived through {@code toBuilder()}, so loop bodies see it too.
     */
    @Builder.Default
    AtomicBoolean abandoned = new AtomicBoolean();

    public void abandon() {
        abandoned.set(true);
    }

    public boolean isAbandoned() {
        return abandoned.get();
    }
}
