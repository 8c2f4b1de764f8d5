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

import java.util.function.BooleanSupplier;

/**
 * Everything the OTP coordinator needs to wait for a code on behalf of one
 * navigation block.
 */
@Value
@Builder
public class OtpPollRequest {

    String organizationId;
    String runId;
    String taskId;
    String totpVerificationUrl;
    String totpIdentifier;
    String totpSecret;

    /**
     * Polled between attempts; returning {@code true} stops the wait early.
     */
    @Builder.Default
    BooleanSupplier cancellation = () -> false;
}
