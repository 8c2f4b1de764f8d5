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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Free-form navigation toward a mini goal. Optionally also extracts data, which
 * is how loop bodies are expressed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NavigateBlockSpec implements BlockSpec {

    private String label;
    private String url;
    private String navigationGoal;
    private String dataExtractionGoal;
    private Map<String, Object> dataSchema;

    @Builder.Default
    private List<String> parameterKeys = new ArrayList<>();

    private String totpVerificationUrl;
    private String totpIdentifier;
    private boolean continueOnFailure;

    @Builder.Default
    private boolean completeVerification = true;

    @Override
    public BlockType getBlockType() {
        return BlockType.NAVIGATE;
    }
}
