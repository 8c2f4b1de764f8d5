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

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of executing one {@link BlockSpec}.
 *
 * <p>
 * The shape of {@link #output} depends on the block type: extraction blocks
 * produce {@code {"extracted_information": ...}}, iterate blocks produce a list
 * with one entry per loop value, each entry being the list of body outputs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlockResult {

    public static final String EXTRACTED_INFORMATION = "extracted_information";

    private String label;
    private boolean success;
    private BlockStatus status;
    private Object output;
    private String failureReason;

    @Builder.Default
    private List<StepRecord> steps = new ArrayList<>();

    public static BlockResult success(String label, Object output, List<StepRecord> steps) {
        return BlockResult.builder()
                .label(label)
                .success(true)
                .status(BlockStatus.SUCCESS)
                .output(output)
                .steps(new ArrayList<>(steps))
                .build();
    }

    public static BlockResult failure(String label, BlockStatus status, String reason, List<StepRecord> steps) {
        return BlockResult.builder()
                .label(label)
                .success(false)
                .status(status)
                .failureReason(reason)
                .steps(new ArrayList<>(steps))
                .build();
    }

    @JsonIgnore
    public boolean isFailureLike() {
        return status == BlockStatus.FAILED || status == BlockStatus.TERMINATED;
    }
}
