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

/**
 * Repeats {@link #loopBody} once per value stored under {@link #loopOverKey}.
 * The body is itself a {@link BlockSpec}, so loops may nest.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IterateBlockSpec implements BlockSpec {

    private String label;
    private String loopOverKey;

    /**
     * Parameter name the current loop value is bound to inside the body.
     */
    private String valueParameterKey;

    private BlockSpec loopBody;
    private boolean continueOnFailure;

    @Override
    @JsonIgnore
    public String getUrl() {
        return null;
    }

    @Override
    public BlockType getBlockType() {
        return BlockType.ITERATE;
    }
}
