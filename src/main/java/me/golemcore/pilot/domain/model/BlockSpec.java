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
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One atomic unit of browser work generated by the planner.
 *
 * <p>
 * Variants are closed over {@link BlockType}: dispatch code switches on
 * {@link #getBlockType()} without a default branch so a new variant fails to
 * compile until every switch handles it.
 *
 * <p>
 * Each block declares exactly one output binding, {@link #getOutputKey()},
 * which later blocks may reference by name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "block_type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = NavigateBlockSpec.class, name = "navigate"),
        @JsonSubTypes.Type(value = ExtractBlockSpec.class, name = "extract"),
        @JsonSubTypes.Type(value = GotoUrlBlockSpec.class, name = "goto_url"),
        @JsonSubTypes.Type(value = IterateBlockSpec.class, name = "iterate")
})
public interface BlockSpec {

    @JsonIgnore
    BlockType getBlockType();

    String getLabel();

    String getUrl();

    boolean isContinueOnFailure();

    @JsonIgnore
    default String getOutputKey() {
        return getLabel() + "_output";
    }
}
