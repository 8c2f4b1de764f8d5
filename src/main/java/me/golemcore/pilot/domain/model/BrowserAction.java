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

import java.util.Locale;
import java.util.Map;

/**
 * Single action chosen by the model during a navigation step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrowserAction {

    private ActionType type;
    private String elementId;
    private String text;
    private String reasoning;

    public enum ActionType {
        CLICK, INPUT_TEXT, SELECT_OPTION, INPUT_VERIFICATION_CODE, COMPLETE, TERMINATE
    }

    public static BrowserAction fromResponse(Map<String, Object> response) {
        Object rawType = response.get("action");
        if (rawType == null) {
            throw new IllegalArgumentException("Action response has no 'action' field");
        }
        ActionType type;
        try {
            type = ActionType.valueOf(rawType.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action type: " + rawType, e);
        }
        return BrowserAction.builder()
                .type(type)
                .elementId(asText(response.get("element_id")))
                .text(asText(response.get("text")))
                .reasoning(asText(response.get("reasoning")))
                .build();
    }

    private static String asText(Object value) {
        return value != null ? value.toString() : null;
    }
}
