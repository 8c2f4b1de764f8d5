package me.golemcore.pilot.domain.service;

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

import java.time.Instant;

/**
 * Prompt texts for every structured model call. Each prompt names the JSON
 * fields the caller reads back.
 */
public final class PromptTemplates {

    static final String MINI_GOAL_TEMPLATE = """
            Achieve the following mini goal and once it's achieved, complete:
            ```%s```

            This mini goal is part of the big goal the user wants to achieve and use the big goal as context \
            to achieve the mini goal:
            ```%s```""";

    static final String EXTRACT_DATA_OPTIMIZATION = " Optimize for extracting as much data as possible. "
            + "Complete when most data is seen even if some data is partially missing.";

    private PromptTemplates() {
    }

    public static String miniGoal(String plan, String userGoal) {
        return String.format(MINI_GOAL_TEMPLATE, plan, userGoal);
    }

    public static String metadata(String userGoal, Instant now) {
        return """
                You are starting an autonomous browser task. Pick the website to open first and give the task \
                a short title.

                User goal:
                ```%s```

                Current time: %s

                Reply with a JSON object: {"url": "<absolute http(s) url>", "title": "<short title>"}
                """.formatted(userGoal, now);
    }

    public static String plan(String userGoal, String currentUrl, String elementTree, String taskHistory,
            Instant now) {
        return """
                You control a web browser to achieve the user goal. Look at the screenshots and the element \
                tree of the current page, review what was done so far and decide the single next task.

                User goal:
                ```%s```

                Current url: %s
                Current time: %s

                Task history (oldest first):
                ```%s```

                Elements on the page:
                ```%s```

                Task types:
                - "navigate": interact with the page (click, type, select) to reach a mini goal
                - "extract": read data from the current page
                - "loop": repeat the same mini goal for every item of a list visible on the page

                Reply with a JSON object:
                {"user_goal_achieved": <bool>, "page_info": "<what the page shows>", \
                "thoughts": "<reasoning>", "plan": "<the next mini goal>", \
                "task_type": "navigate" | "extract" | "loop"}
                """.formatted(userGoal, currentUrl, now, taskHistory, elementTree);
    }

    public static String goalCheck(String userGoal, String currentUrl, String elementTree, String taskHistory,
            Instant now) {
        return """
                Decide whether the user goal is now fully achieved, judging by the current page and the task \
                history.

                User goal:
                ```%s```

                Current url: %s
                Current time: %s

                Task history (oldest first):
                ```%s```

                Elements on the page:
                ```%s```

                Reply with a JSON object:
                {"user_goal_achieved": <bool>, "page_info": "<what the page shows>", "thoughts": "<reasoning>"}
                """.formatted(userGoal, currentUrl, now, taskHistory, elementTree);
    }

    public static String summary(String userGoal, String currentUrl, String taskHistory, String outputSchema,
            Instant now) {
        return """
                The user goal has been achieved. Summarize what was done and produce the final output.

                User goal:
                ```%s```

                Current url: %s
                Current time: %s

                Task history (oldest first):
                ```%s```

                Output schema (may be empty):
                ```%s```

                Reply with a JSON object:
                {"description": "<natural-language summary>", "output": <structured result>}
                """.formatted(userGoal, currentUrl, now, taskHistory, outputSchema != null ? outputSchema : "");
    }

    public static String failureReasoning(String userGoal, String taskHistory, String failure, int maxSteps) {
        return """
                An autonomous browser task stopped before achieving the user goal: %s (step budget: %d).
                Explain briefly what most likely prevented success.

                User goal:
                ```%s```

                Task history (oldest first):
                ```%s```

                Reply with a JSON object: {"reasoning": "<explanation>"}
                """.formatted(failure, maxSteps, userGoal, taskHistory);
    }

    public static String extractionSchema(String dataExtractionGoal, String currentUrl, String elementTree) {
        return """
                Design a JSON schema for the data described by the extraction goal, based on what the current \
                page shows.

                Extraction goal:
                ```%s```

                Current url: %s

                Elements on the page:
                ```%s```

                Reply with a JSON object: {"schema": <JSON schema object>}
                """.formatted(dataExtractionGoal, currentUrl, elementTree);
    }

    public static String loopValuesGoal(String plan) {
        return """
                Extract the list of values to loop over so that the following mini goal can be repeated once \
                per value: %s. Use links when each value leads to its own page.""".formatted(plan);
    }

    public static String taskInLoop(String plan, String userGoal, String loopValues, boolean isLink) {
        return """
                A mini goal will be repeated once for every value of a list.

                Mini goal:
                ```%s```

                Big goal for context:
                ```%s```

                Values: %s
                Each value is %s.

                Write the task for one value. Reply with a JSON object:
                {"navigation_goal": "<goal or null>", "data_extraction_goal": "<goal or null>", \
                "data_schema": <JSON schema or null>}
                """.formatted(plan, userGoal, loopValues,
                isLink ? "a link the browser opens before the task" : "an input variant used on the same page");
    }

    public static String parseVerificationCode(String content, Instant now) {
        return """
                Find the one-time verification code or login link in the content below.

                Current time: %s

                Content:
                ```%s```

                Reply with a JSON object:
                {"otp_value_found": <bool>, "otp_value": "<code or link>", "otp_type": "totp" | "magic_link"}
                """.formatted(now, content);
    }

    public static String navigationStep(String navigationGoal, String currentUrl, String elementTree,
            String previousActions, String parameters) {
        return """
                You operate a web page to achieve a navigation goal. Choose exactly one next action.

                Navigation goal:
                ```%s```

                Parameters: %s
                Current url: %s

                Actions taken so far:
                ```%s```

                Elements on the page:
                ```%s```

                Actions:
                - "click": click element_id
                - "input_text": type text into element_id
                - "select_option": select the option named by text in element_id
                - "input_verification_code": element_id expects a one-time code or the page asks for a login link
                - "complete": the goal is achieved
                - "terminate": the goal cannot be achieved on this site

                Reply with a JSON object:
                {"action": "<action>", "element_id": "<id or null>", "text": "<text or null>", \
                "reasoning": "<why>"}
                """.formatted(navigationGoal, parameters, currentUrl, previousActions, elementTree);
    }

    public static String extractData(String dataExtractionGoal, String dataSchema, String currentUrl,
            String elementTree) {
        return """
                Extract data from the current page.

                Extraction goal:
                ```%s```

                Schema of the result (may be empty):
                ```%s```

                Current url: %s

                Elements on the page:
                ```%s```

                Reply with a JSON object: {"extracted_information": <data matching the schema>}
                """.formatted(dataExtractionGoal, dataSchema != null ? dataSchema : "", currentUrl, elementTree);
    }
}
