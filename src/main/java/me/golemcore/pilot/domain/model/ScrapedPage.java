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
 * Snapshot of the live page: screenshots plus a flat element tree.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrapedPage {

    private String url;
    private String title;

    @Builder.Default
    private List<byte[]> screenshots = new ArrayList<>();

    @Builder.Default
    private List<PageElement> elements = new ArrayList<>();

    /**
     * Renders the element tree in the compact form used inside prompts.
     */
    public String renderElementTree() {
        StringBuilder sb = new StringBuilder();
        for (PageElement element : elements) {
            sb.append('<').append(element.getTagName()).append(" id=\"").append(element.getId()).append('"');
            for (Map.Entry<String, String> attribute : element.getAttributes().entrySet()) {
                sb.append(' ').append(attribute.getKey()).append("=\"").append(attribute.getValue()).append('"');
            }
            sb.append('>');
            if (element.getText() != null) {
                sb.append(element.getText());
            }
            sb.append("</").append(element.getTagName()).append(">\n");
        }
        return sb.toString();
    }
}
