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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.domain.model.LlmPrompt;
import me.golemcore.pilot.domain.model.Run;
import me.golemcore.pilot.domain.model.ThoughtScenario;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Fills in the starting URL and title of a run before the planning loop
 * begins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunMetadataService {

    static final String TASK_URL_MISSING = "Task URL is missing";
    private static final int MAX_TITLE_LENGTH = 80;

    private final ModelCallService modelCallService;
    private final RunService runService;
    private final Clock clock;

    /**
     * Returns the run with a validated starting URL and a title. When the run has
     * no URL the model picks one.
     *
     * @throws UrlGenerationException
     *             when no usable URL can be determined
     */
    public Run ensureMetadata(Run run) {
        if (run.getUrl() != null && !run.getUrl().isBlank() && run.getTitle() != null) {
            return runService.updateMetadata(run.getId(), normalizeUrl(run.getUrl()), run.getTitle());
        }

        String url = run.getUrl();
        String title = run.getTitle();
        if (url == null || url.isBlank()) {
            Map<String, Object> metadata = modelCallService.call(run.getId(), ThoughtScenario.GENERATE_METADATA,
                    LlmPrompt.builder()
                            .name("generate-metadata")
                            .text(PromptTemplates.metadata(run.getPrompt(), Instant.now(clock)))
                            .build());
            Object generatedUrl = metadata.get("url");
            if (generatedUrl == null || generatedUrl.toString().isBlank()) {
                throw new UrlGenerationException(TASK_URL_MISSING);
            }
            url = generatedUrl.toString();
            if (title == null && metadata.get("title") != null) {
                title = metadata.get("title").toString();
            }
            log.info("[Metadata] Generated url {} for run '{}'", url, run.getId());
        }
        if (title == null || title.isBlank()) {
            title = defaultTitle(run.getPrompt());
        }
        return runService.updateMetadata(run.getId(), normalizeUrl(url), title);
    }

    /**
     * Prepends {@code https://} to scheme-less URLs and validates the result.
     */
    static String normalizeUrl(String raw) {
        String url = raw.trim();
        if (!url.toLowerCase(Locale.ROOT).startsWith("http://")
                && !url.toLowerCase(Locale.ROOT).startsWith("https://")) {
            url = "https://" + url;
        }
        try {
            URI uri = new URI(url);
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                throw new UrlGenerationException("Invalid task URL: " + raw);
            }
            return uri.toString();
        } catch (URISyntaxException e) {
            throw new UrlGenerationException("Invalid task URL: " + raw, e);
        }
    }

    private static String defaultTitle(String prompt) {
        String trimmed = prompt.strip();
        return trimmed.length() <= MAX_TITLE_LENGTH ? trimmed : trimmed.substring(0, MAX_TITLE_LENGTH) + "...";
    }

    /**
     * No usable starting URL for the run.
     */
    public static class UrlGenerationException extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        public UrlGenerationException(String message) {
            super(message);
        }

        public UrlGenerationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
