package me.golemcore.pilot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration lives under the {@code pilot.*} prefix:
 * <ul>
 * <li>{@link PlannerProperties} - planning loop budgets and fallbacks</li>
 * <li>{@link SessionsProperties} - browser session pool timeouts</li>
 * <li>{@link OtpProperties} - one-time code polling</li>
 * <li>{@link NotificationsProperties} - notification bus mode</li>
 * <li>{@link BrowserProperties} - Playwright settings</li>
 * <li>{@link LlmProperties} - language model provider</li>
 * <li>{@link StorageProperties} - persistence location</li>
 * <li>{@link WebhookProperties} - run webhook delivery</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "pilot")
@Data
public class PilotProperties {

    private PlannerProperties planner = new PlannerProperties();
    private SessionsProperties sessions = new SessionsProperties();
    private OtpProperties otp = new OtpProperties();
    private NotificationsProperties notifications = new NotificationsProperties();
    private BrowserProperties browser = new BrowserProperties();
    private LlmProperties llm = new LlmProperties();
    private StorageProperties storage = new StorageProperties();
    private WebhookProperties webhook = new WebhookProperties();
    private ExecutorProperties executor = new ExecutorProperties();

    @Data
    public static class PlannerProperties {
        private int maxIterations = 50;
        private int maxStepsPerRun = 25;
        private int maxStepsPerBlock = 10;
        private String fallbackUrl = "https://www.google.com";
        private long blockTimeoutSeconds = 900;
        private long llmTimeoutSeconds = 180;
        private boolean continueOnBlockFailure = false;
    }

    @Data
    public static class SessionsProperties {
        private int defaultTimeoutMinutes = 60;
        private int renewalThresholdMinutes = 5;
        private int renewalIncrementMinutes = 60;
    }

    @Data
    public static class OtpProperties {
        private long pollIntervalMs = 10_000;
        private int pollingTimeoutMinutes = 15;
        private int codeLifespanMinutes = 10;
    }

    @Data
    public static class NotificationsProperties {
        private String mode = "local";
        private int queueCapacity = 100;
        private String channelPrefix = "pilot:notifications:";
    }

    @Data
    public static class BrowserProperties {
        private boolean enabled = true;
        private boolean headless = true;
        private int timeout = 30000;
        private int loadTimeout = 90000;
        private String userAgent;
        private String recordingsPath = "${user.home}/.golemcore/pilot/recordings";
        private boolean recordVideo = false;
        private boolean recordHar = false;
    }

    @Data
    public static class LlmProperties {
        private String provider = "openai";
        private String model = "gpt-4o";
        private String apiKey;
        private String baseUrl;
        private long timeoutMs = 120_000;
        private int maxRateLimitRetries = 5;
        private long initialBackoffMs = 5_000;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/pilot/workspace";
    }

    @Data
    public static class WebhookProperties {
        private String apiKey;
        private long requestTimeoutSeconds = 10;
        private int maxRetries = 3;
        private long firstBackoffMs = 1000;
    }

    @Data
    public static class ExecutorProperties {
        private int maxConcurrentRuns = 8;
    }
}
