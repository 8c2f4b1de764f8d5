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

package me.golemcore.pilot.adapter.outbound.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.domain.model.Run;
import me.golemcore.pilot.domain.service.RunService;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.infrastructure.http.WebhookSigner;
import me.golemcore.pilot.port.outbound.RunWebhookPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Posts the terminal state of a run to its webhook URL. Uses {@link WebClient}
 * (reactive) with exponential backoff retry. The body is signed with the
 * configured webhook API key when one is set.
 */
@Component
@Slf4j
public class RunWebhookSender implements RunWebhookPort {

    private final WebClient webClient;
    private final WebhookSigner webhookSigner;
    private final RunService runService;
    private final ObjectMapper objectMapper;
    private final PilotProperties properties;

    @Autowired
    public RunWebhookSender(WebhookSigner webhookSigner, RunService runService, ObjectMapper objectMapper,
            PilotProperties properties) {
        this(createDefaultWebClient(), webhookSigner, runService, objectMapper, properties);
    }

    RunWebhookSender(WebClient webClient, WebhookSigner webhookSigner, RunService runService,
            ObjectMapper objectMapper, PilotProperties properties) {
        this.webClient = webClient;
        this.webhookSigner = webhookSigner;
        this.runService = runService;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    private static WebClient createDefaultWebClient() {
        return WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(256 * 1024))
                .build();
    }

    /**
     * Fire-and-forget delivery with retry. Runs without a webhook URL are
     * skipped.
     */
    @Override
    public void send(Run run) {
        if (run.getWebhookUrl() == null || run.getWebhookUrl().isBlank()) {
            return;
        }
        buildSendMono(run).subscribe();
    }

    protected Mono<Void> buildSendMono(Run run) {
        String webhookUrl = run.getWebhookUrl();
        String body;
        try {
            body = objectMapper.writeValueAsString(buildPayload(run));
        } catch (JsonProcessingException e) {
            return Mono.error(new IllegalStateException("Failed to serialize webhook payload", e));
        }
        Map<String, String> headers = signHeaders(body);

        return webClient.post()
                .uri(webhookUrl)
                .headers(h -> headers.forEach(h::set))
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(getRequestTimeout())
                .retryWhen(buildRetry()
                        .doBeforeRetry(signal -> log.debug(
                                "[Webhook] Retrying webhook to {} (attempt {})",
                                webhookUrl, signal.totalRetries() + 1)))
                .doOnSuccess(response -> {
                    log.info("[Webhook] Delivered run '{}' to {}", run.getId(), webhookUrl);
                    runService.recordWebhookResult(run.getId(), null);
                })
                .doOnError(error -> {
                    log.error("[Webhook] Webhook to {} failed after retries: {}", webhookUrl, error.getMessage());
                    runService.recordWebhookResult(run.getId(), failureNote(error));
                })
                .onErrorResume(error -> Mono.empty())
                .then();
    }

    private Map<String, String> signHeaders(String body) {
        String apiKey = properties.getWebhook().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("[Webhook] No webhook API key configured, sending unsigned");
            return Map.of("Content-Type", "application/json");
        }
        return webhookSigner.sign(body, apiKey).getHeaders();
    }

    static Map<String, Object> buildPayload(Run run) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("run_id", run.getId());
        payload.put("status", run.getStatus().name().toLowerCase(Locale.ROOT));
        payload.put("title", run.getTitle());
        payload.put("url", run.getUrl());
        payload.put("output", run.getOutput());
        payload.put("summary", run.getSummary());
        payload.put("failure_reason", run.getFailureReason());
        payload.put("created_at", run.getCreatedAt() != null ? run.getCreatedAt().toString() : null);
        payload.put("finished_at", run.getFinishedAt() != null ? run.getFinishedAt().toString() : null);
        return payload;
    }

    static String failureNote(Throwable error) {
        Throwable cause = Exceptions.isRetryExhausted(error) && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof WebClientResponseException response) {
            return "Webhook failed with status code " + response.getStatusCode().value() + ", error message: "
                    + response.getResponseBodyAsString();
        }
        return "Webhook failed with error: " + cause.getMessage();
    }

    protected Duration getRequestTimeout() {
        return Duration.ofSeconds(properties.getWebhook().getRequestTimeoutSeconds());
    }

    protected RetryBackoffSpec buildRetry() {
        return Retry.backoff(properties.getWebhook().getMaxRetries(),
                Duration.ofMillis(properties.getWebhook().getFirstBackoffMs()));
    }
}
