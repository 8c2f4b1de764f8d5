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

package me.golemcore.pilot.adapter.outbound.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.domain.model.LlmPrompt;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Structured-output model calls through langchain4j.
 *
 * <p>
 * Supports OpenAI (and any OpenAI-compatible endpoint) and Anthropic, selected
 * by {@code pilot.llm.provider}. Screenshots are attached as PNG image content.
 * The answer is expected to be one JSON object; surrounding prose and code
 * fences are stripped before parsing.
 *
 * <p>
 * Rate-limit errors are retried with exponential backoff; langchain4j's own
 * retries are disabled.
 */
@Component
@Slf4j
public class Langchain4jLlmAdapter implements LlmPort {

    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String SYSTEM_PROMPT = "You are the planner of an autonomous browser agent. "
            + "Always answer with a single JSON object and nothing else.";

    private final PilotProperties properties;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    public Langchain4jLlmAdapter(PilotProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "pilot-llm-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }
        PilotProperties.LlmProperties config = properties.getLlm();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("[LLM] pilot.llm.api-key is not set, model calls are unavailable");
            return;
        }
        try {
            this.chatModel = PROVIDER_ANTHROPIC.equals(config.getProvider())
                    ? createAnthropicModel(config)
                    : createOpenAiModel(config);
            initialized = true;
            log.info("[LLM] Initialized {} model {}", config.getProvider(), config.getModel());
        } catch (Exception e) {
            log.warn("[LLM] Failed to initialize model: {}", e.getMessage());
        }
    }

    private ChatModel createAnthropicModel(PilotProperties.LlmProperties config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(4096)
                .timeout(Duration.ofMillis(config.getTimeoutMs()));
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(PilotProperties.LlmProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0) // Retry handled by our backoff logic
                .timeout(Duration.ofMillis(config.getTimeoutMs()));
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public CompletableFuture<Map<String, Object>> complete(LlmPrompt prompt) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (chatModel == null) {
                throw new IllegalStateException("Language model not available");
            }
            List<ChatMessage> messages = List.of(SystemMessage.from(SYSTEM_PROMPT), toUserMessage(prompt));
            int maxRetries = properties.getLlm().getMaxRateLimitRetries();

            for (int attempt = 0; attempt <= maxRetries; attempt++) {
                try {
                    long startMs = System.currentTimeMillis();
                    ChatResponse response = chatModel.chat(messages);
                    log.debug("[LLM] {} answered in {}ms", prompt.getName(), System.currentTimeMillis() - startMs);
                    return parseJson(response.aiMessage().text());
                } catch (Exception e) {
                    if (isRateLimitError(e) && attempt < maxRetries) {
                        long backoffMs = (long) (properties.getLlm().getInitialBackoffMs()
                                * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                                attempt + 1, maxRetries, backoffMs);
                        sleep(backoffMs);
                    } else {
                        log.error("[LLM] {} failed: {}", prompt.getName(), e.getMessage());
                        throw new IllegalStateException("LLM call failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM call failed: max retries exhausted");
        }, executor);
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return chatModel != null;
    }

    private static UserMessage toUserMessage(LlmPrompt prompt) {
        List<Content> contents = new ArrayList<>();
        contents.add(TextContent.from(prompt.getText()));
        for (byte[] screenshot : prompt.getScreenshots()) {
            contents.add(ImageContent.from(Base64.getEncoder().encodeToString(screenshot), "image/png"));
        }
        return UserMessage.from(contents);
    }

    /**
     * Parses the first JSON object in the answer.
     */
    Map<String, Object> parseJson(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalStateException("Empty model answer");
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new IllegalStateException("Model answer contains no JSON object");
        }
        try {
            return objectMapper.readValue(text.substring(start, end + 1), new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Model answer is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static void sleep(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM call interrupted during retry backoff", ie);
        }
    }
}
