package me.golemcore.pilot.adapter.outbound.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.pilot.domain.model.Run;
import me.golemcore.pilot.domain.model.RunStatus;
import me.golemcore.pilot.domain.service.RunService;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.infrastructure.http.WebhookSigner;
import me.golemcore.pilot.testsupport.InMemoryStoragePort;
import me.golemcore.pilot.testsupport.MutableClock;
import me.golemcore.pilot.testsupport.TestObjects;
import mockwebserver3.MockResponse;
import mockwebserver3.MockWebServer;
import mockwebserver3.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunWebhookSenderTest {

    private static final String ORG = "org_1";
    private static final String HOOK_PATH = "/hooks/runs";
    private static final String API_KEY = "sk-webhook";

    private MockWebServer mockServer;
    private RunService runService;
    private PilotProperties properties;
    private WebhookSigner signer;
    private ObjectMapper objectMapper;
    private RunWebhookSender sender;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        objectMapper = TestObjects.objectMapper();
        runService = new RunService(new InMemoryStoragePort(), objectMapper, clock);
        properties = new PilotProperties();
        signer = new WebhookSigner(clock);
        sender = new RunWebhookSender(WebClient.create(), signer, runService, objectMapper, properties) {
            @Override
            protected Duration getRequestTimeout() {
                return Duration.ofSeconds(2);
            }

            @Override
            protected RetryBackoffSpec buildRetry() {
                return Retry.fixedDelay(1, Duration.ofMillis(10));
            }

            @Override
            public void send(Run run) {
                buildSendMono(run).block(Duration.ofSeconds(5));
            }
        };
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.close();
    }

    private Run completedRun(String webhookUrl) {
        Run run = runService.createRun(ORG, Run.builder()
                .prompt("Find the price")
                .url("https://shop.test")
                .title("Price")
                .webhookUrl(webhookUrl)
                .build());
        runService.queueRun(run.getId());
        runService.tryMarkRunning(run.getId());
        return runService.finishIfActive(run.getId(), RunStatus.COMPLETED, null, Map.of("price", "10"), "Found it");
    }

    @Test
    void shouldPostSignedRunPayload() throws Exception {
        properties.getWebhook().setApiKey(API_KEY);
        mockServer.enqueue(new MockResponse.Builder().code(200).build());
        Run run = completedRun(mockServer.url(HOOK_PATH).toString());

        sender.send(run);

        RecordedRequest request = mockServer.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("POST", request.getMethod());
        assertTrue(request.getTarget().endsWith(HOOK_PATH));
        String body = request.getBody().utf8();
        Map<?, ?> payload = objectMapper.readValue(body, Map.class);
        assertEquals(run.getId(), payload.get("run_id"));
        assertEquals("completed", payload.get("status"));
        assertEquals("Found it", payload.get("summary"));
        assertEquals(Map.of("price", "10"), payload.get("output"));
        assertTrue(signer.verify(body, request.getHeaders().get(WebhookSigner.TIMESTAMP_HEADER),
                request.getHeaders().get(WebhookSigner.SIGNATURE_HEADER), API_KEY));
        assertNull(runService.getRun(run.getId()).orElseThrow().getWebhookFailureReason());
    }

    @Test
    void shouldSendUnsignedWithoutApiKey() throws Exception {
        mockServer.enqueue(new MockResponse.Builder().code(204).build());
        Run run = completedRun(mockServer.url(HOOK_PATH).toString());

        sender.send(run);

        RecordedRequest request = mockServer.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request);
        assertNull(request.getHeaders().get(WebhookSigner.SIGNATURE_HEADER));
        assertTrue(request.getHeaders().get("Content-Type").startsWith("application/json"));
    }

    @Test
    void shouldRetryOnServerError() throws Exception {
        mockServer.enqueue(new MockResponse.Builder().code(500).build());
        mockServer.enqueue(new MockResponse.Builder().code(200).build());
        Run run = completedRun(mockServer.url(HOOK_PATH).toString());

        sender.send(run);

        assertNotNull(mockServer.takeRequest(3, TimeUnit.SECONDS));
        assertNotNull(mockServer.takeRequest(3, TimeUnit.SECONDS));
        assertEquals(2, mockServer.getRequestCount());
        assertNull(runService.getRun(run.getId()).orElseThrow().getWebhookFailureReason());
    }

    @Test
    void shouldRecordFailureWithoutTouchingStatus() {
        mockServer.enqueue(new MockResponse.Builder().code(500).body("nope").build());
        mockServer.enqueue(new MockResponse.Builder().code(500).body("nope").build());
        Run run = completedRun(mockServer.url(HOOK_PATH).toString());

        sender.send(run);

        Run stored = runService.getRun(run.getId()).orElseThrow();
        assertEquals(RunStatus.COMPLETED, stored.getStatus());
        assertEquals("Webhook failed with status code 500, error message: nope", stored.getWebhookFailureReason());
    }

    @Test
    void shouldSkipRunWithoutWebhookUrl() {
        RunWebhookSender plain = new RunWebhookSender(WebClient.create(), signer, runService, objectMapper,
                properties);

        plain.send(completedRun(null));

        assertEquals(0, mockServer.getRequestCount());
    }
}
