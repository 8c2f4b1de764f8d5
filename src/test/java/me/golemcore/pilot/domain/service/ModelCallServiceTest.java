package me.golemcore.pilot.domain.service;

import me.golemcore.pilot.domain.model.LlmPrompt;
import me.golemcore.pilot.domain.model.ThoughtScenario;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ModelCallServiceTest {

    private static final LlmPrompt PROMPT = LlmPrompt.builder().name("plan").text("What next?").build();

    private LlmPort llmPort;
    private ExecutionContextService contextService;
    private ModelCallService service;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        contextService = mock(ExecutionContextService.class);
        PilotProperties properties = new PilotProperties();
        properties.getPlanner().setLlmTimeoutSeconds(1);
        service = new ModelCallService(llmPort, contextService, properties);
    }

    @Test
    void shouldRecordThoughtForRunCalls() {
        Map<String, Object> answer = Map.of("thoughts", "login first", "page_info", "home", "plan", "click login");
        when(llmPort.complete(PROMPT)).thenReturn(CompletableFuture.completedFuture(answer));

        Map<String, Object> result = service.call("run_1", ThoughtScenario.GENERATE_PLAN, PROMPT);

        assertEquals(answer, result);
        verify(contextService).recordThought("run_1", ThoughtScenario.GENERATE_PLAN, "login first", "home",
                "click login", answer);
    }

    @Test
    void shouldSkipThoughtWithoutRun() {
        when(llmPort.complete(PROMPT)).thenReturn(CompletableFuture.completedFuture(Map.of("ok", true)));

        service.call(null, ThoughtScenario.GENERATE_PLAN, PROMPT);

        verify(contextService, never()).recordThought(any(), any(), any(), any(), any(), anyMap());
    }

    @Test
    void shouldWrapModelFailure() {
        when(llmPort.complete(PROMPT))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("rate limited")));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> service.call("run_1", ThoughtScenario.GENERATE_PLAN, PROMPT));

        assertTrue(ex.getMessage().contains("rate limited"));
    }

    @Test
    void shouldTimeOutSlowModel() {
        when(llmPort.complete(PROMPT)).thenReturn(new CompletableFuture<>());

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> service.call("run_1", ThoughtScenario.GENERATE_PLAN, PROMPT));

        assertTrue(ex.getMessage().contains("timed out"));
    }
}
