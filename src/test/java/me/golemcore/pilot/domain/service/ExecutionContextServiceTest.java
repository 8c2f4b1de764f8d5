package me.golemcore.pilot.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.pilot.domain.model.BlockSpec;
import me.golemcore.pilot.domain.model.GotoUrlBlockSpec;
import me.golemcore.pilot.domain.model.IterateBlockSpec;
import me.golemcore.pilot.domain.model.NavigateBlockSpec;
import me.golemcore.pilot.domain.model.RunExecutionContext;
import me.golemcore.pilot.domain.model.StepRecord;
import me.golemcore.pilot.domain.model.TaskHistoryEntry;
import me.golemcore.pilot.domain.model.ThoughtScenario;
import me.golemcore.pilot.testsupport.InMemoryStoragePort;
import me.golemcore.pilot.testsupport.MutableClock;
import me.golemcore.pilot.testsupport.TestObjects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExecutionContextServiceTest {

    private static final String RUN_ID = "run_1";

    private InMemoryStoragePort storage;
    private ObjectMapper objectMapper;
    private MutableClock clock;
    private ExecutionContextService service;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStoragePort();
        objectMapper = TestObjects.objectMapper();
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        service = new ExecutionContextService(storage, objectMapper, clock);
    }

    @Test
    void shouldRejectDuplicateLabelsIncludingLoopBodies() {
        service.appendBlock(RUN_ID, IterateBlockSpec.builder()
                .label("loop_a")
                .loopOverKey("loop_values_a")
                .loopBody(NavigateBlockSpec.builder().label("task_in_loop_a").build())
                .build());

        BlockSpec duplicate = NavigateBlockSpec.builder().label("task_in_loop_a").build();

        assertThrows(IllegalArgumentException.class, () -> service.appendBlock(RUN_ID, duplicate));
        assertEquals(1, service.getContext(RUN_ID).getBlocks().size());
    }

    @Test
    void shouldPersistPolymorphicBlocksAndHistory() throws Exception {
        service.appendBlock(RUN_ID, GotoUrlBlockSpec.builder().label("goto_url_a").url("https://a.test").build());
        int size = service.appendHistory(RUN_ID, TaskHistoryEntry.builder()
                .type("goto_url")
                .task("Go to this website: https://a.test")
                .status("success")
                .build());

        assertEquals(1, size);
        String json = storage.read("contexts", RUN_ID + ".json");
        RunExecutionContext restored = objectMapper.readValue(json, RunExecutionContext.class);
        assertInstanceOf(GotoUrlBlockSpec.class, restored.getBlocks().get(0));
        assertEquals("https://a.test", restored.getBlocks().get(0).getUrl());
        assertEquals("success", restored.getTaskHistory().get(0).getStatus());
    }

    @Test
    void shouldCountDistinctStepsFromPersistedContext() {
        service.recordSteps(RUN_ID, List.of(
                step("navigation_a", 0, 0),
                step("navigation_a", 0, 1),
                step("navigation_a", 1, 0),
                step("extract_b", 0, 0)));

        assertEquals(3, service.countDistinctSteps(RUN_ID));

        ExecutionContextService restarted = new ExecutionContextService(storage, objectMapper, clock);
        assertEquals(3, restarted.countDistinctSteps(RUN_ID));
    }

    @Test
    void shouldReturnZeroStepsForUnknownRun() {
        assertEquals(0, service.countDistinctSteps("run_unknown"));
    }

    @Test
    void shouldRecordThoughtsWithScenario() {
        service.recordThought(RUN_ID, ThoughtScenario.GENERATE_PLAN, "thinking", "page", "click login",
                Map.of("plan", "click login"));

        RunExecutionContext context = service.getContext(RUN_ID);
        assertEquals(1, context.getThoughts().size());
        assertEquals(ThoughtScenario.GENERATE_PLAN, context.getThoughts().get(0).getScenario());
        assertEquals("click login", context.getThoughts().get(0).getAnswer());
    }

    private static StepRecord step(String taskId, int order, int retry) {
        return StepRecord.builder().taskId(taskId).blockLabel(taskId).order(order).retryIndex(retry).build();
    }
}
