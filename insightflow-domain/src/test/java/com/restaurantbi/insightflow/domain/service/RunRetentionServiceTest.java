package com.restaurantbi.insightflow.domain.service;

import com.restaurantbi.insightflow.domain.batch.DataBatch;
import com.restaurantbi.insightflow.domain.batch.InMemoryBatchStore;
import com.restaurantbi.insightflow.domain.output.InMemoryTaskOutputStore;
import com.restaurantbi.insightflow.domain.pipeline.PipelineDefinition;
import com.restaurantbi.insightflow.domain.pipeline.TaskKind;
import com.restaurantbi.insightflow.domain.pipeline.TaskSpec;
import com.restaurantbi.insightflow.domain.repository.InMemoryValidationResultRepository;
import com.restaurantbi.insightflow.domain.repository.InMemoryWorkflowRunRepository;
import com.restaurantbi.insightflow.domain.run.RunState;
import com.restaurantbi.insightflow.domain.run.RunTrigger;
import com.restaurantbi.insightflow.domain.run.WorkflowRun;
import com.restaurantbi.insightflow.domain.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunRetentionServiceTest {

    private static final PipelineDefinition PIPELINE = PipelineDefinition.builder()
            .id("daily-ingest")
            .task(TaskSpec.builder().id("ingest").kind(TaskKind.INGEST).configEntry("sourceId", "ubereats").build())
            .build();

    @Test
    void testPurgesOnlyExpiredTerminalRuns() {
        MutableClock clock = new MutableClock(Instant.parse("2024-06-15T00:00:00Z"));
        InMemoryWorkflowRunRepository runRepository = new InMemoryWorkflowRunRepository();
        InMemoryTaskOutputStore outputStore = new InMemoryTaskOutputStore();
        InMemoryBatchStore batchStore = new InMemoryBatchStore();

        WorkflowRun old = run("2024-05-01", RunState.SUCCEEDED, Instant.parse("2024-05-01T03:00:00Z"));
        old.setBatchHandle(batchStore.put(DataBatch.of("ubereats", Instant.parse("2024-05-01T01:00:00Z"),
                List.of(Map.of("order_id", "o-1")))));
        outputStore.write(old.getRunId(), "ingest", 1, "batch");
        WorkflowRun recent = run("2024-06-10", RunState.BLOCKED, Instant.parse("2024-06-10T03:00:00Z"));
        WorkflowRun running = run("2024-05-02", RunState.RUNNING, null);
        runRepository.save(old);
        runRepository.save(recent);
        runRepository.save(running);

        RunRetentionService service = new RunRetentionService(new RetentionSettings(), runRepository,
                new InMemoryValidationResultRepository(), outputStore, batchStore, clock);

        assertEquals(1, service.purgeExpired());
        assertTrue(runRepository.findById(old.getRunId()).isEmpty());
        assertTrue(runRepository.findById(recent.getRunId()).isPresent());
        assertTrue(runRepository.findById(running.getRunId()).isPresent());
        assertEquals(0, batchStore.size());
        assertEquals(0, outputStore.countAttempts(old.getRunId(), "ingest"));

        clock.advance(Duration.ofDays(30));
        assertEquals(1, service.purgeExpired());
    }

    private static WorkflowRun run(String key, RunState state, Instant finishedAt) {
        WorkflowRun run = WorkflowRun.create(PIPELINE, key, RunTrigger.SCHEDULED, Instant.parse("2024-05-01T00:00:00Z"));
        run.setState(state);
        run.setFinishedAt(finishedAt);
        return run;
    }
}
