package com.restaurantbi.insightflow.adapter.web;

import com.restaurantbi.insightflow.domain.exception.ConflictException;
import com.restaurantbi.insightflow.domain.exception.PipelineNotFoundException;
import com.restaurantbi.insightflow.domain.exception.RunNotFoundException;
import com.restaurantbi.insightflow.domain.pipeline.PipelineDefinition;
import com.restaurantbi.insightflow.domain.pipeline.TaskKind;
import com.restaurantbi.insightflow.domain.pipeline.TaskSpec;
import com.restaurantbi.insightflow.domain.run.RunState;
import com.restaurantbi.insightflow.domain.run.RunTrigger;
import com.restaurantbi.insightflow.domain.run.WorkflowRun;
import com.restaurantbi.insightflow.domain.service.WorkflowEngine;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 只做准入与状态记录、不执行任务的引擎
 */
class FakeWorkflowEngine implements WorkflowEngine {

    static final PipelineDefinition DAILY_INGEST = PipelineDefinition.builder()
            .id("daily-ingest")
            .task(TaskSpec.builder().id("ingest").kind(TaskKind.INGEST).configEntry("sourceId", "ubereats").build())
            .task(TaskSpec.builder().id("forecast").kind(TaskKind.FORECAST).dependency("ingest").build())
            .build();

    private final Map<String, WorkflowRun> runs = new ConcurrentHashMap<>();

    @Override
    public String submit(String pipelineId, String logicalKey) {
        return submit(pipelineId, logicalKey, RunTrigger.MANUAL);
    }

    @Override
    public String submit(String pipelineId, String logicalKey, RunTrigger trigger) {
        if (!DAILY_INGEST.getId().equals(pipelineId)) {
            throw new PipelineNotFoundException(pipelineId);
        }
        for (WorkflowRun run : runs.values()) {
            if (run.getLogicalKey().equals(logicalKey) && !run.isTerminal()) {
                throw new ConflictException(pipelineId, logicalKey, run.getRunId());
            }
        }
        WorkflowRun run = WorkflowRun.create(DAILY_INGEST, logicalKey, trigger, Instant.parse("2024-05-01T02:00:00Z"));
        runs.put(run.getRunId(), run);
        return run.getRunId();
    }

    @Override
    public String enqueueRetraining(String pipelineId, String modelId, String logicalKey) {
        return submit(pipelineId, logicalKey, RunTrigger.RETRAINING);
    }

    @Override
    public boolean cancel(String runId, String reason) {
        WorkflowRun run = runs.get(runId);
        if (run == null) {
            throw new RunNotFoundException(runId);
        }
        if (run.isTerminal()) {
            return false;
        }
        run.setState(RunState.FAILED);
        run.setLastError(reason);
        return true;
    }

    @Override
    public Optional<WorkflowRun> findRun(String runId) {
        return Optional.ofNullable(runs.get(runId)).map(WorkflowRun::copy);
    }

    @Override
    public CompletableFuture<WorkflowRun> completion(String runId) {
        return new CompletableFuture<>();
    }

    @Override
    public List<WorkflowRun> activeRuns() {
        return runs.values().stream().filter(run -> !run.isTerminal()).map(WorkflowRun::copy)
                .collect(Collectors.toList());
    }
}
