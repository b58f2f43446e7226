package com.restaurantbi.insightflow.domain.repository;

import com.restaurantbi.insightflow.domain.run.WorkflowRun;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryWorkflowRunRepository implements WorkflowRunRepository {
    private final Map<String, WorkflowRun> runStore = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowRun run) {
        runStore.put(run.getRunId(), run.copy());
    }

    @Override
    public Optional<WorkflowRun> findById(String runId) {
        return Optional.ofNullable(runStore.get(runId)).map(WorkflowRun::copy);
    }

    @Override
    public List<WorkflowRun> findByPipelineAndLogicalKey(String pipelineId, String logicalKey) {
        return runStore.values().stream()
                .filter(r -> r.getPipelineId().equals(pipelineId) && r.getLogicalKey().equals(logicalKey))
                .map(WorkflowRun::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowRun> findTerminalBefore(Instant before) {
        return runStore.values().stream()
                .filter(r -> r.isTerminal() && r.getFinishedAt() != null && r.getFinishedAt().isBefore(before))
                .map(WorkflowRun::copy)
                .collect(Collectors.toList());
    }

    @Override
    public void delete(String runId) {
        runStore.remove(runId);
    }

    public int size() {
        return runStore.size();
    }
}
