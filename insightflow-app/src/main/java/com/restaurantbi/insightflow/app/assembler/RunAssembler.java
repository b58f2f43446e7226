package com.restaurantbi.insightflow.app.assembler;

import com.restaurantbi.insightflow.client.dto.QuarantinedBatchDTO;
import com.restaurantbi.insightflow.client.dto.RunDTO;
import com.restaurantbi.insightflow.client.dto.TaskInstanceDTO;
import com.restaurantbi.insightflow.domain.run.TaskInstance;
import com.restaurantbi.insightflow.domain.run.WorkflowRun;
import com.restaurantbi.insightflow.domain.validation.BatchQuarantine;

import java.util.stream.Collectors;

/**
 * RunAssembler - 运行领域对象转视图
 */
public class RunAssembler {

    public static RunDTO toDTO(WorkflowRun run) {
        if (run == null) {
            return null;
        }
        RunDTO dto = new RunDTO();
        dto.setRunId(run.getRunId());
        dto.setPipelineId(run.getPipelineId());
        dto.setLogicalKey(run.getLogicalKey());
        dto.setState(run.getState().name());
        dto.setTrigger(run.getTrigger() == null ? null : run.getTrigger().name());
        dto.setTargetModelId(run.getTargetModelId());
        dto.setCreatedAt(run.getCreatedAt());
        dto.setStartedAt(run.getStartedAt());
        dto.setFinishedAt(run.getFinishedAt());
        dto.setLastError(run.getLastError());
        dto.setTasks(run.taskInstances().stream()
                .map(RunAssembler::toDTO)
                .collect(Collectors.toList()));
        return dto;
    }

    public static TaskInstanceDTO toDTO(TaskInstance instance) {
        TaskInstanceDTO dto = new TaskInstanceDTO();
        dto.setTaskId(instance.getTaskId());
        dto.setKind(instance.getKind().name());
        dto.setState(instance.getState().name());
        dto.setAttempt(instance.getAttempt());
        dto.setOptional(instance.isOptional());
        dto.setLastError(instance.getLastError());
        dto.setOutputRef(instance.getOutputRef());
        dto.setStartedAt(instance.getStartedAt());
        dto.setFinishedAt(instance.getFinishedAt());
        return dto;
    }

    public static QuarantinedBatchDTO toDTO(BatchQuarantine.Entry entry) {
        QuarantinedBatchDTO dto = new QuarantinedBatchDTO();
        dto.setBatchId(entry.getBatchId());
        dto.setRunId(entry.getRunId());
        dto.setLogicalKey(entry.getLogicalKey());
        dto.setSourceId(entry.getSourceId());
        dto.setViolationCount(entry.getViolationCount());
        dto.setQuarantinedAt(entry.getQuarantinedAt());
        return dto;
    }
}
