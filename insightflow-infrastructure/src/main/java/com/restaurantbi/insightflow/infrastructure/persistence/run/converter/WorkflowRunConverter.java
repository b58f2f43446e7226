package com.restaurantbi.insightflow.infrastructure.persistence.run.converter;

import com.restaurantbi.insightflow.domain.pipeline.TaskKind;
import com.restaurantbi.insightflow.domain.run.RunState;
import com.restaurantbi.insightflow.domain.run.RunTrigger;
import com.restaurantbi.insightflow.domain.run.TaskInstance;
import com.restaurantbi.insightflow.domain.run.TaskState;
import com.restaurantbi.insightflow.domain.run.WorkflowRun;
import com.restaurantbi.insightflow.infrastructure.persistence.run.entity.TaskInstanceDO;
import com.restaurantbi.insightflow.infrastructure.persistence.run.entity.WorkflowRunDO;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * WorkflowRunConverter - 运行转换器
 * <p>
 * 负责领域对象与数据对象之间的转换，枚举以名称存储
 * </p>
 * 
 * @author insightflow
 */
public class WorkflowRunConverter {
    
    /**
     * 领域对象转数据对象
     */
    public static WorkflowRunDO toDataObject(WorkflowRun domain) {
        if (domain == null) {
            return null;
        }
        
        WorkflowRunDO dataObject = new WorkflowRunDO();
        copyRunFields(domain, dataObject);
        return dataObject;
    }
    
    /**
     * 用领域对象覆盖已有数据对象的可变字段
     */
    public static void copyRunFields(WorkflowRun domain, WorkflowRunDO dataObject) {
        dataObject.setRunId(domain.getRunId());
        dataObject.setPipelineId(domain.getPipelineId());
        dataObject.setLogicalKey(domain.getLogicalKey());
        dataObject.setState(domain.getState().name());
        dataObject.setTriggerType(domain.getTrigger() == null ? null : domain.getTrigger().name());
        dataObject.setTargetModelId(domain.getTargetModelId());
        dataObject.setCreatedAt(domain.getCreatedAt());
        dataObject.setStartedAt(domain.getStartedAt());
        dataObject.setFinishedAt(domain.getFinishedAt());
        dataObject.setBatchHandle(domain.getBatchHandle());
        dataObject.setLastError(domain.getLastError());
        dataObject.setEventSequence(domain.getEventSequence());
    }
    
    /**
     * 数据对象转领域对象
     */
    public static WorkflowRun toDomain(WorkflowRunDO dataObject, List<TaskInstanceDO> taskDOs) {
        if (dataObject == null) {
            return null;
        }
        
        WorkflowRun domain = new WorkflowRun();
        domain.setRunId(dataObject.getRunId());
        domain.setPipelineId(dataObject.getPipelineId());
        domain.setLogicalKey(dataObject.getLogicalKey());
        domain.setState(RunState.valueOf(dataObject.getState()));
        if (dataObject.getTriggerType() != null) {
            domain.setTrigger(RunTrigger.valueOf(dataObject.getTriggerType()));
        }
        domain.setTargetModelId(dataObject.getTargetModelId());
        domain.setCreatedAt(dataObject.getCreatedAt());
        domain.setStartedAt(dataObject.getStartedAt());
        domain.setFinishedAt(dataObject.getFinishedAt());
        domain.setBatchHandle(dataObject.getBatchHandle());
        domain.setLastError(dataObject.getLastError());
        domain.setEventSequence(dataObject.getEventSequence() == null ? 0L : dataObject.getEventSequence());
        
        // 按定义顺序还原任务实例
        Map<String, TaskInstance> tasks = new LinkedHashMap<>();
        if (taskDOs != null) {
            taskDOs.stream()
                .sorted(Comparator.comparing(TaskInstanceDO::getSortOrder,
                    Comparator.nullsLast(Comparator.naturalOrder())))
                .forEach(taskDO -> tasks.put(taskDO.getTaskId(), taskToDomain(taskDO)));
        }
        domain.setTasks(tasks);
        return domain;
    }
    
    /**
     * 任务实例领域对象转数据对象
     */
    public static TaskInstanceDO taskToDataObject(TaskInstance domain, String runId, int position) {
        TaskInstanceDO dataObject = new TaskInstanceDO();
        dataObject.setRunId(runId);
        dataObject.setSortOrder(position);
        copyTaskFields(domain, dataObject);
        return dataObject;
    }
    
    public static void copyTaskFields(TaskInstance domain, TaskInstanceDO dataObject) {
        dataObject.setTaskId(domain.getTaskId());
        dataObject.setKind(domain.getKind().name());
        dataObject.setState(domain.getState().name());
        dataObject.setAttempt(domain.getAttempt());
        dataObject.setOptionalTask(domain.isOptional());
        dataObject.setLastError(domain.getLastError());
        dataObject.setInputRef(domain.getInputRef());
        dataObject.setOutputRef(domain.getOutputRef());
        dataObject.setStartedAt(domain.getStartedAt());
        dataObject.setFinishedAt(domain.getFinishedAt());
        dataObject.setFirstFailureAt(domain.getFirstFailureAt());
    }
    
    /**
     * 任务实例数据对象转领域对象
     */
    public static TaskInstance taskToDomain(TaskInstanceDO dataObject) {
        TaskInstance domain = new TaskInstance();
        domain.setTaskId(dataObject.getTaskId());
        domain.setKind(TaskKind.valueOf(dataObject.getKind()));
        domain.setState(TaskState.valueOf(dataObject.getState()));
        domain.setAttempt(dataObject.getAttempt() == null ? 0 : dataObject.getAttempt());
        domain.setOptional(Boolean.TRUE.equals(dataObject.getOptionalTask()));
        domain.setLastError(dataObject.getLastError());
        domain.setInputRef(dataObject.getInputRef());
        domain.setOutputRef(dataObject.getOutputRef());
        domain.setStartedAt(dataObject.getStartedAt());
        domain.setFinishedAt(dataObject.getFinishedAt());
        domain.setFirstFailureAt(dataObject.getFirstFailureAt());
        return domain;
    }
}
