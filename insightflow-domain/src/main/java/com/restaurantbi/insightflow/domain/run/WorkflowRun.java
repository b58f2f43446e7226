package com.restaurantbi.insightflow.domain.run;

import com.restaurantbi.insightflow.domain.pipeline.PipelineDefinition;
import com.restaurantbi.insightflow.domain.pipeline.TaskSpec;
import lombok.Data;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * WorkflowRun - 流水线的一次运行
 * <p>
 * 由引擎独占修改（持有该运行的锁），对外只暴露副本。
 * 同一 (pipelineId, logicalKey) 在任意时刻至多一个非终态运行。
 * </p>
 */
@Data
public class WorkflowRun {

    private String runId;

    private String pipelineId;

    /**
     * 逻辑键，例如日期 2024-05-01 或 retrain-demand-forecast-2024-05-01
     */
    private String logicalKey;

    private RunState state;

    private RunTrigger trigger;

    /**
     * 重训练运行的目标模型，其余运行为空
     */
    private String targetModelId;

    private Instant createdAt;

    private Instant startedAt;

    private Instant finishedAt;

    /**
     * 任务实例，按定义顺序
     */
    private Map<String, TaskInstance> tasks = new LinkedHashMap<>();

    /**
     * 采集批次句柄
     */
    private String batchHandle;

    private String lastError;

    /**
     * 已分配的最大事件序号
     */
    private long eventSequence;

    public static WorkflowRun create(PipelineDefinition definition, String logicalKey, RunTrigger trigger, Instant now) {
        WorkflowRun run = new WorkflowRun();
        run.setRunId(UUID.randomUUID().toString());
        run.setPipelineId(definition.getId());
        run.setLogicalKey(logicalKey);
        run.setTrigger(trigger);
        run.setState(trigger == RunTrigger.RETRAINING ? RunState.RETRAINING_QUEUED : RunState.PENDING);
        run.setCreatedAt(now);
        for (TaskSpec spec : definition.getTasks()) {
            TaskInstance instance = new TaskInstance();
            instance.setTaskId(spec.getId());
            instance.setKind(spec.getKind());
            instance.setOptional(spec.isOptional());
            run.getTasks().put(spec.getId(), instance);
        }
        return run;
    }

    public TaskInstance task(String taskId) {
        TaskInstance instance = tasks.get(taskId);
        if (instance == null) {
            throw new IllegalArgumentException("Run [" + runId + "] has no task [" + taskId + "]");
        }
        return instance;
    }

    public Collection<TaskInstance> taskInstances() {
        return tasks.values();
    }

    public long nextSequence() {
        return ++eventSequence;
    }

    public boolean isTerminal() {
        return state != null && state.isTerminal();
    }

    public WorkflowRun copy() {
        WorkflowRun copy = new WorkflowRun();
        copy.setRunId(runId);
        copy.setPipelineId(pipelineId);
        copy.setLogicalKey(logicalKey);
        copy.setState(state);
        copy.setTrigger(trigger);
        copy.setTargetModelId(targetModelId);
        copy.setCreatedAt(createdAt);
        copy.setStartedAt(startedAt);
        copy.setFinishedAt(finishedAt);
        copy.setBatchHandle(batchHandle);
        copy.setLastError(lastError);
        copy.setEventSequence(eventSequence);
        Map<String, TaskInstance> taskCopies = new LinkedHashMap<>();
        tasks.forEach((id, instance) -> taskCopies.put(id, instance.copy()));
        copy.setTasks(taskCopies);
        return copy;
    }
}
