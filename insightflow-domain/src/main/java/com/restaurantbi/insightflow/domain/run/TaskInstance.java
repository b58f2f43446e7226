package com.restaurantbi.insightflow.domain.run;

import com.restaurantbi.insightflow.domain.pipeline.TaskKind;
import lombok.Data;

import java.time.Instant;

/**
 * TaskInstance - 某次运行中的一个任务实例
 */
@Data
public class TaskInstance {

    private String taskId;

    private TaskKind kind;

    private TaskState state = TaskState.PENDING;

    /**
     * 已开始的尝试次数
     */
    private int attempt;

    private boolean optional;

    private String lastError;

    /**
     * 输入批次句柄
     */
    private String inputRef;

    /**
     * 权威产出引用 runId/taskId#attempt
     */
    private String outputRef;

    private Instant startedAt;

    private Instant finishedAt;

    /**
     * 首次失败时间，用于累计等待上限
     */
    private Instant firstFailureAt;

    public TaskInstance copy() {
        TaskInstance copy = new TaskInstance();
        copy.setTaskId(taskId);
        copy.setKind(kind);
        copy.setState(state);
        copy.setAttempt(attempt);
        copy.setOptional(optional);
        copy.setLastError(lastError);
        copy.setInputRef(inputRef);
        copy.setOutputRef(outputRef);
        copy.setStartedAt(startedAt);
        copy.setFinishedAt(finishedAt);
        copy.setFirstFailureAt(firstFailureAt);
        return copy;
    }
}
