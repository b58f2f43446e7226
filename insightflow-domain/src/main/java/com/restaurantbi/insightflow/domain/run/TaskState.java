package com.restaurantbi.insightflow.domain.run;

/**
 * TaskState - 任务实例状态
 */
public enum TaskState {

    PENDING,

    RUNNING,

    RETRY_WAIT,

    SUCCEEDED,

    FAILED,

    SKIPPED,

    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED || this == CANCELLED;
    }
}
