package com.restaurantbi.insightflow.domain.run;

/**
 * RunState - 运行状态
 */
public enum RunState {

    PENDING,

    /**
     * 由反馈聚合器触发的重训练运行，等待准入
     */
    RETRAINING_QUEUED,

    RUNNING,

    SUCCEEDED,

    FAILED,

    /**
     * 数据校验未通过，下游任务不会执行
     */
    BLOCKED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == BLOCKED;
    }
}
