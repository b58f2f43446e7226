package com.restaurantbi.insightflow.domain.exception;

/**
 * 同一 (pipelineId, logicalKey) 已有非终态运行时拒绝新的触发。
 */
public class ConflictException extends InsightflowException {

    private final String activeRunId;

    public ConflictException(String pipelineId, String logicalKey, String activeRunId) {
        super(ErrorCode.CONFLICT, "Pipeline [" + pipelineId + "] already has active run ["
                + activeRunId + "] for key [" + logicalKey + "]");
        this.activeRunId = activeRunId;
    }

    public String getActiveRunId() {
        return activeRunId;
    }
}
