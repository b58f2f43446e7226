package com.restaurantbi.insightflow.domain.feedback;

import lombok.Builder;
import lombok.Value;

/**
 * RetrainingDecision - 一次评估的结论
 */
@Value
@Builder
public class RetrainingDecision {

    String modelId;

    /**
     * 是否满足重训练条件
     */
    boolean triggered;

    String reason;

    int feedbackCount;

    double negativeRatio;

    /**
     * 重训练逻辑键 retrain-{modelId}-{yyyy-MM-dd}
     */
    String logicalKey;

    /**
     * 入队的运行 ID；重复或入队失败时为空
     */
    String runId;

    public boolean isEnqueued() {
        return runId != null;
    }
}
