package com.restaurantbi.insightflow.domain.feedback;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * FeedbackRecord - 用户对分析结果的反馈
 */
@Value
@Builder
public class FeedbackRecord {

    String id;

    String modelId;

    String runId;

    String taskId;

    /**
     * 评分 1..5
     */
    int rating;

    /**
     * 用户给出的修正文本，可为空
     */
    String correction;

    Instant submittedAt;

    public boolean isNegative(int negativeRatingThreshold) {
        return rating <= negativeRatingThreshold;
    }
}
