package com.restaurantbi.insightflow.domain.feedback;

import lombok.Data;

import java.time.Duration;

/**
 * FeedbackSettings - 重训练触发参数
 */
@Data
public class FeedbackSettings {

    /**
     * 每累计 N 条反馈或告警评估一次
     */
    private int evaluateEvery = 20;

    /**
     * 评估窗口
     */
    private Duration window = Duration.ofHours(24);

    /**
     * 窗口内最少反馈数，不足时不按负面比例触发
     */
    private int minFeedbackSamples = 10;

    /**
     * 负面比例阈值（严格大于）
     */
    private double negativeRatioThreshold = 0.3;

    /**
     * 评分不高于该值视为负面
     */
    private int negativeRatingThreshold = 2;

    /**
     * 重训练流水线
     */
    private String retrainingPipelineId = "model-retraining";
}
