package com.restaurantbi.insightflow.domain.monitor;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Alert - 模型漂移告警
 * <p>
 * 仅供参考，不影响任何运行的状态。
 * </p>
 */
@Value
@Builder
public class Alert {

    String id;

    AlertSeverity severity;

    String modelId;

    /**
     * 指标标识 modelId:metric
     */
    String metricId;

    double observedValue;

    /**
     * 窗口均值
     */
    double expectedValue;

    /**
     * z-score
     */
    double deviation;

    String runId;

    Instant createdAt;
}
