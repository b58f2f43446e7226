package com.restaurantbi.insightflow.domain.monitor;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * ModelMetricSnapshot - 模型指标快照，只追加
 */
@Value
@Builder
public class ModelMetricSnapshot {

    String modelId;

    /**
     * 指标名，例如 mape、silhouette
     */
    String metric;

    double value;

    String runId;

    String taskId;

    Instant recordedAt;

    /**
     * 指标标识: modelId:metric
     */
    public String metricId() {
        return metricId(modelId, metric);
    }

    public static String metricId(String modelId, String metric) {
        return modelId + ":" + metric;
    }
}
