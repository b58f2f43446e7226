package com.restaurantbi.insightflow.domain.executor;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * TaskResult - 任务执行结果
 */
@Value
@Builder
public class TaskResult {

    /**
     * 任务产出（批次、校验结论、模型结果等）
     */
    Object output;

    /**
     * 模型质量指标，例如 {"mape": 0.12}
     */
    @Singular
    Map<String, Double> metrics;

    public static TaskResult of(Object output) {
        return TaskResult.builder().output(output).build();
    }
}
