package com.restaurantbi.insightflow.domain.retry;

import com.restaurantbi.insightflow.domain.pipeline.TaskKind;
import lombok.Data;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * RetrySettings - 全局重试参数
 */
@Data
public class RetrySettings {

    private int maxAttempts = 5;

    private Duration initialBackoff = Duration.ofSeconds(1);

    private double multiplier = 2.0;

    private Duration maxBackoff = Duration.ofMinutes(5);

    /**
     * 自首次失败起累计等待的上限
     */
    private Duration maxTotalWait = Duration.ofMinutes(30);

    /**
     * 按任务种类覆盖最大尝试次数
     */
    private Map<TaskKind, Integer> maxAttemptsByKind = new EnumMap<>(TaskKind.class);
}
