package com.restaurantbi.insightflow.domain.pipeline;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * RetryOverride - 单个任务的重试参数覆盖
 * <p>
 * 为空的字段沿用全局 RetrySettings。
 * </p>
 */
@Value
@Builder
public class RetryOverride {

    Integer maxAttempts;

    Duration initialBackoff;

    Duration maxBackoff;

    Duration maxTotalWait;
}
