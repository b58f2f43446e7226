package com.restaurantbi.insightflow.domain.retry;

import lombok.Value;

import java.time.Duration;

/**
 * RetryDecision - 重试决策：延迟后重试，或放弃
 */
@Value
public class RetryDecision {

    public enum Action {
        RETRY,
        ABANDON
    }

    Action action;

    /**
     * 重试前的等待时间，ABANDON 时为空
     */
    Duration delay;

    String reason;

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(Action.RETRY, delay, null);
    }

    public static RetryDecision abandon(String reason) {
        return new RetryDecision(Action.ABANDON, null, reason);
    }

    public boolean isRetry() {
        return action == Action.RETRY;
    }
}
