package com.restaurantbi.insightflow.domain.retry;

import com.restaurantbi.insightflow.domain.pipeline.RetryOverride;
import com.restaurantbi.insightflow.domain.pipeline.TaskKind;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * RetryPolicy - 重试决策函数
 * <p>
 * 瞬时失败按指数退避重试：initialBackoff * multiplier^(attempt-1)，不超过 maxBackoff；
 * 受最大尝试次数与自首次失败起的累计等待上限约束。永久失败立即放弃。
 * 时间取自注入的 Clock，便于测试。
 * </p>
 */
@RequiredArgsConstructor
public class RetryPolicy {

    private final RetrySettings settings;
    private final Clock clock;

    public RetryDecision nextAction(TaskKind kind, int attemptCount, Throwable error) {
        return nextAction(kind, null, attemptCount, error, null);
    }

    /**
     * 计算下一步动作
     *
     * @param kind           任务种类
     * @param override       任务级覆盖，可为空
     * @param attemptCount   已完成的尝试次数（含本次失败）
     * @param error          本次失败原因
     * @param firstFailureAt 首次失败时间，为空表示本次即首次
     */
    public RetryDecision nextAction(TaskKind kind, RetryOverride override, int attemptCount,
                                    Throwable error, Instant firstFailureAt) {
        if (FailureClassifier.classify(error) == FailureClass.PERMANENT) {
            return RetryDecision.abandon("permanent failure: " + describe(error));
        }
        int maxAttempts = maxAttempts(kind, override);
        if (attemptCount >= maxAttempts) {
            return RetryDecision.abandon("exhausted " + maxAttempts + " attempts: " + describe(error));
        }

        Duration delay = backoff(attemptCount, override);
        Duration maxTotalWait = maxTotalWait(override);
        Instant now = Instant.now(clock);
        Duration elapsed = firstFailureAt == null ? Duration.ZERO : Duration.between(firstFailureAt, now);
        if (elapsed.plus(delay).compareTo(maxTotalWait) > 0) {
            return RetryDecision.abandon("retry window of " + maxTotalWait + " exhausted: " + describe(error));
        }
        return RetryDecision.retryAfter(delay);
    }

    public int maxAttempts(TaskKind kind, RetryOverride override) {
        if (override != null && override.getMaxAttempts() != null) {
            return override.getMaxAttempts();
        }
        return settings.getMaxAttemptsByKind().getOrDefault(kind, settings.getMaxAttempts());
    }

    /**
     * 最坏情况下的累计等待时间上限
     */
    public Duration maxTotalWait(RetryOverride override) {
        return override != null && override.getMaxTotalWait() != null
                ? override.getMaxTotalWait() : settings.getMaxTotalWait();
    }

    Duration backoff(int attemptCount, RetryOverride override) {
        Duration initial = override != null && override.getInitialBackoff() != null
                ? override.getInitialBackoff() : settings.getInitialBackoff();
        Duration max = override != null && override.getMaxBackoff() != null
                ? override.getMaxBackoff() : settings.getMaxBackoff();
        double millis = initial.toMillis() * Math.pow(settings.getMultiplier(), Math.max(0, attemptCount - 1));
        if (millis >= max.toMillis()) {
            return max;
        }
        return Duration.ofMillis((long) millis);
    }

    private static String describe(Throwable error) {
        Throwable cause = FailureClassifier.unwrap(error);
        return cause.getClass().getSimpleName() + (cause.getMessage() == null ? "" : " " + cause.getMessage());
    }
}
