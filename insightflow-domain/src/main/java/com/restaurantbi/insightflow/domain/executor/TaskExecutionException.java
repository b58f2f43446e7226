package com.restaurantbi.insightflow.domain.executor;

import com.restaurantbi.insightflow.domain.exception.ErrorCode;
import com.restaurantbi.insightflow.domain.exception.InsightflowException;

/**
 * TaskExecutionException - 任务执行失败
 * <p>
 * retryable 由执行器判定：远端 5xx、限流等为可重试；模型拒绝输入等为不可重试。
 * </p>
 */
public class TaskExecutionException extends InsightflowException {

    private final boolean retryable;

    public TaskExecutionException(String message, boolean retryable) {
        super(ErrorCode.TASK_EXECUTION_ERROR, message);
        this.retryable = retryable;
    }

    public TaskExecutionException(String message, boolean retryable, Throwable cause) {
        super(ErrorCode.TASK_EXECUTION_ERROR, message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
