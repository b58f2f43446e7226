package com.restaurantbi.insightflow.domain.executor;

import com.restaurantbi.insightflow.domain.exception.ErrorCode;
import com.restaurantbi.insightflow.domain.exception.InsightflowException;

import java.time.Duration;

/**
 * 单次尝试超过任务超时时间。
 */
public class TaskTimeoutException extends InsightflowException {

    public TaskTimeoutException(String taskId, int attempt, Duration timeout) {
        super(ErrorCode.TASK_TIMEOUT, "Task [" + taskId + "] attempt " + attempt + " exceeded timeout " + timeout);
    }

    public TaskTimeoutException(String message) {
        super(ErrorCode.TASK_TIMEOUT, message);
    }
}
