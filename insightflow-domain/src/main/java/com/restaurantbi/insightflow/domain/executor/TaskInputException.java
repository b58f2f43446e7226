package com.restaurantbi.insightflow.domain.executor;

import com.restaurantbi.insightflow.domain.exception.ErrorCode;
import com.restaurantbi.insightflow.domain.exception.InsightflowException;

/**
 * 任务输入不合法，重试不会改变结果。
 */
public class TaskInputException extends InsightflowException {

    public TaskInputException(String message) {
        super(ErrorCode.TASK_INPUT_ERROR, message);
    }

    public TaskInputException(String message, Throwable cause) {
        super(ErrorCode.TASK_INPUT_ERROR, message, cause);
    }
}
