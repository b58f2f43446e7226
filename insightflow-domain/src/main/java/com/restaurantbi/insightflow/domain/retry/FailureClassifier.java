package com.restaurantbi.insightflow.domain.retry;

import com.restaurantbi.insightflow.domain.connector.ConnectorUnavailableException;
import com.restaurantbi.insightflow.domain.executor.TaskExecutionException;
import com.restaurantbi.insightflow.domain.executor.TaskTimeoutException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * FailureClassifier - 将异常归类为瞬时或永久失败
 * <p>
 * 未知异常（编程错误）一律视为永久失败。
 * </p>
 */
public final class FailureClassifier {

    private FailureClassifier() {
    }

    public static FailureClass classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof ConnectorUnavailableException || cause instanceof TaskTimeoutException) {
            return FailureClass.TRANSIENT;
        }
        if (cause instanceof TaskExecutionException && ((TaskExecutionException) cause).isRetryable()) {
            return FailureClass.TRANSIENT;
        }
        return FailureClass.PERMANENT;
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
