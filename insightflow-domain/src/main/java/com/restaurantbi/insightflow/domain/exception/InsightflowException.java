package com.restaurantbi.insightflow.domain.exception;

/**
 * InsightflowException - 领域异常基类
 * <p>
 * 所有可预期的业务失败都携带 {@link ErrorCode}。
 * </p>
 */
public class InsightflowException extends RuntimeException {

    private final ErrorCode errorCode;

    public InsightflowException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public InsightflowException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
