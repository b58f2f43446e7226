package com.restaurantbi.insightflow.domain.exception;

/**
 * 流水线定义不合法。加载期致命，但只影响引用该定义的运行。
 */
public class ConfigurationException extends InsightflowException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, message, cause);
    }
}
