package com.restaurantbi.insightflow.domain.exception;

/**
 * ErrorCode - 错误码
 * <p>
 * 对外暴露的错误分类，adapter 层据此映射 HTTP 状态。
 * </p>
 */
public enum ErrorCode {

    CONFLICT("同一逻辑键已有运行中的实例"),
    CONFIGURATION_ERROR("流水线定义不合法"),
    PIPELINE_NOT_FOUND("流水线不存在"),
    RUN_NOT_FOUND("运行实例不存在"),
    CONNECTOR_UNAVAILABLE("数据源暂时不可用"),
    CONNECTOR_AUTH("数据源认证失败"),
    TASK_INPUT_ERROR("任务输入不合法"),
    TASK_EXECUTION_ERROR("任务执行失败"),
    TASK_TIMEOUT("任务执行超时");

    private final String description;

    ErrorCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
