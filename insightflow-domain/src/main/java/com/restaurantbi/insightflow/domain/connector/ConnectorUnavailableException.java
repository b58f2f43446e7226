package com.restaurantbi.insightflow.domain.connector;

import com.restaurantbi.insightflow.domain.exception.ErrorCode;
import com.restaurantbi.insightflow.domain.exception.InsightflowException;

/**
 * 数据源暂时不可用（网络异常、限流、5xx），属于瞬时失败。
 */
public class ConnectorUnavailableException extends InsightflowException {

    public ConnectorUnavailableException(String message) {
        super(ErrorCode.CONNECTOR_UNAVAILABLE, message);
    }

    public ConnectorUnavailableException(String message, Throwable cause) {
        super(ErrorCode.CONNECTOR_UNAVAILABLE, message, cause);
    }
}
