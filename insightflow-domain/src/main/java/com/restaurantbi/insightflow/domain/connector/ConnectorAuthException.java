package com.restaurantbi.insightflow.domain.connector;

import com.restaurantbi.insightflow.domain.exception.ErrorCode;
import com.restaurantbi.insightflow.domain.exception.InsightflowException;

/**
 * 数据源拒绝凭证，重试无意义。
 */
public class ConnectorAuthException extends InsightflowException {

    public ConnectorAuthException(String message) {
        super(ErrorCode.CONNECTOR_AUTH, message);
    }
}
