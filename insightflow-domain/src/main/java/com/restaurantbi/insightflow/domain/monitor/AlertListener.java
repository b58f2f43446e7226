package com.restaurantbi.insightflow.domain.monitor;

/**
 * AlertListener - 告警订阅者
 */
public interface AlertListener {

    void onAlert(Alert alert);
}
