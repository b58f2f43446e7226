package com.restaurantbi.insightflow.domain.monitor;

/**
 * AlertSeverity - 告警级别
 */
public enum AlertSeverity {
    WARNING,
    CRITICAL
}
