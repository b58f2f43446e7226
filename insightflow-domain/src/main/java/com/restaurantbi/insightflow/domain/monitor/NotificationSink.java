package com.restaurantbi.insightflow.domain.monitor;

/**
 * NotificationSink - 告警通知出口（日志、邮件、IM 等）
 */
public interface NotificationSink {

    void notify(Alert alert);
}
