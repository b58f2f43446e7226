package com.restaurantbi.insightflow.infrastructure.notification;

import com.restaurantbi.insightflow.domain.monitor.Alert;
import com.restaurantbi.insightflow.domain.monitor.AlertSeverity;
import com.restaurantbi.insightflow.domain.monitor.NotificationSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * LoggingNotificationSink - 以日志形式输出告警
 */
@Slf4j
@Component
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public void notify(Alert alert) {
        if (alert.getSeverity() == AlertSeverity.CRITICAL) {
            log.error("CRITICAL drift on [{}]: observed={} expected={} z={} run={}",
                    alert.getMetricId(), alert.getObservedValue(), alert.getExpectedValue(),
                    alert.getDeviation(), alert.getRunId());
        } else {
            log.warn("Drift warning on [{}]: observed={} expected={} z={} run={}",
                    alert.getMetricId(), alert.getObservedValue(), alert.getExpectedValue(),
                    alert.getDeviation(), alert.getRunId());
        }
    }
}
