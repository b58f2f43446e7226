package com.restaurantbi.insightflow.app.scheduler;

import com.restaurantbi.insightflow.app.config.InsightflowProperties;
import com.restaurantbi.insightflow.domain.feedback.FeedbackAggregator;
import com.restaurantbi.insightflow.domain.feedback.RetrainingDecision;
import com.restaurantbi.insightflow.domain.service.RunRetentionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * MaintenanceScheduler - 周期性维护：评估重训练条件、清理过期运行
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MaintenanceScheduler {

    private final FeedbackAggregator feedbackAggregator;
    private final RunRetentionService retentionService;
    private final TaskScheduler taskScheduler;
    private final InsightflowProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        taskScheduler.scheduleWithFixedDelay(this::tick, properties.getScheduler().getMaintenanceInterval());
        log.info("Maintenance scheduled every {}", properties.getScheduler().getMaintenanceInterval());
    }

    public void tick() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            evaluateFeedback();
            purgeExpiredRuns();
        } finally {
            running.set(false);
        }
    }

    private void evaluateFeedback() {
        try {
            List<RetrainingDecision> decisions = feedbackAggregator.evaluateAll();
            long enqueued = decisions.stream().filter(RetrainingDecision::isEnqueued).count();
            if (enqueued > 0) {
                log.info("Feedback evaluation enqueued {} retraining runs", enqueued);
            }
        } catch (RuntimeException e) {
            log.error("Feedback evaluation failed", e);
        }
    }

    private void purgeExpiredRuns() {
        try {
            int purged = retentionService.purgeExpired();
            if (purged > 0) {
                log.info("Purged {} expired runs", purged);
            }
        } catch (RuntimeException e) {
            log.error("Run retention sweep failed", e);
        }
    }
}
