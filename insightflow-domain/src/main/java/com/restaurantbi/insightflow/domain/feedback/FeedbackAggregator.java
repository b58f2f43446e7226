package com.restaurantbi.insightflow.domain.feedback;

import com.restaurantbi.insightflow.domain.exception.ConflictException;
import com.restaurantbi.insightflow.domain.exception.InsightflowException;
import com.restaurantbi.insightflow.domain.monitor.Alert;
import com.restaurantbi.insightflow.domain.monitor.AlertListener;
import com.restaurantbi.insightflow.domain.monitor.AlertSeverity;
import com.restaurantbi.insightflow.domain.repository.AlertRepository;
import com.restaurantbi.insightflow.domain.repository.FeedbackRepository;
import com.restaurantbi.insightflow.domain.repository.WorkflowRunRepository;
import com.restaurantbi.insightflow.domain.service.WorkflowEngine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FeedbackAggregator - 反馈聚合与重训练触发
 * <p>
 * 汇总用户反馈与监控告警。每累计 N 条反馈/告警或由定时任务触发时评估：
 * 窗口内负面比例超过阈值（且样本数足够），或窗口内存在 CRITICAL 告警，则为该模型入队一次重训练运行，
 * 逻辑键为 retrain-{modelId}-{yyyy-MM-dd}（UTC）。同一逻辑键当天只入队一次。
 * 从不同步执行重训练。
 * </p>
 */
@Slf4j
public class FeedbackAggregator implements AlertListener {

    private final FeedbackSettings settings;
    private final FeedbackRepository feedbackRepository;
    private final AlertRepository alertRepository;
    private final WorkflowRunRepository runRepository;
    private final WorkflowEngine engine;
    private final Clock clock;

    private final AtomicLong received = new AtomicLong();
    private final Set<String> pendingModels = ConcurrentHashMap.newKeySet();
    private final Set<String> issuedKeys = ConcurrentHashMap.newKeySet();

    public FeedbackAggregator(FeedbackSettings settings, FeedbackRepository feedbackRepository,
                              AlertRepository alertRepository, WorkflowRunRepository runRepository,
                              WorkflowEngine engine, Clock clock) {
        this.settings = settings;
        this.feedbackRepository = feedbackRepository;
        this.alertRepository = alertRepository;
        this.runRepository = runRepository;
        this.engine = engine;
        this.clock = clock;
    }

    /**
     * 接收一条用户反馈
     */
    public void submit(FeedbackRecord record) {
        if (record.getRating() < 1 || record.getRating() > 5) {
            throw new IllegalArgumentException("Rating must be between 1 and 5, got " + record.getRating());
        }
        feedbackRepository.save(record);
        log.debug("Feedback [{}] for model [{}] rated {}", record.getId(), record.getModelId(), record.getRating());
        track(record.getModelId());
    }

    @Override
    public void onAlert(Alert alert) {
        track(alert.getModelId());
    }

    /**
     * 评估窗口内有反馈或告警的全部模型（定时任务调用）
     * <p>
     * 候选模型从仓储读取，重启后无需等待新的反馈即可评估。
     * </p>
     */
    public List<RetrainingDecision> evaluateAll() {
        pendingModels.clear();
        Instant since = Instant.now(clock).minus(settings.getWindow());
        Set<String> models = new LinkedHashSet<>(feedbackRepository.findModelIdsSince(since));
        models.addAll(alertRepository.findModelIdsSince(since));
        List<RetrainingDecision> decisions = new ArrayList<>();
        for (String modelId : models) {
            decisions.add(evaluate(modelId));
        }
        return decisions;
    }

    /**
     * 评估单个模型，满足条件时入队重训练
     */
    public RetrainingDecision evaluate(String modelId) {
        Instant now = Instant.now(clock);
        Instant since = now.minus(settings.getWindow());

        List<FeedbackRecord> feedback = feedbackRepository.findByModelSince(modelId, since);
        long negative = feedback.stream().filter(f -> f.isNegative(settings.getNegativeRatingThreshold())).count();
        double ratio = feedback.isEmpty() ? 0.0 : (double) negative / feedback.size();
        boolean feedbackTriggered = feedback.size() >= settings.getMinFeedbackSamples()
                && ratio > settings.getNegativeRatioThreshold();
        boolean alertTriggered = alertRepository.findByModelSince(modelId, since).stream()
                .anyMatch(a -> a.getSeverity() == AlertSeverity.CRITICAL);

        RetrainingDecision.RetrainingDecisionBuilder decision = RetrainingDecision.builder()
                .modelId(modelId)
                .feedbackCount(feedback.size())
                .negativeRatio(ratio);
        if (!feedbackTriggered && !alertTriggered) {
            return decision.triggered(false).build();
        }

        String reason = feedbackTriggered
                ? String.format("negative feedback ratio %.2f over %d records", ratio, feedback.size())
                : "critical drift alert";
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        String logicalKey = "retrain-" + modelId + "-" + today;
        decision.triggered(true).reason(reason).logicalKey(logicalKey);

        issuedKeys.removeIf(key -> !key.endsWith(today.toString()));
        if (!issuedKeys.add(logicalKey) || alreadyUsed(logicalKey)) {
            log.debug("Retraining [{}] already issued, dropping", logicalKey);
            return decision.build();
        }
        try {
            String runId = engine.enqueueRetraining(settings.getRetrainingPipelineId(), modelId, logicalKey);
            log.info("Enqueued retraining run [{}] for model [{}]: {}", runId, modelId, reason);
            return decision.runId(runId).build();
        } catch (ConflictException e) {
            log.info("Retraining [{}] already active as run [{}], dropping", logicalKey, e.getActiveRunId());
            return decision.build();
        } catch (InsightflowException e) {
            issuedKeys.remove(logicalKey);
            log.error("Failed to enqueue retraining for model [{}]", modelId, e);
            return decision.build();
        }
    }

    private boolean alreadyUsed(String logicalKey) {
        return !runRepository.findByPipelineAndLogicalKey(settings.getRetrainingPipelineId(), logicalKey).isEmpty();
    }

    private void track(String modelId) {
        pendingModels.add(modelId);
        if (received.incrementAndGet() % settings.getEvaluateEvery() == 0) {
            evaluatePending();
        }
    }

    private void evaluatePending() {
        for (String modelId : new ArrayList<>(pendingModels)) {
            pendingModels.remove(modelId);
            evaluate(modelId);
        }
    }
}
