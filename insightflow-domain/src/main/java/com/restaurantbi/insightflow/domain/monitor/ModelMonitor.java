package com.restaurantbi.insightflow.domain.monitor;

import com.restaurantbi.insightflow.domain.event.Event;
import com.restaurantbi.insightflow.domain.event.EventListener;
import com.restaurantbi.insightflow.domain.repository.AlertRepository;
import com.restaurantbi.insightflow.domain.repository.MetricSnapshotRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * ModelMonitor - 模型漂移监控
 * <p>
 * 订阅引擎的 task.succeeded 事件，为每个指标追加快照，并以滚动窗口 z-score 判断是否越界。
 * 同一指标的追加与评估串行执行；告警写入 AlertRepository 并分发给 NotificationSink 和 AlertListener。
 * 监控只产生告警，不影响运行。
 * </p>
 */
@Slf4j
public class ModelMonitor implements EventListener {

    private final MonitorSettings settings;
    private final MetricSnapshotRepository snapshotRepository;
    private final AlertRepository alertRepository;
    private final NotificationSink notificationSink;
    private final Clock clock;

    private final Map<String, MetricWindow> windows = new ConcurrentHashMap<>();
    private final List<AlertListener> alertListeners = new CopyOnWriteArrayList<>();

    public ModelMonitor(MonitorSettings settings, MetricSnapshotRepository snapshotRepository,
                        AlertRepository alertRepository, NotificationSink notificationSink, Clock clock) {
        this.settings = settings;
        this.snapshotRepository = snapshotRepository;
        this.alertRepository = alertRepository;
        this.notificationSink = notificationSink;
        this.clock = clock;
    }

    public void addAlertListener(AlertListener listener) {
        alertListeners.add(listener);
    }

    @Override
    public void onEvent(Event event) {
        if (!Event.TASK_SUCCEEDED.equals(event.getType())) {
            return;
        }
        Object modelId = event.getPayload().get("modelId");
        Object metrics = event.getPayload().get("metrics");
        if (modelId == null || !(metrics instanceof Map)) {
            return;
        }
        Instant recordedAt = event.getTime() != null ? event.getTime() : Instant.now(clock);
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) metrics).entrySet()) {
            if (!(entry.getValue() instanceof Number)) {
                log.warn("Ignoring non-numeric metric [{}] from run [{}]", entry.getKey(), event.getRunId());
                continue;
            }
            record(ModelMetricSnapshot.builder()
                    .modelId(String.valueOf(modelId))
                    .metric(String.valueOf(entry.getKey()))
                    .value(((Number) entry.getValue()).doubleValue())
                    .runId(event.getRunId())
                    .taskId(event.getTaskId())
                    .recordedAt(recordedAt)
                    .build());
        }
    }

    /**
     * 记录一个指标值并评估漂移
     *
     * @return 产生的告警（如有）
     */
    public Optional<Alert> record(ModelMetricSnapshot snapshot) {
        MetricWindow window = windows.computeIfAbsent(snapshot.metricId(),
                id -> new MetricWindow(seedValues(snapshot.getModelId(), snapshot.getMetric()), settings.getWindowSize()));

        Optional<MetricWindow.Breach> breach;
        synchronized (window) {
            snapshotRepository.append(snapshot);
            breach = window.offer(snapshot.getValue(), snapshot.getRecordedAt(), settings);
        }
        if (breach.isEmpty()) {
            return Optional.empty();
        }

        MetricWindow.Breach b = breach.get();
        Alert alert = Alert.builder()
                .id(UUID.randomUUID().toString())
                .severity(b.getSeverity())
                .modelId(snapshot.getModelId())
                .metricId(snapshot.metricId())
                .observedValue(snapshot.getValue())
                .expectedValue(b.getMean())
                .deviation(b.getZScore())
                .runId(snapshot.getRunId())
                .createdAt(Instant.now(clock))
                .build();
        log.warn("{} drift on [{}]: observed {} expected {} (z={})", alert.getSeverity(), alert.getMetricId(),
                alert.getObservedValue(), String.format("%.4f", alert.getExpectedValue()),
                String.format("%.2f", alert.getDeviation()));
        dispatch(alert);
        return Optional.of(alert);
    }

    /**
     * 指标趋势摘要（基于最近一个窗口的快照）
     */
    public MetricTrend trend(String modelId, String metric) {
        return MetricTrend.of(ModelMetricSnapshot.metricId(modelId, metric), seedValues(modelId, metric));
    }

    private List<Double> seedValues(String modelId, String metric) {
        return snapshotRepository.findRecent(modelId, metric, settings.getWindowSize()).stream()
                .map(ModelMetricSnapshot::getValue)
                .collect(Collectors.toList());
    }

    private void dispatch(Alert alert) {
        try {
            alertRepository.save(alert);
        } catch (Exception e) {
            log.error("Failed to persist alert [{}]", alert.getId(), e);
        }
        try {
            notificationSink.notify(alert);
        } catch (Exception e) {
            log.error("Notification sink failed for alert [{}]", alert.getId(), e);
        }
        for (AlertListener listener : alertListeners) {
            try {
                listener.onAlert(alert);
            } catch (Exception e) {
                log.error("Alert listener failed for alert [{}]", alert.getId(), e);
            }
        }
    }
}
