package com.restaurantbi.insightflow.domain.monitor;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * MetricWindow - 单个指标的滚动窗口与告警滞回状态
 * <p>
 * 新值相对之前窗口计算 z-score，然后入窗。持续越界期间只有冷却期过后或级别由 WARNING 升为 CRITICAL 才再次告警；
 * 回到阈值内即解除越界状态。
 * </p>
 */
class MetricWindow {

    private final Deque<Double> values = new ArrayDeque<>();

    private boolean inBreach;

    private AlertSeverity lastSeverity;

    private Instant lastAlertAt;

    MetricWindow(List<Double> seed, int windowSize) {
        for (Double value : seed) {
            append(value, windowSize);
        }
    }

    synchronized Optional<Breach> offer(double value, Instant now, MonitorSettings settings) {
        Optional<Breach> breach = Optional.empty();
        if (values.size() >= settings.getMinSamples()) {
            double mean = mean(values);
            double std = Math.max(std(values, mean), settings.getStdFloor());
            double z = (value - mean) / std;
            AlertSeverity severity = severityOf(Math.abs(z), settings);
            if (severity == null) {
                inBreach = false;
            } else if (shouldAlert(severity, now, settings.getCooldown())) {
                inBreach = true;
                lastSeverity = severity;
                lastAlertAt = now;
                breach = Optional.of(new Breach(severity, mean, z));
            }
        }
        append(value, settings.getWindowSize());
        return breach;
    }

    synchronized List<Double> values() {
        return new ArrayList<>(values);
    }

    private boolean shouldAlert(AlertSeverity severity, Instant now, Duration cooldown) {
        if (!inBreach) {
            return true;
        }
        if (lastSeverity == AlertSeverity.WARNING && severity == AlertSeverity.CRITICAL) {
            return true;
        }
        return lastAlertAt == null || !now.isBefore(lastAlertAt.plus(cooldown));
    }

    private void append(double value, int windowSize) {
        values.addLast(value);
        while (values.size() > windowSize) {
            values.pollFirst();
        }
    }

    private static AlertSeverity severityOf(double absZ, MonitorSettings settings) {
        if (absZ >= settings.getCriticalThreshold()) {
            return AlertSeverity.CRITICAL;
        }
        if (absZ >= settings.getWarningThreshold()) {
            return AlertSeverity.WARNING;
        }
        return null;
    }

    static double mean(Iterable<Double> values) {
        double sum = 0;
        int n = 0;
        for (double v : values) {
            sum += v;
            n++;
        }
        return n == 0 ? 0 : sum / n;
    }

    static double std(Iterable<Double> values, double mean) {
        double sq = 0;
        int n = 0;
        for (double v : values) {
            sq += (v - mean) * (v - mean);
            n++;
        }
        return n == 0 ? 0 : Math.sqrt(sq / n);
    }

    @Value
    static class Breach {
        AlertSeverity severity;
        double mean;
        double zScore;
    }
}
