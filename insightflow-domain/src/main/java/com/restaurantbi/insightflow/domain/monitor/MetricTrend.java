package com.restaurantbi.insightflow.domain.monitor;

import lombok.Value;

import java.util.List;

/**
 * MetricTrend - 指标趋势摘要
 */
@Value
public class MetricTrend {

    public enum Direction {
        UP,
        DOWN,
        FLAT
    }

    String metricId;

    int sampleCount;

    double mean;

    double std;

    double latest;

    /**
     * 按样本序号的最小二乘斜率
     */
    double slope;

    Direction direction;

    static MetricTrend of(String metricId, List<Double> values) {
        double mean = MetricWindow.mean(values);
        double std = MetricWindow.std(values, mean);
        int n = values.size();
        double slope = 0;
        if (n > 1) {
            double xMean = (n - 1) / 2.0;
            double num = 0;
            double den = 0;
            for (int i = 0; i < n; i++) {
                num += (i - xMean) * (values.get(i) - mean);
                den += (i - xMean) * (i - xMean);
            }
            slope = num / den;
        }
        Direction direction = Math.abs(slope) < 1e-9 ? Direction.FLAT : slope > 0 ? Direction.UP : Direction.DOWN;
        return new MetricTrend(metricId, n, mean, std, n == 0 ? Double.NaN : values.get(n - 1), slope, direction);
    }
}
