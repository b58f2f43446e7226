package com.restaurantbi.insightflow.client.dto;

import lombok.Data;

/**
 * MetricTrendDTO - 指标趋势视图
 */
@Data
public class MetricTrendDTO {

    private String metricId;

    private int sampleCount;

    private double mean;

    private double std;

    /**
     * 无样本时为 null
     */
    private Double latest;

    private double slope;

    /**
     * UP / DOWN / FLAT
     */
    private String direction;
}
