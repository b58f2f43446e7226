package com.restaurantbi.insightflow.client.dto;

import lombok.Data;

import java.time.Instant;

/**
 * AlertDTO - 漂移告警视图
 */
@Data
public class AlertDTO {

    private String id;

    private String severity;

    private String modelId;

    private String metricId;

    private double observedValue;

    private double expectedValue;

    private double deviation;

    private String runId;

    private Instant createdAt;
}
