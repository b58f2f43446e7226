package com.restaurantbi.insightflow.client.dto;

import lombok.Data;

import java.time.Instant;

/**
 * QuarantinedBatchDTO - 隔离批次视图
 */
@Data
public class QuarantinedBatchDTO {

    private String batchId;

    private String runId;

    private String logicalKey;

    private String sourceId;

    private int violationCount;

    private Instant quarantinedAt;
}
