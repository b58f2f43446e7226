package com.restaurantbi.insightflow.client.dto;

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * RunDTO - 运行视图
 */
@Data
public class RunDTO {

    private String runId;

    private String pipelineId;

    private String logicalKey;

    /**
     * PENDING / RETRAINING_QUEUED / RUNNING / SUCCEEDED / FAILED / BLOCKED
     */
    private String state;

    private String trigger;

    /**
     * 重训练运行的目标模型
     */
    private String targetModelId;

    private Instant createdAt;

    private Instant startedAt;

    private Instant finishedAt;

    private String lastError;

    private List<TaskInstanceDTO> tasks = new ArrayList<>();
}
