package com.restaurantbi.insightflow.client.dto;

import lombok.Data;

import java.time.Instant;

/**
 * TaskInstanceDTO - 任务实例视图
 */
@Data
public class TaskInstanceDTO {

    private String taskId;

    private String kind;

    private String state;

    private int attempt;

    private boolean optional;

    private String lastError;

    private String outputRef;

    private Instant startedAt;

    private Instant finishedAt;
}
