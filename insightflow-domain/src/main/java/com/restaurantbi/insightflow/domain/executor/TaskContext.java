package com.restaurantbi.insightflow.domain.executor;

import com.restaurantbi.insightflow.domain.batch.DataBatch;
import com.restaurantbi.insightflow.domain.pipeline.TaskKind;
import com.restaurantbi.insightflow.domain.pipeline.TaskSpec;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * TaskContext - 单次任务尝试的执行上下文
 */
@Value
@Builder
public class TaskContext {

    String runId;

    String pipelineId;

    /**
     * 运行的逻辑键，例如 2024-05-01
     */
    String logicalKey;

    String taskId;

    TaskKind kind;

    /**
     * 当前尝试序号，从 1 开始
     */
    int attempt;

    /**
     * 输入批次，INGEST 任务为空
     */
    DataBatch input;

    TaskSpec spec;

    /**
     * 运行级目标模型，仅重训练运行设置
     */
    String targetModelId;

    CancellationSignal cancellation;

    public Map<String, Object> getConfig() {
        return spec.getConfig();
    }

    /**
     * 本次调用针对的模型 ID
     */
    public String modelId() {
        return spec.modelId(targetModelId);
    }

    /**
     * 幂等键：同一任务的多次尝试共享，用于远端去重
     */
    public String idempotencyKey() {
        return runId + "/" + taskId;
    }
}
