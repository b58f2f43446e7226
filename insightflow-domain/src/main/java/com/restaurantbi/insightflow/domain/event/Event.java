package com.restaurantbi.insightflow.domain.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Event - 领域事件
 * <p>
 * 引擎在每一次运行/任务状态迁移时发布。遵循 CloudEvents 规范的核心语义。
 * 同一运行的事件携带单调递增的 sequence，按因果顺序发布。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    public static final String TASK_SUCCEEDED = "task.succeeded";

    /**
     * 事件唯一标识 (UUID)
     */
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    /**
     * 事件类型
     * <p>
     * 格式: {entity}.{state}
     * 示例: "run.running", "task.retry_wait", "task.succeeded"
     * </p>
     */
    private String type;

    /**
     * 事件源
     * <p>
     * 示例: "/pipelines/{pipelineId}/runs/{runId}/tasks/{taskId}"
     * </p>
     */
    private String source;

    /**
     * 事件发生时间
     */
    @Builder.Default
    private Instant time = Instant.now();

    private String pipelineId;

    private String runId;

    private String logicalKey;

    /**
     * 任务事件的任务 ID，运行事件为空
     */
    private String taskId;

    /**
     * 运行内序号，从 1 开始单调递增
     */
    private long sequence;

    /**
     * 事件负载 (Payload)
     * <p>
     * task.succeeded 事件包含: modelId, metrics, outputRef。
     * </p>
     */
    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();

    public static String runType(Enum<?> state) {
        return "run." + state.name().toLowerCase();
    }

    public static String taskType(Enum<?> state) {
        return "task." + state.name().toLowerCase();
    }
}
