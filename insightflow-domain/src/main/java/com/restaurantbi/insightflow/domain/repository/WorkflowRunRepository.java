package com.restaurantbi.insightflow.domain.repository;

import com.restaurantbi.insightflow.domain.run.WorkflowRun;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * WorkflowRunRepository - 运行仓储
 * <p>
 * 保存运行及其任务实例，用于审计与查询。
 * </p>
 */
public interface WorkflowRunRepository {

    /**
     * 保存或更新运行（含任务实例）
     */
    void save(WorkflowRun run);

    Optional<WorkflowRun> findById(String runId);

    List<WorkflowRun> findByPipelineAndLogicalKey(String pipelineId, String logicalKey);

    /**
     * 查询在指定时间之前结束的终态运行
     */
    List<WorkflowRun> findTerminalBefore(Instant before);

    void delete(String runId);
}
