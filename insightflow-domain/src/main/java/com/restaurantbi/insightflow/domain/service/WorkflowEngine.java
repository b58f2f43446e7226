package com.restaurantbi.insightflow.domain.service;

import com.restaurantbi.insightflow.domain.run.RunTrigger;
import com.restaurantbi.insightflow.domain.run.WorkflowRun;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * WorkflowEngine - 工作流引擎
 * <p>
 * 驱动运行的状态机：准入、按依赖调度就绪任务、应用重试策略、在终态释放准入。
 * 所有方法都不会阻塞等待任务完成。
 * </p>
 */
public interface WorkflowEngine {

    /**
     * 提交一次手动触发
     *
     * @return 新运行 ID
     * @throws com.restaurantbi.insightflow.domain.exception.ConflictException      同一逻辑键已有活动运行
     * @throws com.restaurantbi.insightflow.domain.exception.ConfigurationException 流水线定义无效
     */
    String submit(String pipelineId, String logicalKey);

    String submit(String pipelineId, String logicalKey, RunTrigger trigger);

    /**
     * 入队重训练运行，初始状态 RETRAINING_QUEUED
     * <p>
     * modelId 记录在运行上，各任务的模型 ID 以它为准。
     * </p>
     */
    String enqueueRetraining(String pipelineId, String modelId, String logicalKey);

    /**
     * 取消活动运行：运行置为 FAILED，进行中的任务被协作式取消
     *
     * @return false 表示运行已处于终态
     * @throws com.restaurantbi.insightflow.domain.exception.RunNotFoundException 运行不存在
     */
    boolean cancel(String runId, String reason);

    /**
     * 查询运行（副本）
     */
    Optional<WorkflowRun> findRun(String runId);

    /**
     * 运行进入终态时完成的 Future
     */
    CompletableFuture<WorkflowRun> completion(String runId);

    List<WorkflowRun> activeRuns();
}
