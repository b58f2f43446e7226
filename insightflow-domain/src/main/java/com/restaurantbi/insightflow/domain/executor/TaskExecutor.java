package com.restaurantbi.insightflow.domain.executor;

/**
 * TaskExecutor - 任务执行器接口
 * <p>
 * 所有任务种类（采集、校验、NLP 查询、预测、聚类、重训练）共享同一调用契约。
 * 在生产环境中，AI 任务会通过 HTTP 调用远程模型服务。
 * 在测试环境中，可以使用脚本化的 Mock 实现。
 * </p>
 * <p>
 * 执行器只负责计算，不修改运行状态；输出由引擎写入 TaskOutputStore。
 * 同一尝试可能因超时或崩溃被再次执行，实现需保证幂等。
 * </p>
 */
public interface TaskExecutor {

    /**
     * 执行一次尝试
     *
     * @param context 执行上下文
     * @return 执行结果
     * @throws TaskInputException     输入不合法
     * @throws TaskExecutionException 执行失败
     * @throws TaskTimeoutException   执行超时
     */
    TaskResult execute(TaskContext context);
}
