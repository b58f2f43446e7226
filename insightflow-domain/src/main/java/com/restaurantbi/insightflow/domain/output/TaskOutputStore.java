package com.restaurantbi.insightflow.domain.output;

import java.util.Optional;

/**
 * TaskOutputStore - 任务产出存储
 * <p>
 * 以 (runId, taskId, attempt) 为键保存每次尝试的产出。同一任务只有最后一次成功尝试的产出是权威的，
 * 下游只读取权威产出。
 * </p>
 */
public interface TaskOutputStore {

    /**
     * 写入一次尝试的产出
     *
     * @return 产出引用，格式 runId/taskId#attempt
     */
    String write(String runId, String taskId, int attempt, Object output);

    /**
     * 将某次尝试标记为该任务的权威产出
     */
    void markAuthoritative(String runId, String taskId, int attempt);

    Optional<Object> readAuthoritative(String runId, String taskId);

    /**
     * 该任务已写入的尝试数
     */
    int countAttempts(String runId, String taskId);

    /**
     * 清理某次运行的全部产出
     */
    void purgeRun(String runId);

    static String reference(String runId, String taskId, int attempt) {
        return runId + "/" + taskId + "#" + attempt;
    }
}
