package com.restaurantbi.insightflow.domain.executor;

import com.restaurantbi.insightflow.domain.exception.ConfigurationException;
import com.restaurantbi.insightflow.domain.pipeline.TaskKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * TaskExecutorRegistry - 按任务种类注册执行器
 */
public class TaskExecutorRegistry {

    private final Map<TaskKind, TaskExecutor> executors = new EnumMap<>(TaskKind.class);

    public TaskExecutorRegistry register(TaskKind kind, TaskExecutor executor) {
        executors.put(kind, executor);
        return this;
    }

    public TaskExecutor get(TaskKind kind) {
        TaskExecutor executor = executors.get(kind);
        if (executor == null) {
            throw new ConfigurationException("No executor registered for task kind " + kind);
        }
        return executor;
    }

    public boolean supports(TaskKind kind) {
        return executors.containsKey(kind);
    }
}
