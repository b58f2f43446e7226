package com.restaurantbi.insightflow.domain.pipeline;

import com.restaurantbi.insightflow.domain.exception.ConfigurationException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * PipelineDefinition - 流水线模板
 * <p>
 * 有向无环的 TaskSpec 集合。每次触发都基于同一个不可变模板创建 WorkflowRun。
 * </p>
 */
@Value
@Builder
public class PipelineDefinition {

    /**
     * Pipeline ID
     */
    String id;

    String description;

    /**
     * 定时触发的 cron 表达式（Spring 六段格式），为空表示只能手动触发
     */
    String schedule;

    /**
     * 运行级超时，为空时按各任务预算之和计算
     */
    Duration runTimeout;

    /**
     * 包含的任务列表（声明顺序）
     */
    @Singular
    List<TaskSpec> tasks;

    public Optional<TaskSpec> findTask(String taskId) {
        return tasks.stream().filter(t -> t.getId().equals(taskId)).findFirst();
    }

    public TaskSpec getTask(String taskId) {
        return findTask(taskId).orElseThrow(() -> new IllegalArgumentException(
                "Task [" + taskId + "] not declared in pipeline [" + id + "]"));
    }

    /**
     * 直接依赖 taskId 的任务
     */
    public List<TaskSpec> dependentsOf(String taskId) {
        List<TaskSpec> dependents = new ArrayList<>();
        for (TaskSpec task : tasks) {
            if (task.getDependsOn().contains(taskId)) {
                dependents.add(task);
            }
        }
        return dependents;
    }

    /**
     * 校验定义：ID 唯一、依赖存在、无环、各任务配置合法
     *
     * @throws ConfigurationException 定义不合法
     */
    public void validate() {
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Pipeline id cannot be empty");
        }
        if (tasks.isEmpty()) {
            throw new ConfigurationException("Pipeline [" + id + "] declares no tasks");
        }
        if (runTimeout != null && (runTimeout.isNegative() || runTimeout.isZero())) {
            throw new ConfigurationException("Pipeline [" + id + "] runTimeout must be positive");
        }

        Map<String, TaskSpec> byId = new LinkedHashMap<>();
        for (TaskSpec task : tasks) {
            task.validate();
            if (byId.put(task.getId(), task) != null) {
                throw new ConfigurationException("Pipeline [" + id + "] declares task [" + task.getId() + "] twice");
            }
        }
        for (TaskSpec task : tasks) {
            for (String dependency : task.getDependsOn()) {
                if (!byId.containsKey(dependency)) {
                    throw new ConfigurationException("Task [" + task.getId() + "] depends on unknown task ["
                            + dependency + "] in pipeline [" + id + "]");
                }
            }
        }
        if (topologicalOrder().size() != tasks.size()) {
            throw new ConfigurationException("Pipeline [" + id + "] task graph contains a cycle");
        }
    }

    /**
     * Kahn 拓扑排序；存在环时返回的列表短于任务数
     */
    public List<String> topologicalOrder() {
        Map<String, Integer> inDegree = new HashMap<>();
        for (TaskSpec task : tasks) {
            inDegree.put(task.getId(), task.getDependsOn().size());
        }
        Deque<String> ready = new ArrayDeque<>();
        for (TaskSpec task : tasks) {
            if (task.getDependsOn().isEmpty()) {
                ready.add(task.getId());
            }
        }
        List<String> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        while (!ready.isEmpty()) {
            String current = ready.poll();
            if (!visited.add(current)) {
                continue;
            }
            order.add(current);
            for (TaskSpec dependent : dependentsOf(current)) {
                int remaining = inDegree.merge(dependent.getId(), -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent.getId());
                }
            }
        }
        return order;
    }
}
