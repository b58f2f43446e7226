package com.restaurantbi.insightflow.domain.executor;

import com.restaurantbi.insightflow.domain.validation.ValidationGate;
import com.restaurantbi.insightflow.domain.validation.ValidationResult;
import lombok.RequiredArgsConstructor;

/**
 * ValidationTaskExecutor - 校验任务执行器
 * <p>
 * 校验不通过不是执行失败：返回 passed=false 的结论，由引擎将运行置为 BLOCKED。
 * </p>
 */
@RequiredArgsConstructor
public class ValidationTaskExecutor implements TaskExecutor {

    private final ValidationGate gate;

    @Override
    public TaskResult execute(TaskContext context) {
        if (context.getInput() == null) {
            throw new TaskInputException("Validation task [" + context.getTaskId() + "] received no batch");
        }
        ValidationResult result = gate.validate(context.getRunId(), context.getInput(), context.getSpec().getRules());
        return TaskResult.of(result);
    }
}
