package com.restaurantbi.insightflow.domain.pipeline;

import com.restaurantbi.insightflow.domain.exception.ConfigurationException;
import com.restaurantbi.insightflow.domain.validation.RuleSet;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * TaskSpec - 任务模板
 * <p>
 * PipelineDefinition 中的一个节点：定义"做什么"（kind + config）以及"何时做"（dependsOn）。
 * 部署时创建，运行期不可变。
 * </p>
 */
@Value
@Builder
public class TaskSpec {

    /**
     * 任务 ID (Pipeline 内唯一)
     */
    String id;

    /**
     * 任务种类，决定执行器
     */
    TaskKind kind;

    String description;

    /**
     * 上游任务 ID，全部 SUCCEEDED 后本任务才可启动
     */
    @Singular("dependency")
    List<String> dependsOn;

    /**
     * 重试参数覆盖，可为空
     */
    RetryOverride retry;

    /**
     * 单次尝试的超时时间，为空时使用引擎默认值
     */
    Duration timeout;

    /**
     * 可选任务失败时不会导致整个运行失败
     */
    boolean optional;

    /**
     * 任务具体配置
     * <p>
     * 例如: {"sourceId": "ubereats"}, {"baseUrl": "http://forecast-service", "modelId": "demand-forecast"}
     * </p>
     */
    @Singular("configEntry")
    Map<String, Object> config;

    /**
     * 校验规则，仅 VALIDATE 任务使用
     */
    RuleSet rules;

    /**
     * 读取字符串配置项
     */
    public String configString(String key) {
        Object value = config.get(key);
        return value == null ? null : String.valueOf(value);
    }

    /**
     * 结果指标所属的模型 ID，未配置时使用任务 ID
     */
    public String modelId() {
        String modelId = configString("modelId");
        return modelId != null ? modelId : id;
    }

    /**
     * 运行指定了目标模型（重训练）时以运行为准
     */
    public String modelId(String targetModelId) {
        return targetModelId != null ? targetModelId : modelId();
    }

    /**
     * 校验任务配置有效性
     */
    public void validate() {
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Task id cannot be empty");
        }
        if (kind == null) {
            throw new ConfigurationException("Task [" + id + "] has no kind");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new ConfigurationException("Task [" + id + "] timeout must be positive");
        }
        if (retry != null && retry.getMaxAttempts() != null && retry.getMaxAttempts() < 1) {
            throw new ConfigurationException("Task [" + id + "] maxAttempts must be at least 1");
        }
        if (dependsOn.contains(id)) {
            throw new ConfigurationException("Task [" + id + "] depends on itself");
        }
        if (kind == TaskKind.VALIDATE) {
            if (rules == null) {
                throw new ConfigurationException("Validation task [" + id + "] declares no rules");
            }
            rules.validate();
        }
    }
}
