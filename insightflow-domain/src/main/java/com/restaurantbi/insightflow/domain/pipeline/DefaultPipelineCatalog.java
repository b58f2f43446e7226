package com.restaurantbi.insightflow.domain.pipeline;

import com.restaurantbi.insightflow.domain.exception.ConfigurationException;
import com.restaurantbi.insightflow.domain.exception.PipelineNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * DefaultPipelineCatalog - 内存目录
 * <p>
 * 注册时校验定义；校验失败的流水线被记录为无效，只有引用它的触发会失败，其他流水线不受影响。
 * </p>
 */
@Slf4j
public class DefaultPipelineCatalog implements PipelineCatalog {

    private final Map<String, PipelineDefinition> definitions = new ConcurrentHashMap<>();
    private final Map<String, String> invalid = new ConcurrentHashMap<>();

    /**
     * 注册定义
     *
     * @throws ConfigurationException 定义不合法
     */
    public void register(PipelineDefinition definition) {
        definition.validate();
        definitions.put(definition.getId(), definition);
        invalid.remove(definition.getId());
        log.info("Registered pipeline [{}] with {} tasks", definition.getId(), definition.getTasks().size());
    }

    /**
     * 记录一个无法加载的流水线
     */
    public void registerInvalid(String pipelineId, String error) {
        definitions.remove(pipelineId);
        invalid.put(pipelineId, error);
        log.error("Pipeline [{}] is invalid: {}", pipelineId, error);
    }

    @Override
    public PipelineDefinition get(String pipelineId) {
        String error = invalid.get(pipelineId);
        if (error != null) {
            throw new ConfigurationException("Pipeline [" + pipelineId + "] is misconfigured: " + error);
        }
        PipelineDefinition definition = definitions.get(pipelineId);
        if (definition == null) {
            throw new PipelineNotFoundException(pipelineId);
        }
        return definition;
    }

    @Override
    public Collection<PipelineDefinition> definitions() {
        return new ArrayList<>(definitions.values());
    }
}
