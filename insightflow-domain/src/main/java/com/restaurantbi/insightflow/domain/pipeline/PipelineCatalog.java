package com.restaurantbi.insightflow.domain.pipeline;

import java.util.Collection;

/**
 * PipelineCatalog - 流水线定义目录
 */
public interface PipelineCatalog {

    /**
     * 获取定义
     *
     * @throws com.restaurantbi.insightflow.domain.exception.PipelineNotFoundException 未注册
     * @throws com.restaurantbi.insightflow.domain.exception.ConfigurationException    定义加载失败
     */
    PipelineDefinition get(String pipelineId);

    /**
     * 全部有效定义
     */
    Collection<PipelineDefinition> definitions();
}
