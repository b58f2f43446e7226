package com.restaurantbi.insightflow.infrastructure.persistence.run.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.restaurantbi.insightflow.infrastructure.persistence.run.entity.WorkflowRunDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * WorkflowRunMapper - 运行Mapper
 * 
 * @author insightflow
 */
@Mapper
public interface WorkflowRunMapper extends BaseMapper<WorkflowRunDO> {
}
