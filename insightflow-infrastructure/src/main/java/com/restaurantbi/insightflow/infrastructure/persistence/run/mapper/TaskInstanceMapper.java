package com.restaurantbi.insightflow.infrastructure.persistence.run.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.restaurantbi.insightflow.infrastructure.persistence.run.entity.TaskInstanceDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * TaskInstanceMapper - 任务实例Mapper
 * 
 * @author insightflow
 */
@Mapper
public interface TaskInstanceMapper extends BaseMapper<TaskInstanceDO> {
}
