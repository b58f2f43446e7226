package com.restaurantbi.insightflow.infrastructure.persistence.monitor.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.restaurantbi.insightflow.infrastructure.persistence.monitor.entity.AlertDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * AlertMapper - 漂移告警Mapper
 * 
 * @author insightflow
 */
@Mapper
public interface AlertMapper extends BaseMapper<AlertDO> {
}
