package com.restaurantbi.insightflow.infrastructure.persistence.monitor.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.restaurantbi.insightflow.infrastructure.persistence.monitor.entity.MetricSnapshotDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * MetricSnapshotMapper - 指标快照Mapper
 * 
 * @author insightflow
 */
@Mapper
public interface MetricSnapshotMapper extends BaseMapper<MetricSnapshotDO> {
}
