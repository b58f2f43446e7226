package com.restaurantbi.insightflow.infrastructure.persistence.validation.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.restaurantbi.insightflow.infrastructure.persistence.validation.entity.ValidationResultDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * ValidationResultMapper - 校验结论Mapper
 * 
 * @author insightflow
 */
@Mapper
public interface ValidationResultMapper extends BaseMapper<ValidationResultDO> {
}
