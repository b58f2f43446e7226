package com.restaurantbi.insightflow.infrastructure.persistence.feedback.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.restaurantbi.insightflow.infrastructure.persistence.feedback.entity.FeedbackRecordDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * FeedbackRecordMapper - 用户反馈Mapper
 * 
 * @author insightflow
 */
@Mapper
public interface FeedbackRecordMapper extends BaseMapper<FeedbackRecordDO> {
}
