package com.restaurantbi.insightflow.infrastructure.persistence.feedback;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.restaurantbi.insightflow.domain.feedback.FeedbackRecord;
import com.restaurantbi.insightflow.domain.repository.FeedbackRepository;
import com.restaurantbi.insightflow.infrastructure.persistence.feedback.converter.FeedbackConverter;
import com.restaurantbi.insightflow.infrastructure.persistence.feedback.entity.FeedbackRecordDO;
import com.restaurantbi.insightflow.infrastructure.persistence.feedback.mapper.FeedbackRecordMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * FeedbackRepositoryImpl - 用户反馈仓储实现
 * 
 * @author insightflow
 */
@Repository
public class FeedbackRepositoryImpl implements FeedbackRepository {
    
    private final FeedbackRecordMapper feedbackRecordMapper;
    
    public FeedbackRepositoryImpl(FeedbackRecordMapper feedbackRecordMapper) {
        this.feedbackRecordMapper = feedbackRecordMapper;
    }
    
    @Override
    public void save(FeedbackRecord record) {
        feedbackRecordMapper.insert(FeedbackConverter.toDataObject(record));
    }
    
    @Override
    public List<FeedbackRecord> findByModelSince(String modelId, Instant since) {
        return feedbackRecordMapper.selectList(
                new LambdaQueryWrapper<FeedbackRecordDO>()
                    .eq(FeedbackRecordDO::getModelId, modelId)
                    .ge(FeedbackRecordDO::getSubmittedAt, since)
                    .orderByAsc(FeedbackRecordDO::getSubmittedAt)
            ).stream()
            .map(FeedbackConverter::toDomain)
            .collect(Collectors.toList());
    }
    
    @Override
    public List<String> findModelIdsSince(Instant since) {
        return feedbackRecordMapper.selectList(
                new LambdaQueryWrapper<FeedbackRecordDO>()
                    .select(FeedbackRecordDO::getModelId)
                    .ge(FeedbackRecordDO::getSubmittedAt, since)
                    .groupBy(FeedbackRecordDO::getModelId)
            ).stream()
            .map(FeedbackRecordDO::getModelId)
            .collect(Collectors.toList());
    }
}
