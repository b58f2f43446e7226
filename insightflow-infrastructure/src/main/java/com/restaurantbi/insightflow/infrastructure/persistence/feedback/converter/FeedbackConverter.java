package com.restaurantbi.insightflow.infrastructure.persistence.feedback.converter;

import com.restaurantbi.insightflow.domain.feedback.FeedbackRecord;
import com.restaurantbi.insightflow.infrastructure.persistence.feedback.entity.FeedbackRecordDO;

/**
 * FeedbackConverter - 用户反馈转换器
 * 
 * @author insightflow
 */
public class FeedbackConverter {
    
    public static FeedbackRecordDO toDataObject(FeedbackRecord domain) {
        if (domain == null) {
            return null;
        }
        
        FeedbackRecordDO dataObject = new FeedbackRecordDO();
        dataObject.setId(domain.getId());
        dataObject.setModelId(domain.getModelId());
        dataObject.setRunId(domain.getRunId());
        dataObject.setTaskId(domain.getTaskId());
        dataObject.setRating(domain.getRating());
        dataObject.setCorrection(domain.getCorrection());
        dataObject.setSubmittedAt(domain.getSubmittedAt());
        return dataObject;
    }
    
    public static FeedbackRecord toDomain(FeedbackRecordDO dataObject) {
        if (dataObject == null) {
            return null;
        }
        
        return FeedbackRecord.builder()
            .id(dataObject.getId())
            .modelId(dataObject.getModelId())
            .runId(dataObject.getRunId())
            .taskId(dataObject.getTaskId())
            .rating(dataObject.getRating())
            .correction(dataObject.getCorrection())
            .submittedAt(dataObject.getSubmittedAt())
            .build();
    }
}
