package com.restaurantbi.insightflow.domain.repository;

import com.restaurantbi.insightflow.domain.feedback.FeedbackRecord;

import java.time.Instant;
import java.util.List;

/**
 * FeedbackRepository - 用户反馈仓储
 */
public interface FeedbackRepository {

    void save(FeedbackRecord record);

    List<FeedbackRecord> findByModelSince(String modelId, Instant since);

    /**
     * 指定时间之后收到过反馈的模型
     */
    List<String> findModelIdsSince(Instant since);
}
