package com.restaurantbi.insightflow.domain.repository;

import com.restaurantbi.insightflow.domain.feedback.FeedbackRecord;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class InMemoryFeedbackRepository implements FeedbackRepository {
    private final List<FeedbackRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void save(FeedbackRecord record) {
        records.add(record);
    }

    @Override
    public List<FeedbackRecord> findByModelSince(String modelId, Instant since) {
        return records.stream()
                .filter(r -> r.getModelId().equals(modelId) && !r.getSubmittedAt().isBefore(since))
                .collect(Collectors.toList());
    }

    @Override
    public List<String> findModelIdsSince(Instant since) {
        return records.stream()
                .filter(r -> !r.getSubmittedAt().isBefore(since))
                .map(FeedbackRecord::getModelId)
                .distinct()
                .collect(Collectors.toList());
    }
}
