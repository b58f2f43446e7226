package com.restaurantbi.insightflow.domain.repository;

import com.restaurantbi.insightflow.domain.monitor.ModelMetricSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class InMemoryMetricSnapshotRepository implements MetricSnapshotRepository {
    private final List<ModelMetricSnapshot> snapshots = new CopyOnWriteArrayList<>();

    @Override
    public void append(ModelMetricSnapshot snapshot) {
        snapshots.add(snapshot);
    }

    @Override
    public List<ModelMetricSnapshot> findRecent(String modelId, String metric, int limit) {
        List<ModelMetricSnapshot> matching = snapshots.stream()
                .filter(s -> s.getModelId().equals(modelId) && s.getMetric().equals(metric))
                .collect(Collectors.toList());
        return new ArrayList<>(matching.subList(Math.max(0, matching.size() - limit), matching.size()));
    }

    public List<ModelMetricSnapshot> findAll() {
        return List.copyOf(snapshots);
    }
}
