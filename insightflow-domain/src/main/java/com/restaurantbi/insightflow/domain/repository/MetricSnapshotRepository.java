package com.restaurantbi.insightflow.domain.repository;

import com.restaurantbi.insightflow.domain.monitor.ModelMetricSnapshot;

import java.util.List;

/**
 * MetricSnapshotRepository - 指标快照仓储，只追加
 */
public interface MetricSnapshotRepository {

    void append(ModelMetricSnapshot snapshot);

    /**
     * 查询最近的快照
     *
     * @param limit 最多返回条数
     * @return 按记录时间升序（最旧在前）
     */
    List<ModelMetricSnapshot> findRecent(String modelId, String metric, int limit);
}
