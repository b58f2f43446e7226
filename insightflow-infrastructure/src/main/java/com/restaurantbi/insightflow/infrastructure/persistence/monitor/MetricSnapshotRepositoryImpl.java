package com.restaurantbi.insightflow.infrastructure.persistence.monitor;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.restaurantbi.insightflow.domain.monitor.ModelMetricSnapshot;
import com.restaurantbi.insightflow.domain.repository.MetricSnapshotRepository;
import com.restaurantbi.insightflow.infrastructure.persistence.monitor.converter.MonitorConverter;
import com.restaurantbi.insightflow.infrastructure.persistence.monitor.entity.MetricSnapshotDO;
import com.restaurantbi.insightflow.infrastructure.persistence.monitor.mapper.MetricSnapshotMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * MetricSnapshotRepositoryImpl - 指标快照仓储实现
 * <p>
 * 只追加，从不更新或删除。
 * </p>
 * 
 * @author insightflow
 */
@Repository
public class MetricSnapshotRepositoryImpl implements MetricSnapshotRepository {
    
    private final MetricSnapshotMapper metricSnapshotMapper;
    
    public MetricSnapshotRepositoryImpl(MetricSnapshotMapper metricSnapshotMapper) {
        this.metricSnapshotMapper = metricSnapshotMapper;
    }
    
    @Override
    public void append(ModelMetricSnapshot snapshot) {
        metricSnapshotMapper.insert(MonitorConverter.toDataObject(snapshot));
    }
    
    @Override
    public List<ModelMetricSnapshot> findRecent(String modelId, String metric, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<MetricSnapshotDO> newestFirst = metricSnapshotMapper.selectList(
            new LambdaQueryWrapper<MetricSnapshotDO>()
                .eq(MetricSnapshotDO::getModelId, modelId)
                .eq(MetricSnapshotDO::getMetric, metric)
                .orderByDesc(MetricSnapshotDO::getRecordedAt)
                .orderByDesc(MetricSnapshotDO::getId)
                .last("LIMIT " + limit)
        );
        List<ModelMetricSnapshot> result = newestFirst.stream()
            .map(MonitorConverter::toDomain)
            .collect(Collectors.toCollection(ArrayList::new));
        Collections.reverse(result);
        return result;
    }
}
