package com.restaurantbi.insightflow.infrastructure.persistence.monitor;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.restaurantbi.insightflow.domain.monitor.Alert;
import com.restaurantbi.insightflow.domain.repository.AlertRepository;
import com.restaurantbi.insightflow.infrastructure.persistence.monitor.converter.MonitorConverter;
import com.restaurantbi.insightflow.infrastructure.persistence.monitor.entity.AlertDO;
import com.restaurantbi.insightflow.infrastructure.persistence.monitor.mapper.AlertMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AlertRepositoryImpl - 漂移告警仓储实现
 * 
 * @author insightflow
 */
@Repository
public class AlertRepositoryImpl implements AlertRepository {
    
    private final AlertMapper alertMapper;
    
    public AlertRepositoryImpl(AlertMapper alertMapper) {
        this.alertMapper = alertMapper;
    }
    
    @Override
    public void save(Alert alert) {
        alertMapper.insert(MonitorConverter.toDataObject(alert));
    }
    
    @Override
    public List<Alert> findByModelSince(String modelId, Instant since) {
        return alertMapper.selectList(
                new LambdaQueryWrapper<AlertDO>()
                    .eq(AlertDO::getModelId, modelId)
                    .ge(AlertDO::getCreatedAt, since)
                    .orderByAsc(AlertDO::getCreatedAt)
            ).stream()
            .map(MonitorConverter::toDomain)
            .collect(Collectors.toList());
    }
    
    @Override
    public List<Alert> findByModel(String modelId) {
        return alertMapper.selectList(
                new LambdaQueryWrapper<AlertDO>()
                    .eq(AlertDO::getModelId, modelId)
                    .orderByDesc(AlertDO::getCreatedAt)
            ).stream()
            .map(MonitorConverter::toDomain)
            .collect(Collectors.toList());
    }
    
    @Override
    public List<String> findModelIdsSince(Instant since) {
        return alertMapper.selectList(
                new LambdaQueryWrapper<AlertDO>()
                    .select(AlertDO::getModelId)
                    .ge(AlertDO::getCreatedAt, since)
                    .groupBy(AlertDO::getModelId)
            ).stream()
            .map(AlertDO::getModelId)
            .collect(Collectors.toList());
    }
}
