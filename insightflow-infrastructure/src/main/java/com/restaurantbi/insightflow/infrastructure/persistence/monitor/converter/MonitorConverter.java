package com.restaurantbi.insightflow.infrastructure.persistence.monitor.converter;

import com.restaurantbi.insightflow.domain.monitor.Alert;
import com.restaurantbi.insightflow.domain.monitor.AlertSeverity;
import com.restaurantbi.insightflow.domain.monitor.ModelMetricSnapshot;
import com.restaurantbi.insightflow.infrastructure.persistence.monitor.entity.AlertDO;
import com.restaurantbi.insightflow.infrastructure.persistence.monitor.entity.MetricSnapshotDO;

/**
 * MonitorConverter - 指标快照与告警转换器
 * 
 * @author insightflow
 */
public class MonitorConverter {
    
    public static MetricSnapshotDO toDataObject(ModelMetricSnapshot domain) {
        if (domain == null) {
            return null;
        }
        
        MetricSnapshotDO dataObject = new MetricSnapshotDO();
        dataObject.setModelId(domain.getModelId());
        dataObject.setMetric(domain.getMetric());
        dataObject.setMetricValue(domain.getValue());
        dataObject.setRunId(domain.getRunId());
        dataObject.setTaskId(domain.getTaskId());
        dataObject.setRecordedAt(domain.getRecordedAt());
        return dataObject;
    }
    
    public static ModelMetricSnapshot toDomain(MetricSnapshotDO dataObject) {
        if (dataObject == null) {
            return null;
        }
        
        return ModelMetricSnapshot.builder()
            .modelId(dataObject.getModelId())
            .metric(dataObject.getMetric())
            .value(dataObject.getMetricValue())
            .runId(dataObject.getRunId())
            .taskId(dataObject.getTaskId())
            .recordedAt(dataObject.getRecordedAt())
            .build();
    }
    
    public static AlertDO toDataObject(Alert domain) {
        if (domain == null) {
            return null;
        }
        
        AlertDO dataObject = new AlertDO();
        dataObject.setId(domain.getId());
        dataObject.setSeverity(domain.getSeverity().name());
        dataObject.setModelId(domain.getModelId());
        dataObject.setMetricId(domain.getMetricId());
        dataObject.setObservedValue(domain.getObservedValue());
        dataObject.setExpectedValue(domain.getExpectedValue());
        dataObject.setDeviation(domain.getDeviation());
        dataObject.setRunId(domain.getRunId());
        dataObject.setCreatedAt(domain.getCreatedAt());
        return dataObject;
    }
    
    public static Alert toDomain(AlertDO dataObject) {
        if (dataObject == null) {
            return null;
        }
        
        return Alert.builder()
            .id(dataObject.getId())
            .severity(AlertSeverity.valueOf(dataObject.getSeverity()))
            .modelId(dataObject.getModelId())
            .metricId(dataObject.getMetricId())
            .observedValue(dataObject.getObservedValue())
            .expectedValue(dataObject.getExpectedValue())
            .deviation(dataObject.getDeviation())
            .runId(dataObject.getRunId())
            .createdAt(dataObject.getCreatedAt())
            .build();
    }
}
