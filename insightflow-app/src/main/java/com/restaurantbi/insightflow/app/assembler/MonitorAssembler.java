package com.restaurantbi.insightflow.app.assembler;

import com.restaurantbi.insightflow.client.dto.AlertDTO;
import com.restaurantbi.insightflow.client.dto.MetricTrendDTO;
import com.restaurantbi.insightflow.domain.monitor.Alert;
import com.restaurantbi.insightflow.domain.monitor.MetricTrend;

/**
 * MonitorAssembler - 告警与趋势转视图
 */
public class MonitorAssembler {

    public static AlertDTO toDTO(Alert alert) {
        AlertDTO dto = new AlertDTO();
        dto.setId(alert.getId());
        dto.setSeverity(alert.getSeverity().name());
        dto.setModelId(alert.getModelId());
        dto.setMetricId(alert.getMetricId());
        dto.setObservedValue(alert.getObservedValue());
        dto.setExpectedValue(alert.getExpectedValue());
        dto.setDeviation(alert.getDeviation());
        dto.setRunId(alert.getRunId());
        dto.setCreatedAt(alert.getCreatedAt());
        return dto;
    }

    public static MetricTrendDTO toDTO(MetricTrend trend) {
        MetricTrendDTO dto = new MetricTrendDTO();
        dto.setMetricId(trend.getMetricId());
        dto.setSampleCount(trend.getSampleCount());
        dto.setMean(trend.getMean());
        dto.setStd(trend.getStd());
        // NaN 无法序列化为 JSON 数字
        dto.setLatest(trend.getSampleCount() == 0 ? null : trend.getLatest());
        dto.setSlope(trend.getSlope());
        dto.setDirection(trend.getDirection().name());
        return dto;
    }
}
