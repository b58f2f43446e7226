package com.restaurantbi.insightflow.domain.repository;

import com.restaurantbi.insightflow.domain.monitor.Alert;

import java.time.Instant;
import java.util.List;

/**
 * AlertRepository - 告警仓储
 */
public interface AlertRepository {

    void save(Alert alert);

    /**
     * 查询某模型在指定时间之后的告警
     */
    List<Alert> findByModelSince(String modelId, Instant since);

    /**
     * 查询某模型的全部告警，最新在前
     */
    List<Alert> findByModel(String modelId);

    /**
     * 指定时间之后产生过告警的模型
     */
    List<String> findModelIdsSince(Instant since);
}
