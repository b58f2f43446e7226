package com.restaurantbi.insightflow.infrastructure.persistence.monitor.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.Instant;

/**
 * AlertDO - 漂移告警数据对象
 * 
 * @author insightflow
 */
@Data
@TableName("model_alert")
public class AlertDO {
    
    @TableId(type = IdType.INPUT)
    private String id;
    
    /**
     * 告警级别 WARNING / CRITICAL
     */
    private String severity;
    
    private String modelId;
    
    private String metricId;
    
    private Double observedValue;
    
    private Double expectedValue;
    
    private Double deviation;
    
    private String runId;
    
    private Instant createdAt;
}
