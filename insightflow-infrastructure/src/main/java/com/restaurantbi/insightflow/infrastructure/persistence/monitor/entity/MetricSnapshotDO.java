package com.restaurantbi.insightflow.infrastructure.persistence.monitor.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.Instant;

/**
 * MetricSnapshotDO - 指标快照数据对象
 * 
 * @author insightflow
 */
@Data
@TableName("metric_snapshot")
public class MetricSnapshotDO {
    
    @TableId(type = IdType.AUTO)
    private Long id;
    
    private String modelId;
    
    private String metric;
    
    private Double metricValue;
    
    private String runId;
    
    private String taskId;
    
    private Instant recordedAt;
}
