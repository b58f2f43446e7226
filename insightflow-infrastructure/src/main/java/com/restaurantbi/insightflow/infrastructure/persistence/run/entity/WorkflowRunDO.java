package com.restaurantbi.insightflow.infrastructure.persistence.run.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.Instant;

/**
 * WorkflowRunDO - 运行数据对象
 * 
 * @author insightflow
 */
@Data
@TableName("workflow_run")
public class WorkflowRunDO {
    
    /**
     * 运行ID（UUID）
     */
    @TableId(value = "run_id", type = IdType.INPUT)
    private String runId;
    
    private String pipelineId;
    
    private String logicalKey;
    
    /**
     * 运行状态
     */
    private String state;
    
    /**
     * 触发方式
     */
    private String triggerType;
    
    /**
     * 重训练目标模型
     */
    private String targetModelId;
    
    private Instant createdAt;
    
    private Instant startedAt;
    
    private Instant finishedAt;
    
    /**
     * 采集批次句柄
     */
    private String batchHandle;
    
    private String lastError;
    
    /**
     * 已分配的最大事件序号
     */
    private Long eventSequence;
}
