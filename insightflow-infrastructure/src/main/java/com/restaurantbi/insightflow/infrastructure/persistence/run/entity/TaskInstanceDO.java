package com.restaurantbi.insightflow.infrastructure.persistence.run.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.Instant;

/**
 * TaskInstanceDO - 任务实例数据对象
 * 
 * @author insightflow
 */
@Data
@TableName("task_instance")
public class TaskInstanceDO {
    
    /**
     * 主键ID
     */
    @TableId(type = IdType.AUTO)
    private Long id;
    
    /**
     * 所属运行ID
     */
    private String runId;
    
    private String taskId;
    
    private String kind;
    
    private String state;
    
    private Integer attempt;
    
    private Boolean optionalTask;
    
    private String lastError;
    
    private String inputRef;
    
    private String outputRef;
    
    private Instant startedAt;
    
    private Instant finishedAt;
    
    private Instant firstFailureAt;
    
    /**
     * 定义中的任务顺序
     */
    private Integer sortOrder;
}
