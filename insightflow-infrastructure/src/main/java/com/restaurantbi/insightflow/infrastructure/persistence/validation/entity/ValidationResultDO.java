package com.restaurantbi.insightflow.infrastructure.persistence.validation.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * ValidationResultDO - 校验结论数据对象
 * 
 * @author insightflow
 */
@Data
@TableName(value = "validation_result", autoResultMap = true)
public class ValidationResultDO {
    
    @TableId(type = IdType.INPUT)
    private String id;
    
    private String runId;
    
    private String batchId;
    
    private Boolean passed;
    
    private Integer violationCount;
    
    /**
     * 违规明细（JSON）
     */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<Map<String, Object>> violations;
    
    private Instant evaluatedAt;
}
