package com.restaurantbi.insightflow.infrastructure.persistence.feedback.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.Instant;

/**
 * FeedbackRecordDO - 用户反馈数据对象
 * 
 * @author insightflow
 */
@Data
@TableName("feedback_record")
public class FeedbackRecordDO {
    
    @TableId(type = IdType.INPUT)
    private String id;
    
    private String modelId;
    
    private String runId;
    
    private String taskId;
    
    /**
     * 评分 1..5
     */
    private Integer rating;
    
    private String correction;
    
    private Instant submittedAt;
}
