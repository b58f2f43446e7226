package com.restaurantbi.insightflow.client.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * SubmitFeedbackCmd - 用户对分析结果的反馈
 * <p>
 * 只校验结构，内容不做审核。
 * </p>
 */
@Data
public class SubmitFeedbackCmd {

    @NotBlank
    private String modelId;

    private String runId;

    private String taskId;

    @NotNull
    @Min(1)
    @Max(5)
    private Integer rating;

    @Size(max = 4000)
    private String correction;
}
