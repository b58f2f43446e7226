package com.restaurantbi.insightflow.client.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * SubmitRunCmd - 手动触发运行
 */
@Data
public class SubmitRunCmd {

    /**
     * 逻辑键，例如 2024-05-01
     */
    @NotBlank
    @Size(max = 256)
    private String logicalKey;
}
