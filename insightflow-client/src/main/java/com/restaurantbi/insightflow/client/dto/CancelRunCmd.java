package com.restaurantbi.insightflow.client.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * CancelRunCmd - 取消运行
 */
@Data
public class CancelRunCmd {

    @Size(max = 512)
    private String reason;
}
