package com.restaurantbi.insightflow.app.dto;

import lombok.Data;

@Data
public class RetryYamlDto {
    private Integer maxAttempts;
    private String initialBackoff;
    private String maxBackoff;
    private String maxTotalWait;
}
