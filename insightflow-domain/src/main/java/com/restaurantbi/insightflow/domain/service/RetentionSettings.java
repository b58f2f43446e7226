package com.restaurantbi.insightflow.domain.service;

import lombok.Data;

import java.time.Duration;

/**
 * RetentionSettings - 运行数据保留策略
 */
@Data
public class RetentionSettings {

    /**
     * 终态运行的保留时长
     */
    private Duration maxAge = Duration.ofDays(30);
}
