package com.restaurantbi.insightflow.domain.monitor;

import lombok.Data;

import java.time.Duration;

/**
 * MonitorSettings - 漂移检测参数
 */
@Data
public class MonitorSettings {

    /**
     * 滚动窗口大小
     */
    private int windowSize = 30;

    /**
     * 开始评估前窗口内的最少样本数
     */
    private int minSamples = 5;

    private double warningThreshold = 2.0;

    private double criticalThreshold = 3.0;

    /**
     * 持续越界时的重复告警间隔
     */
    private Duration cooldown = Duration.ofHours(1);

    /**
     * 标准差下限，窗口值完全相同时避免除零
     */
    private double stdFloor = 1e-9;
}
