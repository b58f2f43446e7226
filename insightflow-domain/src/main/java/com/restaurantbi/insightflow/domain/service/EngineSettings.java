package com.restaurantbi.insightflow.domain.service;

import lombok.Data;

import java.time.Duration;

/**
 * EngineSettings - 引擎参数
 */
@Data
public class EngineSettings {

    /**
     * 任务执行线程数
     */
    private int workerThreads = 8;

    /**
     * 重试与超时定时线程数
     */
    private int timerThreads = 2;

    /**
     * 任务未声明 timeout 时的单次尝试超时
     */
    private Duration defaultTaskTimeout = Duration.ofMinutes(10);
}
