package com.restaurantbi.insightflow.domain.run;

/**
 * RunTrigger - 运行来源
 */
public enum RunTrigger {
    SCHEDULED,
    MANUAL,
    RETRAINING
}
