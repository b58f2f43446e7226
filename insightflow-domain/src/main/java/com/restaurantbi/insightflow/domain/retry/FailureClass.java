package com.restaurantbi.insightflow.domain.retry;

/**
 * FailureClass - 失败分类
 */
public enum FailureClass {

    /**
     * 瞬时失败，重试可能成功
     */
    TRANSIENT,

    /**
     * 永久失败，重试无意义
     */
    PERMANENT
}
