package com.restaurantbi.insightflow.domain.validation;

/**
 * RuleType - 校验规则类型
 */
public enum RuleType {

    /**
     * 字段不能为空
     */
    NOT_NULL,

    /**
     * 数值范围 [minValue, maxValue]
     */
    RANGE,

    /**
     * 引用检查：字段值必须在已知标识集合内（例如平台 ID、门店 ID）
     */
    KNOWN_SOURCE,

    /**
     * 字符串正则
     */
    PATTERN,

    /**
     * SpEL 布尔表达式，记录绑定为 #record
     */
    EXPRESSION
}
