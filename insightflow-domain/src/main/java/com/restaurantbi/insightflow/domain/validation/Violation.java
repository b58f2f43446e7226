package com.restaurantbi.insightflow.domain.validation;

import lombok.Value;

/**
 * Violation - 单条违规记录
 */
@Value
public class Violation {

    /**
     * 记录在批次中的下标
     */
    int recordIndex;

    String field;

    /**
     * 违反的规则名称
     */
    String rule;

    /**
     * 违规值的字符串形式，空值为 null
     */
    String offendingValue;
}
