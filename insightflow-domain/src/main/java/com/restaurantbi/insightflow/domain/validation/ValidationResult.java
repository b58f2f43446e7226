package com.restaurantbi.insightflow.domain.validation;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * ValidationResult - 校验结论
 * <p>
 * 零违规即通过，任意违规即失败，不存在部分通过。
 * </p>
 */
@Value
@Builder
public class ValidationResult {

    String id;

    String runId;

    String batchId;

    boolean passed;

    List<Violation> violations;

    Instant evaluatedAt;

    public int getViolationCount() {
        return violations.size();
    }
}
