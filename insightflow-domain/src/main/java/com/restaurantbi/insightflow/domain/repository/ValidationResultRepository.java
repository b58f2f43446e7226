package com.restaurantbi.insightflow.domain.repository;

import com.restaurantbi.insightflow.domain.validation.ValidationResult;

import java.util.List;
import java.util.Optional;

/**
 * ValidationResultRepository - 校验结论仓储（审计用）
 */
public interface ValidationResultRepository {

    void save(ValidationResult result);

    Optional<ValidationResult> findById(String id);

    List<ValidationResult> findByRunId(String runId);

    void deleteByRunId(String runId);
}
