package com.restaurantbi.insightflow.infrastructure.persistence.validation.converter;

import com.restaurantbi.insightflow.domain.validation.ValidationResult;
import com.restaurantbi.insightflow.domain.validation.Violation;
import com.restaurantbi.insightflow.infrastructure.persistence.validation.entity.ValidationResultDO;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * ValidationResultConverter - 校验结论转换器
 * 
 * @author insightflow
 */
public class ValidationResultConverter {
    
    /**
     * 领域对象转数据对象
     */
    public static ValidationResultDO toDataObject(ValidationResult domain) {
        if (domain == null) {
            return null;
        }
        
        ValidationResultDO dataObject = new ValidationResultDO();
        dataObject.setId(domain.getId());
        dataObject.setRunId(domain.getRunId());
        dataObject.setBatchId(domain.getBatchId());
        dataObject.setPassed(domain.isPassed());
        dataObject.setViolationCount(domain.getViolationCount());
        dataObject.setViolations(
            domain.getViolations().stream()
                .map(ValidationResultConverter::violationToMap)
                .collect(Collectors.toList())
        );
        dataObject.setEvaluatedAt(domain.getEvaluatedAt());
        return dataObject;
    }
    
    /**
     * 数据对象转领域对象
     */
    public static ValidationResult toDomain(ValidationResultDO dataObject) {
        if (dataObject == null) {
            return null;
        }
        
        List<Violation> violations = new ArrayList<>();
        if (dataObject.getViolations() != null) {
            for (Map<String, Object> map : dataObject.getViolations()) {
                violations.add(mapToViolation(map));
            }
        }
        
        return ValidationResult.builder()
            .id(dataObject.getId())
            .runId(dataObject.getRunId())
            .batchId(dataObject.getBatchId())
            .passed(Boolean.TRUE.equals(dataObject.getPassed()))
            .violations(violations)
            .evaluatedAt(dataObject.getEvaluatedAt())
            .build();
    }
    
    private static Map<String, Object> violationToMap(Violation violation) {
        Map<String, Object> map = new HashMap<>();
        map.put("recordIndex", violation.getRecordIndex());
        map.put("field", violation.getField());
        map.put("rule", violation.getRule());
        map.put("offendingValue", violation.getOffendingValue());
        return map;
    }
    
    private static Violation mapToViolation(Map<String, Object> map) {
        Object index = map.get("recordIndex");
        return new Violation(
            index instanceof Number ? ((Number) index).intValue() : -1,
            (String) map.get("field"),
            (String) map.get("rule"),
            (String) map.get("offendingValue")
        );
    }
}
