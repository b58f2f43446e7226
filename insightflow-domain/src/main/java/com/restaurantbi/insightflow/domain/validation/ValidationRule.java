package com.restaurantbi.insightflow.domain.validation;

import com.restaurantbi.insightflow.domain.exception.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * ValidationRule - 记录级校验规则（值对象）
 * <p>
 * 声明式谓词，作用于批次中的每一条记录。
 * 空值只由 NOT_NULL 规则约束，其余字段规则遇到空值视为通过。
 * </p>
 */
@Value
@Builder
public class ValidationRule {

    /**
     * 已编译的正则，按表达式文本共享，规模受配置的规则数约束
     */
    private static final Map<String, Pattern> COMPILED_PATTERNS = new ConcurrentHashMap<>();

    /**
     * 规则名称，出现在违规记录中
     */
    String name;

    RuleType type;

    /**
     * 作用字段（EXPRESSION 规则可为空）
     */
    String field;

    /**
     * 最小值（RANGE）
     */
    Double minValue;

    /**
     * 最大值（RANGE）
     */
    Double maxValue;

    /**
     * 已知标识集合（KNOWN_SOURCE）
     */
    Set<String> knownValues;

    /**
     * 正则表达式（PATTERN）
     */
    String pattern;

    /**
     * SpEL 表达式（EXPRESSION）
     * <p>
     * 示例: "#record['rating'] == null || #record['rating'] <= 5"
     * </p>
     */
    String expression;

    /**
     * 判断记录是否满足规则
     */
    public boolean test(Map<String, Object> record, RuleExpressionEvaluator evaluator) {
        Object value = field == null ? null : record.get(field);
        switch (type) {
            case NOT_NULL:
                return value != null;
            case RANGE:
                return value == null || validateNumber(value);
            case KNOWN_SOURCE:
                return value == null || knownValues.contains(String.valueOf(value));
            case PATTERN:
                return value == null || compiledPattern().matcher(String.valueOf(value)).matches();
            case EXPRESSION:
                return evaluator.test(expression, record);
            default:
                return true;
        }
    }

    Pattern compiledPattern() {
        return COMPILED_PATTERNS.computeIfAbsent(pattern, Pattern::compile);
    }

    private boolean validateNumber(Object value) {
        double number;
        if (value instanceof Number) {
            number = ((Number) value).doubleValue();
        } else {
            try {
                number = Double.parseDouble(String.valueOf(value));
            } catch (NumberFormatException e) {
                return false;
            }
        }
        if (minValue != null && number < minValue) {
            return false;
        }
        return maxValue == null || number <= maxValue;
    }

    /**
     * 校验规则定义本身
     *
     * @throws ConfigurationException 规则不完整或表达式非法
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Validation rule name cannot be empty");
        }
        if (type == null) {
            throw new ConfigurationException("Validation rule [" + name + "] has no type");
        }
        if (type != RuleType.EXPRESSION && (field == null || field.isBlank())) {
            throw new ConfigurationException("Validation rule [" + name + "] requires a field");
        }
        switch (type) {
            case RANGE:
                if (minValue == null && maxValue == null) {
                    throw new ConfigurationException("Range rule [" + name + "] needs min or max");
                }
                break;
            case KNOWN_SOURCE:
                if (knownValues == null || knownValues.isEmpty()) {
                    throw new ConfigurationException("Rule [" + name + "] declares no known values");
                }
                break;
            case PATTERN:
                try {
                    compiledPattern();
                } catch (PatternSyntaxException | NullPointerException e) {
                    throw new ConfigurationException("Rule [" + name + "] has invalid pattern: " + pattern, e);
                }
                break;
            case EXPRESSION:
                RuleExpressionEvaluator.checkSyntax(name, expression);
                break;
            default:
                break;
        }
    }
}
