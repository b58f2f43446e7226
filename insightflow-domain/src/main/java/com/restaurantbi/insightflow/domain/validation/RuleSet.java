package com.restaurantbi.insightflow.domain.validation;

import lombok.Value;

import java.util.List;

/**
 * RuleSet - 一个校验任务的全部规则
 */
@Value
public class RuleSet {

    List<ValidationRule> rules;

    public static RuleSet of(List<ValidationRule> rules) {
        return new RuleSet(List.copyOf(rules));
    }

    public static RuleSet of(ValidationRule... rules) {
        return new RuleSet(List.of(rules));
    }

    public void validate() {
        rules.forEach(ValidationRule::validate);
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
