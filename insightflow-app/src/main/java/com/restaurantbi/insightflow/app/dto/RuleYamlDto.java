package com.restaurantbi.insightflow.app.dto;

import lombok.Data;
import java.util.List;

@Data
public class RuleYamlDto {
    private String name;
    private String type; // NOT_NULL / RANGE / KNOWN_SOURCE / PATTERN / EXPRESSION
    private String field;
    private Double min;
    private Double max;
    private List<String> values;
    private String pattern;
    private String expression;
}
