package com.restaurantbi.insightflow.app.dto;

import lombok.Data;
import java.util.List;
import java.util.Map;

@Data
public class TaskYamlDto {
    private String id;
    private String kind; // TaskKind name
    private String description;
    private List<String> dependsOn;
    private String timeout;
    private Boolean optional;
    private Map<String, Object> config;
    private RetryYamlDto retry;
    private List<RuleYamlDto> rules; // VALIDATE only
}
