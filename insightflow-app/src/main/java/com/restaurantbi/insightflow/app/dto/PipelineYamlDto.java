package com.restaurantbi.insightflow.app.dto;

import lombok.Data;
import java.util.List;

@Data
public class PipelineYamlDto {
    private String id;
    private String description;
    private String schedule; // cron, e.g. "0 0 0 * * *"
    private String runTimeout; // 2h / PT2H
    private List<TaskYamlDto> tasks;
}
