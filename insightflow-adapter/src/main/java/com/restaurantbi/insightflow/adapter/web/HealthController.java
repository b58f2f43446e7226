package com.restaurantbi.insightflow.adapter.web;

import com.restaurantbi.insightflow.client.dto.SingleResponse;
import com.restaurantbi.insightflow.domain.pipeline.PipelineCatalog;
import com.restaurantbi.insightflow.domain.service.WorkflowEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health Check Controller
 * <p>
 * 附带已加载的流水线数与活动运行数。
 * </p>
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HealthController {

    private final PipelineCatalog pipelineCatalog;
    private final WorkflowEngine workflowEngine;

    @GetMapping("/health")
    public SingleResponse<Map<String, Object>> health() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("pipelines", pipelineCatalog.definitions().size());
        status.put("activeRuns", workflowEngine.activeRuns().size());
        return SingleResponse.of(status);
    }
}
