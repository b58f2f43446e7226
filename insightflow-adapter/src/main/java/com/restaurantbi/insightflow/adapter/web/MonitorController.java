package com.restaurantbi.insightflow.adapter.web;

import com.restaurantbi.insightflow.app.service.FeedbackAppService;
import com.restaurantbi.insightflow.client.dto.AlertDTO;
import com.restaurantbi.insightflow.client.dto.MetricTrendDTO;
import com.restaurantbi.insightflow.client.dto.MultiResponse;
import com.restaurantbi.insightflow.client.dto.SingleResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 模型漂移告警与指标趋势查询
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class MonitorController {

    private final FeedbackAppService feedbackAppService;

    @GetMapping("/alerts")
    public MultiResponse<AlertDTO> alerts(@RequestParam String modelId) {
        return MultiResponse.of(feedbackAppService.listAlerts(modelId));
    }

    @GetMapping("/models/{modelId}/metrics/{metric}/trend")
    public SingleResponse<MetricTrendDTO> trend(@PathVariable String modelId, @PathVariable String metric) {
        return SingleResponse.of(feedbackAppService.trend(modelId, metric));
    }
}
