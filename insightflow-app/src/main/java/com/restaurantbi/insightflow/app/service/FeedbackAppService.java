package com.restaurantbi.insightflow.app.service;

import com.restaurantbi.insightflow.app.assembler.MonitorAssembler;
import com.restaurantbi.insightflow.client.dto.AlertDTO;
import com.restaurantbi.insightflow.client.dto.MetricTrendDTO;
import com.restaurantbi.insightflow.client.dto.SubmitFeedbackCmd;
import com.restaurantbi.insightflow.domain.feedback.FeedbackAggregator;
import com.restaurantbi.insightflow.domain.feedback.FeedbackRecord;
import com.restaurantbi.insightflow.domain.monitor.ModelMonitor;
import com.restaurantbi.insightflow.domain.repository.AlertRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * FeedbackAppService - 用户反馈入口与模型监控查询
 */
@Service
@RequiredArgsConstructor
public class FeedbackAppService {

    private final FeedbackAggregator feedbackAggregator;
    private final ModelMonitor modelMonitor;
    private final AlertRepository alertRepository;
    private final Clock clock;

    /**
     * @return 反馈 ID
     */
    public String submitFeedback(SubmitFeedbackCmd cmd) {
        FeedbackRecord record = FeedbackRecord.builder()
                .id(UUID.randomUUID().toString())
                .modelId(cmd.getModelId())
                .runId(cmd.getRunId())
                .taskId(cmd.getTaskId())
                .rating(cmd.getRating())
                .correction(cmd.getCorrection())
                .submittedAt(clock.instant())
                .build();
        feedbackAggregator.submit(record);
        return record.getId();
    }

    public List<AlertDTO> listAlerts(String modelId) {
        return alertRepository.findByModel(modelId).stream()
                .map(MonitorAssembler::toDTO)
                .collect(Collectors.toList());
    }

    public MetricTrendDTO trend(String modelId, String metric) {
        return MonitorAssembler.toDTO(modelMonitor.trend(modelId, metric));
    }
}
