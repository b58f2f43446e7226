package com.restaurantbi.insightflow.app.service;

import com.restaurantbi.insightflow.app.assembler.RunAssembler;
import com.restaurantbi.insightflow.client.dto.QuarantinedBatchDTO;
import com.restaurantbi.insightflow.client.dto.RunDTO;
import com.restaurantbi.insightflow.client.dto.SubmitRunCmd;
import com.restaurantbi.insightflow.domain.exception.ConflictException;
import com.restaurantbi.insightflow.domain.exception.RunNotFoundException;
import com.restaurantbi.insightflow.domain.repository.WorkflowRunRepository;
import com.restaurantbi.insightflow.domain.run.RunTrigger;
import com.restaurantbi.insightflow.domain.service.WorkflowEngine;
import com.restaurantbi.insightflow.domain.validation.BatchQuarantine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * PipelineRunAppService - 运行的触发、查询与取消
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineRunAppService {

    private final WorkflowEngine workflowEngine;
    private final WorkflowRunRepository runRepository;
    private final BatchQuarantine quarantine;

    /**
     * 手动触发
     *
     * @throws ConflictException 同一逻辑键已有活动运行
     */
    public RunDTO submitRun(String pipelineId, SubmitRunCmd cmd) {
        log.info("Manual trigger: pipeline [{}] key [{}]", pipelineId, cmd.getLogicalKey());
        String runId = workflowEngine.submit(pipelineId, cmd.getLogicalKey(), RunTrigger.MANUAL);
        return getRun(runId);
    }

    /**
     * 定时触发；已有活动运行时跳过
     *
     * @return 新运行 ID，被跳过时为空
     */
    public Optional<String> triggerScheduled(String pipelineId, String logicalKey) {
        try {
            String runId = workflowEngine.submit(pipelineId, logicalKey, RunTrigger.SCHEDULED);
            log.info("Scheduled trigger: pipeline [{}] key [{}] -> run [{}]", pipelineId, logicalKey, runId);
            return Optional.of(runId);
        } catch (ConflictException e) {
            log.warn("Scheduled trigger skipped, run [{}] still active for pipeline [{}] key [{}]",
                    e.getActiveRunId(), pipelineId, logicalKey);
            return Optional.empty();
        }
    }

    /**
     * 查询运行：活动运行取引擎中的最新副本，否则查仓储
     *
     * @throws RunNotFoundException 运行不存在
     */
    public RunDTO getRun(String runId) {
        return workflowEngine.findRun(runId)
                .or(() -> runRepository.findById(runId))
                .map(RunAssembler::toDTO)
                .orElseThrow(() -> new RunNotFoundException(runId));
    }

    public List<RunDTO> listRuns(String pipelineId, String logicalKey) {
        return runRepository.findByPipelineAndLogicalKey(pipelineId, logicalKey).stream()
                .map(RunAssembler::toDTO)
                .collect(Collectors.toList());
    }

    public List<RunDTO> activeRuns() {
        return workflowEngine.activeRuns().stream()
                .map(RunAssembler::toDTO)
                .collect(Collectors.toList());
    }

    /**
     * 被校验拒绝的批次，按隔离时间升序
     */
    public List<QuarantinedBatchDTO> quarantine() {
        return quarantine.list().stream()
                .map(RunAssembler::toDTO)
                .collect(Collectors.toList());
    }

    /**
     * @return false 表示运行已结束
     */
    public boolean cancelRun(String runId, String reason) {
        String effectiveReason = reason == null || reason.isBlank() ? "cancelled by operator" : reason;
        boolean cancelled = workflowEngine.cancel(runId, effectiveReason);
        log.info("Cancel request for run [{}]: {}", runId, cancelled ? "cancelled" : "already terminal");
        return cancelled;
    }
}
