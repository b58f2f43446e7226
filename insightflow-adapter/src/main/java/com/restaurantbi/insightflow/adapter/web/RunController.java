package com.restaurantbi.insightflow.adapter.web;

import com.restaurantbi.insightflow.app.service.PipelineRunAppService;
import com.restaurantbi.insightflow.client.dto.CancelRunCmd;
import com.restaurantbi.insightflow.client.dto.MultiResponse;
import com.restaurantbi.insightflow.client.dto.QuarantinedBatchDTO;
import com.restaurantbi.insightflow.client.dto.RunDTO;
import com.restaurantbi.insightflow.client.dto.SingleResponse;
import com.restaurantbi.insightflow.client.dto.SubmitRunCmd;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * 运行触发、查询与取消
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RunController {

    private final PipelineRunAppService runAppService;

    @PostMapping("/pipelines/{pipelineId}/runs")
    @ResponseStatus(HttpStatus.CREATED)
    public SingleResponse<RunDTO> submit(@PathVariable String pipelineId, @Valid @RequestBody SubmitRunCmd cmd) {
        return SingleResponse.of(runAppService.submitRun(pipelineId, cmd));
    }

    @GetMapping("/pipelines/{pipelineId}/runs")
    public MultiResponse<RunDTO> listRuns(@PathVariable String pipelineId, @RequestParam String logicalKey) {
        return MultiResponse.of(runAppService.listRuns(pipelineId, logicalKey));
    }

    @GetMapping("/runs/active")
    public MultiResponse<RunDTO> activeRuns() {
        return MultiResponse.of(runAppService.activeRuns());
    }

    @GetMapping("/runs/{runId}")
    public SingleResponse<RunDTO> getRun(@PathVariable String runId) {
        return SingleResponse.of(runAppService.getRun(runId));
    }

    /**
     * data 为 false 表示运行已结束，未做任何改动
     */
    @PostMapping("/runs/{runId}/cancel")
    public SingleResponse<Boolean> cancel(@PathVariable String runId,
                                          @Valid @RequestBody(required = false) CancelRunCmd cmd) {
        return SingleResponse.of(runAppService.cancelRun(runId, cmd == null ? null : cmd.getReason()));
    }

    @GetMapping("/quarantine")
    public MultiResponse<QuarantinedBatchDTO> quarantine() {
        return MultiResponse.of(runAppService.quarantine());
    }
}
