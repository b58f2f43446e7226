package com.restaurantbi.insightflow.domain.service;

import com.restaurantbi.insightflow.domain.batch.BatchStore;
import com.restaurantbi.insightflow.domain.output.TaskOutputStore;
import com.restaurantbi.insightflow.domain.repository.ValidationResultRepository;
import com.restaurantbi.insightflow.domain.repository.WorkflowRunRepository;
import com.restaurantbi.insightflow.domain.run.WorkflowRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * RunRetentionService - 清理过期的终态运行及其批次、产出与校验结论
 */
@Slf4j
@RequiredArgsConstructor
public class RunRetentionService {

    private final RetentionSettings settings;
    private final WorkflowRunRepository runRepository;
    private final ValidationResultRepository validationResultRepository;
    private final TaskOutputStore outputStore;
    private final BatchStore batchStore;
    private final Clock clock;

    /**
     * @return 清理的运行数
     */
    public int purgeExpired() {
        Instant cutoff = Instant.now(clock).minus(settings.getMaxAge());
        List<WorkflowRun> expired = runRepository.findTerminalBefore(cutoff);
        int purged = 0;
        for (WorkflowRun run : expired) {
            try {
                outputStore.purgeRun(run.getRunId());
                if (run.getBatchHandle() != null) {
                    batchStore.remove(run.getBatchHandle());
                }
                validationResultRepository.deleteByRunId(run.getRunId());
                runRepository.delete(run.getRunId());
                purged++;
            } catch (RuntimeException e) {
                log.error("Failed to purge run [{}]", run.getRunId(), e);
            }
        }
        if (purged > 0) {
            log.info("Purged {} runs finished before {}", purged, cutoff);
        }
        return purged;
    }
}
