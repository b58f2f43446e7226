package com.restaurantbi.insightflow;

import com.restaurantbi.insightflow.domain.executor.TaskExecutorRegistry;
import com.restaurantbi.insightflow.domain.pipeline.DefaultPipelineCatalog;
import com.restaurantbi.insightflow.domain.pipeline.PipelineDefinition;
import com.restaurantbi.insightflow.domain.pipeline.TaskKind;
import com.restaurantbi.insightflow.domain.service.WorkflowEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "insightflow.scheduler.enabled=false")
class InsightflowApplicationTest {

    @Autowired
    private DefaultPipelineCatalog pipelineCatalog;

    @Autowired
    private TaskExecutorRegistry executorRegistry;

    @Autowired
    private WorkflowEngine workflowEngine;

    @Test
    void testContextLoadsBundledPipelines() {
        PipelineDefinition daily = pipelineCatalog.get("daily-ingest");
        assertThat(daily.getTasks()).hasSize(5);
        assertThat(daily.getSchedule()).isEqualTo("0 30 2 * * *");
        assertThat(pipelineCatalog.get("model-retraining").getSchedule()).isNull();

        for (TaskKind kind : TaskKind.values()) {
            assertThat(executorRegistry.supports(kind)).isTrue();
        }
        assertThat(workflowEngine.activeRuns()).isEmpty();
    }
}
