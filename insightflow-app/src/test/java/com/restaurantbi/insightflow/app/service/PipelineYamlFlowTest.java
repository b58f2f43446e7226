package com.restaurantbi.insightflow.app.service;

import com.restaurantbi.insightflow.app.catalog.PipelineCatalogLoader;
import com.restaurantbi.insightflow.app.parser.PipelineYamlParser;
import com.restaurantbi.insightflow.client.dto.RunDTO;
import com.restaurantbi.insightflow.client.dto.SubmitRunCmd;
import com.restaurantbi.insightflow.client.dto.TaskInstanceDTO;
import com.restaurantbi.insightflow.domain.batch.InMemoryBatchStore;
import com.restaurantbi.insightflow.domain.event.EventBus;
import com.restaurantbi.insightflow.domain.executor.IngestionTaskExecutor;
import com.restaurantbi.insightflow.domain.executor.TaskExecutorRegistry;
import com.restaurantbi.insightflow.domain.executor.ValidationTaskExecutor;
import com.restaurantbi.insightflow.domain.monitor.Alert;
import com.restaurantbi.insightflow.domain.monitor.ModelMetricSnapshot;
import com.restaurantbi.insightflow.domain.monitor.ModelMonitor;
import com.restaurantbi.insightflow.domain.monitor.MonitorSettings;
import com.restaurantbi.insightflow.domain.output.InMemoryTaskOutputStore;
import com.restaurantbi.insightflow.domain.pipeline.DefaultPipelineCatalog;
import com.restaurantbi.insightflow.domain.pipeline.TaskKind;
import com.restaurantbi.insightflow.domain.repository.AlertRepository;
import com.restaurantbi.insightflow.domain.repository.MetricSnapshotRepository;
import com.restaurantbi.insightflow.domain.repository.ValidationResultRepository;
import com.restaurantbi.insightflow.domain.repository.WorkflowRunRepository;
import com.restaurantbi.insightflow.domain.retry.RetryPolicy;
import com.restaurantbi.insightflow.domain.retry.RetrySettings;
import com.restaurantbi.insightflow.domain.run.AdmissionTable;
import com.restaurantbi.insightflow.domain.run.WorkflowRun;
import com.restaurantbi.insightflow.domain.service.EngineSettings;
import com.restaurantbi.insightflow.domain.service.impl.WorkflowEngineImpl;
import com.restaurantbi.insightflow.domain.validation.BatchQuarantine;
import com.restaurantbi.insightflow.domain.validation.RuleExpressionEvaluator;
import com.restaurantbi.insightflow.domain.validation.ValidationGate;
import com.restaurantbi.insightflow.domain.validation.ValidationResult;
import com.restaurantbi.insightflow.infrastructure.connector.HttpSourceConnector;
import com.restaurantbi.insightflow.infrastructure.executor.HttpModelTaskExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * YAML 定义 -> 目录 -> 引擎 -> HTTP 数据源与模型服务 的端到端流程
 */
class PipelineYamlFlowTest {

    private static final String SOURCE_URL =
            "http://source-service/sources/ubereats/records?since=2024-05-01T00:00:00Z";

    private MockRestServiceServer mockServer;
    private ExecutorService workerPool;
    private ScheduledExecutorService timer;
    private WorkflowEngineImpl engine;
    private PipelineRunAppService runAppService;
    private Map<String, WorkflowRun> runStore;
    private List<ValidationResult> validationStore;
    private List<ModelMetricSnapshot> snapshotStore;

    @BeforeEach
    void setUp() {
        runStore = new ConcurrentHashMap<>();
        validationStore = new CopyOnWriteArrayList<>();
        snapshotStore = new CopyOnWriteArrayList<>();

        RestTemplate restTemplate = new RestTemplate();
        mockServer = MockRestServiceServer.bindTo(restTemplate).ignoreExpectOrder(true).build();

        WorkflowRunRepository runRepo = new WorkflowRunRepository() {
            @Override
            public void save(WorkflowRun run) {
                runStore.put(run.getRunId(), run.copy());
            }

            @Override
            public Optional<WorkflowRun> findById(String runId) {
                return Optional.ofNullable(runStore.get(runId)).map(WorkflowRun::copy);
            }

            @Override
            public List<WorkflowRun> findByPipelineAndLogicalKey(String pipelineId, String logicalKey) {
                return runStore.values().stream()
                        .filter(r -> r.getPipelineId().equals(pipelineId) && r.getLogicalKey().equals(logicalKey))
                        .collect(Collectors.toList());
            }

            @Override
            public List<WorkflowRun> findTerminalBefore(Instant before) {
                return new ArrayList<>();
            }

            @Override
            public void delete(String runId) {
                runStore.remove(runId);
            }
        };

        ValidationResultRepository validationRepo = new ValidationResultRepository() {
            @Override
            public void save(ValidationResult result) {
                validationStore.add(result);
            }

            @Override
            public Optional<ValidationResult> findById(String id) {
                return validationStore.stream().filter(r -> r.getId().equals(id)).findFirst();
            }

            @Override
            public List<ValidationResult> findByRunId(String runId) {
                return validationStore.stream().filter(r -> runId.equals(r.getRunId())).collect(Collectors.toList());
            }

            @Override
            public void deleteByRunId(String runId) {
                validationStore.removeIf(r -> runId.equals(r.getRunId()));
            }
        };

        MetricSnapshotRepository snapshotRepo = new MetricSnapshotRepository() {
            @Override
            public void append(ModelMetricSnapshot snapshot) {
                snapshotStore.add(snapshot);
            }

            @Override
            public List<ModelMetricSnapshot> findRecent(String modelId, String metric, int limit) {
                return new ArrayList<>();
            }
        };

        AlertRepository alertRepo = new AlertRepository() {
            @Override
            public void save(Alert alert) {
            }

            @Override
            public List<Alert> findByModelSince(String modelId, Instant since) {
                return new ArrayList<>();
            }

            @Override
            public List<Alert> findByModel(String modelId) {
                return new ArrayList<>();
            }

            @Override
            public List<String> findModelIdsSince(Instant since) {
                return new ArrayList<>();
            }
        };

        Clock clock = Clock.systemUTC();
        DefaultPipelineCatalog catalog = new DefaultPipelineCatalog();
        PipelineCatalogLoader loader = new PipelineCatalogLoader(new PipelineYamlParser());
        assertTrue(loader.loadYaml("daily-ingest", DAILY_INGEST_YAML, catalog));

        BatchQuarantine quarantine = new BatchQuarantine();
        ValidationGate gate = new ValidationGate(new RuleExpressionEvaluator(), validationRepo, quarantine, clock);
        HttpModelTaskExecutor modelExecutor = new HttpModelTaskExecutor(restTemplate, "http://model-service");
        TaskExecutorRegistry registry = new TaskExecutorRegistry()
                .register(TaskKind.INGEST, new IngestionTaskExecutor(
                        new HttpSourceConnector(restTemplate, "http://source-service", clock)))
                .register(TaskKind.VALIDATE, new ValidationTaskExecutor(gate))
                .register(TaskKind.FORECAST, modelExecutor)
                .register(TaskKind.CLUSTER, modelExecutor);

        RetrySettings retrySettings = new RetrySettings();
        retrySettings.setInitialBackoff(Duration.ofMillis(10));
        retrySettings.setMaxBackoff(Duration.ofMillis(20));

        EventBus eventBus = new EventBus();
        ModelMonitor monitor = new ModelMonitor(new MonitorSettings(), snapshotRepo, alertRepo, alert -> {
        }, clock);
        eventBus.subscribe(monitor);

        workerPool = Executors.newFixedThreadPool(4);
        timer = Executors.newScheduledThreadPool(1);
        engine = new WorkflowEngineImpl(catalog, registry, new RetryPolicy(retrySettings, clock), new AdmissionTable(),
                runRepo, new InMemoryBatchStore(), new InMemoryTaskOutputStore(), eventBus, workerPool, timer,
                new EngineSettings(), clock);
        runAppService = new PipelineRunAppService(engine, runRepo, quarantine);
    }

    @AfterEach
    void tearDown() {
        workerPool.shutdownNow();
        timer.shutdownNow();
    }

    private static final String DAILY_INGEST_YAML = """
            id: daily-ingest
            description: Daily order ingestion with forecast and segmentation
            runTimeout: 1m
            tasks:
              - id: ingest
                kind: INGEST
                timeout: 10s
                config:
                  sourceId: ubereats
              - id: validate
                kind: VALIDATE
                dependsOn: [ingest]
                rules:
                  - name: restaurant-required
                    type: NOT_NULL
                    field: restaurant_id
                  - name: order-value-range
                    type: RANGE
                    field: order_value
                    min: 0
              - id: forecast
                kind: FORECAST
                dependsOn: [validate]
                timeout: 10s
                config:
                  modelId: demand-forecast
                  horizonDays: 7
              - id: cluster
                kind: CLUSTER
                dependsOn: [validate]
                timeout: 10s
                optional: true
                config:
                  modelId: restaurant-segmenter
            """;

    @Test
    void testYamlPipelineFlow() throws Exception {
        mockServer.expect(ExpectedCount.once(), requestTo(SOURCE_URL))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("[{\"restaurant_id\":\"r-1\",\"order_value\":18.5},"
                        + "{\"restaurant_id\":\"r-2\",\"order_value\":42}]", MediaType.APPLICATION_JSON));

        mockServer.expect(ExpectedCount.once(), requestTo("http://model-service/models/forecast/invoke"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"output\":{\"orders\":[120,131]},\"metrics\":{\"mape\":0.12}}",
                        MediaType.APPLICATION_JSON));

        mockServer.expect(ExpectedCount.once(), requestTo("http://model-service/models/cluster/invoke"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"output\":{\"segments\":3},\"metrics\":{\"silhouette\":0.61}}",
                        MediaType.APPLICATION_JSON));

        // 1. Manual trigger
        SubmitRunCmd cmd = new SubmitRunCmd();
        cmd.setLogicalKey("2024-05-01");
        RunDTO submitted = runAppService.submitRun("daily-ingest", cmd);
        assertEquals("daily-ingest", submitted.getPipelineId());

        // 2. Wait for completion
        WorkflowRun finished = engine.completion(submitted.getRunId()).get(10, TimeUnit.SECONDS);
        assertEquals("SUCCEEDED", finished.getState().name());

        // 3. Verify run view, validation audit and monitored metrics
        RunDTO view = runAppService.getRun(submitted.getRunId());
        assertEquals(List.of("SUCCEEDED", "SUCCEEDED", "SUCCEEDED", "SUCCEEDED"),
                view.getTasks().stream().map(TaskInstanceDTO::getState).collect(Collectors.toList()));

        assertEquals(1, validationStore.size());
        assertTrue(validationStore.get(0).isPassed());

        assertEquals(List.of("demand-forecast:mape", "restaurant-segmenter:silhouette"),
                snapshotStore.stream().map(ModelMetricSnapshot::metricId).sorted().collect(Collectors.toList()));

        mockServer.verify();
    }

    @Test
    void testOptionalAnalysisFailureKeepsRunSuccessful() throws Exception {
        mockServer.expect(ExpectedCount.once(), requestTo(SOURCE_URL))
                .andRespond(withSuccess("[{\"restaurant_id\":\"r-1\",\"order_value\":18.5}]",
                        MediaType.APPLICATION_JSON));
        mockServer.expect(ExpectedCount.once(), requestTo("http://model-service/models/forecast/invoke"))
                .andRespond(withSuccess("{\"output\":{\"orders\":[99]}}", MediaType.APPLICATION_JSON));
        // 聚类服务持续 5xx，重试耗尽
        mockServer.expect(ExpectedCount.manyTimes(), requestTo("http://model-service/models/cluster/invoke"))
                .andRespond(withServerError());

        SubmitRunCmd cmd = new SubmitRunCmd();
        cmd.setLogicalKey("2024-05-01");
        String runId = runAppService.submitRun("daily-ingest", cmd).getRunId();

        WorkflowRun finished = engine.completion(runId).get(10, TimeUnit.SECONDS);

        assertEquals("SUCCEEDED", finished.getState().name());
        assertEquals("FAILED", finished.task("cluster").getState().name());
        assertEquals(5, finished.task("cluster").getAttempt());
        assertFalse(runStore.isEmpty());
    }
}
