package com.restaurantbi.insightflow.config;

import com.restaurantbi.insightflow.app.catalog.PipelineCatalogLoader;
import com.restaurantbi.insightflow.app.config.InsightflowProperties;
import com.restaurantbi.insightflow.domain.batch.BatchStore;
import com.restaurantbi.insightflow.domain.batch.InMemoryBatchStore;
import com.restaurantbi.insightflow.domain.event.EventBus;
import com.restaurantbi.insightflow.domain.executor.IngestionTaskExecutor;
import com.restaurantbi.insightflow.domain.executor.TaskExecutorRegistry;
import com.restaurantbi.insightflow.domain.executor.ValidationTaskExecutor;
import com.restaurantbi.insightflow.domain.feedback.FeedbackAggregator;
import com.restaurantbi.insightflow.domain.monitor.ModelMonitor;
import com.restaurantbi.insightflow.domain.monitor.NotificationSink;
import com.restaurantbi.insightflow.domain.output.InMemoryTaskOutputStore;
import com.restaurantbi.insightflow.domain.output.TaskOutputStore;
import com.restaurantbi.insightflow.domain.pipeline.DefaultPipelineCatalog;
import com.restaurantbi.insightflow.domain.pipeline.TaskKind;
import com.restaurantbi.insightflow.domain.repository.AlertRepository;
import com.restaurantbi.insightflow.domain.repository.FeedbackRepository;
import com.restaurantbi.insightflow.domain.repository.MetricSnapshotRepository;
import com.restaurantbi.insightflow.domain.repository.ValidationResultRepository;
import com.restaurantbi.insightflow.domain.repository.WorkflowRunRepository;
import com.restaurantbi.insightflow.domain.retry.RetryPolicy;
import com.restaurantbi.insightflow.domain.run.AdmissionTable;
import com.restaurantbi.insightflow.domain.service.RunRetentionService;
import com.restaurantbi.insightflow.domain.service.WorkflowEngine;
import com.restaurantbi.insightflow.domain.service.impl.WorkflowEngineImpl;
import com.restaurantbi.insightflow.domain.validation.BatchQuarantine;
import com.restaurantbi.insightflow.domain.validation.RuleExpressionEvaluator;
import com.restaurantbi.insightflow.domain.validation.ValidationGate;
import com.restaurantbi.insightflow.infrastructure.connector.HttpSourceConnector;
import com.restaurantbi.insightflow.infrastructure.executor.HttpModelTaskExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * InsightflowConfiguration - 领域对象装配
 * <p>
 * 领域层不依赖 Spring，引擎、监控、反馈聚合等在此统一创建并相互连接：
 * 引擎事件 → ModelMonitor → 告警 → FeedbackAggregator → 重训练运行。
 * </p>
 *
 * @author insightflow
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(InsightflowProperties.class)
public class InsightflowConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("insightflow-scheduler-");
        return scheduler;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService workerPool(InsightflowProperties properties) {
        return Executors.newFixedThreadPool(properties.getEngine().getWorkerThreads());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService engineTimer(InsightflowProperties properties) {
        return Executors.newScheduledThreadPool(properties.getEngine().getTimerThreads());
    }

    @Bean
    public DefaultPipelineCatalog pipelineCatalog(PipelineCatalogLoader loader, InsightflowProperties properties) {
        DefaultPipelineCatalog catalog = new DefaultPipelineCatalog();
        int loaded = loader.load(properties.getPipelinesLocation(), catalog);
        log.info("Pipeline catalog ready with {} valid definitions from {}", loaded,
                properties.getPipelinesLocation());
        return catalog;
    }

    @Bean
    public BatchStore batchStore() {
        return new InMemoryBatchStore();
    }

    @Bean
    public TaskOutputStore taskOutputStore() {
        return new InMemoryTaskOutputStore();
    }

    @Bean
    public BatchQuarantine batchQuarantine(InsightflowProperties properties) {
        return new BatchQuarantine(properties.getQuarantineCapacity());
    }

    @Bean
    public ValidationGate validationGate(ValidationResultRepository resultRepository, BatchQuarantine quarantine,
                                         Clock clock) {
        return new ValidationGate(new RuleExpressionEvaluator(), resultRepository, quarantine, clock);
    }

    @Bean
    public TaskExecutorRegistry taskExecutorRegistry(RestTemplateBuilder restTemplateBuilder,
                                                     ValidationGate validationGate,
                                                     InsightflowProperties properties,
                                                     Clock clock) {
        InsightflowProperties.Endpoint connector = properties.getConnector();
        RestTemplate connectorTemplate = restTemplateBuilder
                .setConnectTimeout(connector.getConnectTimeout())
                .setReadTimeout(connector.getReadTimeout())
                .build();
        InsightflowProperties.Endpoint model = properties.getModel();
        RestTemplate modelTemplate = restTemplateBuilder
                .setConnectTimeout(model.getConnectTimeout())
                .setReadTimeout(model.getReadTimeout())
                .build();

        HttpModelTaskExecutor modelExecutor = new HttpModelTaskExecutor(modelTemplate, model.getBaseUrl());
        return new TaskExecutorRegistry()
                .register(TaskKind.INGEST, new IngestionTaskExecutor(
                        new HttpSourceConnector(connectorTemplate, connector.getBaseUrl(), clock)))
                .register(TaskKind.VALIDATE, new ValidationTaskExecutor(validationGate))
                .register(TaskKind.NLP_QUERY, modelExecutor)
                .register(TaskKind.FORECAST, modelExecutor)
                .register(TaskKind.CLUSTER, modelExecutor)
                .register(TaskKind.RETRAIN, modelExecutor);
    }

    @Bean
    public EventBus eventBus() {
        return new EventBus();
    }

    @Bean
    public WorkflowEngine workflowEngine(DefaultPipelineCatalog catalog,
                                         TaskExecutorRegistry executorRegistry,
                                         WorkflowRunRepository runRepository,
                                         BatchStore batchStore,
                                         TaskOutputStore outputStore,
                                         EventBus eventBus,
                                         @Qualifier("workerPool") ExecutorService workerPool,
                                         @Qualifier("engineTimer") ScheduledExecutorService engineTimer,
                                         InsightflowProperties properties,
                                         Clock clock) {
        return new WorkflowEngineImpl(catalog, executorRegistry, new RetryPolicy(properties.getRetry(), clock),
                new AdmissionTable(), runRepository, batchStore, outputStore, eventBus, workerPool, engineTimer,
                properties.getEngine(), clock);
    }

    @Bean
    public FeedbackAggregator feedbackAggregator(FeedbackRepository feedbackRepository,
                                                 AlertRepository alertRepository,
                                                 WorkflowRunRepository runRepository,
                                                 WorkflowEngine workflowEngine,
                                                 InsightflowProperties properties,
                                                 Clock clock) {
        return new FeedbackAggregator(properties.getFeedback(), feedbackRepository, alertRepository, runRepository,
                workflowEngine, clock);
    }

    @Bean
    public ModelMonitor modelMonitor(MetricSnapshotRepository snapshotRepository,
                                     AlertRepository alertRepository,
                                     NotificationSink notificationSink,
                                     EventBus eventBus,
                                     FeedbackAggregator feedbackAggregator,
                                     InsightflowProperties properties,
                                     Clock clock) {
        ModelMonitor monitor = new ModelMonitor(properties.getMonitor(), snapshotRepository, alertRepository,
                notificationSink, clock);
        monitor.addAlertListener(feedbackAggregator);
        eventBus.subscribe(monitor);
        return monitor;
    }

    @Bean
    public RunRetentionService runRetentionService(WorkflowRunRepository runRepository,
                                                   ValidationResultRepository validationResultRepository,
                                                   TaskOutputStore outputStore,
                                                   BatchStore batchStore,
                                                   InsightflowProperties properties,
                                                   Clock clock) {
        return new RunRetentionService(properties.getRetention(), runRepository, validationResultRepository,
                outputStore, batchStore, clock);
    }
}
