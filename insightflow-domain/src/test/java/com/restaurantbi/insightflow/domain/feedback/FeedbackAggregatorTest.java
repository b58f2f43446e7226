package com.restaurantbi.insightflow.domain.feedback;

import com.restaurantbi.insightflow.domain.monitor.Alert;
import com.restaurantbi.insightflow.domain.monitor.AlertSeverity;
import com.restaurantbi.insightflow.domain.pipeline.PipelineDefinition;
import com.restaurantbi.insightflow.domain.pipeline.TaskKind;
import com.restaurantbi.insightflow.domain.pipeline.TaskSpec;
import com.restaurantbi.insightflow.domain.repository.InMemoryAlertRepository;
import com.restaurantbi.insightflow.domain.repository.InMemoryFeedbackRepository;
import com.restaurantbi.insightflow.domain.repository.InMemoryWorkflowRunRepository;
import com.restaurantbi.insightflow.domain.run.RunTrigger;
import com.restaurantbi.insightflow.domain.run.WorkflowRun;
import com.restaurantbi.insightflow.domain.service.RecordingWorkflowEngine;
import com.restaurantbi.insightflow.domain.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FeedbackAggregatorTest {

    private static final String MODEL = "demand-forecast";

    private MutableClock clock;
    private FeedbackSettings settings;
    private InMemoryFeedbackRepository feedbackRepository;
    private InMemoryAlertRepository alertRepository;
    private InMemoryWorkflowRunRepository runRepository;
    private RecordingWorkflowEngine engine;
    private FeedbackAggregator aggregator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        settings = new FeedbackSettings();
        feedbackRepository = new InMemoryFeedbackRepository();
        alertRepository = new InMemoryAlertRepository();
        runRepository = new InMemoryWorkflowRunRepository();
        engine = new RecordingWorkflowEngine();
        aggregator = new FeedbackAggregator(settings, feedbackRepository, alertRepository, runRepository, engine, clock);
    }

    private void submit(int... ratings) {
        for (int rating : ratings) {
            aggregator.submit(FeedbackRecord.builder()
                    .id(UUID.randomUUID().toString())
                    .modelId(MODEL)
                    .runId("run-1")
                    .taskId("forecast")
                    .rating(rating)
                    .submittedAt(clock.instant())
                    .build());
        }
    }

    private Alert alert(AlertSeverity severity) {
        return Alert.builder()
                .id(UUID.randomUUID().toString())
                .severity(severity)
                .modelId(MODEL)
                .metricId(MODEL + ":mape")
                .observedValue(0.4)
                .expectedValue(0.1)
                .deviation(4.2)
                .createdAt(clock.instant())
                .build();
    }

    @Test
    void testNegativeFeedbackRatioTriggersRetraining() {
        submit(1, 2, 1, 2, 5, 4, 5, 4, 5, 4);

        RetrainingDecision decision = aggregator.evaluate(MODEL);

        assertTrue(decision.isTriggered());
        assertTrue(decision.isEnqueued());
        assertEquals(0.4, decision.getNegativeRatio(), 1e-9);
        assertEquals("retrain-demand-forecast-2024-05-01", decision.getLogicalKey());
        assertEquals(List.of("RETRAINING:model-retraining:retrain-demand-forecast-2024-05-01"), engine.getSubmissions());
        assertEquals(List.of(MODEL), engine.getRetrainedModels());
    }

    @Test
    void testRatioAtThresholdDoesNotTrigger() {
        submit(1, 2, 1, 5, 5, 4, 5, 4, 5, 4);

        assertFalse(aggregator.evaluate(MODEL).isTriggered());
        assertTrue(engine.getSubmissions().isEmpty());
    }

    @Test
    void testTooFewSamplesDoNotTrigger() {
        submit(1, 1, 1, 1, 1);

        RetrainingDecision decision = aggregator.evaluate(MODEL);

        assertFalse(decision.isTriggered());
        assertEquals(1.0, decision.getNegativeRatio(), 1e-9);
    }

    @Test
    void testFeedbackOutsideWindowIsIgnored() {
        submit(1, 1, 1, 1, 1, 1, 1, 1, 1, 1);
        clock.advance(Duration.ofHours(25));

        assertFalse(aggregator.evaluate(MODEL).isTriggered());
    }

    @Test
    void testCriticalAlertTriggersButWarningDoesNot() {
        alertRepository.save(alert(AlertSeverity.WARNING));
        assertFalse(aggregator.evaluate(MODEL).isTriggered());

        alertRepository.save(alert(AlertSeverity.CRITICAL));
        RetrainingDecision decision = aggregator.evaluate(MODEL);
        assertTrue(decision.isTriggered());
        assertEquals("critical drift alert", decision.getReason());
        assertEquals(1, engine.getSubmissions().size());
    }

    @Test
    void testSameDayDuplicatesAreDropped() {
        alertRepository.save(alert(AlertSeverity.CRITICAL));

        assertTrue(aggregator.evaluate(MODEL).isEnqueued());
        assertFalse(aggregator.evaluate(MODEL).isEnqueued());

        clock.advance(Duration.ofHours(20));
        alertRepository.save(alert(AlertSeverity.CRITICAL));
        RetrainingDecision nextDay = aggregator.evaluate(MODEL);
        assertTrue(nextDay.isEnqueued());
        assertEquals("retrain-demand-forecast-2024-05-02", nextDay.getLogicalKey());
        assertEquals(2, engine.getSubmissions().size());
    }

    @Test
    void testKeyAlreadyUsedByStoredRunIsDropped() {
        PipelineDefinition retraining = PipelineDefinition.builder()
                .id("model-retraining")
                .task(TaskSpec.builder().id("retrain").kind(TaskKind.RETRAIN).build())
                .build();
        runRepository.save(WorkflowRun.create(retraining, "retrain-demand-forecast-2024-05-01",
                RunTrigger.RETRAINING, clock.instant()));
        alertRepository.save(alert(AlertSeverity.CRITICAL));

        RetrainingDecision decision = aggregator.evaluate(MODEL);

        assertTrue(decision.isTriggered());
        assertFalse(decision.isEnqueued());
        assertTrue(engine.getSubmissions().isEmpty());
    }

    @Test
    void testConflictIsSwallowedAsDuplicate() {
        engine.setConflictOnSubmit(true);
        alertRepository.save(alert(AlertSeverity.CRITICAL));

        RetrainingDecision decision = aggregator.evaluate(MODEL);

        assertTrue(decision.isTriggered());
        assertFalse(decision.isEnqueued());
    }

    @Test
    void testEvaluatesAutomaticallyEveryNRecords() {
        settings.setEvaluateEvery(5);
        settings.setMinFeedbackSamples(3);

        submit(1, 1, 1, 1);
        assertTrue(engine.getSubmissions().isEmpty());

        submit(1);
        assertEquals(1, engine.getSubmissions().size());
    }

    @Test
    void testAlertsCountTowardsEvaluationCadence() {
        settings.setEvaluateEvery(2);
        Alert critical = alert(AlertSeverity.CRITICAL);
        alertRepository.save(critical);

        aggregator.onAlert(critical);
        assertTrue(engine.getSubmissions().isEmpty());
        aggregator.onAlert(critical);
        assertEquals(1, engine.getSubmissions().size());
    }

    @Test
    void testEvaluateAllCoversEveryKnownModel() {
        submit(5);
        alertRepository.save(alert(AlertSeverity.CRITICAL));

        List<RetrainingDecision> decisions = aggregator.evaluateAll();

        assertEquals(1, decisions.size());
        assertTrue(decisions.get(0).isEnqueued());
    }

    @Test
    void testEvaluateAllAfterRestartReadsModelsFromRepositories() {
        for (int i = 0; i < 10; i++) {
            feedbackRepository.save(FeedbackRecord.builder()
                    .id("stored-" + i)
                    .modelId(MODEL)
                    .rating(i < 6 ? 1 : 5)
                    .submittedAt(clock.instant())
                    .build());
        }
        alertRepository.save(Alert.builder()
                .id("old")
                .severity(AlertSeverity.CRITICAL)
                .modelId("review-sentiment")
                .metricId("review-sentiment:f1")
                .createdAt(clock.instant().minus(Duration.ofDays(3)))
                .build());
        FeedbackAggregator restarted = new FeedbackAggregator(settings, feedbackRepository, alertRepository,
                runRepository, engine, clock);

        List<RetrainingDecision> decisions = restarted.evaluateAll();

        assertEquals(1, decisions.size());
        assertEquals(MODEL, decisions.get(0).getModelId());
        assertTrue(decisions.get(0).isEnqueued());
        assertEquals(List.of(MODEL), engine.getRetrainedModels());
    }

    @Test
    void testRejectsRatingOutsideScale() {
        assertThrows(IllegalArgumentException.class, () -> submit(6));
        assertThrows(IllegalArgumentException.class, () -> submit(0));
    }
}
