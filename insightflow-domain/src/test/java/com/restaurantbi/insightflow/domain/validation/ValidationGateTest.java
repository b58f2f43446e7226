package com.restaurantbi.insightflow.domain.validation;

import com.restaurantbi.insightflow.domain.batch.DataBatch;
import com.restaurantbi.insightflow.domain.exception.ConfigurationException;
import com.restaurantbi.insightflow.domain.repository.InMemoryValidationResultRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ValidationGateTest {

    private InMemoryValidationResultRepository repository;
    private BatchQuarantine quarantine;
    private ValidationGate gate;

    @BeforeEach
    void setUp() {
        repository = new InMemoryValidationResultRepository();
        quarantine = new BatchQuarantine(2);
        gate = new ValidationGate(new RuleExpressionEvaluator(), repository, quarantine,
                Clock.fixed(Instant.parse("2024-05-01T02:00:00Z"), ZoneOffset.UTC));
    }

    private static Map<String, Object> record(String restaurantId, Object rating, String platform) {
        Map<String, Object> record = new HashMap<>();
        record.put("restaurant_id", restaurantId);
        record.put("rating", rating);
        record.put("platform", platform);
        return record;
    }

    private static DataBatch batch(List<Map<String, Object>> records) {
        return DataBatch.of("ubereats", Instant.parse("2024-05-01T01:00:00Z"), records).withLogicalKey("2024-05-01");
    }

    private static RuleSet rules() {
        return RuleSet.of(
                ValidationRule.builder().name("restaurant-required").type(RuleType.NOT_NULL).field("restaurant_id").build(),
                ValidationRule.builder().name("rating-range").type(RuleType.RANGE).field("rating").minValue(1.0).maxValue(5.0).build(),
                ValidationRule.builder().name("known-platform").type(RuleType.KNOWN_SOURCE).field("platform")
                        .knownValues(Set.of("ubereats", "doordash")).build(),
                ValidationRule.builder().name("restaurant-format").type(RuleType.PATTERN).field("restaurant_id")
                        .pattern("r-\\d+").build());
    }

    @Test
    void testCleanBatchPasses() {
        DataBatch batch = batch(List.of(record("r-1", 4, "ubereats"), record("r-2", 5.0, "doordash")));

        ValidationResult result = gate.validate("run-1", batch, rules());

        assertTrue(result.isPassed());
        assertEquals(0, result.getViolationCount());
        assertEquals(batch.getId(), result.getBatchId());
        assertEquals(Instant.parse("2024-05-01T02:00:00Z"), result.getEvaluatedAt());
        assertEquals(1, repository.findByRunId("run-1").size());
        assertEquals(0, quarantine.size());
    }

    @Test
    void testAggregatesEveryViolationInsteadOfFailingFast() {
        DataBatch batch = batch(List.of(
                record(null, 4, "ubereats"),
                record("r-2", 9, "grubhub"),
                record("bad-id", "n/a", "doordash")));

        ValidationResult result = gate.validate("run-1", batch, rules());

        assertFalse(result.isPassed());
        assertEquals(5, result.getViolationCount());
        Violation first = result.getViolations().get(0);
        assertEquals(0, first.getRecordIndex());
        assertEquals("restaurant-required", first.getRule());
        assertNull(first.getOffendingValue());
        assertTrue(result.getViolations().contains(new Violation(1, "rating", "rating-range", "9")));
        assertTrue(result.getViolations().contains(new Violation(1, "platform", "known-platform", "grubhub")));
        assertTrue(result.getViolations().contains(new Violation(2, "rating", "rating-range", "n/a")));
        assertTrue(result.getViolations().contains(new Violation(2, "restaurant_id", "restaurant-format", "bad-id")));
        assertEquals(1, quarantine.size());
        assertEquals(batch.getId(), quarantine.list().get(0).getBatchId());
    }

    @Test
    void testDoesNotModifyBatch() {
        DataBatch batch = batch(List.of(record(null, 1, "ubereats")));

        gate.validate(batch, rules());

        assertEquals(1, batch.getRecordCount());
        assertThrows(UnsupportedOperationException.class, () -> batch.getRecords().get(0).put("x", 1));
    }

    @Test
    void testExpressionRuleSeesRecordVariable() {
        RuleSet expressionRules = RuleSet.of(ValidationRule.builder()
                .name("rating-needs-restaurant")
                .type(RuleType.EXPRESSION)
                .expression("#record['rating'] == null || #record['restaurant_id'] != null")
                .build());

        ValidationResult result = gate.validate(batch(List.of(
                record("r-1", 3, "ubereats"), record(null, 2, "ubereats"), record(null, null, "ubereats"))), expressionRules);

        assertEquals(1, result.getViolationCount());
        assertEquals(1, result.getViolations().get(0).getRecordIndex());
    }

    @Test
    void testQuarantineKeepsNewestEntries() {
        RuleSet required = RuleSet.of(ValidationRule.builder()
                .name("restaurant-required").type(RuleType.NOT_NULL).field("restaurant_id").build());
        for (int i = 0; i < 3; i++) {
            gate.validate(batch(List.of(record(null, 1, "ubereats"))), required);
        }
        assertEquals(2, quarantine.size());
    }

    @Test
    void testPatternRuleCompilesExpressionOnce() {
        ValidationRule format = ValidationRule.builder().name("order-format").type(RuleType.PATTERN).field("order_id")
                .pattern("o-[0-9]{4}").build();
        ValidationRule sameFormat = ValidationRule.builder().name("order-format-copy").type(RuleType.PATTERN)
                .field("order_id").pattern("o-[0-9]{4}").build();

        assertSame(format.compiledPattern(), format.compiledPattern());
        assertSame(format.compiledPattern(), sameFormat.compiledPattern());
        RuleExpressionEvaluator evaluator = new RuleExpressionEvaluator();
        assertTrue(format.test(Map.of("order_id", "o-1234"), evaluator));
        assertFalse(format.test(Map.of("order_id", "o-12345"), evaluator));
        assertTrue(format.test(Map.of(), evaluator), "absent values are left to NOT_NULL rules");
    }

    @Test
    void testMalformedRulesAreConfigurationErrors() {
        assertThrows(ConfigurationException.class, () -> ValidationRule.builder()
                .name("broken").type(RuleType.EXPRESSION).expression("#record['a'] >").build().validate());
        assertThrows(ConfigurationException.class, () -> ValidationRule.builder()
                .name("broken").type(RuleType.PATTERN).field("a").pattern("[").build().validate());
        assertThrows(ConfigurationException.class, () -> ValidationRule.builder()
                .name("broken").type(RuleType.RANGE).field("a").build().validate());
        assertThrows(ConfigurationException.class, () -> ValidationRule.builder()
                .name("broken").type(RuleType.NOT_NULL).build().validate());
    }
}
