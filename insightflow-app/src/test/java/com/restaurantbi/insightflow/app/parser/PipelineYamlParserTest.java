package com.restaurantbi.insightflow.app.parser;

import com.restaurantbi.insightflow.domain.exception.ConfigurationException;
import com.restaurantbi.insightflow.domain.pipeline.PipelineDefinition;
import com.restaurantbi.insightflow.domain.pipeline.TaskKind;
import com.restaurantbi.insightflow.domain.pipeline.TaskSpec;
import com.restaurantbi.insightflow.domain.validation.RuleType;
import com.restaurantbi.insightflow.domain.validation.ValidationRule;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineYamlParserTest {

    private final PipelineYamlParser parser = new PipelineYamlParser();

    @Test
    void testParseFullDefinition() {
        String yaml = """
                id: daily-ingest
                description: Daily order ingestion
                schedule: "0 0 0 * * *"
                runTimeout: PT2H
                tasks:
                  - id: ingest
                    kind: ingest
                    timeout: 5m
                    config:
                      sourceId: ubereats
                    retry:
                      maxAttempts: 3
                      initialBackoff: 2s
                      maxTotalWait: 10m
                  - id: validate
                    kind: VALIDATE
                    dependsOn: [ingest]
                    rules:
                      - name: order-value-range
                        type: RANGE
                        field: order_value
                        min: 0
                        max: 5000
                      - name: known-platform
                        type: KNOWN_SOURCE
                        field: platform
                        values: [ubereats, doordash]
                      - name: lunch-or-dinner
                        type: EXPRESSION
                        expression: "#record['hour'] == null or #record['hour'] >= 10"
                  - id: cluster
                    kind: CLUSTER
                    dependsOn: [validate]
                    optional: true
                """;

        PipelineDefinition definition = parser.parse(yaml);

        assertThat(definition.getId()).isEqualTo("daily-ingest");
        assertThat(definition.getSchedule()).isEqualTo("0 0 0 * * *");
        assertThat(definition.getRunTimeout()).isEqualTo(Duration.ofHours(2));
        assertThat(definition.getTasks()).extracting(TaskSpec::getId).containsExactly("ingest", "validate", "cluster");

        TaskSpec ingest = definition.getTask("ingest");
        assertThat(ingest.getKind()).isEqualTo(TaskKind.INGEST);
        assertThat(ingest.getTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(ingest.configString("sourceId")).isEqualTo("ubereats");
        assertThat(ingest.getRetry().getMaxAttempts()).isEqualTo(3);
        assertThat(ingest.getRetry().getInitialBackoff()).isEqualTo(Duration.ofSeconds(2));
        assertThat(ingest.getRetry().getMaxBackoff()).isNull();
        assertThat(ingest.getRetry().getMaxTotalWait()).isEqualTo(Duration.ofMinutes(10));

        List<ValidationRule> rules = definition.getTask("validate").getRules().getRules();
        assertThat(rules).extracting(ValidationRule::getType)
                .containsExactly(RuleType.RANGE, RuleType.KNOWN_SOURCE, RuleType.EXPRESSION);
        assertThat(rules.get(0).getMinValue()).isEqualTo(0.0);
        assertThat(rules.get(0).getMaxValue()).isEqualTo(5000.0);
        assertThat(rules.get(1).getKnownValues()).containsExactlyInAnyOrder("ubereats", "doordash");

        assertThat(definition.getTask("cluster").isOptional()).isTrue();
        assertThat(definition.getTask("cluster").getDependsOn()).containsExactly("validate");

        definition.validate();
    }

    @Test
    void testUnknownKindIsConfigurationError() {
        String yaml = """
                id: bad
                tasks:
                  - id: t
                    kind: TELEPORT
                """;

        assertThatThrownBy(() -> parser.parse(yaml))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("TELEPORT");
    }

    @Test
    void testInvalidDurationIsConfigurationError() {
        String yaml = """
                id: bad
                tasks:
                  - id: t
                    kind: FORECAST
                    timeout: soon
                """;

        assertThatThrownBy(() -> parser.parse(yaml))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("bad.t.timeout");
    }

    @Test
    void testMalformedYamlIsConfigurationError() {
        assertThatThrownBy(() -> parser.parse("id: [unterminated"))
                .isInstanceOf(ConfigurationException.class);
    }
}
