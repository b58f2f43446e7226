package com.restaurantbi.insightflow.app.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.restaurantbi.insightflow.app.dto.PipelineYamlDto;
import com.restaurantbi.insightflow.app.dto.RetryYamlDto;
import com.restaurantbi.insightflow.app.dto.RuleYamlDto;
import com.restaurantbi.insightflow.app.dto.TaskYamlDto;
import com.restaurantbi.insightflow.domain.exception.ConfigurationException;
import com.restaurantbi.insightflow.domain.pipeline.PipelineDefinition;
import com.restaurantbi.insightflow.domain.pipeline.RetryOverride;
import com.restaurantbi.insightflow.domain.pipeline.TaskKind;
import com.restaurantbi.insightflow.domain.pipeline.TaskSpec;
import com.restaurantbi.insightflow.domain.validation.RuleSet;
import com.restaurantbi.insightflow.domain.validation.RuleType;
import com.restaurantbi.insightflow.domain.validation.ValidationRule;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * PipelineYamlParser - 流水线 YAML 解析
 * <p>
 * 只做结构转换（种类、时长、规则类型）；DAG 校验在注册到目录时由 PipelineDefinition.validate 完成。
 * 时长支持 30s / 5m / 2h 以及 ISO-8601 (PT30S)。
 * </p>
 */
@Component
public class PipelineYamlParser {

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    /**
     * @throws ConfigurationException YAML 格式错误或字段取值不合法
     */
    public PipelineDefinition parse(String yamlContent) {
        PipelineYamlDto dto;
        try {
            dto = mapper.readValue(yamlContent, PipelineYamlDto.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Failed to parse pipeline YAML: " + e.getOriginalMessage(), e);
        }
        if (dto == null) {
            throw new ConfigurationException("Pipeline YAML is empty");
        }
        return convert(dto);
    }

    private PipelineDefinition convert(PipelineYamlDto dto) {
        PipelineDefinition.PipelineDefinitionBuilder builder = PipelineDefinition.builder()
                .id(dto.getId())
                .description(dto.getDescription())
                .schedule(dto.getSchedule())
                .runTimeout(duration(dto.getRunTimeout(), dto.getId() + ".runTimeout"));

        if (dto.getTasks() != null) {
            for (TaskYamlDto taskDto : dto.getTasks()) {
                builder.task(convertTask(dto.getId(), taskDto));
            }
        }
        return builder.build();
    }

    private TaskSpec convertTask(String pipelineId, TaskYamlDto taskDto) {
        String where = pipelineId + "." + taskDto.getId();
        TaskSpec.TaskSpecBuilder builder = TaskSpec.builder()
                .id(taskDto.getId())
                .kind(enumValue(TaskKind.class, taskDto.getKind(), where + ".kind"))
                .description(taskDto.getDescription())
                .timeout(duration(taskDto.getTimeout(), where + ".timeout"))
                .optional(Boolean.TRUE.equals(taskDto.getOptional()))
                .retry(convertRetry(taskDto.getRetry(), where));

        if (taskDto.getDependsOn() != null) {
            builder.dependsOn(taskDto.getDependsOn());
        }
        if (taskDto.getConfig() != null) {
            builder.config(taskDto.getConfig());
        }
        if (taskDto.getRules() != null) {
            builder.rules(RuleSet.of(taskDto.getRules().stream()
                    .map(rule -> convertRule(rule, where))
                    .collect(Collectors.toList())));
        }
        return builder.build();
    }

    private RetryOverride convertRetry(RetryYamlDto retryDto, String where) {
        if (retryDto == null) {
            return null;
        }
        return RetryOverride.builder()
                .maxAttempts(retryDto.getMaxAttempts())
                .initialBackoff(duration(retryDto.getInitialBackoff(), where + ".retry.initialBackoff"))
                .maxBackoff(duration(retryDto.getMaxBackoff(), where + ".retry.maxBackoff"))
                .maxTotalWait(duration(retryDto.getMaxTotalWait(), where + ".retry.maxTotalWait"))
                .build();
    }

    private ValidationRule convertRule(RuleYamlDto ruleDto, String where) {
        List<String> values = ruleDto.getValues();
        return ValidationRule.builder()
                .name(ruleDto.getName())
                .type(enumValue(RuleType.class, ruleDto.getType(), where + ".rules." + ruleDto.getName()))
                .field(ruleDto.getField())
                .minValue(ruleDto.getMin())
                .maxValue(ruleDto.getMax())
                .knownValues(values == null ? null : new LinkedHashSet<>(values))
                .pattern(ruleDto.getPattern())
                .expression(ruleDto.getExpression())
                .build();
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String value, String where) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown " + type.getSimpleName() + " [" + value + "] at " + where, e);
        }
    }

    private static Duration duration(String value, String where) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return DurationStyle.detectAndParse(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid duration [" + value + "] at " + where, e);
        }
    }
}
