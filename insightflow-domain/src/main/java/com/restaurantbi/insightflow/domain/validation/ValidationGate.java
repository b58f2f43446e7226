package com.restaurantbi.insightflow.domain.validation;

import com.restaurantbi.insightflow.domain.batch.DataBatch;
import com.restaurantbi.insightflow.domain.repository.ValidationResultRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * ValidationGate - 数据批次准入闸门
 * <p>
 * 对批次中的每一条记录执行全部规则，汇总所有违规（不做快速失败）。
 * 零违规即通过；任意违规即拒绝，拒绝的批次进入隔离区。
 * 批次本身从不被修改。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class ValidationGate {

    private final RuleExpressionEvaluator evaluator;
    private final ValidationResultRepository resultRepository;
    private final BatchQuarantine quarantine;
    private final Clock clock;

    /**
     * 校验批次并持久化结论
     *
     * @param runId 所属运行，可为空
     * @param batch 待校验批次
     * @param rules 规则集
     * @return 校验结论
     */
    public ValidationResult validate(String runId, DataBatch batch, RuleSet rules) {
        List<Violation> violations = evaluate(batch, rules);
        ValidationResult result = ValidationResult.builder()
                .id(UUID.randomUUID().toString())
                .runId(runId)
                .batchId(batch.getId())
                .passed(violations.isEmpty())
                .violations(Collections.unmodifiableList(violations))
                .evaluatedAt(Instant.now(clock))
                .build();

        resultRepository.save(result);

        if (result.isPassed()) {
            log.info("Batch [{}] passed validation ({} records)", batch.getId(), batch.getRecordCount());
        } else {
            log.warn("Batch [{}] rejected with {} violations, quarantined", batch.getId(), violations.size());
            quarantine.add(new BatchQuarantine.Entry(batch.getId(), runId, batch.getLogicalKey(),
                    batch.getSourceId(), violations.size(), result.getEvaluatedAt()));
        }
        return result;
    }

    public ValidationResult validate(DataBatch batch, RuleSet rules) {
        return validate(null, batch, rules);
    }

    private List<Violation> evaluate(DataBatch batch, RuleSet rules) {
        List<Violation> violations = new ArrayList<>();
        List<Map<String, Object>> records = batch.getRecords();
        for (int i = 0; i < records.size(); i++) {
            Map<String, Object> record = records.get(i);
            for (ValidationRule rule : rules.getRules()) {
                if (!rule.test(record, evaluator)) {
                    Object value = rule.getField() == null ? null : record.get(rule.getField());
                    violations.add(new Violation(i, rule.getField(), rule.getName(),
                            value == null ? null : String.valueOf(value)));
                }
            }
        }
        return violations;
    }
}
