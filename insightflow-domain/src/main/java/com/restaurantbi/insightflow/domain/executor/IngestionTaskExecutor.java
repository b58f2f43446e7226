package com.restaurantbi.insightflow.domain.executor;

import com.restaurantbi.insightflow.domain.batch.DataBatch;
import com.restaurantbi.insightflow.domain.connector.SourceConnector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * IngestionTaskExecutor - 采集任务执行器
 * <p>
 * 配置项: sourceId (必填)。拉取起点取逻辑键末尾的日期 (UTC 零点)，无日期时全量拉取。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class IngestionTaskExecutor implements TaskExecutor {

    private static final Pattern TRAILING_DATE = Pattern.compile("(\\d{4}-\\d{2}-\\d{2})$");

    private final SourceConnector connector;

    @Override
    public TaskResult execute(TaskContext context) {
        String sourceId = context.getSpec().configString("sourceId");
        if (sourceId == null || sourceId.isBlank()) {
            throw new TaskInputException("Ingestion task [" + context.getTaskId() + "] has no sourceId configured");
        }
        Instant since = sinceOf(context.getLogicalKey());
        context.getCancellation().throwIfCancelled();

        log.info("Fetching source [{}] since {} for run [{}]", sourceId, since, context.getRunId());
        DataBatch batch = connector.fetch(sourceId, since).withLogicalKey(context.getLogicalKey());
        return TaskResult.of(batch);
    }

    static Instant sinceOf(String logicalKey) {
        if (logicalKey == null) {
            return Instant.EPOCH;
        }
        Matcher matcher = TRAILING_DATE.matcher(logicalKey);
        if (!matcher.find()) {
            return Instant.EPOCH;
        }
        try {
            return LocalDate.parse(matcher.group(1)).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            throw new TaskInputException("Logical key [" + logicalKey + "] carries an invalid date", e);
        }
    }
}
