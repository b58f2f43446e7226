package com.restaurantbi.insightflow.app.scheduler;

import com.restaurantbi.insightflow.app.config.InsightflowProperties;
import com.restaurantbi.insightflow.app.service.PipelineRunAppService;
import com.restaurantbi.insightflow.domain.exception.InsightflowException;
import com.restaurantbi.insightflow.domain.pipeline.PipelineCatalog;
import com.restaurantbi.insightflow.domain.pipeline.PipelineDefinition;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

/**
 * PipelineTriggerScheduler - 按流水线 cron 定时触发
 * <p>
 * 逻辑键为触发当天的日期（配置时区），同一天重复触发会因已有活动运行而被跳过。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineTriggerScheduler {

    private final PipelineCatalog catalog;
    private final PipelineRunAppService runAppService;
    private final TaskScheduler taskScheduler;
    private final InsightflowProperties properties;
    private final Clock clock;

    private final List<ScheduledFuture<?>> scheduled = new CopyOnWriteArrayList<>();

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!properties.getScheduler().isEnabled()) {
            log.info("Pipeline scheduler disabled");
            return;
        }
        ZoneId zone = zone();
        for (PipelineDefinition definition : catalog.definitions()) {
            if (!StringUtils.hasText(definition.getSchedule())) {
                continue;
            }
            String pipelineId = definition.getId();
            scheduled.add(taskScheduler.schedule(() -> fire(pipelineId),
                    new CronTrigger(definition.getSchedule(), zone)));
            log.info("Scheduled pipeline [{}] with cron [{}] ({})", pipelineId, definition.getSchedule(), zone);
        }
    }

    /**
     * 以当天日期为逻辑键触发一次
     */
    public Optional<String> fire(String pipelineId) {
        String logicalKey = LocalDate.now(clock.withZone(zone())).toString();
        try {
            return runAppService.triggerScheduled(pipelineId, logicalKey);
        } catch (InsightflowException e) {
            log.error("Scheduled trigger of pipeline [{}] key [{}] failed: {}", pipelineId, logicalKey, e.getMessage());
            return Optional.empty();
        }
    }

    @PreDestroy
    public void stop() {
        scheduled.forEach(future -> future.cancel(false));
        scheduled.clear();
    }

    private ZoneId zone() {
        return ZoneId.of(properties.getScheduler().getZone());
    }
}
