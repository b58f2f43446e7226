package com.restaurantbi.insightflow.app.config;

import com.restaurantbi.insightflow.domain.feedback.FeedbackSettings;
import com.restaurantbi.insightflow.domain.monitor.MonitorSettings;
import com.restaurantbi.insightflow.domain.retry.RetrySettings;
import com.restaurantbi.insightflow.domain.service.EngineSettings;
import com.restaurantbi.insightflow.domain.service.RetentionSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * InsightflowProperties - application.yml 中 insightflow.* 配置
 * <p>
 * 各分节直接绑定到领域参数对象，未配置的项保留领域默认值。
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "insightflow")
public class InsightflowProperties {

    /**
     * 流水线定义文件位置
     */
    private String pipelinesLocation = "classpath*:pipelines/*.yml";

    private EngineSettings engine = new EngineSettings();

    private RetrySettings retry = new RetrySettings();

    private MonitorSettings monitor = new MonitorSettings();

    private FeedbackSettings feedback = new FeedbackSettings();

    private RetentionSettings retention = new RetentionSettings();

    private Scheduler scheduler = new Scheduler();

    private Endpoint connector = new Endpoint();

    private Endpoint model = new Endpoint();

    /**
     * 隔离区最多保留的被拒批次数
     */
    private int quarantineCapacity = 1000;

    @Data
    public static class Scheduler {

        /**
         * 是否按流水线 schedule 自动触发；未声明 schedule 的流水线只接受手动或重训练触发
         */
        private boolean enabled = true;

        /**
         * cron 与逻辑键日期使用的时区
         */
        private String zone = "UTC";

        /**
         * 反馈评估与过期运行清理的间隔
         */
        private Duration maintenanceInterval = Duration.ofHours(1);
    }

    @Data
    public static class Endpoint {

        private String baseUrl;

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(60);
    }
}
