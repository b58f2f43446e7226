package com.restaurantbi.insightflow.app.catalog;

import com.restaurantbi.insightflow.app.parser.PipelineYamlParser;
import com.restaurantbi.insightflow.domain.exception.ConfigurationException;
import com.restaurantbi.insightflow.domain.pipeline.DefaultPipelineCatalog;
import com.restaurantbi.insightflow.domain.pipeline.PipelineDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * PipelineCatalogLoader - 从 YAML 文件加载流水线目录
 * <p>
 * 单个文件解析或校验失败只会使该流水线被标记为无效，其余文件照常加载。
 * 无法解析出 id 的文件以文件名（去掉扩展名）登记。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineCatalogLoader {

    private final PipelineYamlParser parser;

    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

    /**
     * @return 成功注册的流水线数
     */
    public int load(String locationPattern, DefaultPipelineCatalog catalog) {
        Resource[] resources;
        try {
            resources = resolver.getResources(locationPattern);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list pipeline definitions at " + locationPattern, e);
        }

        int registered = 0;
        for (Resource resource : resources) {
            if (loadOne(resource, catalog)) {
                registered++;
            }
        }
        log.info("Loaded {} of {} pipeline definitions from {}", registered, resources.length, locationPattern);
        return registered;
    }

    /**
     * 加载单个定义
     *
     * @return 是否注册成功
     */
    public boolean loadYaml(String fallbackId, String yamlContent, DefaultPipelineCatalog catalog) {
        String pipelineId = fallbackId;
        try {
            PipelineDefinition definition = parser.parse(yamlContent);
            if (StringUtils.hasText(definition.getId())) {
                pipelineId = definition.getId();
            }
            checkSchedule(definition);
            catalog.register(definition);
            return true;
        } catch (ConfigurationException e) {
            catalog.registerInvalid(pipelineId, e.getMessage());
            return false;
        }
    }

    private boolean loadOne(Resource resource, DefaultPipelineCatalog catalog) {
        String fallbackId = StringUtils.stripFilenameExtension(String.valueOf(resource.getFilename()));
        String content;
        try (InputStream in = resource.getInputStream()) {
            content = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            catalog.registerInvalid(fallbackId, "unreadable definition: " + e.getMessage());
            return false;
        }
        return loadYaml(fallbackId, content, catalog);
    }

    private static void checkSchedule(PipelineDefinition definition) {
        String schedule = definition.getSchedule();
        if (StringUtils.hasText(schedule) && !CronExpression.isValidExpression(schedule)) {
            throw new ConfigurationException("Pipeline [" + definition.getId()
                    + "] has an invalid cron schedule [" + schedule + "]");
        }
    }
}
