package com.restaurantbi.insightflow.infrastructure.executor;

import com.restaurantbi.insightflow.domain.batch.DataBatch;
import com.restaurantbi.insightflow.domain.executor.TaskContext;
import com.restaurantbi.insightflow.domain.executor.TaskExecutionException;
import com.restaurantbi.insightflow.domain.executor.TaskExecutor;
import com.restaurantbi.insightflow.domain.executor.TaskInputException;
import com.restaurantbi.insightflow.domain.executor.TaskResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * HttpModelTaskExecutor - HTTP 模型任务执行器
 * <p>
 * 通用的分析任务执行器（NLP 查询、预测、聚类、重训练）。
 * 根据任务配置中的 baseUrl 和 endpoint 拼接 URL，未配置时使用默认模型服务地址和
 * /models/{kind}/invoke。每次调用携带 Idempotency-Key 请求头，同一任务的多次尝试共享该键。
 * </p>
 * <p>
 * 响应格式: {"output": ..., "metrics": {"mape": 0.12}}，缺少 output 时整个响应体作为产出。
 * </p>
 */
@Slf4j
public class HttpModelTaskExecutor implements TaskExecutor {

    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private static final Set<String> ROUTING_KEYS = Set.of("baseUrl", "endpoint");

    private final RestTemplate restTemplate;
    private final String defaultBaseUrl;

    public HttpModelTaskExecutor(RestTemplate restTemplate, String defaultBaseUrl) {
        this.restTemplate = restTemplate;
        this.defaultBaseUrl = defaultBaseUrl;
    }

    @Override
    public TaskResult execute(TaskContext context) {
        String url = buildUrl(context);
        context.getCancellation().throwIfCancelled();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(IDEMPOTENCY_HEADER, context.idempotencyKey());

        HttpEntity<Map<String, Object>> request = new HttpEntity<>(buildBody(context), headers);

        log.info("Invoking model: POST {} for task [{}] attempt {} of run [{}]",
                url, context.getTaskId(), context.getAttempt(), context.getRunId());

        Map<String, Object> body;
        try {
            ResponseEntity<Map<String, Object>> response =
                    restTemplate.exchange(url, HttpMethod.POST, request, RESPONSE_TYPE);
            body = response.getBody() != null ? response.getBody() : Collections.emptyMap();
        } catch (HttpClientErrorException e) {
            throw translateClientError(context, e);
        } catch (HttpServerErrorException e) {
            throw new TaskExecutionException("Model service returned " + e.getStatusCode().value()
                    + " for task [" + context.getTaskId() + "]", true, e);
        } catch (ResourceAccessException e) {
            throw new TaskExecutionException("Model service unreachable for task ["
                    + context.getTaskId() + "]: " + e.getMessage(), true, e);
        }

        return toResult(body);
    }

    private RuntimeException translateClientError(TaskContext context, HttpClientErrorException e) {
        int status = e.getStatusCode().value();
        String message = "Model service returned " + status + " for task [" + context.getTaskId() + "]";
        if (status == 400 || status == 422) {
            return new TaskInputException(message + ": " + e.getResponseBodyAsString(), e);
        }
        if (status == 429 || status == 408) {
            return new TaskExecutionException(message, true, e);
        }
        return new TaskExecutionException(message, false, e);
    }

    private Map<String, Object> buildBody(TaskContext context) {
        Map<String, Object> parameters = new LinkedHashMap<>(context.getConfig());
        ROUTING_KEYS.forEach(parameters::remove);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", context.getRunId());
        body.put("pipelineId", context.getPipelineId());
        body.put("taskId", context.getTaskId());
        body.put("logicalKey", context.getLogicalKey());
        body.put("attempt", context.getAttempt());
        body.put("modelId", context.modelId());
        body.put("parameters", parameters);

        DataBatch input = context.getInput();
        if (input != null) {
            body.put("batchId", input.getId());
            body.put("records", input.getRecords());
        }
        return body;
    }

    @SuppressWarnings("unchecked")
    private TaskResult toResult(Map<String, Object> body) {
        Object output = body.containsKey("output") ? body.get("output") : body;
        TaskResult.TaskResultBuilder builder = TaskResult.builder().output(output);

        Object metrics = body.get("metrics");
        if (metrics instanceof Map) {
            ((Map<String, Object>) metrics).forEach((name, value) -> {
                if (value instanceof Number) {
                    builder.metric(name, ((Number) value).doubleValue());
                } else {
                    log.debug("Ignoring non-numeric metric [{}]: {}", name, value);
                }
            });
        }
        return builder.build();
    }

    private String buildUrl(TaskContext context) {
        String endpoint = context.getSpec().configString("endpoint");
        // 1. 如果 endpoint 是绝对路径，直接使用
        if (endpoint != null && (endpoint.startsWith("http://") || endpoint.startsWith("https://"))) {
            return endpoint;
        }

        // 2. 任务配置的 baseUrl 优先，其次是默认模型服务地址
        String baseUrl = context.getSpec().configString("baseUrl");
        if (!StringUtils.hasText(baseUrl)) {
            baseUrl = defaultBaseUrl;
        }
        if (!StringUtils.hasText(baseUrl)) {
            throw new TaskInputException("Task [" + context.getTaskId()
                    + "] has no 'baseUrl' and no default model service is configured");
        }

        // 3. 拼接
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        String path = StringUtils.hasText(endpoint)
                ? endpoint
                : "/models/" + context.getKind().name().toLowerCase(Locale.ROOT) + "/invoke";
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        return baseUrl + path;
    }
}
