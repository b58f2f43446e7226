package com.restaurantbi.insightflow.infrastructure.connector;

import com.restaurantbi.insightflow.domain.batch.DataBatch;
import com.restaurantbi.insightflow.domain.connector.ConnectorAuthException;
import com.restaurantbi.insightflow.domain.connector.ConnectorUnavailableException;
import com.restaurantbi.insightflow.domain.connector.SourceConnector;
import com.restaurantbi.insightflow.domain.executor.TaskInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * HttpSourceConnector - HTTP 数据源连接器
 * <p>
 * 通过 GET {baseUrl}/sources/{sourceId}/records?since=... 拉取记录，
 * 响应体为记录数组。
 * </p>
 * <ul>
 *   <li>5xx、429、网络异常: ConnectorUnavailableException（可重试）</li>
 *   <li>401、403: ConnectorAuthException（不可重试）</li>
 *   <li>其余 4xx: TaskInputException（数据源标识或参数有误）</li>
 * </ul>
 * 
 * @author insightflow
 */
@Slf4j
public class HttpSourceConnector implements SourceConnector {

    private static final ParameterizedTypeReference<List<Map<String, Object>>> RECORDS_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final Clock clock;

    public HttpSourceConnector(RestTemplate restTemplate, String baseUrl, Clock clock) {
        if (!StringUtils.hasText(baseUrl)) {
            throw new IllegalArgumentException("Source connector requires a baseUrl");
        }
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.clock = clock;
    }

    @Override
    public DataBatch fetch(String sourceId, Instant since) {
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/sources/{sourceId}/records")
                .queryParam("since", since.toString())
                .buildAndExpand(sourceId)
                .toUriString();

        log.debug("Fetching records: GET {}", url);

        try {
            ResponseEntity<List<Map<String, Object>>> response =
                    restTemplate.exchange(url, HttpMethod.GET, null, RECORDS_TYPE);
            List<Map<String, Object>> records = response.getBody() != null
                    ? response.getBody() : Collections.emptyList();
            log.info("Fetched {} records from source [{}]", records.size(), sourceId);
            return DataBatch.of(sourceId, clock.instant(), records);
        } catch (HttpServerErrorException e) {
            throw new ConnectorUnavailableException(
                    "Source [" + sourceId + "] returned " + e.getStatusCode().value(), e);
        } catch (HttpClientErrorException e) {
            int status = e.getStatusCode().value();
            if (status == 401 || status == 403) {
                throw new ConnectorAuthException("Source [" + sourceId + "] rejected credentials: " + status);
            }
            if (status == 429) {
                throw new ConnectorUnavailableException("Source [" + sourceId + "] is rate limiting requests", e);
            }
            throw new TaskInputException("Source [" + sourceId + "] rejected request: " + status, e);
        } catch (ResourceAccessException e) {
            throw new ConnectorUnavailableException("Source [" + sourceId + "] is unreachable: " + e.getMessage(), e);
        }
    }
}
