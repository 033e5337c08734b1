package com.vibecoding.byoc.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.vibecoding.byoc.config.ControlPlaneConfig;
import com.vibecoding.byoc.exception.ControlPlaneApiException;
import com.vibecoding.byoc.exception.ControlPlaneInternalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * 컨트롤 플레인 HTTP 클라이언트
 * - 2xx: JSON 본문 파싱 (JSON이 아니면 텍스트 노드)
 * - 5xx: 지수 백오프로 재시도, 소진 시 ControlPlaneInternalException
 * - 그 외: 즉시 ControlPlaneApiException
 */
@Component
public class ControlPlaneClient {

    private static final Logger log = LoggerFactory.getLogger(ControlPlaneClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;
    private final ControlPlaneConfig config;

    public ControlPlaneClient(RestTemplate restTemplate, ObjectMapper objectMapper,
                              Sleeper sleeper, ControlPlaneConfig config) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
        this.config = config;
    }

    public JsonNode request(HttpMethod method, String url, Map<String, String> headers, Object body) {
        return request(method, url, headers, body, config.getMaxRetries(), config.getBaseDelay());
    }

    public JsonNode request(HttpMethod method, String url, Map<String, String> headers, Object body,
                            int maxRetries, Duration baseDelay) {
        HttpHeaders httpHeaders = new HttpHeaders();
        httpHeaders.setContentType(MediaType.APPLICATION_JSON);
        headers.forEach(httpHeaders::set);
        HttpEntity<Object> entity = new HttpEntity<>(body, httpHeaders);

        for (int attempt = 0; ; attempt++) {
            ResponseEntity<String> response;
            try {
                response = restTemplate.exchange(URI.create(url), method, entity, String.class);
            } catch (ResourceAccessException e) {
                log.error("Control plane request failed: {} {}", method, url, e);
                throw new ControlPlaneInternalException(
                    String.format("%s %s failed: %s", method, url, e.getMessage()), e);
            }

            HttpStatusCode status = response.getStatusCode();
            String responseBody = response.getBody() != null ? response.getBody() : "";

            if (status.is2xxSuccessful()) {
                log.debug("{} {} -> {}", method, url, status.value());
                return parseBody(responseBody);
            }

            if (status.is5xxServerError()) {
                if (attempt < maxRetries) {
                    Duration delay = baseDelay.multipliedBy(1L << attempt);
                    log.warn("{} {} returned {}, retrying in {}ms (attempt {}/{})",
                        method, url, status.value(), delay.toMillis(), attempt + 1, maxRetries);
                    backoff(delay);
                    continue;
                }
                log.error("{} {} returned {} after {} retries", method, url, status.value(), maxRetries);
                throw new ControlPlaneInternalException(status.value(), responseBody);
            }

            log.warn("{} {} returned {}: {}", method, url, status.value(), responseBody);
            throw new ControlPlaneApiException(status.value(), responseBody);
        }
    }

    private JsonNode parseBody(String responseBody) {
        if (responseBody.isBlank()) {
            return TextNode.valueOf(responseBody);
        }
        try {
            return objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(responseBody);
        }
    }

    private void backoff(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ControlPlaneInternalException("Interrupted while waiting to retry", e);
        }
    }
}
