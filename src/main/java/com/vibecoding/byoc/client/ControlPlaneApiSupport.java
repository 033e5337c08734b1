package com.vibecoding.byoc.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.byoc.exception.ControlPlaneApiException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * 컨트롤 플레인 엔드포인트 클라이언트 공통 기능 (URL 조합, 응답 검증)
 */
abstract class ControlPlaneApiSupport {

    protected final ControlPlaneClient client;
    protected final ObjectMapper objectMapper;

    protected ControlPlaneApiSupport(ControlPlaneClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    protected static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * 기준 URL 뒤에 경로 세그먼트를 붙임. 각 세그먼트는 퍼센트 인코딩 ("/"도 인코딩)
     */
    protected static String endpoint(String baseUrl, String... segments) {
        return UriComponentsBuilder.fromUriString(trimTrailingSlash(baseUrl))
            .pathSegment(segments)
            .build()
            .encode()
            .toUriString();
    }

    /**
     * 응답 본문을 DTO로 변환. 필수 필드는 JSON pointer 경로("key/id")로 지정
     */
    protected <T> T parse(JsonNode body, Class<T> type, String... requiredFields) {
        if (body == null || !body.isObject()) {
            throw invalidResponse("expected a JSON object but got " + (body == null ? "nothing" : body.toString()));
        }
        for (String field : requiredFields) {
            JsonNode value = body.at("/" + field);
            if (value.isMissingNode() || value.isNull() || (value.isTextual() && value.asText().isBlank())) {
                throw invalidResponse("missing field '" + field.replace('/', '.') + "'");
            }
        }
        try {
            return objectMapper.treeToValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ControlPlaneApiException(500, "invalid response: " + e.getOriginalMessage(), e);
        }
    }

    private static ControlPlaneApiException invalidResponse(String detail) {
        return new ControlPlaneApiException(500, "invalid response: " + detail);
    }
}
