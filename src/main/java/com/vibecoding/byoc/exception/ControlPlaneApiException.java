package com.vibecoding.byoc.exception;

/**
 * 재시도하지 않는 컨트롤 플레인 오류 (4xx, 리다이렉트, 잘못된 응답 본문)
 */
public class ControlPlaneApiException extends ControlPlaneException {

    public ControlPlaneApiException(int statusCode, String responseBody) {
        super(statusCode + ": " + responseBody, statusCode, responseBody);
    }

    public ControlPlaneApiException(int statusCode, String responseBody, Throwable cause) {
        super(statusCode + ": " + responseBody, statusCode, responseBody, cause);
    }

    public boolean isNotFound() {
        return getStatusCode() != null && getStatusCode() == 404;
    }
}
