package com.vibecoding.byoc.exception;

/**
 * 일시적 컨트롤 플레인 오류 (5xx 재시도 소진, 네트워크 실패)
 */
public class ControlPlaneInternalException extends ControlPlaneException {

    public ControlPlaneInternalException(int statusCode, String responseBody) {
        super(statusCode + ": " + responseBody, statusCode, responseBody);
    }

    public ControlPlaneInternalException(String message, Throwable cause) {
        super(message, null, null, cause);
    }
}
