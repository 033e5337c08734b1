package com.vibecoding.byoc.exception;

/**
 * 컨트롤 플레인(cpgw) 호출 중 발생하는 예외의 공통 부모
 */
public abstract class ControlPlaneException extends RuntimeException {

    private final Integer statusCode;
    private final String responseBody;

    protected ControlPlaneException(String message, Integer statusCode, String responseBody) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    protected ControlPlaneException(String message, Integer statusCode, String responseBody, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * 마지막 HTTP 응답 코드 (전송 계층 실패 시 null)
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
