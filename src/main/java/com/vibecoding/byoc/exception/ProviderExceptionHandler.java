package com.vibecoding.byoc.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 프로바이더 API 예외 -> JSON 오류 응답
 * 형식: {error, status, message[, logs]}
 */
@RestControllerAdvice
public class ProviderExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ProviderExceptionHandler.class);

    @ExceptionHandler(ControlPlaneApiException.class)
    public ResponseEntity<Map<String, Object>> handleControlPlaneApi(ControlPlaneApiException ex) {
        log.error("Control plane rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "control_plane_api_error", ex.getStatusCode(), ex.getMessage());
    }

    @ExceptionHandler(ControlPlaneInternalException.class)
    public ResponseEntity<Map<String, Object>> handleControlPlaneInternal(ControlPlaneInternalException ex) {
        log.error("Control plane unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "control_plane_internal_error", ex.getStatusCode(), ex.getMessage());
    }

    @ExceptionHandler(UninstallJobFailedException.class)
    public ResponseEntity<Map<String, Object>> handleUninstallFailed(UninstallJobFailedException ex) {
        log.error("Cluster uninstall job {} failed", ex.getJobName());
        ResponseEntity<Map<String, Object>> response = error(HttpStatus.INTERNAL_SERVER_ERROR,
            "uninstall_failed", null, ex.getMessage());
        response.getBody().put("logs", ex.getLogs());
        return response;
    }

    @ExceptionHandler(ClusterUninstallException.class)
    public ResponseEntity<Map<String, Object>> handleClusterUninstall(ClusterUninstallException ex) {
        log.error("Cluster uninstall error: {}", ex.getMessage());
        String code = ex instanceof UninstallTimeoutException ? "uninstall_timeout" : "uninstall_error";
        return error(HttpStatus.INTERNAL_SERVER_ERROR, code, null, ex.getMessage());
    }

    @ExceptionHandler(BootstrapException.class)
    public ResponseEntity<Map<String, Object>> handleBootstrap(BootstrapException ex) {
        log.error("Bootstrap failed at {}: {}", ex.getFailedStep(), ex.getMessage());

        HttpStatus httpStatus = HttpStatus.INTERNAL_SERVER_ERROR;
        Integer remoteStatus = null;
        if (ex.getCause() instanceof ControlPlaneApiException) {
            httpStatus = HttpStatus.BAD_GATEWAY;
            remoteStatus = ((ControlPlaneApiException) ex.getCause()).getStatusCode();
        } else if (ex.getCause() instanceof ControlPlaneInternalException) {
            httpStatus = HttpStatus.SERVICE_UNAVAILABLE;
            remoteStatus = ((ControlPlaneInternalException) ex.getCause()).getStatusCode();
        }

        ResponseEntity<Map<String, Object>> response = error(httpStatus, "bootstrap_failed", remoteStatus, ex.getMessage());
        response.getBody().put("failed_step", ex.getFailedStep());
        response.getBody().put("partial_result", ex.getPartialResult());
        return response;
    }

    @ExceptionHandler({UnknownResourceKindException.class, IllegalArgumentException.class,
        HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        log.warn("Bad provider request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "bad_request", null, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", null, ex.getMessage());
    }

    /**
     * status: 원격 응답 코드가 있으면 그 값, 없으면 HTTP 응답 코드
     */
    private static ResponseEntity<Map<String, Object>> error(HttpStatus httpStatus, String code,
                                                             Integer remoteStatus, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("status", remoteStatus != null ? remoteStatus : httpStatus.value());
        body.put("message", message);
        return ResponseEntity.status(httpStatus).body(body);
    }
}
