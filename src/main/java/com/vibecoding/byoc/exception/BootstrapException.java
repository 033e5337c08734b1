package com.vibecoding.byoc.exception;

import com.vibecoding.byoc.bootstrap.BootstrapResult;

/**
 * 부트스트랩 도중 실패. 그때까지 생성된 리소스를 함께 전달
 */
public class BootstrapException extends RuntimeException {

    private final String failedStep;
    private final transient BootstrapResult partialResult;

    public BootstrapException(String failedStep, BootstrapResult partialResult, Throwable cause) {
        super("Bootstrap failed at " + failedStep + ": " + cause.getMessage(), cause);
        this.failedStep = failedStep;
        this.partialResult = partialResult;
    }

    public String getFailedStep() {
        return failedStep;
    }

    public BootstrapResult getPartialResult() {
        return partialResult;
    }
}
