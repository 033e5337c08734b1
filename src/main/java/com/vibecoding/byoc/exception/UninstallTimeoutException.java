package com.vibecoding.byoc.exception;

import java.time.Duration;

/**
 * 언인스톨 Job이 제한 시간 안에 종료 상태에 도달하지 못한 경우
 */
public class UninstallTimeoutException extends ClusterUninstallException {

    private final String jobName;
    private final Duration timeout;

    public UninstallTimeoutException(String jobName, Duration timeout) {
        super(String.format("Uninstall job %s timed out after %ds. Check cluster health, then run destroy again to retry.",
            jobName, timeout.toSeconds()));
        this.jobName = jobName;
        this.timeout = timeout;
    }

    public String getJobName() {
        return jobName;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
