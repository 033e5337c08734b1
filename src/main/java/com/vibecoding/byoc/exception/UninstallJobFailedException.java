package com.vibecoding.byoc.exception;

/**
 * 언인스톨 Job이 실행되었으나 실패를 보고한 경우
 */
public class UninstallJobFailedException extends ClusterUninstallException {

    private final String jobName;
    private final String logs;

    public UninstallJobFailedException(String jobName, String logs) {
        super(String.format("Uninstall job %s failed. Run destroy again to retry.%nLogs:%n%s", jobName, logs));
        this.jobName = jobName;
        this.logs = logs;
    }

    public String getJobName() {
        return jobName;
    }

    public String getLogs() {
        return logs;
    }
}
