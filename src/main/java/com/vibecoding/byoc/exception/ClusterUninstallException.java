package com.vibecoding.byoc.exception;

/**
 * 클러스터 언인스톨 중 발생하는 예외
 */
public class ClusterUninstallException extends RuntimeException {

    public ClusterUninstallException(String message) {
        super(message);
    }

    public ClusterUninstallException(String message, Throwable cause) {
        super(message, cause);
    }
}
