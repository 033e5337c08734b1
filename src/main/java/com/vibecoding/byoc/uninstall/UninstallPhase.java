package com.vibecoding.byoc.uninstall;

/**
 * 언인스톨 진행 단계
 * SUBMITTED -> {SUCCEEDED, FAILED, TIMED_OUT, ALREADY_GONE}
 */
public enum UninstallPhase {
    SUBMITTED,
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    ALREADY_GONE
}
