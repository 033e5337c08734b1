package com.vibecoding.byoc.uninstall;

/**
 * Job 상태 한 번 조회 후 다음 동작
 */
public enum PollDecision {
    CONTINUE(UninstallPhase.SUBMITTED),
    SUCCEED(UninstallPhase.SUCCEEDED),
    FAIL(UninstallPhase.FAILED),
    GONE(UninstallPhase.ALREADY_GONE),
    TIMEOUT(UninstallPhase.TIMED_OUT);

    private final UninstallPhase phase;

    PollDecision(UninstallPhase phase) {
        this.phase = phase;
    }

    public UninstallPhase getPhase() {
        return phase;
    }
}
