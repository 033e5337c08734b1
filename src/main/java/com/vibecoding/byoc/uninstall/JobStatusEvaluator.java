package com.vibecoding.byoc.uninstall;

import java.time.Duration;

/**
 * Job 상태 -> 다음 동작 (순수 함수)
 */
public final class JobStatusEvaluator {

    private JobStatusEvaluator() {
    }

    /**
     * @param snapshot 조회 결과, Job이 없으면(404) null
     * @param elapsed  폴링 시작 후 경과 시간
     * @param timeout  최대 대기 시간
     */
    public static PollDecision evaluate(JobSnapshot snapshot, Duration elapsed, Duration timeout) {
        if (snapshot == null) {
            return PollDecision.GONE;
        }
        if (snapshot.getSucceeded() > 0) {
            return PollDecision.SUCCEED;
        }
        if (snapshot.getFailed() > 0) {
            return PollDecision.FAIL;
        }
        if (elapsed.compareTo(timeout) >= 0) {
            return PollDecision.TIMEOUT;
        }
        return PollDecision.CONTINUE;
    }
}
