package com.vibecoding.byoc.uninstall;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class JobStatusEvaluatorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1800);

    @Test
    void testMissingJobIsGone() {
        assertThat(JobStatusEvaluator.evaluate(null, Duration.ZERO, TIMEOUT)).isEqualTo(PollDecision.GONE);
        assertThat(PollDecision.GONE.getPhase()).isEqualTo(UninstallPhase.ALREADY_GONE);
    }

    @Test
    void testSucceededWinsOverFailed() {
        JobSnapshot snapshot = JobSnapshot.builder().succeeded(1).failed(1).build();

        assertThat(JobStatusEvaluator.evaluate(snapshot, Duration.ZERO, TIMEOUT)).isEqualTo(PollDecision.SUCCEED);
    }

    @Test
    void testFailedJob() {
        JobSnapshot snapshot = JobSnapshot.builder().failed(2).build();

        PollDecision decision = JobStatusEvaluator.evaluate(snapshot, Duration.ofSeconds(60), TIMEOUT);

        assertThat(decision).isEqualTo(PollDecision.FAIL);
        assertThat(decision.getPhase()).isEqualTo(UninstallPhase.FAILED);
    }

    @Test
    void testActiveJobContinuesUntilTimeout() {
        JobSnapshot active = JobSnapshot.builder().active(1).build();

        assertThat(JobStatusEvaluator.evaluate(active, Duration.ofSeconds(1790), TIMEOUT)).isEqualTo(PollDecision.CONTINUE);
        assertThat(JobStatusEvaluator.evaluate(active, TIMEOUT, TIMEOUT)).isEqualTo(PollDecision.TIMEOUT);
    }

    @Test
    void testCompletionAtDeadlineStillSucceeds() {
        JobSnapshot done = JobSnapshot.builder().succeeded(1).build();

        assertThat(JobStatusEvaluator.evaluate(done, TIMEOUT.plusSeconds(10), TIMEOUT)).isEqualTo(PollDecision.SUCCEED);
    }
}
