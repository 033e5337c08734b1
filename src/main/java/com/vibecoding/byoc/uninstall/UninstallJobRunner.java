package com.vibecoding.byoc.uninstall;

import com.vibecoding.byoc.client.Sleeper;
import com.vibecoding.byoc.config.UninstallerConfig;
import com.vibecoding.byoc.exception.ClusterUninstallException;
import com.vibecoding.byoc.exception.UninstallJobFailedException;
import com.vibecoding.byoc.exception.UninstallTimeoutException;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.client.Config;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 언인스톨 Job 제출 후 종료 상태까지 폴링
 */
@Component
@RequiredArgsConstructor
public class UninstallJobRunner {

    private static final Logger log = LoggerFactory.getLogger(UninstallJobRunner.class);

    private final UninstallerConfig config;
    private final KubeconfigLoader kubeconfigLoader;
    private final UninstallJobFactory jobFactory;
    private final UninstallJobGatewayFactory gatewayFactory;
    private final Sleeper sleeper;
    private final Clock clock;

    /**
     * @return 성공 종료 상태 (SUCCEEDED 또는 ALREADY_GONE)
     * @throws UninstallJobFailedException Job이 실패를 보고한 경우
     * @throws UninstallTimeoutException   제한 시간 초과
     */
    public UninstallPhase run(String kubeconfig, String image, String cloud) {
        Config clientConfig = kubeconfigLoader.load(kubeconfig, cloud);
        String jobName = jobFactory.newJobName();
        Job job = jobFactory.build(jobName, image);
        String namespace = config.getNamespace();

        log.info("Running cluster uninstall job {}/{} with image {}", namespace, jobName, image);

        try (UninstallJobGateway gateway = gatewayFactory.open(clientConfig)) {
            UninstallJobGateway.SubmitOutcome outcome = gateway.submit(job);
            log.info("Uninstall job {} {}", jobName, outcome == UninstallJobGateway.SubmitOutcome.CREATED
                ? "submitted" : "already present, resuming");

            Instant startedAt = clock.instant();
            while (true) {
                Optional<JobSnapshot> snapshot = gateway.readStatus(namespace, jobName);
                // API 호출 시간까지 포함한 실제 경과 시간
                Duration elapsed = Duration.between(startedAt, clock.instant());
                PollDecision decision = JobStatusEvaluator.evaluate(snapshot.orElse(null), elapsed, config.getTimeout());

                switch (decision) {
                    case SUCCEED:
                        log.info("Uninstall job {} completed successfully", jobName);
                        return decision.getPhase();
                    case GONE:
                        log.warn("Uninstall job {} no longer exists, assuming it completed", jobName);
                        return decision.getPhase();
                    case FAIL:
                        String logs = gateway.collectLogs(namespace, jobName);
                        log.error("Uninstall job {} failed", jobName);
                        throw new UninstallJobFailedException(jobName, logs);
                    case TIMEOUT:
                        log.error("Uninstall job {} did not finish within {}s", jobName, config.getTimeout().toSeconds());
                        throw new UninstallTimeoutException(jobName, config.getTimeout());
                    default:
                        log.info("Uninstall job {} still running ({}s elapsed, active={})",
                            jobName, elapsed.toSeconds(), snapshot.map(JobSnapshot::getActive).orElse(0));
                        sleep(jobName);
                }
            }
        }
    }

    private void sleep(String jobName) {
        try {
            sleeper.sleep(config.getPollInterval());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClusterUninstallException("Interrupted while waiting for uninstall job " + jobName, e);
        }
    }
}
