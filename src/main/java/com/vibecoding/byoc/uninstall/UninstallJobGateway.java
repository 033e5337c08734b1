package com.vibecoding.byoc.uninstall;

import io.fabric8.kubernetes.api.model.batch.v1.Job;

import java.util.Optional;

/**
 * 대상 클러스터의 Job API 접근
 */
public interface UninstallJobGateway extends AutoCloseable {

    enum SubmitOutcome {
        CREATED,
        ALREADY_EXISTS
    }

    /**
     * 같은 이름의 Job이 이미 있으면 ALREADY_EXISTS (이전 destroy 시도가 남긴 Job)
     */
    SubmitOutcome submit(Job job);

    /**
     * Job이 사라졌으면 empty
     */
    Optional<JobSnapshot> readStatus(String namespace, String jobName);

    /**
     * Job 파드 로그 수집. 로그를 읽지 못한 파드는 건너뜀
     */
    String collectLogs(String namespace, String jobName);

    @Override
    void close();
}
