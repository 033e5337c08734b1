package com.vibecoding.byoc.uninstall;

import com.vibecoding.byoc.exception.ClusterUninstallException;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobStatus;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.HttpURLConnection;
import java.util.List;
import java.util.Optional;

/**
 * fabric8 클라이언트 기반 Job 게이트웨이
 */
public class Fabric8UninstallJobGateway implements UninstallJobGateway {

    private static final Logger log = LoggerFactory.getLogger(Fabric8UninstallJobGateway.class);

    static final String JOB_NAME_LABEL = "job-name";

    private final KubernetesClient client;

    public Fabric8UninstallJobGateway(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public SubmitOutcome submit(Job job) {
        String namespace = job.getMetadata().getNamespace();
        String name = job.getMetadata().getName();
        try {
            client.batch().v1().jobs()
                .inNamespace(namespace)
                .resource(job)
                .create();
            log.info("Created uninstall job: {}/{}", namespace, name);
            return SubmitOutcome.CREATED;
        } catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_CONFLICT) {
                log.info("Uninstall job {}/{} already exists, polling it", namespace, name);
                return SubmitOutcome.ALREADY_EXISTS;
            }
            log.error("Failed to create uninstall job: {}/{}", namespace, name, e);
            throw new ClusterUninstallException("Failed to create uninstall job: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<JobSnapshot> readStatus(String namespace, String jobName) {
        Job job;
        try {
            job = client.batch().v1().jobs()
                .inNamespace(namespace)
                .withName(jobName)
                .get();
        } catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_NOT_FOUND) {
                return Optional.empty();
            }
            log.error("Failed to read uninstall job status: {}/{}", namespace, jobName, e);
            throw new ClusterUninstallException("Failed to read uninstall job status: " + e.getMessage(), e);
        }

        if (job == null) {
            return Optional.empty();
        }

        JobStatus status = job.getStatus();
        if (status == null) {
            return Optional.of(JobSnapshot.builder().build());
        }
        return Optional.of(JobSnapshot.builder()
            .active(orZero(status.getActive()))
            .succeeded(orZero(status.getSucceeded()))
            .failed(orZero(status.getFailed()))
            .build());
    }

    @Override
    public String collectLogs(String namespace, String jobName) {
        List<Pod> pods;
        try {
            pods = client.pods()
                .inNamespace(namespace)
                .withLabel(JOB_NAME_LABEL, jobName)
                .list()
                .getItems();
        } catch (KubernetesClientException e) {
            log.warn("Failed to list pods for job {}/{}: {}", namespace, jobName, e.getMessage());
            return "(failed to list job pods: " + e.getMessage() + ")";
        }

        StringBuilder logs = new StringBuilder();
        for (Pod pod : pods) {
            String podName = pod.getMetadata().getName();
            try {
                String podLog = client.pods()
                    .inNamespace(namespace)
                    .withName(podName)
                    .getLog();
                if (podLog != null) {
                    logs.append(podLog);
                }
            } catch (KubernetesClientException e) {
                log.warn("Failed to read logs of pod {}/{}: {}", namespace, podName, e.getMessage());
            }
        }
        return logs.toString();
    }

    @Override
    public void close() {
        client.close();
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
