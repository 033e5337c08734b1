package com.vibecoding.byoc.uninstall;

import com.vibecoding.byoc.config.UninstallerConfig;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 언인스톨 Job 매니페스트 생성
 */
@Component
@RequiredArgsConstructor
public class UninstallJobFactory {

    static final String DISK_PRESSURE_TAINT = "node.kubernetes.io/disk-pressure";

    private final UninstallerConfig config;

    /**
     * 재시도된 destroy 간 이름 충돌을 피하기 위해 임의 접미사 사용
     */
    public String newJobName() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return config.getJobNamePrefix() + "-" + suffix;
    }

    public Job build(String jobName, String image) {
        return new JobBuilder()
            .withNewMetadata()
                .withName(jobName)
                .withNamespace(config.getNamespace())
                .addToLabels("app.kubernetes.io/name", config.getContainerName())
                .addToLabels("app.kubernetes.io/component", "uninstall")
            .endMetadata()
            .withNewSpec()
                .withBackoffLimit(config.getBackoffLimit())
                .withActiveDeadlineSeconds(config.getActiveDeadlineSeconds())
                .withTtlSecondsAfterFinished(config.getTtlSecondsAfterFinished())
                .withNewTemplate()
                    .withNewSpec()
                        .withServiceAccountName(config.getServiceAccount())
                        .withRestartPolicy("OnFailure")
                        .addNewToleration()
                            .withKey(DISK_PRESSURE_TAINT)
                            .withOperator("Exists")
                            .withEffect("NoSchedule")
                        .endToleration()
                        .addNewContainer()
                            .withName(config.getContainerName())
                            .withImage(image)
                            .withCommand("/bin/sh", "-c")
                            .withArgs(config.getCommand())
                            .withNewResources()
                                .addToRequests("ephemeral-storage", new Quantity("1Gi"))
                                .addToRequests("memory", new Quantity("512Mi"))
                                .addToRequests("cpu", new Quantity("100m"))
                                .addToLimits("ephemeral-storage", new Quantity("5Gi"))
                                .addToLimits("memory", new Quantity("2Gi"))
                            .endResources()
                        .endContainer()
                    .endSpec()
                .endTemplate()
            .endSpec()
            .build();
    }
}
