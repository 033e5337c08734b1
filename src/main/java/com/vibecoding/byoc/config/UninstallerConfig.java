package com.vibecoding.byoc.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 클러스터 언인스톨 Job 설정
 */
@Configuration
@ConfigurationProperties(prefix = "byoc.uninstaller")
@Data
public class UninstallerConfig {

    private static final Logger log = LoggerFactory.getLogger(UninstallerConfig.class);

    private String namespace = "pc-control-plane";
    private String serviceAccount = "pinetools";
    private String jobNamePrefix = "pinetools-uninstall";
    private String containerName = "pinetools";
    private String command = "pinetools cluster uninstall --force";

    private int backoffLimit = 1;
    private long activeDeadlineSeconds = 600;
    private int ttlSecondsAfterFinished = 300;

    private Duration pollInterval = Duration.ofSeconds(10);
    private Duration timeout = Duration.ofSeconds(1800);

    // exec 기반 kubeconfig 토큰 갱신
    private Duration tokenRefreshTimeout = Duration.ofSeconds(10);

    @PostConstruct
    public void init() {
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalStateException("byoc.uninstaller.poll-interval must be positive");
        }
        if (timeout == null || timeout.compareTo(pollInterval) < 0) {
            throw new IllegalStateException("byoc.uninstaller.timeout must be at least one poll interval");
        }

        log.info("Uninstaller configuration: namespace={}, poll={}s, timeout={}s",
            namespace, pollInterval.toSeconds(), timeout.toSeconds());
    }
}
