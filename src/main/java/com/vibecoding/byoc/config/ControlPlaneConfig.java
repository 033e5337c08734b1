package com.vibecoding.byoc.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;


@Configuration
@ConfigurationProperties(prefix = "byoc.control-plane")
@Data
public class ControlPlaneConfig {

    private static final Logger log = LoggerFactory.getLogger(ControlPlaneConfig.class);

    private int maxRetries = 3;
    private Duration baseDelay = Duration.ofSeconds(2);
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(60);

    // management plane 버전 헤더
    private String apiVersionHeader = "X-Pinecone-Api-Version";
    private String apiVersion = "unstable";

    @PostConstruct
    public void init() {
        validateConfig();
    }

    public void validateConfig() {
        if (maxRetries < 0) {
            throw new IllegalStateException("byoc.control-plane.max-retries must not be negative");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalStateException("byoc.control-plane.base-delay must be a non-negative duration");
        }

        log.info("Control plane client configuration validated");
        log.info("  - Max retries: {}", maxRetries);
        log.info("  - Base delay: {}ms", baseDelay.toMillis());
        log.info("  - Timeouts: connect={}ms, read={}ms", connectTimeout.toMillis(), readTimeout.toMillis());
    }
}
