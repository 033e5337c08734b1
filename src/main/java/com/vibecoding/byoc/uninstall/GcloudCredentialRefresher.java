package com.vibecoding.byoc.uninstall;

import com.vibecoding.byoc.config.UninstallerConfig;
import com.vibecoding.byoc.exception.ClusterUninstallException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * GKE exec 인증용 gcloud 액세스 토큰 발급
 * 다른 클라우드는 exec 플러그인을 그대로 두고 fabric8이 직접 실행
 */
@Component
@RequiredArgsConstructor
public class GcloudCredentialRefresher implements ExecCredentialRefresher {

    private static final Logger log = LoggerFactory.getLogger(GcloudCredentialRefresher.class);

    static final List<String> PRINT_TOKEN_COMMAND = List.of("gcloud", "auth", "print-access-token");

    private final UninstallerConfig config;

    @Override
    public Optional<String> refreshToken(String cloud) {
        if (!"gcp".equalsIgnoreCase(cloud)) {
            log.debug("No token refresh for cloud '{}', keeping exec auth", cloud);
            return Optional.empty();
        }

        long timeoutMs = config.getTokenRefreshTimeout().toMillis();
        try {
            Process process = new ProcessBuilder(PRINT_TOKEN_COMMAND).start();
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ClusterUninstallException("gcloud did not return a token within " + timeoutMs + "ms");
            }

            String stdout = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
            if (process.exitValue() != 0 || stdout.isEmpty()) {
                String stderr = new String(process.getErrorStream().readAllBytes(), StandardCharsets.UTF_8).trim();
                throw new ClusterUninstallException("gcloud exited with " + process.exitValue() + ": " + stderr);
            }

            log.info("Obtained gcloud access token: {}...", stdout.substring(0, Math.min(10, stdout.length())));
            return Optional.of(stdout);
        } catch (IOException e) {
            throw new ClusterUninstallException("Failed to run gcloud: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClusterUninstallException("Interrupted while waiting for gcloud", e);
        }
    }
}
