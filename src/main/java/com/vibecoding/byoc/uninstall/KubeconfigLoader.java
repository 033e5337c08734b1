package com.vibecoding.byoc.uninstall;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.vibecoding.byoc.exception.ClusterUninstallException;
import io.fabric8.kubernetes.client.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * kubeconfig 파싱 (JSON 우선, YAML 대체) 및 exec 인증 토큰 주입
 * - AWS EKS는 JSON, GKE는 YAML 형식으로 전달됨
 */
@Component
public class KubeconfigLoader {

    private static final Logger log = LoggerFactory.getLogger(KubeconfigLoader.class);

    private static final Set<String> GKE_EXEC_COMMANDS = Set.of("gke-gcloud-auth-plugin", "gcloud");

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper jsonMapper;
    private final YAMLMapper yamlMapper = new YAMLMapper();
    private final ExecCredentialRefresher credentialRefresher;

    public KubeconfigLoader(ObjectMapper jsonMapper, ExecCredentialRefresher credentialRefresher) {
        this.jsonMapper = jsonMapper;
        this.credentialRefresher = credentialRefresher;
    }

    public Config load(String kubeconfig, String cloud) {
        Map<String, Object> prepared = prepare(kubeconfig, cloud);
        try {
            return Config.fromKubeconfig(yamlMapper.writeValueAsString(prepared));
        } catch (JsonProcessingException e) {
            throw new ClusterUninstallException("Failed to serialize kubeconfig: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 파싱 후 exec 인증이면 새 토큰으로 교체한 kubeconfig
     */
    Map<String, Object> prepare(String kubeconfig, String cloud) {
        Map<String, Object> parsed = parse(kubeconfig);

        boolean execAuth = usesExecAuth(parsed);
        log.info("Uninstaller kubeconfig auth: exec={}", execAuth);
        if (execAuth) {
            injectFreshToken(parsed, resolveCloud(cloud, parsed));
        }
        return parsed;
    }

    Map<String, Object> parse(String kubeconfig) {
        if (kubeconfig == null || kubeconfig.isBlank()) {
            throw new ClusterUninstallException("kubeconfig not provided to uninstaller");
        }
        try {
            return jsonMapper.readValue(kubeconfig, MAP_TYPE);
        } catch (JsonProcessingException jsonError) {
            log.debug("kubeconfig is not JSON, trying YAML: {}", jsonError.getOriginalMessage());
        }
        try {
            Map<String, Object> parsed = yamlMapper.readValue(kubeconfig, MAP_TYPE);
            if (parsed == null) {
                throw new ClusterUninstallException("Failed to parse kubeconfig as JSON or YAML: empty document");
            }
            return parsed;
        } catch (JsonProcessingException yamlError) {
            throw new ClusterUninstallException(
                "Failed to parse kubeconfig as JSON or YAML: " + yamlError.getOriginalMessage(), yamlError);
        }
    }

    @SuppressWarnings("unchecked")
    static boolean usesExecAuth(Map<String, Object> kubeconfig) {
        Object users = kubeconfig.get("users");
        if (!(users instanceof List) || ((List<?>) users).isEmpty()) {
            return false;
        }
        Object first = ((List<?>) users).get(0);
        if (!(first instanceof Map)) {
            return false;
        }
        Object user = ((Map<String, Object>) first).get("user");
        return user instanceof Map && ((Map<String, Object>) user).containsKey("exec");
    }

    /**
     * 기록된 cloud가 없으면 exec 명령으로 추정 (GKE 플러그인이면 gcp)
     */
    static String resolveCloud(String cloud, Map<String, Object> kubeconfig) {
        if (cloud != null && !cloud.isBlank()) {
            return cloud;
        }
        String command = execCommand(kubeconfig);
        if (command == null) {
            return cloud;
        }
        String executable = command.substring(Math.max(command.lastIndexOf('/'), command.lastIndexOf('\\')) + 1);
        if (GKE_EXEC_COMMANDS.contains(executable)) {
            log.info("No cloud recorded for uninstaller, exec command '{}' implies gcp", executable);
            return "gcp";
        }
        return cloud;
    }

    @SuppressWarnings("unchecked")
    static String execCommand(Map<String, Object> kubeconfig) {
        if (!usesExecAuth(kubeconfig)) {
            return null;
        }
        Map<String, Object> first = (Map<String, Object>) ((List<?>) kubeconfig.get("users")).get(0);
        Object exec = ((Map<String, Object>) first.get("user")).get("exec");
        if (!(exec instanceof Map)) {
            return null;
        }
        Object command = ((Map<String, Object>) exec).get("command");
        return command instanceof String ? (String) command : null;
    }

    /**
     * 토큰 발급에 실패하면 경고만 남기고 exec 인증을 그대로 사용
     */
    @SuppressWarnings("unchecked")
    private void injectFreshToken(Map<String, Object> kubeconfig, String cloud) {
        Optional<String> token;
        try {
            token = credentialRefresher.refreshToken(cloud);
        } catch (RuntimeException e) {
            log.warn("Failed to refresh cluster token, keeping exec auth: {}", e.getMessage());
            return;
        }
        if (token.isEmpty()) {
            return;
        }

        for (Object entry : (List<Object>) kubeconfig.get("users")) {
            if (entry instanceof Map) {
                Map<String, Object> tokenUser = new HashMap<>();
                tokenUser.put("token", token.get());
                ((Map<String, Object>) entry).put("user", tokenUser);
            }
        }
        log.info("Injected refreshed token into kubeconfig users");
    }
}
