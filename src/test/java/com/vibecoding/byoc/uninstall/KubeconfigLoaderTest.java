package com.vibecoding.byoc.uninstall;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.byoc.config.UninstallerConfig;
import com.vibecoding.byoc.exception.ClusterUninstallException;
import io.fabric8.kubernetes.client.Config;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KubeconfigLoaderTest {

    private static final String TOKEN_KUBECONFIG_JSON = "{"
        + "\"apiVersion\":\"v1\",\"kind\":\"Config\",\"current-context\":\"byoc\","
        + "\"clusters\":[{\"name\":\"byoc\",\"cluster\":{\"server\":\"https://10.0.0.1:6443\"}}],"
        + "\"contexts\":[{\"name\":\"byoc\",\"context\":{\"cluster\":\"byoc\",\"user\":\"admin\"}}],"
        + "\"users\":[{\"name\":\"admin\",\"user\":{\"token\":\"static-token\"}}]"
        + "}";

    private static final String EXEC_KUBECONFIG_YAML = String.join("\n",
        "apiVersion: v1",
        "kind: Config",
        "current-context: gke",
        "clusters:",
        "- name: gke",
        "  cluster:",
        "    server: https://10.0.0.2",
        "contexts:",
        "- name: gke",
        "  context:",
        "    cluster: gke",
        "    user: gke-user",
        "users:",
        "- name: gke-user",
        "  user:",
        "    exec:",
        "      apiVersion: client.authentication.k8s.io/v1beta1",
        "      command: gke-gcloud-auth-plugin",
        "");

    @Test
    void testJsonKubeconfigIsLoaded() {
        KubeconfigLoader loader = new KubeconfigLoader(new ObjectMapper(), cloud -> Optional.empty());

        Config config = loader.load(TOKEN_KUBECONFIG_JSON, "aws");

        assertThat(config.getMasterUrl()).contains("10.0.0.1:6443");
    }

    @Test
    void testYamlKubeconfigIsParsed() {
        KubeconfigLoader loader = new KubeconfigLoader(new ObjectMapper(), cloud -> Optional.empty());

        Map<String, Object> parsed = loader.parse(EXEC_KUBECONFIG_YAML);

        assertThat(parsed).containsEntry("current-context", "gke");
        assertThat(KubeconfigLoader.usesExecAuth(parsed)).isTrue();
    }

    @Test
    void testUnparseableKubeconfigFails() {
        KubeconfigLoader loader = new KubeconfigLoader(new ObjectMapper(), cloud -> Optional.empty());

        assertThatThrownBy(() -> loader.load("just some text", "aws"))
            .isInstanceOf(ClusterUninstallException.class)
            .hasMessageContaining("Failed to parse kubeconfig");
    }

    @Test
    @SuppressWarnings("unchecked")
    void testExecAuthIsReplacedByRefreshedToken() {
        KubeconfigLoader loader = new KubeconfigLoader(new ObjectMapper(),
            cloud -> "gcp".equals(cloud) ? Optional.of("ya29.fresh") : Optional.empty());

        Map<String, Object> prepared = loader.prepare(EXEC_KUBECONFIG_YAML, "gcp");

        Map<String, Object> user = (Map<String, Object>) ((List<Map<String, Object>>) prepared.get("users")).get(0);
        assertThat((Map<String, Object>) user.get("user")).containsExactly(Map.entry("token", "ya29.fresh"));
        assertThat(KubeconfigLoader.usesExecAuth(prepared)).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void testGkeExecAuthIsRefreshedWhenCloudIsMissing() {
        // given
        List<String> requestedClouds = new ArrayList<>();
        KubeconfigLoader loader = new KubeconfigLoader(new ObjectMapper(), cloud -> {
            requestedClouds.add(cloud);
            return "gcp".equals(cloud) ? Optional.of("ya29.fresh") : Optional.empty();
        });

        // when
        Map<String, Object> prepared = loader.prepare(EXEC_KUBECONFIG_YAML, null);

        // then
        assertThat(requestedClouds).containsExactly("gcp");
        Map<String, Object> user = (Map<String, Object>) ((List<Map<String, Object>>) prepared.get("users")).get(0);
        assertThat((Map<String, Object>) user.get("user")).containsExactly(Map.entry("token", "ya29.fresh"));
    }

    @Test
    void testRecordedCloudWinsOverExecCommand() {
        Map<String, Object> parsed = new KubeconfigLoader(new ObjectMapper(), cloud -> Optional.empty())
            .parse(EXEC_KUBECONFIG_YAML);

        assertThat(KubeconfigLoader.execCommand(parsed)).isEqualTo("gke-gcloud-auth-plugin");
        assertThat(KubeconfigLoader.resolveCloud("aws", parsed)).isEqualTo("aws");
        assertThat(KubeconfigLoader.resolveCloud("", parsed)).isEqualTo("gcp");
    }

    @Test
    void testRefreshFailureKeepsExecAuth() {
        KubeconfigLoader loader = new KubeconfigLoader(new ObjectMapper(), cloud -> {
            throw new ClusterUninstallException("gcloud exited with 1");
        });

        Map<String, Object> prepared = loader.prepare(EXEC_KUBECONFIG_YAML, "gcp");

        assertThat(KubeconfigLoader.usesExecAuth(prepared)).isTrue();
    }

    @Test
    void testNonGcpCloudNeedsNoRefresh() {
        GcloudCredentialRefresher refresher = new GcloudCredentialRefresher(new UninstallerConfig());

        assertThat(refresher.refreshToken("aws")).isEmpty();
        assertThat(refresher.refreshToken("azure")).isEmpty();
    }
}
