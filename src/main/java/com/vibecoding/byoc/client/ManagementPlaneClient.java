package com.vibecoding.byoc.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.byoc.client.dto.CreateApiKeyResponse;
import com.vibecoding.byoc.client.dto.CreateProjectResponse;
import com.vibecoding.byoc.config.ControlPlaneConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * management plane 클라이언트 (Bearer 토큰 인증)
 */
@Component
public class ManagementPlaneClient extends ControlPlaneApiSupport {

    private static final Logger log = LoggerFactory.getLogger(ManagementPlaneClient.class);

    public static final String PROJECT_EDITOR_ROLE = "ProjectEditor";

    private final ControlPlaneConfig config;

    public ManagementPlaneClient(ControlPlaneClient client, ObjectMapper objectMapper, ControlPlaneConfig config) {
        super(client, objectMapper);
        this.config = config;
    }

    static String managementUrl(String apiUrl) {
        return trimTrailingSlash(apiUrl) + "/management";
    }

    private Map<String, String> headers(String accessToken) {
        return Map.of(
            "Authorization", "Bearer " + accessToken,
            config.getApiVersionHeader(), config.getApiVersion()
        );
    }

    public CreateProjectResponse createProject(String orgId, String projectName, String apiUrl, String accessToken) {
        log.info("Creating project '{}' in organization {}", projectName, orgId);
        JsonNode resp = client.request(HttpMethod.POST,
            endpoint(managementUrl(apiUrl), "organizations", orgId, "projects"),
            headers(accessToken), Map.of("name", projectName));
        return parse(resp, CreateProjectResponse.class, "id");
    }

    public CreateApiKeyResponse createApiKey(String projectId, String keyName, String apiUrl, String accessToken) {
        log.info("Minting API key '{}' for project {}", keyName, projectId);
        JsonNode resp = client.request(HttpMethod.POST,
            endpoint(managementUrl(apiUrl), "projects", projectId, "api-keys"),
            headers(accessToken), Map.of("name", keyName, "roles", List.of(PROJECT_EDITOR_ROLE)));
        return parse(resp, CreateApiKeyResponse.class, "key/id", "key/project_id", "value");
    }

    public void deleteProject(String projectId, String apiUrl, String accessToken) {
        log.info("Deleting project: {}", projectId);
        client.request(HttpMethod.DELETE,
            endpoint(managementUrl(apiUrl), "projects", projectId), headers(accessToken), null);
    }
}
