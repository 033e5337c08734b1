package com.vibecoding.byoc.provider;

import com.vibecoding.byoc.client.ManagementPlaneClient;
import com.vibecoding.byoc.client.OAuthTokenClient;
import com.vibecoding.byoc.client.dto.CreateApiKeyResponse;
import com.vibecoding.byoc.client.dto.CreateProjectResponse;
import com.vibecoding.byoc.model.ProjectApiKeyProps;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 프로젝트 API 키 프로바이더
 * - create: 프로젝트 생성 -> ProjectEditor 역할 키 발급 (2단계)
 * - 키 발급 실패 시 방금 만든 프로젝트를 best-effort로 삭제한 뒤 원래 오류를 전달
 * - 리소스 ID는 프로젝트 ID (삭제는 프로젝트 단위)
 */
@Component
@RequiredArgsConstructor
public class ProjectApiKeyProvider implements ResourceProvider<ProjectApiKeyProps> {

    private static final Logger log = LoggerFactory.getLogger(ProjectApiKeyProvider.class);

    private final ManagementPlaneClient managementClient;
    private final OAuthTokenClient tokenClient;

    @Override
    public ResourceKind kind() {
        return ResourceKind.PROJECT_API_KEY;
    }

    @Override
    public Class<ProjectApiKeyProps> propsType() {
        return ProjectApiKeyProps.class;
    }

    @Override
    public CreateResult<ProjectApiKeyProps> create(ProjectApiKeyProps inputs) {
        String apiUrl = inputs.getApiUrl();
        String accessToken = accessToken(inputs);

        CreateProjectResponse project = managementClient.createProject(
            inputs.getOrgId(), inputs.getProjectName(), apiUrl, accessToken);

        CompensationActions compensation = new CompensationActions();
        compensation.register("delete project " + project.getId(),
            () -> managementClient.deleteProject(project.getId(), apiUrl, accessToken));

        CreateApiKeyResponse apiKey;
        try {
            apiKey = managementClient.createApiKey(project.getId(), inputs.getKeyName(), apiUrl, accessToken);
        } catch (RuntimeException e) {
            log.error("Failed to mint API key for project {}, rolling back project", project.getId(), e);
            compensation.compensate(e);
            throw e;
        }

        log.info("Created project {} with API key {}", apiKey.getKey().getProjectId(), apiKey.getKey().getId());

        return CreateResult.of(apiKey.getKey().getProjectId(), inputs.toBuilder()
            .apiKeyId(apiKey.getKey().getId())
            .projectId(apiKey.getKey().getProjectId())
            .value(apiKey.getValue())
            .build());
    }

    @Override
    public DiffResult diff(String id, ProjectApiKeyProps olds, ProjectApiKeyProps news) {
        // 키 값은 다시 조회할 수 없으므로 누락 시 교체
        if (!ProviderSupport.allPresent(olds.getValue())) {
            return DiffResult.forceReplace("value");
        }
        List<String> replaces = new ArrayList<>();
        if (ProviderSupport.differs(olds.getProjectName(), news.getProjectName())) {
            replaces.add("project_name");
        }
        if (ProviderSupport.differs(olds.getKeyName(), news.getKeyName())) {
            replaces.add("key_name");
        }
        if (ProviderSupport.differs(olds.getOrgId(), news.getOrgId())) {
            replaces.add("org_id");
        }
        return DiffResult.replacing(replaces, List.of("value", "api_key_id", "project_id"));
    }

    @Override
    public ProjectApiKeyProps update(String id, ProjectApiKeyProps olds, ProjectApiKeyProps news) {
        return news.toBuilder()
            .apiKeyId(olds.getApiKeyId())
            .projectId(olds.getProjectId())
            .value(olds.getValue())
            .build();
    }

    @Override
    public void delete(String id, ProjectApiKeyProps props) {
        if (!ProviderSupport.allPresent(id, props.getApiUrl(), props.getAuth0Domain(),
                props.getAuth0ClientId(), props.getAuth0ClientSecret())) {
            log.warn("Skipping delete of project {}: recorded state is missing auth settings", id);
            return;
        }
        String accessToken = accessToken(props);
        ProviderSupport.deleteIgnoringNotFound(log, "Project " + id,
            () -> managementClient.deleteProject(id, props.getApiUrl(), accessToken));
    }

    private String accessToken(ProjectApiKeyProps props) {
        return tokenClient.fetchAccessToken(
            props.getAuth0Domain(), props.getAuth0ClientId(), props.getAuth0ClientSecret(), props.getApiUrl());
    }
}
