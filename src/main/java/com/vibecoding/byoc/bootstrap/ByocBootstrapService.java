package com.vibecoding.byoc.bootstrap;

import com.vibecoding.byoc.exception.BootstrapException;
import com.vibecoding.byoc.model.AmpAccessProps;
import com.vibecoding.byoc.model.CpgwApiKeyProps;
import com.vibecoding.byoc.model.DatadogApiKeyProps;
import com.vibecoding.byoc.model.DnsDelegationProps;
import com.vibecoding.byoc.model.EnvironmentProps;
import com.vibecoding.byoc.model.ProjectApiKeyProps;
import com.vibecoding.byoc.model.ServiceAccountProps;
import com.vibecoding.byoc.provider.AmpAccessProvider;
import com.vibecoding.byoc.provider.CpgwApiKeyProvider;
import com.vibecoding.byoc.provider.CreateResult;
import com.vibecoding.byoc.provider.DatadogApiKeyProvider;
import com.vibecoding.byoc.provider.DnsDelegationProvider;
import com.vibecoding.byoc.provider.EnvironmentProvider;
import com.vibecoding.byoc.provider.ProjectApiKeyProvider;
import com.vibecoding.byoc.provider.ResourceProvider;
import com.vibecoding.byoc.provider.ServiceAccountProvider;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;

/**
 * 컨트롤 플레인 리소스 부트스트랩
 * Environment -> CpgwApiKey -> ServiceAccount -> ProjectApiKey -> DatadogApiKey -> [DnsDelegation] -> [AmpAccess]
 * 각 단계의 출력이 다음 단계의 입력이 됨
 */
@Service
@RequiredArgsConstructor
public class ByocBootstrapService {

    private static final Logger log = LoggerFactory.getLogger(ByocBootstrapService.class);

    private final EnvironmentProvider environmentProvider;
    private final CpgwApiKeyProvider cpgwApiKeyProvider;
    private final ServiceAccountProvider serviceAccountProvider;
    private final ProjectApiKeyProvider projectApiKeyProvider;
    private final DatadogApiKeyProvider datadogApiKeyProvider;
    private final DnsDelegationProvider dnsDelegationProvider;
    private final AmpAccessProvider ampAccessProvider;

    /**
     * @throws BootstrapException 실패한 단계와 그때까지 생성된 리소스 포함
     */
    public BootstrapResult bootstrap(BootstrapRequest request) {
        validate(request);
        String apiUrl = request.getApiUrl();
        BootstrapResult result = new BootstrapResult();

        log.info("Bootstrapping BYOC environment: cloud={}, region={}, global_env={}",
            request.getCloud(), request.getRegion(), request.getGlobalEnv());

        CreateResult<EnvironmentProps> environment = step("environment", result, () ->
            environmentProvider.create(EnvironmentProps.builder()
                .cloud(request.getCloud())
                .region(request.getRegion())
                .globalEnv(request.getGlobalEnv())
                .apiUrl(apiUrl)
                .secret(request.getPineconeApiKey())
                .build()));
        result.setEnvironment(environment);

        EnvironmentProps env = environment.getOutputs();
        String cellName = step("cell-name", result, () -> CellNames.cellName(env.getOrgName(), env.getEnvName()));
        result.setCellName(cellName);
        log.info("Cell name: {}", cellName);

        CreateResult<CpgwApiKeyProps> cpgwApiKey = step("cpgw-api-key", result, () ->
            cpgwApiKeyProvider.create(CpgwApiKeyProps.builder()
                .environment(env.getEnvName())
                .apiUrl(apiUrl)
                .pineconeApiKey(request.getPineconeApiKey())
                .build()));
        result.setCpgwApiKey(cpgwApiKey);
        String cpgwKey = cpgwApiKey.getOutputs().getKey();

        CreateResult<ServiceAccountProps> serviceAccount = step("service-account", result, () ->
            serviceAccountProvider.create(ServiceAccountProps.builder()
                .name(CellNames.serviceAccountName(cellName))
                .apiUrl(apiUrl)
                .secret(cpgwKey)
                .build()));
        result.setServiceAccount(serviceAccount);

        CreateResult<ProjectApiKeyProps> projectApiKey = step("project-api-key", result, () ->
            projectApiKeyProvider.create(ProjectApiKeyProps.builder()
                .orgId(env.getOrgId())
                .projectName(projectName(request))
                .keyName(CellNames.apiKeyName(cellName))
                .apiUrl(apiUrl)
                .auth0Domain(request.getAuth0Domain())
                .auth0ClientId(serviceAccount.getOutputs().getClientId())
                .auth0ClientSecret(serviceAccount.getOutputs().getClientSecret())
                .build()));
        result.setProjectApiKey(projectApiKey);

        result.setDatadogApiKey(step("datadog-api-key", result, () ->
            datadogApiKeyProvider.create(DatadogApiKeyProps.builder()
                .apiUrl(apiUrl)
                .secret(cpgwKey)
                .build())));

        List<String> nameservers = request.getNameservers();
        if (nameservers != null && !nameservers.isEmpty()) {
            result.setDnsDelegation(step("dns-delegation", result, () ->
                dnsDelegationProvider.create(DnsDelegationProps.builder()
                    .subdomain(CellNames.subdomain(env.getEnvName()))
                    .nameservers(nameservers)
                    .apiUrl(apiUrl)
                    .secret(cpgwKey)
                    .build())));
        }

        String workloadRoleArn = request.getWorkloadRoleArn();
        if (workloadRoleArn != null && !workloadRoleArn.isBlank()) {
            result.setAmpAccess(step("amp-access", result, () ->
                ampAccessProvider.create(AmpAccessProps.builder()
                    .workloadRoleArn(workloadRoleArn)
                    .apiUrl(apiUrl)
                    .secret(cpgwKey)
                    .build())));
        }

        log.info("Bootstrap complete for cell {}", cellName);
        return result;
    }

    /**
     * 생성의 역순으로 삭제. 없는 단계는 건너뜀
     */
    public void teardown(BootstrapResult result) {
        log.info("Tearing down cell {}", result.getCellName());
        deleteIfPresent(ampAccessProvider, result.getAmpAccess());
        deleteIfPresent(dnsDelegationProvider, result.getDnsDelegation());
        deleteIfPresent(datadogApiKeyProvider, result.getDatadogApiKey());
        deleteIfPresent(projectApiKeyProvider, result.getProjectApiKey());
        deleteIfPresent(serviceAccountProvider, result.getServiceAccount());
        deleteIfPresent(cpgwApiKeyProvider, result.getCpgwApiKey());
        deleteIfPresent(environmentProvider, result.getEnvironment());
        log.info("Teardown complete for cell {}", result.getCellName());
    }

    private <P> void deleteIfPresent(ResourceProvider<P> provider, CreateResult<P> created) {
        if (created == null || created.getId() == null) {
            return;
        }
        provider.delete(created.getId(), created.getOutputs());
    }

    private <T> T step(String name, BootstrapResult partial, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            log.error("Bootstrap step {} failed: {}", name, e.getMessage());
            throw new BootstrapException(name, partial, e);
        }
    }

    private static String projectName(BootstrapRequest request) {
        String name = request.getProjectName();
        return name == null || name.isBlank() ? BootstrapRequest.DEFAULT_PROJECT_NAME : name;
    }

    private static void validate(BootstrapRequest request) {
        requireText(request.getCloud(), "cloud");
        requireText(request.getRegion(), "region");
        requireText(request.getGlobalEnv(), "global_env");
        requireText(request.getApiUrl(), "api_url");
        requireText(request.getPineconeApiKey(), "pinecone_api_key");
        requireText(request.getAuth0Domain(), "auth0_domain");
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
