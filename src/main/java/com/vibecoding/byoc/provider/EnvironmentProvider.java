package com.vibecoding.byoc.provider;

import com.vibecoding.byoc.client.CpgwInfraClient;
import com.vibecoding.byoc.client.dto.CreateEnvironmentResponse;
import com.vibecoding.byoc.model.EnvironmentProps;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 테넌트 환경 프로바이더
 */
@Component
@RequiredArgsConstructor
public class EnvironmentProvider implements ResourceProvider<EnvironmentProps> {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentProvider.class);

    private final CpgwInfraClient cpgwClient;

    @Override
    public ResourceKind kind() {
        return ResourceKind.ENVIRONMENT;
    }

    @Override
    public Class<EnvironmentProps> propsType() {
        return EnvironmentProps.class;
    }

    @Override
    public CreateResult<EnvironmentProps> create(EnvironmentProps inputs) {
        CreateEnvironmentResponse environment = cpgwClient.createEnvironment(
            inputs.getCloud(), inputs.getRegion(), inputs.getGlobalEnv(),
            inputs.getApiUrl(), inputs.getSecret());

        log.info("Created environment {} ({}) in organization {}",
            environment.getName(), environment.getId(), environment.getOrgName());

        EnvironmentProps outputs = inputs.toBuilder()
            .envName(environment.getName())
            .orgId(environment.getOrgId())
            .orgName(environment.getOrgName())
            .build();
        return CreateResult.of(environment.getId(), outputs);
    }

    @Override
    public DiffResult diff(String id, EnvironmentProps olds, EnvironmentProps news) {
        if (!ProviderSupport.allPresent(olds.getEnvName())) {
            return DiffResult.forceReplace("env_name");
        }

        // cloud는 대소문자 구분 없음
        List<String> replaces = new ArrayList<>();
        if (ProviderSupport.differs(lower(olds.getCloud()), lower(news.getCloud()))) {
            replaces.add("cloud");
        }
        if (ProviderSupport.differs(olds.getRegion(), news.getRegion())) {
            replaces.add("region");
        }
        if (ProviderSupport.differs(olds.getGlobalEnv(), news.getGlobalEnv())) {
            replaces.add("global_env");
        }

        DiffResult result = DiffResult.replacing(replaces, List.of("env_name", "org_id", "org_name"));
        // 대소문자만 바뀐 경우 교체 없이 상태만 갱신
        result.setChanges(!replaces.isEmpty() || ProviderSupport.differs(olds.getCloud(), news.getCloud()));
        return result;
    }

    @Override
    public EnvironmentProps update(String id, EnvironmentProps olds, EnvironmentProps news) {
        return news.toBuilder()
            .envName(olds.getEnvName())
            .orgId(olds.getOrgId())
            .orgName(olds.getOrgName())
            .build();
    }

    @Override
    public void delete(String id, EnvironmentProps props) {
        if (!ProviderSupport.allPresent(id, props.getApiUrl(), props.getSecret())) {
            log.warn("Skipping delete of environment {}: recorded state is missing api_url or secret", id);
            return;
        }
        ProviderSupport.deleteIgnoringNotFound(log, "Environment " + id,
            () -> cpgwClient.deleteEnvironment(id, props.getApiUrl(), props.getSecret()));
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
