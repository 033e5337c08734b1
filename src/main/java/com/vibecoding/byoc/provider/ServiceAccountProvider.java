package com.vibecoding.byoc.provider;

import com.vibecoding.byoc.client.CpgwInfraClient;
import com.vibecoding.byoc.client.dto.CreateServiceAccountResponse;
import com.vibecoding.byoc.model.ServiceAccountProps;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 서비스 계정 프로바이더 (cpgw 관리자 키로 인증)
 */
@Component
@RequiredArgsConstructor
public class ServiceAccountProvider implements ResourceProvider<ServiceAccountProps> {

    private static final Logger log = LoggerFactory.getLogger(ServiceAccountProvider.class);

    private final CpgwInfraClient cpgwClient;

    @Override
    public ResourceKind kind() {
        return ResourceKind.SERVICE_ACCOUNT;
    }

    @Override
    public Class<ServiceAccountProps> propsType() {
        return ServiceAccountProps.class;
    }

    @Override
    public CreateResult<ServiceAccountProps> create(ServiceAccountProps inputs) {
        CreateServiceAccountResponse response = cpgwClient.createServiceAccount(
            inputs.getName(), inputs.getApiUrl(), inputs.getSecret());

        log.info("Created service account {} (client id {})", response.getId(), response.getClientId());

        return CreateResult.of(response.getId(), inputs.toBuilder()
            .clientId(response.getClientId())
            .clientSecret(response.getClientSecret())
            .build());
    }

    @Override
    public DiffResult diff(String id, ServiceAccountProps olds, ServiceAccountProps news) {
        if (!ProviderSupport.allPresent(olds.getClientId(), olds.getClientSecret())) {
            return DiffResult.forceReplace("client_id");
        }
        List<String> replaces = new ArrayList<>();
        if (ProviderSupport.differs(olds.getName(), news.getName())) {
            replaces.add("name");
        }
        return DiffResult.replacing(replaces, List.of("client_id", "client_secret"));
    }

    @Override
    public ServiceAccountProps update(String id, ServiceAccountProps olds, ServiceAccountProps news) {
        return news.toBuilder()
            .clientId(olds.getClientId())
            .clientSecret(olds.getClientSecret())
            .build();
    }

    @Override
    public void delete(String id, ServiceAccountProps props) {
        if (!ProviderSupport.allPresent(id, props.getApiUrl(), props.getSecret())) {
            log.warn("Skipping delete of service account {}: recorded state is missing api_url or secret", id);
            return;
        }
        ProviderSupport.deleteIgnoringNotFound(log, "Service account " + id,
            () -> cpgwClient.deleteServiceAccount(id, props.getApiUrl(), props.getSecret()));
    }
}
