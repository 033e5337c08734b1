package com.vibecoding.byoc.provider;

import com.vibecoding.byoc.client.CpgwInfraClient;
import com.vibecoding.byoc.client.dto.CreateCpgwApiKeyResponse;
import com.vibecoding.byoc.model.CpgwApiKeyProps;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 환경 범위 cpgw 관리자 키 프로바이더. 환경이 먼저 생성되어 있어야 함
 */
@Component
@RequiredArgsConstructor
public class CpgwApiKeyProvider implements ResourceProvider<CpgwApiKeyProps> {

    private static final Logger log = LoggerFactory.getLogger(CpgwApiKeyProvider.class);

    private final CpgwInfraClient cpgwClient;

    @Override
    public ResourceKind kind() {
        return ResourceKind.CPGW_API_KEY;
    }

    @Override
    public Class<CpgwApiKeyProps> propsType() {
        return CpgwApiKeyProps.class;
    }

    @Override
    public CreateResult<CpgwApiKeyProps> create(CpgwApiKeyProps inputs) {
        CreateCpgwApiKeyResponse response = cpgwClient.createCpgwApiKey(
            inputs.getEnvironment(), inputs.getApiUrl(), inputs.getPineconeApiKey());

        log.info("Created cpgw API key {} for environment {}", response.getId(), inputs.getEnvironment());

        return CreateResult.of(response.getId(), inputs.toBuilder()
            .keyId(response.getId())
            .key(response.getKey())
            .build());
    }

    @Override
    public DiffResult diff(String id, CpgwApiKeyProps olds, CpgwApiKeyProps news) {
        if (!ProviderSupport.allPresent(olds.getKey())) {
            return DiffResult.forceReplace("key");
        }
        List<String> replaces = new ArrayList<>();
        if (ProviderSupport.differs(olds.getEnvironment(), news.getEnvironment())) {
            replaces.add("environment");
        }
        return DiffResult.replacing(replaces, List.of("key_id", "key"));
    }

    @Override
    public CpgwApiKeyProps update(String id, CpgwApiKeyProps olds, CpgwApiKeyProps news) {
        return news.toBuilder()
            .keyId(olds.getKeyId())
            .key(olds.getKey())
            .build();
    }

    @Override
    public void delete(String id, CpgwApiKeyProps props) {
        if (!ProviderSupport.allPresent(id, props.getApiUrl(), props.getPineconeApiKey())) {
            log.warn("Skipping delete of cpgw API key {}: recorded state is missing api_url or pinecone_api_key", id);
            return;
        }
        ProviderSupport.deleteIgnoringNotFound(log, "cpgw API key " + id,
            () -> cpgwClient.deleteCpgwApiKey(id, props.getApiUrl(), props.getPineconeApiKey()));
    }
}
