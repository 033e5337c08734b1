package com.vibecoding.byoc.provider;

import com.vibecoding.byoc.client.CpgwInfraClient;
import com.vibecoding.byoc.client.dto.DatadogApiKeyResponse;
import com.vibecoding.byoc.client.dto.DeleteDatadogApiKeyResponse;
import com.vibecoding.byoc.model.DatadogApiKeyProps;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 환경별 Datadog API 키 프로바이더
 */
@Component
@RequiredArgsConstructor
public class DatadogApiKeyProvider implements ResourceProvider<DatadogApiKeyProps> {

    private static final Logger log = LoggerFactory.getLogger(DatadogApiKeyProvider.class);

    private final CpgwInfraClient cpgwClient;

    @Override
    public ResourceKind kind() {
        return ResourceKind.DATADOG_API_KEY;
    }

    @Override
    public Class<DatadogApiKeyProps> propsType() {
        return DatadogApiKeyProps.class;
    }

    @Override
    public CreateResult<DatadogApiKeyProps> create(DatadogApiKeyProps inputs) {
        DatadogApiKeyResponse response = cpgwClient.createDatadogApiKey(inputs.getApiUrl(), inputs.getSecret());
        log.info("Created Datadog API key {}", response.getKeyId());

        return CreateResult.of(response.getKeyId(), inputs.toBuilder()
            .keyId(response.getKeyId())
            .apiKey(response.getApiKey())
            .build());
    }

    @Override
    public DiffResult diff(String id, DatadogApiKeyProps olds, DatadogApiKeyProps news) {
        if (!ProviderSupport.allPresent(olds.getKeyId(), olds.getApiKey())) {
            return DiffResult.forceReplace("api_key");
        }
        return DiffResult.replacing(List.of(), List.of("api_key", "key_id"));
    }

    @Override
    public DatadogApiKeyProps update(String id, DatadogApiKeyProps olds, DatadogApiKeyProps news) {
        return news.toBuilder()
            .keyId(olds.getKeyId())
            .apiKey(olds.getApiKey())
            .build();
    }

    @Override
    public void delete(String id, DatadogApiKeyProps props) {
        String keyId = props.getKeyId() != null ? props.getKeyId() : id;
        if (!ProviderSupport.allPresent(keyId, props.getApiUrl(), props.getSecret())) {
            log.warn("Skipping delete of Datadog API key {}: recorded state is missing key_id or credentials", id);
            return;
        }
        ProviderSupport.deleteIgnoringNotFound(log, "Datadog API key " + keyId, () -> {
            DeleteDatadogApiKeyResponse response = cpgwClient.deleteDatadogApiKey(keyId, props.getApiUrl(), props.getSecret());
            if (!response.isDeleted()) {
                log.warn("Control plane reported Datadog API key {} was not deleted", keyId);
            }
        });
    }
}
