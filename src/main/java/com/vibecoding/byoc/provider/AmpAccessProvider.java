package com.vibecoding.byoc.provider;

import com.vibecoding.byoc.client.CpgwInfraClient;
import com.vibecoding.byoc.client.dto.AmpAccessResponse;
import com.vibecoding.byoc.model.AmpAccessProps;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 메트릭 연합(AMP) 접근 프로바이더
 * 워크로드 역할에 원격 Prometheus remote-write 용 역할 위임을 부여
 */
@Component
@RequiredArgsConstructor
public class AmpAccessProvider implements ResourceProvider<AmpAccessProps> {

    private static final Logger log = LoggerFactory.getLogger(AmpAccessProvider.class);

    private final CpgwInfraClient cpgwClient;

    @Override
    public ResourceKind kind() {
        return ResourceKind.AMP_ACCESS;
    }

    @Override
    public Class<AmpAccessProps> propsType() {
        return AmpAccessProps.class;
    }

    @Override
    public CreateResult<AmpAccessProps> create(AmpAccessProps inputs) {
        AmpAccessResponse response = cpgwClient.createAmpAccess(
            inputs.getWorkloadRoleArn(), inputs.getApiUrl(), inputs.getSecret());

        log.info("AMP access granted: {} may assume {} ({})",
            inputs.getWorkloadRoleArn(), response.getPineconeRoleArn(), response.getAmpRegion());

        return CreateResult.of(response.getPineconeRoleArn(), inputs.toBuilder()
            .pineconeRoleArn(response.getPineconeRoleArn())
            .ampRemoteWriteEndpoint(response.getAmpRemoteWriteEndpoint())
            .ampRegion(response.getAmpRegion())
            .build());
    }

    @Override
    public DiffResult diff(String id, AmpAccessProps olds, AmpAccessProps news) {
        if (!ProviderSupport.allPresent(olds.getPineconeRoleArn())) {
            return DiffResult.forceReplace("pinecone_role_arn");
        }
        List<String> replaces = new ArrayList<>();
        if (ProviderSupport.differs(olds.getWorkloadRoleArn(), news.getWorkloadRoleArn())) {
            replaces.add("workload_role_arn");
        }
        return DiffResult.replacing(replaces,
            List.of("pinecone_role_arn", "amp_remote_write_endpoint", "amp_region"));
    }

    @Override
    public AmpAccessProps update(String id, AmpAccessProps olds, AmpAccessProps news) {
        return news.toBuilder()
            .pineconeRoleArn(olds.getPineconeRoleArn())
            .ampRemoteWriteEndpoint(olds.getAmpRemoteWriteEndpoint())
            .ampRegion(olds.getAmpRegion())
            .build();
    }

    @Override
    public void delete(String id, AmpAccessProps props) {
        if (!ProviderSupport.allPresent(props.getWorkloadRoleArn(), props.getApiUrl(), props.getSecret())) {
            log.warn("Skipping delete of AMP access {}: recorded state is missing workload_role_arn or credentials", id);
            return;
        }
        ProviderSupport.deleteIgnoringNotFound(log, "AMP access " + id,
            () -> cpgwClient.deleteAmpAccess(props.getWorkloadRoleArn(), props.getApiUrl(), props.getSecret()));
    }
}
