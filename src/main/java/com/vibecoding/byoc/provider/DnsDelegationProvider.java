package com.vibecoding.byoc.provider;

import com.vibecoding.byoc.client.CpgwInfraClient;
import com.vibecoding.byoc.client.dto.DnsDelegationResponse;
import com.vibecoding.byoc.model.DnsDelegationProps;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * DNS 위임 프로바이더
 * 원격은 위임을 값으로 기록하므로 delete는 create 시점에 기록된 (subdomain, nameservers)를 그대로 사용
 */
@Component
@RequiredArgsConstructor
public class DnsDelegationProvider implements ResourceProvider<DnsDelegationProps> {

    private static final Logger log = LoggerFactory.getLogger(DnsDelegationProvider.class);

    private final CpgwInfraClient cpgwClient;

    @Override
    public ResourceKind kind() {
        return ResourceKind.DNS_DELEGATION;
    }

    @Override
    public Class<DnsDelegationProps> propsType() {
        return DnsDelegationProps.class;
    }

    @Override
    public CreateResult<DnsDelegationProps> create(DnsDelegationProps inputs) {
        List<String> nameservers = List.copyOf(inputs.getNameservers());
        DnsDelegationResponse response = cpgwClient.createDnsDelegation(
            inputs.getSubdomain(), nameservers, inputs.getApiUrl(), inputs.getSecret());

        log.info("Delegated {} (change {}, status {})", response.getFqdn(), response.getChangeId(), response.getStatus());

        return CreateResult.of(response.getFqdn(), inputs.toBuilder()
            .nameservers(nameservers)
            .fqdn(response.getFqdn())
            .changeId(response.getChangeId())
            .status(response.getStatus())
            .build());
    }

    /**
     * 위임은 수정이 아니라 교체. 변경된 값은 모두 replace로 보고
     */
    @Override
    public DiffResult diff(String id, DnsDelegationProps olds, DnsDelegationProps news) {
        List<String> replaces = new ArrayList<>();
        if (ProviderSupport.differs(olds.getSubdomain(), news.getSubdomain())) {
            replaces.add("subdomain");
        }
        if (ProviderSupport.differs(olds.getNameservers(), news.getNameservers())) {
            replaces.add("nameservers");
        }
        return DiffResult.replacing(replaces, List.of());
    }

    @Override
    public DnsDelegationProps update(String id, DnsDelegationProps olds, DnsDelegationProps news) {
        return news.toBuilder()
            .fqdn(olds.getFqdn())
            .changeId(olds.getChangeId())
            .status(olds.getStatus())
            .build();
    }

    @Override
    public void delete(String id, DnsDelegationProps props) {
        if (!ProviderSupport.allPresent(props.getSubdomain(), props.getNameservers(),
                props.getApiUrl(), props.getSecret())) {
            log.warn("Skipping delete of DNS delegation {}: recorded state is missing subdomain, nameservers or credentials", id);
            return;
        }
        ProviderSupport.deleteIgnoringNotFound(log, "DNS delegation " + id, () -> {
            DnsDelegationResponse response = cpgwClient.deleteDnsDelegation(
                props.getSubdomain(), props.getNameservers(), props.getApiUrl(), props.getSecret());
            log.info("Removed delegation for {} (change {}, status {})",
                props.getSubdomain(), response.getChangeId(), response.getStatus());
        });
    }
}
