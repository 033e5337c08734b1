package com.vibecoding.byoc.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.byoc.client.CpgwInfraClient;
import com.vibecoding.byoc.client.dto.CreateEnvironmentResponse;
import com.vibecoding.byoc.exception.UnknownResourceKindException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProviderRegistryTest {

    @Mock
    private CpgwInfraClient cpgwClient;

    private ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry(List.of(new EnvironmentProvider(cpgwClient)), new ObjectMapper());
    }

    @Test
    void testCreateConvertsWireMapsToTypedProps() {
        // Given
        when(cpgwClient.createEnvironment("aws", "us-east-1", "prod", "https://api.example.test", "pc-user-key"))
            .thenReturn(CreateEnvironmentResponse.builder()
                .id("env-1").name("prod-ab12.byoc").orgId("org-1").orgName("Acme").build());
        Map<String, Object> inputs = Map.of(
            "cloud", "aws",
            "region", "us-east-1",
            "global_env", "prod",
            "api_url", "https://api.example.test",
            "secret", "pc-user-key");

        // When
        CreateResult<Map<String, Object>> result = registry.create(ResourceKind.ENVIRONMENT, inputs);

        // Then
        assertThat(result.getId()).isEqualTo("env-1");
        assertThat(result.getOutputs())
            .containsEntry("env_name", "prod-ab12.byoc")
            .containsEntry("org_name", "Acme")
            .containsEntry("cloud", "aws");
    }

    @Test
    void testUpdatePassesRecordedOutputsThrough() {
        Map<String, Object> olds = Map.of("cloud", "aws", "region", "us-east-1", "env_name", "prod-ab12.byoc");
        Map<String, Object> news = Map.of("cloud", "AWS", "region", "us-east-1");

        Map<String, Object> outputs = registry.update(ResourceKind.ENVIRONMENT, "env-1", olds, news);

        assertThat(outputs).containsEntry("cloud", "AWS").containsEntry("env_name", "prod-ab12.byoc");
    }

    @Test
    void testUnregisteredKindIsRejected() {
        assertThatThrownBy(() -> registry.get(ResourceKind.AMP_ACCESS))
            .isInstanceOf(UnknownResourceKindException.class)
            .hasMessageContaining("amp-access");
    }

    @Test
    void testUnknownWireNameIsRejected() {
        assertThatThrownBy(() -> ResourceKind.fromWireName("load-balancer"))
            .isInstanceOf(UnknownResourceKindException.class);
        assertThat(ResourceKind.fromWireName("project-api-key")).isEqualTo(ResourceKind.PROJECT_API_KEY);
    }

    @Test
    void testDuplicateProvidersAreRejected() {
        List<ResourceProvider<?>> providers = List.of(new EnvironmentProvider(cpgwClient), new EnvironmentProvider(cpgwClient));

        assertThatThrownBy(() -> new ProviderRegistry(providers, new ObjectMapper()))
            .isInstanceOf(IllegalStateException.class);
    }
}
