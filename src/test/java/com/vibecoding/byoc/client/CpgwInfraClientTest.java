package com.vibecoding.byoc.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.byoc.client.dto.CreateEnvironmentResponse;
import com.vibecoding.byoc.client.dto.DeleteDatadogApiKeyResponse;
import com.vibecoding.byoc.client.dto.DnsDelegationResponse;
import com.vibecoding.byoc.config.ControlPlaneConfig;
import com.vibecoding.byoc.config.HttpClientConfig;
import com.vibecoding.byoc.exception.ControlPlaneApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class CpgwInfraClientTest {

    private static final String API_URL = "https://api.example.test/";
    private static final String INFRA = "https://api.example.test/internal/cpgw/infra";

    private MockRestServiceServer server;
    private List<Object> sleeps;
    private CpgwInfraClient cpgwClient;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        restTemplate.setErrorHandler(HttpClientConfig.passThroughErrorHandler());
        server = MockRestServiceServer.bindTo(restTemplate).build();
        sleeps = new ArrayList<>();
        ObjectMapper objectMapper = new ObjectMapper();
        ControlPlaneClient client = new ControlPlaneClient(restTemplate, objectMapper, sleeps::add, new ControlPlaneConfig());
        cpgwClient = new CpgwInfraClient(client, objectMapper);
    }

    @Test
    void testCreateEnvironment() {
        // Given
        server.expect(requestTo(INFRA + "/bootstrap/environments"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Api-Key", "pc-user-key"))
            .andExpect(content().json("{\"cloud\":\"aws\",\"region\":\"us-east-1\",\"global_env\":\"prod\"}"))
            .andRespond(withSuccess(
                "{\"id\":\"env-1\",\"name\":\"prod-ab12.byoc\",\"org_id\":\"org-1\",\"org_name\":\"Acme\",\"extra\":true}",
                MediaType.APPLICATION_JSON));

        // When
        CreateEnvironmentResponse response = cpgwClient.createEnvironment("aws", "us-east-1", "prod", API_URL, "pc-user-key");

        // Then
        assertThat(response.getId()).isEqualTo("env-1");
        assertThat(response.getName()).isEqualTo("prod-ab12.byoc");
        assertThat(response.getOrgId()).isEqualTo("org-1");
        assertThat(response.getOrgName()).isEqualTo("Acme");
        server.verify();
    }

    @Test
    void testMissingResponseFieldIsReportedAsApiError() {
        server.expect(requestTo(INFRA + "/bootstrap/environments"))
            .andRespond(withSuccess("{\"id\":\"env-1\",\"name\":\"prod-ab12.byoc\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> cpgwClient.createEnvironment("aws", "us-east-1", "prod", API_URL, "key"))
            .isInstanceOf(ControlPlaneApiException.class)
            .hasMessageContaining("missing field 'org_id'");
    }

    @Test
    void testInvalidEnvironmentNameIsNotRetried() {
        server.expect(requestTo(INFRA + "/bootstrap/cpgw-api-keys"))
            .andExpect(content().json("{\"environment\":\"no-such-env\"}"))
            .andRespond(withStatus(HttpStatus.BAD_REQUEST).body("environment not found"));

        assertThatThrownBy(() -> cpgwClient.createCpgwApiKey("no-such-env", API_URL, "key"))
            .isInstanceOf(ControlPlaneApiException.class)
            .hasMessage("400: environment not found");
        assertThat(sleeps).isEmpty();
        server.verify();
    }

    @Test
    void testDeleteDnsDelegationSendsRecordedPair() {
        server.expect(requestTo(INFRA + "/dns-delegation/delete"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(content().json("{\"subdomain\":\"prod-ab12\",\"nameservers\":[\"ns1.example.com\",\"ns2.example.com\"]}"))
            .andRespond(withSuccess("{\"change_id\":\"C123\",\"status\":\"PENDING\"}", MediaType.APPLICATION_JSON));

        DnsDelegationResponse response = cpgwClient.deleteDnsDelegation(
            "prod-ab12", List.of("ns1.example.com", "ns2.example.com"), API_URL, "cpgw-key");

        assertThat(response.getChangeId()).isEqualTo("C123");
        assertThat(response.getStatus()).isEqualTo("PENDING");
        server.verify();
    }

    @Test
    void testDeleteDatadogApiKey() {
        server.expect(requestTo(INFRA + "/datadog-credentials/delete"))
            .andExpect(content().json("{\"key_id\":\"dd-1\"}"))
            .andRespond(withSuccess("{\"deleted\":true}", MediaType.APPLICATION_JSON));

        DeleteDatadogApiKeyResponse response = cpgwClient.deleteDatadogApiKey("dd-1", API_URL, "cpgw-key");

        assertThat(response.isDeleted()).isTrue();
    }

    @Test
    void testDeleteEnvironmentNotFound() {
        server.expect(requestTo(INFRA + "/bootstrap/environments/env-1"))
            .andExpect(method(HttpMethod.DELETE))
            .andRespond(withStatus(HttpStatus.NOT_FOUND).body("not found"));

        assertThatThrownBy(() -> cpgwClient.deleteEnvironment("env-1", API_URL, "key"))
            .isInstanceOf(ControlPlaneApiException.class)
            .satisfies(e -> assertThat(((ControlPlaneApiException) e).isNotFound()).isTrue());
    }
}
