package com.vibecoding.byoc.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.byoc.client.dto.AmpAccessResponse;
import com.vibecoding.byoc.client.dto.CreateCpgwApiKeyResponse;
import com.vibecoding.byoc.client.dto.CreateEnvironmentResponse;
import com.vibecoding.byoc.client.dto.CreateServiceAccountResponse;
import com.vibecoding.byoc.client.dto.DatadogApiKeyResponse;
import com.vibecoding.byoc.client.dto.DeleteDatadogApiKeyResponse;
import com.vibecoding.byoc.client.dto.DnsDelegationResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * cpgw 내부 인프라 엔드포인트 클라이언트 (Api-Key 헤더 인증)
 */
@Component
public class CpgwInfraClient extends ControlPlaneApiSupport {

    private static final Logger log = LoggerFactory.getLogger(CpgwInfraClient.class);

    public CpgwInfraClient(ControlPlaneClient client, ObjectMapper objectMapper) {
        super(client, objectMapper);
    }

    static String infraUrl(String apiUrl) {
        return trimTrailingSlash(apiUrl) + "/internal/cpgw/infra";
    }

    static Map<String, String> headers(String apiKey) {
        return Map.of("Api-Key", apiKey);
    }

    // ========== Environment ==========

    public CreateEnvironmentResponse createEnvironment(String cloud, String region, String globalEnv,
                                                       String apiUrl, String apiKey) {
        Map<String, Object> body = new HashMap<>();
        body.put("cloud", cloud);
        body.put("region", region);
        body.put("global_env", globalEnv);

        log.info("Creating environment: cloud={}, region={}, global_env={}", cloud, region, globalEnv);
        JsonNode resp = client.request(HttpMethod.POST,
            endpoint(infraUrl(apiUrl), "bootstrap", "environments"), headers(apiKey), body);
        return parse(resp, CreateEnvironmentResponse.class, "id", "name", "org_id", "org_name");
    }

    public void deleteEnvironment(String environmentId, String apiUrl, String apiKey) {
        log.info("Deleting environment: {}", environmentId);
        client.request(HttpMethod.DELETE,
            endpoint(infraUrl(apiUrl), "bootstrap", "environments", environmentId), headers(apiKey), null);
    }

    // ========== cpgw admin API key ==========

    public CreateCpgwApiKeyResponse createCpgwApiKey(String environmentName, String apiUrl, String apiKey) {
        log.info("Creating cpgw API key for environment: {}", environmentName);
        JsonNode resp = client.request(HttpMethod.POST,
            endpoint(infraUrl(apiUrl), "bootstrap", "cpgw-api-keys"), headers(apiKey),
            Map.of("environment", environmentName));
        return parse(resp, CreateCpgwApiKeyResponse.class, "id", "key");
    }

    public void deleteCpgwApiKey(String keyId, String apiUrl, String apiKey) {
        log.info("Deleting cpgw API key: {}", keyId);
        client.request(HttpMethod.DELETE,
            endpoint(infraUrl(apiUrl), "bootstrap", "cpgw-api-keys", keyId), headers(apiKey), null);
    }

    // ========== Service account ==========

    public CreateServiceAccountResponse createServiceAccount(String name, String apiUrl, String cpgwApiKey) {
        log.info("Creating service account: {}", name);
        JsonNode resp = client.request(HttpMethod.POST,
            endpoint(infraUrl(apiUrl), "service-accounts"), headers(cpgwApiKey), Map.of("name", name));
        return parse(resp, CreateServiceAccountResponse.class, "id", "client_id", "client_secret");
    }

    public void deleteServiceAccount(String serviceAccountId, String apiUrl, String cpgwApiKey) {
        log.info("Deleting service account: {}", serviceAccountId);
        client.request(HttpMethod.DELETE,
            endpoint(infraUrl(apiUrl), "service-accounts", serviceAccountId), headers(cpgwApiKey), null);
    }

    // ========== DNS delegation ==========

    public DnsDelegationResponse createDnsDelegation(String subdomain, List<String> nameservers,
                                                     String apiUrl, String cpgwApiKey) {
        log.info("Creating DNS delegation: {} -> {}", subdomain, nameservers);
        JsonNode resp = client.request(HttpMethod.POST,
            endpoint(infraUrl(apiUrl), "dns-delegation"), headers(cpgwApiKey), delegationBody(subdomain, nameservers));
        return parse(resp, DnsDelegationResponse.class, "change_id", "status", "fqdn");
    }

    public DnsDelegationResponse deleteDnsDelegation(String subdomain, List<String> nameservers,
                                                     String apiUrl, String cpgwApiKey) {
        log.info("Deleting DNS delegation: {} -> {}", subdomain, nameservers);
        JsonNode resp = client.request(HttpMethod.POST,
            endpoint(infraUrl(apiUrl), "dns-delegation", "delete"), headers(cpgwApiKey), delegationBody(subdomain, nameservers));
        return parse(resp, DnsDelegationResponse.class, "change_id", "status");
    }

    private static Map<String, Object> delegationBody(String subdomain, List<String> nameservers) {
        Map<String, Object> body = new HashMap<>();
        body.put("subdomain", subdomain);
        body.put("nameservers", nameservers);
        return body;
    }

    // ========== Metrics federation (AMP) ==========

    public AmpAccessResponse createAmpAccess(String workloadRoleArn, String apiUrl, String cpgwApiKey) {
        log.info("Granting AMP access to workload role: {}", workloadRoleArn);
        JsonNode resp = client.request(HttpMethod.POST,
            endpoint(infraUrl(apiUrl), "amp-access"), headers(cpgwApiKey), Map.of("workload_role_arn", workloadRoleArn));
        return parse(resp, AmpAccessResponse.class, "pinecone_role_arn", "amp_remote_write_endpoint", "amp_region");
    }

    public void deleteAmpAccess(String workloadRoleArn, String apiUrl, String cpgwApiKey) {
        log.info("Revoking AMP access for workload role: {}", workloadRoleArn);
        client.request(HttpMethod.POST,
            endpoint(infraUrl(apiUrl), "amp-access", "delete"), headers(cpgwApiKey), Map.of("workload_role_arn", workloadRoleArn));
    }

    // ========== Datadog ==========

    public DatadogApiKeyResponse createDatadogApiKey(String apiUrl, String cpgwApiKey) {
        log.info("Creating Datadog API key");
        JsonNode resp = client.request(HttpMethod.POST,
            endpoint(infraUrl(apiUrl), "datadog-credentials"), headers(cpgwApiKey), Map.of());
        return parse(resp, DatadogApiKeyResponse.class, "api_key", "key_id");
    }

    public DeleteDatadogApiKeyResponse deleteDatadogApiKey(String keyId, String apiUrl, String cpgwApiKey) {
        log.info("Deleting Datadog API key: {}", keyId);
        JsonNode resp = client.request(HttpMethod.POST,
            endpoint(infraUrl(apiUrl), "datadog-credentials", "delete"), headers(cpgwApiKey), Map.of("key_id", keyId));
        return parse(resp, DeleteDatadogApiKeyResponse.class, "deleted");
    }
}
