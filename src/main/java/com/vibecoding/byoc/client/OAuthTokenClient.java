package com.vibecoding.byoc.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.byoc.client.dto.AccessTokenResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * OAuth client-credentials 교환으로 management plane 토큰 발급
 * 토큰은 호출자가 한 번의 작업 동안만 보관 (저장하지 않음)
 */
@Component
public class OAuthTokenClient extends ControlPlaneApiSupport {

    private static final Logger log = LoggerFactory.getLogger(OAuthTokenClient.class);

    public OAuthTokenClient(ControlPlaneClient client, ObjectMapper objectMapper) {
        super(client, objectMapper);
    }

    public String fetchAccessToken(String authDomain, String clientId, String clientSecret, String apiUrl) {
        Map<String, Object> body = new HashMap<>();
        body.put("client_id", clientId);
        body.put("client_secret", clientSecret);
        body.put("audience", trimTrailingSlash(apiUrl) + "/");
        body.put("grant_type", "client_credentials");

        log.debug("Requesting access token from {} for client {}", authDomain, clientId);
        JsonNode resp = client.request(HttpMethod.POST,
            trimTrailingSlash(authDomain) + "/oauth/token", Map.of("Cache-Control", "no-cache"), body);
        return parse(resp, AccessTokenResponse.class, "access_token").getAccessToken();
    }
}
