package com.vibecoding.byoc.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 프로젝트 API 키 (프로젝트 생성 후 키 발급)
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectApiKeyProps {
    private String orgId;
    private String projectName;
    private String keyName;
    private String apiUrl;
    private String auth0Domain;
    private String auth0ClientId;

    @ToString.Exclude
    private String auth0ClientSecret;

    // outputs
    private String apiKeyId;
    private String projectId;

    @ToString.Exclude
    private String value;
}
