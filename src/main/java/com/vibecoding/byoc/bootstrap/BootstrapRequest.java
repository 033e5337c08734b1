package com.vibecoding.byoc.bootstrap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * BYOC 부트스트랩 입력
 * nameservers, workloadRoleArn이 없으면 해당 리소스는 생성하지 않음
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class BootstrapRequest {

    public static final String DEFAULT_PROJECT_NAME = "__SLI__";

    private String cloud;
    private String region;
    private String globalEnv;
    private String apiUrl;

    @ToString.Exclude
    private String pineconeApiKey;

    private String auth0Domain;

    @Builder.Default
    private String projectName = DEFAULT_PROJECT_NAME;

    private List<String> nameservers;
    private String workloadRoleArn;
}
