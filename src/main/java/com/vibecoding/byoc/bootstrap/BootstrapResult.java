package com.vibecoding.byoc.bootstrap;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.vibecoding.byoc.model.AmpAccessProps;
import com.vibecoding.byoc.model.CpgwApiKeyProps;
import com.vibecoding.byoc.model.DatadogApiKeyProps;
import com.vibecoding.byoc.model.DnsDelegationProps;
import com.vibecoding.byoc.model.EnvironmentProps;
import com.vibecoding.byoc.model.ProjectApiKeyProps;
import com.vibecoding.byoc.model.ServiceAccountProps;
import com.vibecoding.byoc.provider.CreateResult;
import lombok.Data;

/**
 * 부트스트랩으로 생성된 리소스 (실패 시 생성된 것까지만 채워짐)
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BootstrapResult {
    private String cellName;
    private CreateResult<EnvironmentProps> environment;
    private CreateResult<CpgwApiKeyProps> cpgwApiKey;
    private CreateResult<ServiceAccountProps> serviceAccount;
    private CreateResult<ProjectApiKeyProps> projectApiKey;
    private CreateResult<DatadogApiKeyProps> datadogApiKey;
    private CreateResult<DnsDelegationProps> dnsDelegation;
    private CreateResult<AmpAccessProps> ampAccess;
}
