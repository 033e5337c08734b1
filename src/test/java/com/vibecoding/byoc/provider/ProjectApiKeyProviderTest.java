package com.vibecoding.byoc.provider;

import com.vibecoding.byoc.client.ManagementPlaneClient;
import com.vibecoding.byoc.client.OAuthTokenClient;
import com.vibecoding.byoc.client.dto.ApiKeyInfo;
import com.vibecoding.byoc.client.dto.CreateApiKeyResponse;
import com.vibecoding.byoc.client.dto.CreateProjectResponse;
import com.vibecoding.byoc.exception.ControlPlaneApiException;
import com.vibecoding.byoc.exception.ControlPlaneInternalException;
import com.vibecoding.byoc.model.ProjectApiKeyProps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProjectApiKeyProviderTest {

    private static final String API_URL = "https://api.example.test";

    @Mock
    private ManagementPlaneClient managementClient;

    @Mock
    private OAuthTokenClient tokenClient;

    private ProjectApiKeyProvider provider;
    private ProjectApiKeyProps inputs;

    @BeforeEach
    void setUp() {
        provider = new ProjectApiKeyProvider(managementClient, tokenClient);
        inputs = ProjectApiKeyProps.builder()
            .orgId("org-1")
            .projectName("__SLI__")
            .keyName("acme-byoc-ab12-key")
            .apiUrl(API_URL)
            .auth0Domain("https://auth.example.test")
            .auth0ClientId("cid")
            .auth0ClientSecret("csecret")
            .build();
    }

    @Test
    void testCreateMintsKeyInNewProject() {
        // Given
        when(tokenClient.fetchAccessToken("https://auth.example.test", "cid", "csecret", API_URL)).thenReturn("jwt");
        when(managementClient.createProject("org-1", "__SLI__", API_URL, "jwt"))
            .thenReturn(CreateProjectResponse.builder().id("proj-1").build());
        when(managementClient.createApiKey("proj-1", "acme-byoc-ab12-key", API_URL, "jwt"))
            .thenReturn(CreateApiKeyResponse.builder()
                .key(ApiKeyInfo.builder().id("key-1").projectId("proj-1").build())
                .value("pcsk_secret")
                .build());

        // When
        CreateResult<ProjectApiKeyProps> result = provider.create(inputs);

        // Then
        assertThat(result.getId()).isEqualTo("proj-1");
        assertThat(result.getOutputs().getProjectId()).isEqualTo("proj-1");
        assertThat(result.getOutputs().getApiKeyId()).isEqualTo("key-1");
        assertThat(result.getOutputs().getValue()).isEqualTo("pcsk_secret");
        assertThat(result.getOutputs().getOrgId()).isEqualTo("org-1");
        verify(tokenClient, times(1)).fetchAccessToken(anyString(), anyString(), anyString(), anyString());
    }

    @Test
    void testKeyMintFailureDeletesProjectAndRethrowsOriginal() {
        // Given
        ControlPlaneInternalException mintError = new ControlPlaneInternalException(500, "boom");
        when(tokenClient.fetchAccessToken(anyString(), anyString(), anyString(), anyString())).thenReturn("jwt");
        when(managementClient.createProject("org-1", "__SLI__", API_URL, "jwt"))
            .thenReturn(CreateProjectResponse.builder().id("proj-1").build());
        when(managementClient.createApiKey("proj-1", "acme-byoc-ab12-key", API_URL, "jwt")).thenThrow(mintError);

        // When / Then
        assertThatThrownBy(() -> provider.create(inputs)).isSameAs(mintError);
        verify(managementClient).deleteProject("proj-1", API_URL, "jwt");
        assertThat(mintError.getSuppressed()).isEmpty();
    }

    @Test
    void testCompensationFailureIsSuppressedOnOriginalError() {
        // Given
        ControlPlaneApiException mintError = new ControlPlaneApiException(403, "forbidden");
        ControlPlaneInternalException cleanupError = new ControlPlaneInternalException(503, "unavailable");
        when(tokenClient.fetchAccessToken(anyString(), anyString(), anyString(), anyString())).thenReturn("jwt");
        when(managementClient.createProject("org-1", "__SLI__", API_URL, "jwt"))
            .thenReturn(CreateProjectResponse.builder().id("proj-1").build());
        when(managementClient.createApiKey("proj-1", "acme-byoc-ab12-key", API_URL, "jwt")).thenThrow(mintError);
        doThrow(cleanupError).when(managementClient).deleteProject("proj-1", API_URL, "jwt");

        // When / Then
        assertThatThrownBy(() -> provider.create(inputs))
            .isSameAs(mintError)
            .hasMessage("403: forbidden");
        assertThat(mintError.getSuppressed()).containsExactly(cleanupError);
    }

    @Test
    void testDeleteTreatsMissingProjectAsDeleted() {
        when(tokenClient.fetchAccessToken(anyString(), anyString(), anyString(), anyString())).thenReturn("jwt");
        doThrow(new ControlPlaneApiException(404, "not found"))
            .when(managementClient).deleteProject("proj-1", API_URL, "jwt");

        assertThatCode(() -> provider.delete("proj-1", inputs)).doesNotThrowAnyException();
    }

    @Test
    void testDeleteSkippedWhenAuthSettingsMissing() {
        ProjectApiKeyProps corrupted = inputs.toBuilder().auth0ClientSecret(null).build();

        provider.delete("proj-1", corrupted);

        verifyNoInteractions(tokenClient, managementClient);
    }

    @Test
    void testDiffReplacesOnNameChangeAndKeepsKeyStable() {
        ProjectApiKeyProps olds = inputs.toBuilder().apiKeyId("key-1").projectId("proj-1").value("pcsk_secret").build();
        ProjectApiKeyProps news = inputs.toBuilder().keyName("renamed-key").build();

        DiffResult diff = provider.diff("proj-1", olds, news);

        assertThat(diff.isChanges()).isTrue();
        assertThat(diff.getReplaces()).containsExactly("key_name");
        assertThat(diff.getStables()).contains("value");
        assertThat(diff.isDeleteBeforeReplace()).isTrue();
    }

    @Test
    void testUpdateCarriesRecordedKeyForward() {
        ProjectApiKeyProps olds = inputs.toBuilder().apiKeyId("key-1").projectId("proj-1").value("pcsk_secret").build();

        ProjectApiKeyProps updated = provider.update("proj-1", olds, inputs);

        assertThat(updated.getValue()).isEqualTo("pcsk_secret");
        assertThat(updated.getApiKeyId()).isEqualTo("key-1");
        assertThat(updated.getProjectId()).isEqualTo("proj-1");
    }
}
