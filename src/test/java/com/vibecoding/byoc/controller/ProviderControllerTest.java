package com.vibecoding.byoc.controller;

import com.vibecoding.byoc.exception.ControlPlaneApiException;
import com.vibecoding.byoc.exception.ControlPlaneInternalException;
import com.vibecoding.byoc.exception.ProviderExceptionHandler;
import com.vibecoding.byoc.exception.UninstallJobFailedException;
import com.vibecoding.byoc.provider.CreateResult;
import com.vibecoding.byoc.provider.DiffResult;
import com.vibecoding.byoc.provider.ProviderRegistry;
import com.vibecoding.byoc.provider.ResourceKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ProviderControllerTest {

    @Mock
    private ProviderRegistry registry;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ProviderController(registry))
            .setControllerAdvice(new ProviderExceptionHandler())
            .build();
    }

    @Test
    void testCreate() throws Exception {
        when(registry.create(eq(ResourceKind.CPGW_API_KEY), anyMap()))
            .thenReturn(CreateResult.of("ck-1", Map.of("key_id", "ck-1", "environment", "prod-ef7a.byoc")));

        mockMvc.perform(post("/api/providers/cpgw-api-key/create")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"inputs\":{\"environment\":\"prod-ef7a.byoc\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value("ck-1"))
            .andExpect(jsonPath("$.outputs.key_id").value("ck-1"));
    }

    @Test
    void testDiffUsesSnakeCase() throws Exception {
        when(registry.diff(eq(ResourceKind.ENVIRONMENT), eq("env-1"), anyMap(), anyMap()))
            .thenReturn(DiffResult.replacing(List.of("region"), List.of("env_name")));

        mockMvc.perform(post("/api/providers/environment/diff")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\":\"env-1\",\"olds\":{\"region\":\"us-east-1\"},\"news\":{\"region\":\"eu-west-1\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.changes").value(true))
            .andExpect(jsonPath("$.replaces[0]").value("region"))
            .andExpect(jsonPath("$.delete_before_replace").value(true));
    }

    @Test
    void testDeleteReturnsNoContent() throws Exception {
        mockMvc.perform(post("/api/providers/datadog-api-key/delete")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\":\"dd-1\",\"props\":{\"key_id\":\"dd-1\"}}"))
            .andExpect(status().isNoContent());

        verify(registry).delete(eq(ResourceKind.DATADOG_API_KEY), eq("dd-1"), anyMap());
    }

    @Test
    void testUnknownKindIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/providers/load-balancer/create")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"inputs\":{}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
        verifyNoInteractions(registry);
    }

    @Test
    void testMissingIdIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/providers/environment/delete")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"props\":{}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("id is required"));
    }

    @Test
    void testControlPlaneRejectionMapsToBadGateway() throws Exception {
        when(registry.create(eq(ResourceKind.ENVIRONMENT), anyMap()))
            .thenThrow(new ControlPlaneApiException(422, "invalid region"));

        mockMvc.perform(post("/api/providers/environment/create")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"inputs\":{\"region\":\"mars-1\"}}"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.status").value(422))
            .andExpect(jsonPath("$.message").value("422: invalid region"));
    }

    @Test
    void testControlPlaneOutageMapsToServiceUnavailable() throws Exception {
        when(registry.create(eq(ResourceKind.ENVIRONMENT), anyMap()))
            .thenThrow(new ControlPlaneInternalException(503, "unavailable"));

        mockMvc.perform(post("/api/providers/environment/create")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"inputs\":{}}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("control_plane_internal_error"));
    }

    @Test
    void testFailedUninstallIncludesLogs() throws Exception {
        doThrow(new UninstallJobFailedException("pinetools-uninstall-abcd1234", "boom"))
            .when(registry).delete(eq(ResourceKind.CLUSTER_UNINSTALLER), eq("uninstaller-ready"), any());

        mockMvc.perform(post("/api/providers/cluster-uninstaller/delete")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\":\"uninstaller-ready\",\"props\":{\"kubeconfig\":\"{}\"}}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("uninstall_failed"))
            .andExpect(jsonPath("$.logs").value("boom"));
    }
}
