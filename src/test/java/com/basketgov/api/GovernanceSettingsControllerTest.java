package com.basketgov.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static com.basketgov.api.ApiTestSupport.as;
import static com.basketgov.api.ApiTestSupport.newWorkspace;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class GovernanceSettingsControllerTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper objectMapper;

    private ApiTestSupport api;
    private String workspace;

    @BeforeEach
    void setUp() {
        api = new ApiTestSupport(mvc, objectMapper);
        workspace = newWorkspace();
    }

    @Test
    void defaultsComeFromEnvironment() throws Exception {
        mvc.perform(as(get("/v1/governance/settings"), workspace, null))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.source").value("environment_defaults"))
            .andExpect(jsonPath("$.settings.governance_enabled").value(false))
            .andExpect(jsonPath("$.settings.direct_substrate_writes").value(true))
            .andExpect(jsonPath("$.settings.cascade_events_enabled").value(true))
            .andExpect(jsonPath("$.settings.default_blast_radius").value("Scoped"))
            .andExpect(jsonPath("$.settings.entry_point_policies.manual_edit").value("proposal"));
    }

    @Test
    void missingWorkspaceHeaderIsUnauthorized() throws Exception {
        mvc.perform(get("/v1/governance/settings"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error_code").value("UNAUTHORIZED"));
    }

    @Test
    void nonAdminCannotUpdate() throws Exception {
        mvc.perform(as(put("/v1/governance/settings"), workspace, "member")
                .contentType(MediaType.APPLICATION_JSON)
                .content(api.json(Map.of("governance_enabled", true))))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error_code").value("FORBIDDEN"));
    }

    @Test
    void invalidPolicyIsBadRequest() throws Exception {
        mvc.perform(as(put("/v1/governance/settings"), workspace, "admin")
                .contentType(MediaType.APPLICATION_JSON)
                .content(api.json(Map.of("entry_point_policies", Map.of("manual_edit", "yolo")))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error", containsString("manual_edit")));
    }

    @Test
    void invalidBlastRadiusIsBadRequest() throws Exception {
        mvc.perform(as(put("/v1/governance/settings"), workspace, "owner")
                .contentType(MediaType.APPLICATION_JSON)
                .content(api.json(Map.of("default_blast_radius", "Universe"))))
            .andExpect(status().isBadRequest());
    }

    @Test
    void adminUpdatePersistsForWorkspace() throws Exception {
        mvc.perform(as(put("/v1/governance/settings"), workspace, "admin")
                .contentType(MediaType.APPLICATION_JSON)
                .content(api.json(Map.of(
                    "governance_enabled", true,
                    "entry_point_policies", Map.of("graph_action", "hybrid"),
                    "default_blast_radius", "Local"))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.source").value("workspace_database"));

        mvc.perform(as(get("/v1/governance/settings"), workspace, null))
            .andExpect(jsonPath("$.source").value("workspace_database"))
            .andExpect(jsonPath("$.settings.governance_enabled").value(true))
            .andExpect(jsonPath("$.settings.entry_point_policies.graph_action").value("hybrid"))
            .andExpect(jsonPath("$.settings.default_blast_radius").value("Local"));

        mvc.perform(as(get("/v1/governance/status"), workspace, null))
            .andExpect(jsonPath("$.status").value("testing"));

        mvc.perform(as(get("/v1/governance/settings"), newWorkspace(), null))
            .andExpect(jsonPath("$.source").value("environment_defaults"));
    }
}
