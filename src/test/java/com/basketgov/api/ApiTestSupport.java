package com.basketgov.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Request helpers shared by the controller tests. Every test works in a
 * fresh workspace so the shared application context never leaks state.
 */
final class ApiTestSupport {

    private final MockMvc mvc;
    private final ObjectMapper objectMapper;

    ApiTestSupport(MockMvc mvc, ObjectMapper objectMapper) {
        this.mvc = mvc;
        this.objectMapper = objectMapper;
    }

    static String newWorkspace() {
        return "ws-" + UUID.randomUUID();
    }

    static MockHttpServletRequestBuilder as(MockHttpServletRequestBuilder request, String workspaceId, String role) {
        request.header(CallerHeaderFilter.WORKSPACE_HEADER, workspaceId)
            .header(CallerHeaderFilter.USER_HEADER, "user-" + workspaceId);
        if (role != null) {
            request.header(CallerHeaderFilter.ROLE_HEADER, role);
        }
        return request;
    }

    String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    Map<String, Object> read(MvcResult result) throws Exception {
        return objectMapper.readValue(result.getResponse().getContentAsString(), new TypeReference<>() {});
    }

    String createBasket(String workspaceId) throws Exception {
        MvcResult result = mvc.perform(as(post("/v1/baskets"), workspaceId, null)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("name", "Research notes"))))
            .andExpect(status().isCreated())
            .andReturn();
        return (String) read(result).get("id");
    }

    void updateSettings(String workspaceId, Map<String, Object> settings) throws Exception {
        mvc.perform(as(put("/v1/governance/settings"), workspaceId, "admin")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(settings)))
            .andExpect(status().isOk());
    }

    void enableGovernance(String workspaceId) throws Exception {
        updateSettings(workspaceId, Map.of("governance_enabled", true));
    }

    String createProposal(String workspaceId, String basketId, List<Map<String, Object>> ops) throws Exception {
        MvcResult result = mvc.perform(as(post("/v1/baskets/{id}/proposals", basketId), workspaceId, null)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("proposal_kind", "Extraction", "ops", ops, "origin", "human"))))
            .andExpect(status().isOk())
            .andReturn();
        return (String) read(result).get("proposal_id");
    }

    static Map<String, Object> createBlockOp(String content) {
        return Map.of("type", "CreateBlock", "data", Map.of("content", content));
    }
}
