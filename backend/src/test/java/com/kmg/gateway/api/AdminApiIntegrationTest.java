package com.kmg.gateway.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.gateway.config.AdminTokenInterceptor;
import com.kmg.gateway.support.GatewayIntegrationSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
@DisplayName("HTTP API")
class AdminApiIntegrationTest extends GatewayIntegrationSupport {

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("Should reject admin calls without the admin token")
    void shouldRequireAdminToken() throws Exception {
        mockMvc.perform(get("/api/admin/services"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/admin/services").header(AdminTokenInterceptor.HEADER, "wrong"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/admin/services").header(AdminTokenInterceptor.HEADER, ADMIN_TOKEN))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("Should issue a key, fund the caller and serve a verification over HTTP")
    void shouldServeVerificationEndToEnd() throws Exception {
        // Given
        String caller = unique("caller");
        String serviceId = registerService(2, "fake-b");
        fakeB.returning(objectMapper.createObjectNode().put("success", true).put("owner", "Z"));

        MvcResult created = mockMvc.perform(post("/api/admin/keys")
                        .header(AdminTokenInterceptor.HEADER, ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"callerId\":\"" + caller + "\",\"label\":\"ci\",\"services\":[\"" + serviceId + "\"]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.key.callerId").value(caller))
                .andReturn();
        String apiKey = objectMapper.readTree(created.getResponse().getContentAsString()).get("apiKey").asText();

        mockMvc.perform(post("/api/admin/accounts/" + caller + "/credits")
                        .header(AdminTokenInterceptor.HEADER, ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"delta\":10,\"reason\":\"welcome credits\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(10));

        // When
        MvcResult pending = mockMvc.perform(post("/api/v1/services/" + serviceId)
                        .header(VerificationController.API_KEY_HEADER, apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lookupKey\":\"up32ab0001\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        // Then
        MvcResult done = mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.source").value("fake-b"))
                .andExpect(jsonPath("$.lookupKey").value("UP32AB0001"))
                .andExpect(jsonPath("$.creditsCharged").value(2))
                .andExpect(jsonPath("$.payload.owner").value("Z"))
                .andReturn();
        JsonNode body = objectMapper.readTree(done.getResponse().getContentAsString());
        assertThat(body.get("fetchedAt").asText()).isNotBlank();

        mockMvc.perform(get("/api/admin/accounts/" + caller).header(AdminTokenInterceptor.HEADER, ADMIN_TOKEN))
                .andExpect(jsonPath("$.balance").value(8))
                .andExpect(jsonPath("$.keys[0].services[0]").value(serviceId));
        mockMvc.perform(get("/api/admin/usage").param("callerId", caller).header(AdminTokenInterceptor.HEADER, ADMIN_TOKEN))
                .andExpect(jsonPath("$[0].outcome").value("SUCCESS"))
                .andExpect(jsonPath("$[0].source").value("fake-b"));
    }

    @Test
    @DisplayName("Should map failures to distinct HTTP statuses and codes")
    void shouldMapFailures() throws Exception {
        String serviceId = registerService(1, "fake-a");

        MvcResult unauthenticated = mockMvc.perform(post("/api/v1/services/" + serviceId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lookupKey\":\"X1\"}"))
                .andReturn();
        mockMvc.perform(asyncDispatch(unauthenticated))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));

        String caller = unique("caller");
        String apiKey = issueKey(caller, serviceId);
        MvcResult broke = mockMvc.perform(post("/api/v1/services/" + serviceId)
                        .header(VerificationController.API_KEY_HEADER, apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lookupKey\":\"X1\"}"))
                .andReturn();
        mockMvc.perform(asyncDispatch(broke))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.status").value("INSUFFICIENT_CREDITS"));

        mockMvc.perform(post("/api/v1/services/" + serviceId)
                        .header(VerificationController.API_KEY_HEADER, apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lookupKey\":\"  \"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should toggle a service and hide it from the public catalog")
    void shouldToggleService() throws Exception {
        String serviceId = registerService(1, "fake-a");

        mockMvc.perform(get("/api/v1/services"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].id", hasItem(serviceId)));

        mockMvc.perform(patch("/api/admin/services/" + serviceId)
                        .header(AdminTokenInterceptor.HEADER, ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"active\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));

        mockMvc.perform(get("/api/v1/services/" + serviceId))
                .andExpect(status().isNotFound());
        mockMvc.perform(patch("/api/admin/services/no-such-service")
                        .header(AdminTokenInterceptor.HEADER, ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"active\":true}"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should reject grants to unknown services and accept replacement grants")
    void shouldManageGrants() throws Exception {
        String serviceId = registerService(1, "fake-a");
        String other = registerService(1, "fake-a");

        mockMvc.perform(post("/api/admin/keys")
                        .header(AdminTokenInterceptor.HEADER, ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"callerId\":\"c1\",\"services\":[\"no-such-service\"]}"))
                .andExpect(status().isBadRequest());

        String keyId = apiKeyService.issue(unique("caller"), "grants", List.of(serviceId)).grant().keyId();
        mockMvc.perform(put("/api/admin/keys/" + keyId + "/services")
                        .header(AdminTokenInterceptor.HEADER, ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"services\":[\"" + other + "\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.services[0]").value(other));

        mockMvc.perform(delete("/api/admin/keys/" + keyId).header(AdminTokenInterceptor.HEADER, ADMIN_TOKEN))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/admin/keys/unknown-key").header(AdminTokenInterceptor.HEADER, ADMIN_TOKEN))
                .andExpect(status().isNotFound());
    }
}
