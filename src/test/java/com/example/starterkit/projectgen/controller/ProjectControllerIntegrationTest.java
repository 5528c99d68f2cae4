package com.example.starterkit.projectgen.controller;

import com.example.starterkit.projectgen.model.OrderDetails;
import com.example.starterkit.projectgen.model.ResolveRequest;
import com.example.starterkit.projectgen.model.TemplateRef;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasItems;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end tests for the project API against the bundled catalog and the
 * starter fixture tree.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public class ProjectControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("resolve returns the dependency closure")
    public void resolveReturnsClosure() throws Exception {
        ResolveRequest request = ResolveRequest.builder()
                .selectedFeatures(List.of("auth.social"))
                .tier("pro")
                .build();

        mockMvc.perform(post("/api/projects/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("pro"))
                .andExpect(jsonPath("$.allFeatureSlugs", contains("auth.social", "auth.basic")))
                .andExpect(jsonPath("$.dependencyTree['auth.social']", contains("auth.basic")));
    }

    @Test
    @DisplayName("resolve with an unknown slug answers 400 with the offending slug")
    public void resolveUnknownFeature() throws Exception {
        String body = "{\"selectedFeatures\": [\"auth.basic\", \"billing.crypto\"], \"tier\": \"pro\"}";

        mockMvc.perform(post("/api/projects/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNKNOWN_FEATURE"))
                .andExpect(jsonPath("$.identifiers", contains("billing.crypto")));
    }

    @Test
    @DisplayName("generate returns a summary of the assembled project")
    public void generateReturnsSummary() throws Exception {
        OrderDetails order = order(null);

        mockMvc.perform(post("/api/projects/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(order)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.projectName").value("saas-starter-pro"))
                .andExpect(jsonPath("$.features", hasItems("auth.basic", "payments.stripe", "infra.docker")))
                .andExpect(jsonPath("$.files", hasItems("starter-config.json", "LICENSE.md",
                        "backend/src/modules/auth/auth.service.ts", "Dockerfile")))
                .andExpect(jsonPath("$.models", hasItems("User", "Session", "Payment", "Subscription")))
                .andExpect(jsonPath("$.versionConflicts[0].package").value("jsonwebtoken"))
                .andExpect(jsonPath("$.versionConflicts[0].selected").value("^9.0.0"));
    }

    @Test
    @DisplayName("a submitted job can be polled and its files downloaded")
    public void submitPollAndDownload() throws Exception {
        String orderId = "order-" + UUID.randomUUID();

        mockMvc.perform(post("/api/projects/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(order(orderId))))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.orderId").value(orderId));

        awaitStatus(orderId, "COMPLETED");

        MvcResult manifest = mockMvc.perform(get("/api/projects/jobs/{orderId}/files", orderId)
                        .param("path", "backend/package.json"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_OCTET_STREAM))
                .andReturn();

        JsonNode packageJson = objectMapper.readTree(manifest.getResponse().getContentAsByteArray());
        assertEquals("saas-starter-pro", packageJson.get("name").asText());
        assertEquals("^14.0.0", packageJson.get("dependencies").get("stripe").asText());

        mockMvc.perform(get("/api/projects/jobs/{orderId}/files", orderId)
                        .param("path", "backend/missing.ts"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("a job failing on an unknown feature reports its error code")
    public void failedJobReportsError() throws Exception {
        String orderId = "order-" + UUID.randomUUID();
        OrderDetails order = order(orderId);
        order.setSelectedFeatures(List.of("billing.crypto"));

        mockMvc.perform(post("/api/projects/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(order)))
                .andExpect(status().isAccepted());

        awaitStatus(orderId, "FAILED");

        mockMvc.perform(get("/api/projects/jobs/{orderId}", orderId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.errorCode").value("UNKNOWN_FEATURE"))
                .andExpect(jsonPath("$.errorIdentifiers", contains("billing.crypto")));

        mockMvc.perform(get("/api/projects/jobs/{orderId}/files", orderId)
                        .param("path", "README.md"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNKNOWN_FEATURE"));
    }

    @Test
    public void unknownJobIsNotFound() throws Exception {
        mockMvc.perform(get("/api/projects/jobs/{orderId}", "no-such-order"))
                .andExpect(status().isNotFound());
    }

    @Test
    public void jobWithoutOrderIdIsRejected() throws Exception {
        mockMvc.perform(post("/api/projects/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(order(null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    public void healthCheck() throws Exception {
        mockMvc.perform(get("/api/projects/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("Project generation service is running"));
    }

    @Test
    @DisplayName("admin endpoints list the catalog and reload its cache")
    public void adminCatalog() throws Exception {
        mockMvc.perform(get("/api/admin/catalog"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].slug", hasItems("auth.basic", "comms.email")));

        mockMvc.perform(delete("/api/admin/catalog/cache"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/admin/catalog/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cacheName").value("featureCatalog"))
                .andExpect(jsonPath("$.estimatedSize").value(1))
                .andExpect(jsonPath("$.locations", hasItem("classpath:catalog/features.yaml")))
                .andExpect(jsonPath("$.catalogs['classpath:catalog/features.yaml'].featureCount").value(10))
                .andExpect(jsonPath("$.catalogs['classpath:catalog/features.yaml'].categories.payments").value(3));
    }

    private OrderDetails order(String id) {
        return OrderDetails.builder()
                .id(id)
                .orderNumber("ORD-1001")
                .tier("pro")
                .customerEmail("dev@example.com")
                .selectedFeatures(List.of("auth.social", "payments.subscriptions"))
                .template(TemplateRef.builder()
                        .name("SaaS Starter")
                        .slug("saas-starter")
                        .includedFeatures(List.of("infra.docker"))
                        .build())
                .build();
    }

    private void awaitStatus(String orderId, String expected) throws Exception {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            MvcResult result = mockMvc.perform(get("/api/projects/jobs/{orderId}", orderId))
                    .andExpect(status().isOk())
                    .andReturn();
            String status = objectMapper.readTree(
                    result.getResponse().getContentAsString(StandardCharsets.UTF_8)).get("status").asText();
            if (expected.equals(status)) {
                return;
            }
            assertTrue(status.equals("QUEUED") || status.equals("RUNNING"),
                    "Job for " + orderId + " ended as " + status);
            Thread.sleep(20);
        }
        fail("Job for " + orderId + " did not reach " + expected);
    }
}
