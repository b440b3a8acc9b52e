package com.grokpm.backend.modules.subscription;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grokpm.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class SubscriptionIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void plansAreListedCheapestFirst() throws Exception {
        postJson("/api/subscription/plans", """
                {"name": "Enterprise", "monthlyPrice": 199.99}
                """);
        postJson("/api/subscription/plans", """
                {"name": "Starter", "monthlyPrice": 29.99, "maxProperties": 5}
                """);
        postJson("/api/subscription/plans", """
                {"name": "Retired", "monthlyPrice": 9.99, "active": false}
                """);

        mockMvc.perform(get("/api/subscription/plans"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Retired"))
                .andExpect(jsonPath("$[1].name").value("Starter"))
                .andExpect(jsonPath("$[2].name").value("Enterprise"));
        mockMvc.perform(get("/api/subscription/plans").param("active", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    void subscriptionLifecycle() throws Exception {
        long planId = postJson("/api/subscription/plans", """
                {"name": "Starter", "monthlyPrice": 29.99}
                """).path("id").asLong();
        long subscriptionId = postJson("/api/subscriptions", """
                {"userId": "demo-user", "planId": %d}
                """.formatted(planId)).path("id").asLong();

        mockMvc.perform(post("/api/subscriptions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": \"demo-user\", \"planId\": %d}".formatted(planId)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("SUBSCRIPTION_ALREADY_ACTIVE"));

        mockMvc.perform(delete("/api/subscription/plans/" + planId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("RESOURCE_IN_USE"));

        mockMvc.perform(post("/api/subscriptions/" + subscriptionId + "/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"))
                .andExpect(jsonPath("$.cancelledAt").isNotEmpty());
        mockMvc.perform(post("/api/subscriptions/" + subscriptionId + "/cancel"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("SUBSCRIPTION_ALREADY_CANCELLED"));

        postJson("/api/subscriptions", """
                {"userId": "demo-user", "planId": %d}
                """.formatted(planId));
        mockMvc.perform(get("/api/subscriptions").param("userId", "demo-user"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    void planRoundTrip() throws Exception {
        long planId = postJson("/api/subscription/plans", """
                {"name": "Starter", "description": "Small landlords", "monthlyPrice": 29.99, "maxProperties": 5}
                """).path("id").asLong();

        mockMvc.perform(get("/api/subscription/plans/" + planId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Starter"))
                .andExpect(jsonPath("$.maxProperties").value(5))
                .andExpect(jsonPath("$.active").value(true));

        mockMvc.perform(put("/api/subscription/plans/" + planId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"monthlyPrice\": 34.99, \"active\": false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Starter"))
                .andExpect(jsonPath("$.description").value("Small landlords"))
                .andExpect(jsonPath("$.monthlyPrice").value(34.99))
                .andExpect(jsonPath("$.active").value(false));
        mockMvc.perform(put("/api/subscription/plans/" + planId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(delete("/api/subscription/plans/" + planId))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/subscription/plans/" + planId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SUBSCRIPTION_PLAN_NOT_FOUND"));
    }

    @Test
    void subscriptionRoundTrip() throws Exception {
        long starterId = postJson("/api/subscription/plans", """
                {"name": "Starter", "monthlyPrice": 29.99}
                """).path("id").asLong();
        long proId = postJson("/api/subscription/plans", """
                {"name": "Pro", "monthlyPrice": 79.99}
                """).path("id").asLong();
        long subscriptionId = postJson("/api/subscriptions", """
                {"userId": "demo-user", "planId": %d}
                """.formatted(starterId)).path("id").asLong();

        mockMvc.perform(get("/api/subscriptions/" + subscriptionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value("demo-user"))
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.plan.id").value(starterId));

        mockMvc.perform(put("/api/subscriptions/" + subscriptionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"planId\": %d}".formatted(proId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.plan.name").value("Pro"))
                .andExpect(jsonPath("$.status").value("ACTIVE"));
        mockMvc.perform(put("/api/subscriptions/" + subscriptionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"CANCELLED\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"))
                .andExpect(jsonPath("$.cancelledAt").isNotEmpty());

        mockMvc.perform(delete("/api/subscriptions/" + subscriptionId))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/subscriptions/" + subscriptionId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SUBSCRIPTION_NOT_FOUND"));
        mockMvc.perform(delete("/api/subscription/plans/" + starterId))
                .andExpect(status().isNoContent());
    }

    private JsonNode postJson(String path, String body) throws Exception {
        MvcResult result = mockMvc.perform(post(path)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
