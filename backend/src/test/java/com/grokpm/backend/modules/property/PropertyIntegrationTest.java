package com.grokpm.backend.modules.property;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grokpm.backend.modules.property.application.PropertyService;
import com.grokpm.backend.modules.property.presentation.dto.AddressInput;
import com.grokpm.backend.modules.property.presentation.dto.CreatePropertyRequest;
import com.grokpm.backend.modules.property.presentation.dto.PropertyResponse;
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
class PropertyIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private PropertyService propertyService;

    @Test
    void deletingPropertyRemovesEveryDependentRow() throws Exception {
        JsonNode property = postJson("/api/properties", """
                {
                  "name": "Main St Property",
                  "type": "Residential",
                  "status": "active",
                  "value": 500000,
                  "addresses": [
                    {"street": "123 Main St", "city": "Portland", "state": "OR", "zip": "97201"},
                    {"street": "125 Main St", "city": "Portland", "state": "OR", "zip": "97201"}
                  ],
                  "photos": [{"url": "https://img.example/front.jpg", "name": "front"}]
                }
                """);
        long propertyId = property.path("id").asLong();
        long addressId = property.path("addresses").get(0).path("id").asLong();
        assertThat(property.path("addresses").get(0).path("primary").asBoolean()).isTrue();
        assertThat(property.path("addresses").get(1).path("primary").asBoolean()).isFalse();

        long unitId = postJson("/api/units", """
                {"addressId": %d, "unitNumber": "101", "rentAmount": 1200, "status": "occupied"}
                """.formatted(addressId)).path("id").asLong();
        long tenantId = postJson("/api/tenants", """
                {"unitId": %d, "name": "Jane Smith", "email": "jane@example.com",
                 "leaseStartDate": "2026-01-01", "leaseEndDate": "2026-12-31", "rent": 1200}
                """.formatted(unitId)).path("id").asLong();
        postJson("/api/payments", """
                {"tenantId": %d, "amount": 1200, "date": "2026-02-01", "status": "paid"}
                """.formatted(tenantId));
        postJson("/api/maintenance", """
                {"unitId": %d, "title": "Leaky faucet", "priority": "HIGH"}
                """.formatted(unitId));
        postJson("/api/photos", """
                {"url": "https://img.example/unit.jpg", "unitId": %d}
                """.formatted(unitId));
        postJson("/api/owners", """
                {"name": "John Doe", "email": "john@example.com", "propertyId": %d}
                """.formatted(propertyId));
        long associationId = postJson("/api/associations", """
                {"name": "Main St HOA", "fee": 100, "propertyId": %d}
                """.formatted(propertyId)).path("id").asLong();
        postJson("/api/board-members", """
                {"associationId": %d, "name": "Alice Brown"}
                """.formatted(associationId));
        long accountTypeId = postJson("/api/account-types", """
                {"name": "Income"}
                """).path("id").asLong();
        long accountId = postJson("/api/accounts", """
                {"accountTypeId": %d, "name": "Rent Income"}
                """.formatted(accountTypeId)).path("id").asLong();
        postJson("/api/transactions", """
                {"accountId": %d, "propertyId": %d, "amount": 1200, "description": "Rent Payment"}
                """.formatted(accountId, propertyId));
        long portfolioId = postJson("/api/portfolios", """
                {"userId": "demo-user", "name": "Pacific Northwest", "propertyIds": [%d]}
                """.formatted(propertyId)).path("id").asLong();

        mockMvc.perform(delete("/api/properties/" + propertyId))
                .andExpect(status().isNoContent());

        for (String table : List.of("property", "property_address", "unit", "tenant", "payment", "owner",
                "association", "board_member", "ledger_transaction", "photo", "maintenance_ticket",
                "portfolio_property")) {
            Integer remaining = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
            assertThat(remaining)
                    .withFailMessage("expected %s to be empty but found %s rows", table, remaining)
                    .isZero();
        }
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM account", Integer.class)).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM portfolio WHERE id = ?", Integer.class, portfolioId)).isEqualTo(1);

        mockMvc.perform(get("/api/properties/" + propertyId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("PROPERTY_NOT_FOUND"));
    }

    @Test
    void updatingAddressesKeepsMatchedRowsAndDropsTheRest() throws Exception {
        JsonNode property = postJson("/api/properties", """
                {
                  "name": "Oak Ave Property",
                  "addresses": [
                    {"street": "1 Oak Ave", "city": "Seattle"},
                    {"street": "3 Oak Ave", "city": "Seattle"}
                  ]
                }
                """);
        long propertyId = property.path("id").asLong();
        long keptId = property.path("addresses").get(0).path("id").asLong();
        long droppedId = property.path("addresses").get(1).path("id").asLong();

        MvcResult result = mockMvc.perform(put("/api/properties/" + propertyId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "addresses": [
                                    {"id": %d, "street": "1 Oak Avenue", "city": "Seattle"},
                                    {"street": "2 Oak Ave", "city": "Seattle"}
                                  ]
                                }
                                """.formatted(keptId)))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode updated = objectMapper.readTree(result.getResponse().getContentAsString());

        assertThat(updated.path("name").asText()).isEqualTo("Oak Ave Property");
        assertThat(updated.path("addresses")).hasSize(2);
        assertThat(updated.path("addresses").get(0).path("id").asLong()).isEqualTo(keptId);
        assertThat(updated.path("addresses").get(0).path("street").asText()).isEqualTo("1 Oak Avenue");
        assertThat(updated.path("addresses").get(0).path("primary").asBoolean()).isTrue();
        assertThat(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM property_address WHERE id = ?", Integer.class, droppedId)).isZero();
        assertThat(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM property_address WHERE property_id = ? AND is_primary",
                Integer.class, propertyId)).isEqualTo(1);
    }

    @Test
    void concurrentCreatesReceiveDistinctIds() throws Exception {
        int workers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<CompletableFuture<PropertyResponse>> futures = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                String name = "Concurrent " + i;
                futures.add(CompletableFuture.supplyAsync(() -> propertyService.createProperty(new CreatePropertyRequest(
                        name, null, null, null, List.of(new AddressInput(null, name + " St", null, null, null)), null
                )), executor));
            }
            Set<Long> ids = new HashSet<>();
            for (CompletableFuture<PropertyResponse> future : futures) {
                ids.add(future.get().id());
            }
            assertThat(ids).hasSize(workers);
        } finally {
            executor.shutdownNow();
        }
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM property", Integer.class)).isEqualTo(workers);
    }

    @Test
    void addressEndpointsKeepSinglePrimary() throws Exception {
        JsonNode property = postJson("/api/properties", """
                {"name": "Elm Property", "addresses": [{"street": "1 Elm St"}]}
                """);
        long propertyId = property.path("id").asLong();
        long firstId = property.path("addresses").get(0).path("id").asLong();

        JsonNode second = postJson("/api/properties/" + propertyId + "/addresses", """
                {"street": "2 Elm St", "primary": true}
                """);
        assertThat(second.path("primary").asBoolean()).isTrue();

        mockMvc.perform(get("/api/properties/addresses/" + firstId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.primary").value(false));

        mockMvc.perform(delete("/api/properties/addresses/" + second.path("id").asLong()))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/properties/" + propertyId + "/addresses"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].primary").value(true));
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
