package com.grokpm.backend.modules.leasing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grokpm.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class LeasingIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private long addressId;
    private long unitId;

    @BeforeEach
    void setUpUnit() throws Exception {
        JsonNode property = postJson("/api/properties", """
                {"name": "Main St Property", "addresses": [{"street": "123 Main St", "city": "Portland"}]}
                """);
        addressId = property.path("addresses").get(0).path("id").asLong();
        unitId = postJson("/api/units", """
                {"addressId": %d, "unitNumber": "101", "rentAmount": 1200, "status": "vacant"}
                """.formatted(addressId)).path("id").asLong();
    }

    @Test
    void unitShowsTenantsAndOpenTickets() throws Exception {
        long tenantId = postJson("/api/tenants", """
                {"unitId": %d, "name": "Jane Smith", "email": "jane@example.com",
                 "leaseStartDate": "2026-01-01", "leaseEndDate": "2026-12-31", "rent": 1200}
                """.formatted(unitId)).path("id").asLong();
        long ticketId = postJson("/api/maintenance", """
                {"unitId": %d, "title": "Broken heater", "priority": "URGENT"}
                """.formatted(unitId)).path("id").asLong();
        postJson("/api/maintenance", """
                {"unitId": %d, "title": "Loose railing"}
                """.formatted(unitId));

        mockMvc.perform(get("/api/units/" + unitId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unitNumber").value("101"))
                .andExpect(jsonPath("$.address.id").value(addressId))
                .andExpect(jsonPath("$.tenants[0].id").value(tenantId))
                .andExpect(jsonPath("$.openTicketCount").value(2));

        mockMvc.perform(put("/api/maintenance/" + ticketId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"RESOLVED\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RESOLVED"))
                .andExpect(jsonPath("$.resolvedAt").isNotEmpty());

        mockMvc.perform(get("/api/units/" + unitId))
                .andExpect(jsonPath("$.openTicketCount").value(1));
        mockMvc.perform(get("/api/maintenance").param("status", "OPEN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void paymentDefaultsToPendingToday() throws Exception {
        long tenantId = postJson("/api/tenants", """
                {"unitId": %d, "name": "Jane Smith"}
                """.formatted(unitId)).path("id").asLong();

        JsonNode payment = postJson("/api/payments", """
                {"tenantId": %d, "amount": 1200}
                """.formatted(tenantId));

        assertThat(payment.path("status").asText()).isEqualTo("pending");
        assertThat(payment.path("date").asText()).isNotBlank();
        assertThat(payment.path("tenant").path("id").asLong()).isEqualTo(tenantId);

        mockMvc.perform(get("/api/tenants/" + tenantId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payments.length()").value(1));
    }

    @Test
    void leaseEndingBeforeItStartsIsRejected() throws Exception {
        mockMvc.perform(post("/api/tenants")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"unitId": %d, "name": "Jane Smith",
                                 "leaseStartDate": "2026-06-01", "leaseEndDate": "2026-05-31"}
                                """.formatted(unitId)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_LEASE_PERIOD"));
    }

    @Test
    void unitForUnknownAddressIsInvalidReference() throws Exception {
        mockMvc.perform(post("/api/units")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"addressId\": 999999, \"unitNumber\": \"9\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REFERENCE"));
    }

    @Test
    void deletingUnitRemovesTenantsAndPayments() throws Exception {
        long tenantId = postJson("/api/tenants", """
                {"unitId": %d, "name": "Jane Smith"}
                """.formatted(unitId)).path("id").asLong();
        postJson("/api/payments", """
                {"tenantId": %d, "amount": 1200, "status": "paid"}
                """.formatted(tenantId));

        mockMvc.perform(delete("/api/units/" + unitId))
                .andExpect(status().isNoContent());

        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM tenant", Integer.class)).isZero();
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM payment", Integer.class)).isZero();
        mockMvc.perform(get("/api/tenants/" + tenantId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TENANT_NOT_FOUND"));
    }

    @Test
    void unitRoundTrip() throws Exception {
        mockMvc.perform(get("/api/units/" + unitId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rentAmount").value(1200.0))
                .andExpect(jsonPath("$.status").value("vacant"));

        mockMvc.perform(put("/api/units/" + unitId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"occupied\", \"rentAmount\": 1250.50}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unitNumber").value("101"))
                .andExpect(jsonPath("$.status").value("occupied"))
                .andExpect(jsonPath("$.rentAmount").value(1250.5));
        mockMvc.perform(get("/api/units").param("status", "occupied"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
        mockMvc.perform(put("/api/units/" + unitId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"unitNumber\": \" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(delete("/api/units/" + unitId))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/units/" + unitId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("UNIT_NOT_FOUND"));
    }

    @Test
    void tenantRoundTrip() throws Exception {
        long tenantId = postJson("/api/tenants", """
                {"unitId": %d, "name": "Jane Smith", "leaseStartDate": "2026-01-01", "rent": 1200}
                """.formatted(unitId)).path("id").asLong();

        mockMvc.perform(get("/api/tenants/" + tenantId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Jane Smith"))
                .andExpect(jsonPath("$.unit.id").value(unitId));

        mockMvc.perform(put("/api/tenants/" + tenantId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\": \"jane@example.com\", \"leaseEndDate\": \"2026-12-31\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Jane Smith"))
                .andExpect(jsonPath("$.email").value("jane@example.com"))
                .andExpect(jsonPath("$.leaseStartDate").value("2026-01-01"))
                .andExpect(jsonPath("$.leaseEndDate").value("2026-12-31"));
        mockMvc.perform(put("/api/tenants/" + tenantId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
        mockMvc.perform(get("/api/tenants/" + tenantId))
                .andExpect(jsonPath("$.name").value("Jane Smith"));

        mockMvc.perform(delete("/api/tenants/" + tenantId))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/tenants/" + tenantId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TENANT_NOT_FOUND"));
        mockMvc.perform(get("/api/units/" + unitId))
                .andExpect(jsonPath("$.tenants.length()").value(0));
    }

    @Test
    void paymentRoundTrip() throws Exception {
        long tenantId = postJson("/api/tenants", """
                {"unitId": %d, "name": "Jane Smith"}
                """.formatted(unitId)).path("id").asLong();
        long paymentId = postJson("/api/payments", """
                {"tenantId": %d, "amount": 1200, "date": "2026-02-01"}
                """.formatted(tenantId)).path("id").asLong();

        mockMvc.perform(get("/api/payments/" + paymentId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date").value("2026-02-01"))
                .andExpect(jsonPath("$.status").value("pending"));

        mockMvc.perform(put("/api/payments/" + paymentId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"paid\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("paid"))
                .andExpect(jsonPath("$.amount").value(1200.0))
                .andExpect(jsonPath("$.date").value("2026-02-01"));
        mockMvc.perform(put("/api/payments/" + paymentId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 12345678901.00}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(delete("/api/payments/" + paymentId))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/payments/" + paymentId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("PAYMENT_NOT_FOUND"));
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM tenant", Integer.class)).isEqualTo(1);
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
