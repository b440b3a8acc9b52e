package com.grokpm.backend.modules.ledger;

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
class LedgerIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private long propertyId;
    private long accountTypeId;
    private long accountId;

    @BeforeEach
    void setUpLedger() throws Exception {
        propertyId = postJson("/api/properties", "{\"name\": \"Main St Property\"}").path("id").asLong();
        accountTypeId = postJson("/api/account-types", "{\"name\": \"Income\"}").path("id").asLong();
        accountId = postJson("/api/accounts", """
                {"accountTypeId": %d, "name": "Rent Income"}
                """.formatted(accountTypeId)).path("id").asLong();
    }

    @Test
    void accountBalanceSumsItsTransactions() throws Exception {
        long rentTypeId = postJson("/api/transaction-types", "{\"name\": \"Rent\"}").path("id").asLong();
        JsonNode rent = postJson("/api/transactions", """
                {"accountId": %d, "propertyId": %d, "transactionTypeId": %d, "amount": 1200.00,
                 "date": "2026-02-01", "description": "Rent Payment"}
                """.formatted(accountId, propertyId, rentTypeId));
        JsonNode deposit = postJson("/api/transactions", """
                {"accountId": %d, "propertyId": %d, "amount": 300.00}
                """.formatted(accountId, propertyId));

        assertThat(rent.path("date").asText()).isEqualTo("2026-02-01");
        assertThat(deposit.path("date").asText()).isNotBlank();

        MvcResult result = mockMvc.perform(get("/api/accounts/" + accountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transactionCount").value(2))
                .andReturn();
        JsonNode account = objectMapper.readTree(result.getResponse().getContentAsString());
        assertThat(account.path("balance").decimalValue()).isEqualByComparingTo("1500");

        mockMvc.perform(get("/api/transactions").param("accountId", String.valueOf(accountId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    void referencedLedgerRowsCannotBeDeleted() throws Exception {
        postJson("/api/transactions", """
                {"accountId": %d, "propertyId": %d, "amount": 50}
                """.formatted(accountId, propertyId));

        mockMvc.perform(delete("/api/accounts/" + accountId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("RESOURCE_IN_USE"));
        mockMvc.perform(delete("/api/account-types/" + accountTypeId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("RESOURCE_IN_USE"));
    }

    @Test
    void duplicateAccountTypeNameIsConflict() throws Exception {
        mockMvc.perform(post("/api/account-types")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Income\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ACCOUNT_TYPE_NAME_TAKEN"));
    }

    @Test
    void transactionForUnknownAccountIsInvalidReference() throws Exception {
        mockMvc.perform(post("/api/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"accountId": 999999, "propertyId": %d, "amount": 10}
                                """.formatted(propertyId)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REFERENCE"));
    }

    @Test
    void accountRoundTrip() throws Exception {
        long expenseTypeId = postJson("/api/account-types", "{\"name\": \"Expense\"}").path("id").asLong();

        mockMvc.perform(get("/api/accounts/" + accountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Rent Income"))
                .andExpect(jsonPath("$.accountType.id").value(accountTypeId))
                .andExpect(jsonPath("$.transactionCount").value(0));

        mockMvc.perform(put("/api/accounts/" + accountId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accountTypeId\": %d}".formatted(expenseTypeId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Rent Income"))
                .andExpect(jsonPath("$.accountType.name").value("Expense"));
        mockMvc.perform(put("/api/accounts/" + accountId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(delete("/api/accounts/" + accountId))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/accounts/" + accountId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ACCOUNT_NOT_FOUND"));
    }

    @Test
    void transactionRoundTrip() throws Exception {
        long transactionId = postJson("/api/transactions", """
                {"accountId": %d, "propertyId": %d, "amount": 500.00, "date": "2026-01-15"}
                """.formatted(accountId, propertyId)).path("id").asLong();
        long repairTypeId = postJson("/api/transaction-types", "{\"name\": \"Repair\"}").path("id").asLong();

        mockMvc.perform(get("/api/transactions/" + transactionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amount").value(500.0))
                .andExpect(jsonPath("$.account.id").value(accountId))
                .andExpect(jsonPath("$.property.id").value(propertyId))
                .andExpect(jsonPath("$.transactionType").doesNotExist());

        mockMvc.perform(put("/api/transactions/" + transactionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"transactionTypeId": %d, "description": "Plumbing"}
                                """.formatted(repairTypeId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transactionType.name").value("Repair"))
                .andExpect(jsonPath("$.description").value("Plumbing"))
                .andExpect(jsonPath("$.date").value("2026-01-15"));

        mockMvc.perform(delete("/api/transactions/" + transactionId))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/transactions/" + transactionId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TRANSACTION_NOT_FOUND"));
        mockMvc.perform(delete("/api/accounts/" + accountId))
                .andExpect(status().isNoContent());
    }

    @Test
    void transactionTypeRoundTrip() throws Exception {
        long typeId = postJson("/api/transaction-types", "{\"name\": \"Rent\"}").path("id").asLong();
        postJson("/api/transaction-types", "{\"name\": \"Deposit\"}");

        mockMvc.perform(get("/api/transaction-types/" + typeId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Rent"));

        mockMvc.perform(put("/api/transaction-types/" + typeId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Monthly Rent\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Monthly Rent"));
        mockMvc.perform(put("/api/transaction-types/" + typeId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"deposit\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("TRANSACTION_TYPE_NAME_TAKEN"));

        mockMvc.perform(delete("/api/transaction-types/" + typeId))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/transaction-types/" + typeId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TRANSACTION_TYPE_NOT_FOUND"));
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
