package com.grokpm.backend.modules.ledger.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.grokpm.backend.modules.property.presentation.dto.PropertySummary;

public record TransactionResponse(
        Long id,
        BigDecimal amount,
        LocalDate date,
        String description,
        AccountSummary account,
        @JsonInclude(JsonInclude.Include.NON_NULL) LedgerTypeSummary transactionType,
        PropertySummary property,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
