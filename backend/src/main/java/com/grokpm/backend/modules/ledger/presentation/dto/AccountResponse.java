package com.grokpm.backend.modules.ledger.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

public record AccountResponse(
        Long id,
        String name,
        LedgerTypeSummary accountType,
        int transactionCount,
        BigDecimal balance,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
