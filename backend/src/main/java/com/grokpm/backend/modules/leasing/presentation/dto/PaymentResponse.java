package com.grokpm.backend.modules.leasing.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;

public record PaymentResponse(
        Long id,
        BigDecimal amount,
        LocalDate date,
        String status,
        TenantSummary tenant,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
