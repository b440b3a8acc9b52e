package com.grokpm.backend.modules.leasing.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

public record TenantResponse(
        Long id,
        String name,
        String email,
        String phone,
        LocalDate leaseStartDate,
        LocalDate leaseEndDate,
        BigDecimal rent,
        UnitSummary unit,
        List<PaymentSummary> payments,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
