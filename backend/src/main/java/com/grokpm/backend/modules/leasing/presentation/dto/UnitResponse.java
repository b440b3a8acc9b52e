package com.grokpm.backend.modules.leasing.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

import com.grokpm.backend.modules.property.presentation.dto.AddressSummary;
import com.grokpm.backend.modules.property.presentation.dto.PhotoResponse;

public record UnitResponse(
        Long id,
        String unitNumber,
        BigDecimal rentAmount,
        String status,
        AddressSummary address,
        List<TenantSummary> tenants,
        List<PhotoResponse> photos,
        long openTicketCount,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
