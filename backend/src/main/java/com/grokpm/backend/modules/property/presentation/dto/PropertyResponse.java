package com.grokpm.backend.modules.property.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

import com.grokpm.backend.modules.association.presentation.dto.AssociationSummary;

public record PropertyResponse(
        Long id,
        String name,
        String type,
        String status,
        BigDecimal value,
        List<AddressResponse> addresses,
        List<OwnerSummary> owners,
        List<PhotoResponse> photos,
        List<AssociationSummary> associations,
        List<Long> portfolioIds,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
