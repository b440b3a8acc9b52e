package com.grokpm.backend.modules.property.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.grokpm.backend.modules.leasing.presentation.dto.UnitSummary;

public record AddressResponse(
        Long id,
        Long propertyId,
        String street,
        String city,
        String state,
        String zip,
        boolean primary,
        List<UnitSummary> units,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
