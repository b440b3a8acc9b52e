package com.grokpm.backend.modules.property.presentation.dto;

import java.time.OffsetDateTime;

public record OwnerResponse(
        Long id,
        String name,
        String email,
        String phone,
        PropertySummary property,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
