package com.grokpm.backend.modules.property.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PhotoResponse(
        Long id,
        String url,
        String name,
        boolean primary,
        Long propertyId,
        Long unitId,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
