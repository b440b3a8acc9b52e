package com.grokpm.backend.modules.portfolio.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.grokpm.backend.modules.property.presentation.dto.PropertySummary;

public record PortfolioResponse(
        Long id,
        String userId,
        String name,
        String description,
        List<PropertySummary> properties,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
