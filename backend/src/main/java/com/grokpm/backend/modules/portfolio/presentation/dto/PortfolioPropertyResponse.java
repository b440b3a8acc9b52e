package com.grokpm.backend.modules.portfolio.presentation.dto;

import java.time.OffsetDateTime;

import com.grokpm.backend.modules.property.presentation.dto.PropertySummary;

public record PortfolioPropertyResponse(Long portfolioId, PropertySummary property, OffsetDateTime addedAt) {
}
