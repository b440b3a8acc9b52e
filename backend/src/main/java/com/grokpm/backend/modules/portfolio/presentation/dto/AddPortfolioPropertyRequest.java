package com.grokpm.backend.modules.portfolio.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record AddPortfolioPropertyRequest(@NotNull Long propertyId) {
}
