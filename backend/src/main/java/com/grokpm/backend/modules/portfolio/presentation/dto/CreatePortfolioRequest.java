package com.grokpm.backend.modules.portfolio.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreatePortfolioRequest(
        @NotBlank @Size(max = 100) String userId,
        @NotBlank @Size(max = 150) String name,
        @Size(max = 500) String description,
        List<@NotNull Long> propertyIds
) {
}
