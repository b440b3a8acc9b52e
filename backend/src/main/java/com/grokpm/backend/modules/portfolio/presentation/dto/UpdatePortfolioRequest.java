package com.grokpm.backend.modules.portfolio.presentation.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UpdatePortfolioRequest(
        @Pattern(regexp = "(?s).*\\S.*", message = "must not be blank") @Size(max = 150) String name,
        @Size(max = 500) String description
) {
}
