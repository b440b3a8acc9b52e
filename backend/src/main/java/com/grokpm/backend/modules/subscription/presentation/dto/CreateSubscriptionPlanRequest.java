package com.grokpm.backend.modules.subscription.presentation.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record CreateSubscriptionPlanRequest(
        @NotBlank @Size(max = 100) String name,
        @Size(max = 500) String description,
        @NotNull @PositiveOrZero @Digits(integer = 8, fraction = 2) BigDecimal monthlyPrice,
        @Positive Integer maxProperties,
        Boolean active
) {
}
