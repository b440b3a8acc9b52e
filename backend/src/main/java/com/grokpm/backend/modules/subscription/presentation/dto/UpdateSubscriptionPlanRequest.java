package com.grokpm.backend.modules.subscription.presentation.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record UpdateSubscriptionPlanRequest(
        @Pattern(regexp = "(?s).*\\S.*", message = "must not be blank") @Size(max = 100) String name,
        @Size(max = 500) String description,
        @PositiveOrZero @Digits(integer = 8, fraction = 2) BigDecimal monthlyPrice,
        @Positive Integer maxProperties,
        Boolean active
) {
}
