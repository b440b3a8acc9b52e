package com.grokpm.backend.modules.subscription.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateSubscriptionRequest(
        @NotBlank @Size(max = 100) String userId,
        @NotNull Long planId
) {
}
