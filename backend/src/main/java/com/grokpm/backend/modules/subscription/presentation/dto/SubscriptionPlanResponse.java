package com.grokpm.backend.modules.subscription.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

public record SubscriptionPlanResponse(
        Long id,
        String name,
        String description,
        BigDecimal monthlyPrice,
        Integer maxProperties,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
