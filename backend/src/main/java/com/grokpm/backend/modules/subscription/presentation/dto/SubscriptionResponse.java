package com.grokpm.backend.modules.subscription.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.grokpm.backend.modules.subscription.domain.SubscriptionStatus;

public record SubscriptionResponse(
        Long id,
        String userId,
        SubscriptionStatus status,
        OffsetDateTime startedAt,
        @JsonInclude(JsonInclude.Include.NON_NULL) OffsetDateTime cancelledAt,
        SubscriptionPlanResponse plan,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
