package com.grokpm.backend.modules.subscription.presentation.dto;

import com.grokpm.backend.modules.subscription.domain.Subscription;
import com.grokpm.backend.modules.subscription.domain.SubscriptionPlan;

public final class SubscriptionDtoMapper {

    private SubscriptionDtoMapper() {
    }

    public static SubscriptionPlanResponse toPlanResponse(SubscriptionPlan plan) {
        return new SubscriptionPlanResponse(
                plan.getId(),
                plan.getName(),
                plan.getDescription(),
                plan.getMonthlyPrice(),
                plan.getMaxProperties(),
                plan.isActive(),
                plan.getCreatedAt(),
                plan.getUpdatedAt()
        );
    }

    public static SubscriptionResponse toResponse(Subscription subscription) {
        return new SubscriptionResponse(
                subscription.getId(),
                subscription.getUserId(),
                subscription.getStatus(),
                subscription.getStartedAt(),
                subscription.getCancelledAt(),
                toPlanResponse(subscription.getPlan()),
                subscription.getCreatedAt(),
                subscription.getUpdatedAt()
        );
    }
}
