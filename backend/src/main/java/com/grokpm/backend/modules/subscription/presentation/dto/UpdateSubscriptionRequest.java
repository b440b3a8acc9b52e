package com.grokpm.backend.modules.subscription.presentation.dto;

import com.grokpm.backend.modules.subscription.domain.SubscriptionStatus;

public record UpdateSubscriptionRequest(
        Long planId,
        SubscriptionStatus status
) {
}
