package com.grokpm.backend.modules.subscription.domain;

public enum SubscriptionStatus {
    ACTIVE,
    CANCELLED
}
