package com.grokpm.backend.modules.subscription.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.subscription.domain.Subscription;
import com.grokpm.backend.modules.subscription.domain.SubscriptionPlan;
import com.grokpm.backend.modules.subscription.domain.SubscriptionStatus;
import com.grokpm.backend.modules.subscription.infrastructure.persistence.SubscriptionPlanRepository;
import com.grokpm.backend.modules.subscription.infrastructure.persistence.SubscriptionRepository;
import com.grokpm.backend.modules.subscription.presentation.dto.CreateSubscriptionRequest;
import com.grokpm.backend.modules.subscription.presentation.dto.SubscriptionDtoMapper;
import com.grokpm.backend.modules.subscription.presentation.dto.SubscriptionResponse;
import com.grokpm.backend.modules.subscription.presentation.dto.UpdateSubscriptionRequest;

/**
 * Subscription lifecycle. A user holds at most one ACTIVE subscription; the partial unique index
 * {@code uq_subscription_active_user} backs the check made here when two requests race.
 */
@Service
@Transactional
public class SubscriptionService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionPlanRepository subscriptionPlanRepository;
    private final Clock clock;

    public SubscriptionService(
            SubscriptionRepository subscriptionRepository,
            SubscriptionPlanRepository subscriptionPlanRepository,
            Clock clock
    ) {
        this.subscriptionRepository = subscriptionRepository;
        this.subscriptionPlanRepository = subscriptionPlanRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<SubscriptionResponse> getSubscriptions(String userId) {
        List<Subscription> subscriptions = userId != null && !userId.isBlank()
                ? subscriptionRepository.findByUserIdOrderByIdAsc(userId.trim())
                : subscriptionRepository.findAllByOrderByIdAsc();
        return subscriptions.stream().map(SubscriptionDtoMapper::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public SubscriptionResponse getSubscription(Long subscriptionId) {
        return SubscriptionDtoMapper.toResponse(loadSubscription(subscriptionId));
    }

    public SubscriptionResponse createSubscription(CreateSubscriptionRequest request) {
        String userId = request.userId().trim();
        ensureNoActiveSubscription(userId);

        Subscription subscription = new Subscription();
        subscription.setUserId(userId);
        subscription.setPlan(resolveActivePlan(request.planId()));
        subscription.setStartedAt(OffsetDateTime.now(clock));
        Subscription saved = subscriptionRepository.saveAndFlush(subscription);
        log.info("User {} subscribed to plan {}", userId, request.planId());
        return SubscriptionDtoMapper.toResponse(saved);
    }

    public SubscriptionResponse updateSubscription(Long subscriptionId, UpdateSubscriptionRequest request) {
        Subscription subscription = loadSubscription(subscriptionId);
        if (request.planId() != null && !request.planId().equals(subscription.getPlan().getId())) {
            subscription.setPlan(resolveActivePlan(request.planId()));
        }
        if (request.status() == SubscriptionStatus.CANCELLED && subscription.isActive()) {
            subscription.cancel(OffsetDateTime.now(clock));
        } else if (request.status() == SubscriptionStatus.ACTIVE && !subscription.isActive()) {
            ensureNoActiveSubscription(subscription.getUserId());
            subscription.reactivate(OffsetDateTime.now(clock));
        }
        return SubscriptionDtoMapper.toResponse(subscriptionRepository.saveAndFlush(subscription));
    }

    public SubscriptionResponse cancelSubscription(Long subscriptionId) {
        Subscription subscription = loadSubscription(subscriptionId);
        if (!subscription.isActive()) {
            throw ProblemException.conflict(
                    "SUBSCRIPTION_ALREADY_CANCELLED",
                    "Subscription " + subscriptionId + " is already cancelled"
            );
        }
        subscription.cancel(OffsetDateTime.now(clock));
        log.info("Cancelled subscription {} of user {}", subscriptionId, subscription.getUserId());
        return SubscriptionDtoMapper.toResponse(subscriptionRepository.saveAndFlush(subscription));
    }

    public void deleteSubscription(Long subscriptionId) {
        subscriptionRepository.delete(loadSubscription(subscriptionId));
    }

    private void ensureNoActiveSubscription(String userId) {
        if (subscriptionRepository.existsByUserIdAndStatus(userId, SubscriptionStatus.ACTIVE)) {
            throw ProblemException.conflict(
                    "SUBSCRIPTION_ALREADY_ACTIVE",
                    "User " + userId + " already has an active subscription"
            );
        }
    }

    private SubscriptionPlan resolveActivePlan(Long planId) {
        SubscriptionPlan plan = subscriptionPlanRepository.findById(planId)
                .orElseThrow(() -> ProblemException.invalidReference("planId", planId));
        if (!plan.isActive()) {
            throw ProblemException.badRequest("PLAN_INACTIVE", "Subscription plan " + planId + " is not offered anymore");
        }
        return plan;
    }

    private Subscription loadSubscription(Long subscriptionId) {
        return subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> ProblemException.notFound("Subscription", subscriptionId));
    }
}
