package com.grokpm.backend.modules.subscription.application;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.subscription.domain.SubscriptionPlan;
import com.grokpm.backend.modules.subscription.infrastructure.persistence.SubscriptionPlanRepository;
import com.grokpm.backend.modules.subscription.infrastructure.persistence.SubscriptionRepository;
import com.grokpm.backend.modules.subscription.presentation.dto.CreateSubscriptionPlanRequest;
import com.grokpm.backend.modules.subscription.presentation.dto.SubscriptionDtoMapper;
import com.grokpm.backend.modules.subscription.presentation.dto.SubscriptionPlanResponse;
import com.grokpm.backend.modules.subscription.presentation.dto.UpdateSubscriptionPlanRequest;

@Service
@Transactional
public class SubscriptionPlanService {

    private final SubscriptionPlanRepository subscriptionPlanRepository;
    private final SubscriptionRepository subscriptionRepository;

    public SubscriptionPlanService(
            SubscriptionPlanRepository subscriptionPlanRepository,
            SubscriptionRepository subscriptionRepository
    ) {
        this.subscriptionPlanRepository = subscriptionPlanRepository;
        this.subscriptionRepository = subscriptionRepository;
    }

    @Transactional(readOnly = true)
    public List<SubscriptionPlanResponse> getPlans(Boolean active) {
        List<SubscriptionPlan> plans = active != null
                ? subscriptionPlanRepository.findByActiveOrderByMonthlyPriceAscIdAsc(active)
                : subscriptionPlanRepository.findAllByOrderByMonthlyPriceAscIdAsc();
        return plans.stream().map(SubscriptionDtoMapper::toPlanResponse).toList();
    }

    @Transactional(readOnly = true)
    public SubscriptionPlanResponse getPlan(Long planId) {
        return SubscriptionDtoMapper.toPlanResponse(loadPlan(planId));
    }

    public SubscriptionPlanResponse createPlan(CreateSubscriptionPlanRequest request) {
        String name = request.name().trim();
        ensureNameAvailable(name);
        SubscriptionPlan plan = new SubscriptionPlan();
        plan.setName(name);
        plan.setDescription(request.description());
        plan.setMonthlyPrice(request.monthlyPrice());
        plan.setMaxProperties(request.maxProperties());
        plan.setActive(request.active() == null || request.active());
        return SubscriptionDtoMapper.toPlanResponse(subscriptionPlanRepository.saveAndFlush(plan));
    }

    public SubscriptionPlanResponse updatePlan(Long planId, UpdateSubscriptionPlanRequest request) {
        SubscriptionPlan plan = loadPlan(planId);
        if (request.name() != null) {
            String name = request.name().trim();
            if (!plan.getName().equalsIgnoreCase(name)) {
                ensureNameAvailable(name);
            }
            plan.setName(name);
        }
        if (request.description() != null) {
            plan.setDescription(request.description());
        }
        if (request.monthlyPrice() != null) {
            plan.setMonthlyPrice(request.monthlyPrice());
        }
        if (request.maxProperties() != null) {
            plan.setMaxProperties(request.maxProperties());
        }
        if (request.active() != null) {
            plan.setActive(request.active());
        }
        return SubscriptionDtoMapper.toPlanResponse(subscriptionPlanRepository.saveAndFlush(plan));
    }

    public void deletePlan(Long planId) {
        SubscriptionPlan plan = loadPlan(planId);
        if (subscriptionRepository.existsByPlanId(planId)) {
            throw ProblemException.inUse("Subscription plan", planId, "subscriptions");
        }
        subscriptionPlanRepository.delete(plan);
    }

    private void ensureNameAvailable(String name) {
        if (subscriptionPlanRepository.existsByNameIgnoreCase(name)) {
            throw ProblemException.conflict("PLAN_NAME_TAKEN", "Subscription plan '" + name + "' already exists");
        }
    }

    private SubscriptionPlan loadPlan(Long planId) {
        return subscriptionPlanRepository.findById(planId)
                .orElseThrow(() -> ProblemException.notFound("SubscriptionPlan", planId));
    }
}
