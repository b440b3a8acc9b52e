package com.grokpm.backend.modules.subscription.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.grokpm.backend.modules.subscription.domain.SubscriptionPlan;

public interface SubscriptionPlanRepository extends JpaRepository<SubscriptionPlan, Long> {

    List<SubscriptionPlan> findAllByOrderByMonthlyPriceAscIdAsc();

    List<SubscriptionPlan> findByActiveOrderByMonthlyPriceAscIdAsc(boolean active);

    boolean existsByNameIgnoreCase(String name);
}
