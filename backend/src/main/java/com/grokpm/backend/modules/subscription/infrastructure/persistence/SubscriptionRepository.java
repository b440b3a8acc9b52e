package com.grokpm.backend.modules.subscription.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import com.grokpm.backend.modules.subscription.domain.Subscription;
import com.grokpm.backend.modules.subscription.domain.SubscriptionStatus;

public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    @EntityGraph(attributePaths = "plan")
    List<Subscription> findAllByOrderByIdAsc();

    @EntityGraph(attributePaths = "plan")
    List<Subscription> findByUserIdOrderByIdAsc(String userId);

    boolean existsByUserIdAndStatus(String userId, SubscriptionStatus status);

    boolean existsByPlanId(Long planId);
}
