package com.grokpm.backend.modules.subscription.presentation;

import java.net.URI;
import java.util.List;

import com.grokpm.backend.modules.subscription.application.SubscriptionPlanService;
import com.grokpm.backend.modules.subscription.presentation.dto.CreateSubscriptionPlanRequest;
import com.grokpm.backend.modules.subscription.presentation.dto.SubscriptionPlanResponse;
import com.grokpm.backend.modules.subscription.presentation.dto.UpdateSubscriptionPlanRequest;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/subscription/plans")
public class SubscriptionPlanController {

    private final SubscriptionPlanService subscriptionPlanService;

    public SubscriptionPlanController(SubscriptionPlanService subscriptionPlanService) {
        this.subscriptionPlanService = subscriptionPlanService;
    }

    @GetMapping
    public ResponseEntity<List<SubscriptionPlanResponse>> getPlans(
            @RequestParam(name = "active", required = false) Boolean active
    ) {
        return ResponseEntity.ok(subscriptionPlanService.getPlans(active));
    }

    @GetMapping("/{planId}")
    public ResponseEntity<SubscriptionPlanResponse> getPlan(@PathVariable("planId") Long planId) {
        return ResponseEntity.ok(subscriptionPlanService.getPlan(planId));
    }

    @PostMapping
    public ResponseEntity<SubscriptionPlanResponse> createPlan(@Valid @RequestBody CreateSubscriptionPlanRequest request) {
        SubscriptionPlanResponse response = subscriptionPlanService.createPlan(request);
        return ResponseEntity.created(URI.create("/api/subscription/plans/" + response.id())).body(response);
    }

    @PutMapping("/{planId}")
    public ResponseEntity<SubscriptionPlanResponse> updatePlan(
            @PathVariable("planId") Long planId,
            @Valid @RequestBody UpdateSubscriptionPlanRequest request
    ) {
        return ResponseEntity.ok(subscriptionPlanService.updatePlan(planId, request));
    }

    @DeleteMapping("/{planId}")
    public ResponseEntity<Void> deletePlan(@PathVariable("planId") Long planId) {
        subscriptionPlanService.deletePlan(planId);
        return ResponseEntity.noContent().build();
    }
}
