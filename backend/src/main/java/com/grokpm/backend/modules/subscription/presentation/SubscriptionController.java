package com.grokpm.backend.modules.subscription.presentation;

import java.net.URI;
import java.util.List;

import com.grokpm.backend.modules.subscription.application.SubscriptionService;
import com.grokpm.backend.modules.subscription.presentation.dto.CreateSubscriptionRequest;
import com.grokpm.backend.modules.subscription.presentation.dto.SubscriptionResponse;
import com.grokpm.backend.modules.subscription.presentation.dto.UpdateSubscriptionRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
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
@RequestMapping("/api/subscriptions")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    public SubscriptionController(SubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    @GetMapping
    public ResponseEntity<List<SubscriptionResponse>> getSubscriptions(
            @RequestParam(name = "userId", required = false) String userId
    ) {
        return ResponseEntity.ok(subscriptionService.getSubscriptions(userId));
    }

    @GetMapping("/{subscriptionId}")
    public ResponseEntity<SubscriptionResponse> getSubscription(@PathVariable("subscriptionId") Long subscriptionId) {
        return ResponseEntity.ok(subscriptionService.getSubscription(subscriptionId));
    }

    @Operation(summary = "Subscribe a user to a plan")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Subscription started"),
            @ApiResponse(responseCode = "400", description = "Unknown plan (INVALID_REFERENCE) or inactive plan (PLAN_INACTIVE)"),
            @ApiResponse(responseCode = "409", description = "User already has an active subscription (SUBSCRIPTION_ALREADY_ACTIVE)")
    })
    @PostMapping
    public ResponseEntity<SubscriptionResponse> createSubscription(@Valid @RequestBody CreateSubscriptionRequest request) {
        SubscriptionResponse response = subscriptionService.createSubscription(request);
        return ResponseEntity.created(URI.create("/api/subscriptions/" + response.id())).body(response);
    }

    @PutMapping("/{subscriptionId}")
    public ResponseEntity<SubscriptionResponse> updateSubscription(
            @PathVariable("subscriptionId") Long subscriptionId,
            @Valid @RequestBody UpdateSubscriptionRequest request
    ) {
        return ResponseEntity.ok(subscriptionService.updateSubscription(subscriptionId, request));
    }

    @Operation(summary = "Cancel an active subscription")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subscription cancelled"),
            @ApiResponse(responseCode = "409", description = "Already cancelled (SUBSCRIPTION_ALREADY_CANCELLED)")
    })
    @PostMapping("/{subscriptionId}/cancel")
    public ResponseEntity<SubscriptionResponse> cancelSubscription(@PathVariable("subscriptionId") Long subscriptionId) {
        return ResponseEntity.ok(subscriptionService.cancelSubscription(subscriptionId));
    }

    @DeleteMapping("/{subscriptionId}")
    public ResponseEntity<Void> deleteSubscription(@PathVariable("subscriptionId") Long subscriptionId) {
        subscriptionService.deleteSubscription(subscriptionId);
        return ResponseEntity.noContent().build();
    }
}
