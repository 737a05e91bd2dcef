package com.magicminds.backend.modules.voice.presentation;

import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.voice.application.BillingService;
import com.magicminds.backend.modules.voice.presentation.dto.CheckoutRequest;
import com.magicminds.backend.modules.voice.presentation.dto.CheckoutResponse;
import com.magicminds.backend.modules.voice.presentation.dto.UpsertVoiceSubscriptionRequest;
import com.magicminds.backend.modules.voice.presentation.dto.VoiceSubscriptionResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/billing")
public class BillingController {

    private final BillingService billingService;

    public BillingController(BillingService billingService) {
        this.billingService = billingService;
    }

    @PostMapping("/create-checkout")
    public ResponseEntity<CheckoutResponse> createCheckout(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @RequestHeader(value = HttpHeaders.ORIGIN, required = false) String origin,
            @Valid @RequestBody(required = false) CheckoutRequest request
    ) {
        return ResponseEntity.ok(billingService.createCheckout(subject, request, origin));
    }

    @PostMapping("/voice-subscription")
    public ResponseEntity<VoiceSubscriptionResponse> upsertSubscription(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @Valid @RequestBody UpsertVoiceSubscriptionRequest request
    ) {
        return ResponseEntity.status(201).body(billingService.upsertSubscription(subject, request));
    }

    @GetMapping("/voice-subscription")
    public ResponseEntity<VoiceSubscriptionResponse> getSubscription(
            @AuthenticationPrincipal AuthenticatedSubject subject
    ) {
        return ResponseEntity.ok(billingService.getSubscription(subject));
    }

    @DeleteMapping("/voice-subscription")
    public ResponseEntity<Void> cancelSubscription(@AuthenticationPrincipal AuthenticatedSubject subject) {
        billingService.cancelSubscription(subject);
        return ResponseEntity.noContent().build();
    }
}
