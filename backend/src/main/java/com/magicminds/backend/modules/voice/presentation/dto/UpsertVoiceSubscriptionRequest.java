package com.magicminds.backend.modules.voice.presentation.dto;

import com.magicminds.backend.modules.voice.domain.SubscriptionStatus;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record UpsertVoiceSubscriptionRequest(
        @NotBlank String stripeSubscriptionId,
        String stripeCustomerId,
        @NotNull SubscriptionStatus status,
        @NotBlank @Size(max = 64) String planType
) {
}
