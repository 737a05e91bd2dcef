package com.magicminds.backend.modules.voice.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.magicminds.backend.modules.voice.domain.SubscriptionStatus;
import com.magicminds.backend.modules.voice.domain.VoiceSubscription;

public record VoiceSubscriptionResponse(
        UUID id,
        UUID parentId,
        String stripeSubscriptionId,
        String stripeCustomerId,
        SubscriptionStatus status,
        String planType,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static VoiceSubscriptionResponse from(VoiceSubscription subscription) {
        return new VoiceSubscriptionResponse(
                subscription.getId(),
                subscription.getParentId(),
                subscription.getStripeSubscriptionId(),
                subscription.getStripeCustomerId(),
                subscription.getStatus(),
                subscription.getPlanType(),
                subscription.getCreatedAt(),
                subscription.getUpdatedAt()
        );
    }
}
