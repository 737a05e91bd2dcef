package com.magicminds.backend.modules.voice.domain;

import java.util.UUID;

import com.magicminds.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;


/**
 * A parent's voice-cloning entitlement as last reported by the billing provider. One row per parent;
 * cancelling keeps the row and flips the status.
 */
@Entity
@Table(name = "voice_subscriptions")
public class VoiceSubscription extends AbstractTimestampedEntity {

    @Column(name = "parent_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID parentId;

    @Column(name = "stripe_subscription_id")
    private String stripeSubscriptionId;

    @Column(name = "stripe_customer_id")
    private String stripeCustomerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private SubscriptionStatus status;

    @Column(name = "plan_type", length = 64)
    private String planType;

    protected VoiceSubscription() {
    }

    public VoiceSubscription(UUID parentId) {
        this.parentId = parentId;
        this.status = SubscriptionStatus.INACTIVE;
    }

    public void apply(String stripeSubscriptionId, String stripeCustomerId, SubscriptionStatus status, String planType) {
        this.stripeSubscriptionId = stripeSubscriptionId;
        if (stripeCustomerId != null) {
            this.stripeCustomerId = stripeCustomerId;
        }
        this.status = status;
        this.planType = planType;
    }

    public void cancel() {
        this.status = SubscriptionStatus.CANCELLED;
    }

    public boolean isActive() {
        return status == SubscriptionStatus.ACTIVE;
    }

    public UUID getParentId() {
        return parentId;
    }

    public String getStripeSubscriptionId() {
        return stripeSubscriptionId;
    }

    public String getStripeCustomerId() {
        return stripeCustomerId;
    }

    public SubscriptionStatus getStatus() {
        return status;
    }

    public String getPlanType() {
        return planType;
    }
}
