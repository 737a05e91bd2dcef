package com.magicminds.backend.modules.voice.application;

import com.magicminds.backend.global.error.ProblemException;
import com.magicminds.backend.global.persistence.SubjectUnitOfWork;
import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.profile.application.ProfileLookup;
import com.magicminds.backend.modules.profile.domain.ParentAccount;
import com.magicminds.backend.modules.voice.domain.VoiceSubscription;
import com.magicminds.backend.modules.voice.infrastructure.persistence.VoiceSubscriptionRepository;
import com.magicminds.backend.modules.voice.infrastructure.stripe.StripeClient;
import com.magicminds.backend.modules.voice.presentation.dto.CheckoutRequest;
import com.magicminds.backend.modules.voice.presentation.dto.CheckoutResponse;
import com.magicminds.backend.modules.voice.presentation.dto.UpsertVoiceSubscriptionRequest;
import com.magicminds.backend.modules.voice.presentation.dto.VoiceSubscriptionResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Checkout and the locally mirrored voice subscription. Stripe is called outside any unit of work so
 * no transaction stays open across the network round trip.
 */
@Service
public class BillingService {

    private static final Logger log = LoggerFactory.getLogger(BillingService.class);
    static final String DEFAULT_ORIGIN = "http://localhost:3000";

    private final SubjectUnitOfWork unitOfWork;
    private final VoiceSubscriptionRepository voiceSubscriptionRepository;
    private final ProfileLookup profileLookup;
    private final StripeClient stripeClient;

    public BillingService(SubjectUnitOfWork unitOfWork,
                          VoiceSubscriptionRepository voiceSubscriptionRepository,
                          ProfileLookup profileLookup,
                          StripeClient stripeClient) {
        this.unitOfWork = unitOfWork;
        this.voiceSubscriptionRepository = voiceSubscriptionRepository;
        this.profileLookup = profileLookup;
        this.stripeClient = stripeClient;
    }

    public CheckoutResponse createCheckout(AuthenticatedSubject subject, CheckoutRequest request, String origin) {
        if (!stripeClient.isConfigured()) {
            throw new ProblemException(HttpStatus.SERVICE_UNAVAILABLE, "billing.not_configured",
                    "Stripe integration not configured");
        }
        BillingContact contact = unitOfWork.read(subject, () -> {
            ParentAccount parent = profileLookup.requireParent(subject);
            String email = firstText(request == null ? null : request.email(), parent.getEmail(), subject.email());
            String name = firstText(request == null ? null : request.name(), parent.getName(), email);
            return new BillingContact(email, name);
        });
        if (!StringUtils.hasText(contact.email())) {
            throw ProblemException.badRequest("billing.email_required", "Email is required");
        }

        String base = StringUtils.hasText(origin) ? origin : DEFAULT_ORIGIN;
        String customerId = stripeClient.findOrCreateCustomer(contact.email(), contact.name());
        String url = stripeClient.createSubscriptionCheckout(customerId,
                base + "/subscription/success?session_id={CHECKOUT_SESSION_ID}",
                base + "/subscription/cancel");
        log.info("Created checkout session for subject {}", subject.subject());
        return new CheckoutResponse(url);
    }

    public VoiceSubscriptionResponse upsertSubscription(AuthenticatedSubject subject,
                                                        UpsertVoiceSubscriptionRequest request) {
        return unitOfWork.execute(subject, () -> {
            ParentAccount parent = profileLookup.requireParent(subject);
            VoiceSubscription subscription = voiceSubscriptionRepository.findByParentId(parent.getId())
                    .orElseGet(() -> new VoiceSubscription(parent.getId()));
            subscription.apply(request.stripeSubscriptionId(), request.stripeCustomerId(),
                    request.status(), request.planType());
            VoiceSubscription saved = voiceSubscriptionRepository.saveAndFlush(subscription);
            log.info("Voice subscription for parent {} is now {}", parent.getId(), saved.getStatus());
            return VoiceSubscriptionResponse.from(saved);
        });
    }

    public VoiceSubscriptionResponse getSubscription(AuthenticatedSubject subject) {
        return unitOfWork.read(subject, () -> VoiceSubscriptionResponse.from(requireSubscription(subject)));
    }

    public void cancelSubscription(AuthenticatedSubject subject) {
        unitOfWork.run(subject, () -> {
            VoiceSubscription subscription = requireSubscription(subject);
            subscription.cancel();
            voiceSubscriptionRepository.save(subscription);
        });
    }

    private VoiceSubscription requireSubscription(AuthenticatedSubject subject) {
        ParentAccount parent = profileLookup.requireParent(subject);
        return voiceSubscriptionRepository.findByParentId(parent.getId())
                .orElseThrow(() -> ProblemException.notFound("billing.subscription_not_found", "No subscription found"));
    }

    private record BillingContact(String email, String name) {
    }

    private static String firstText(String... candidates) {
        for (String candidate : candidates) {
            if (StringUtils.hasText(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
