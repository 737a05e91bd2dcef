package com.magicminds.backend.modules.voice.infrastructure.stripe;

import java.net.URI;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.magicminds.backend.global.error.ProblemException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Thin client over the Stripe REST v1 endpoints used by checkout. Requests are form encoded and
 * authenticated with the secret key as a bearer token.
 */
@Component
public class StripeClient {

    private static final Logger log = LoggerFactory.getLogger(StripeClient.class);

    private final RestTemplate restTemplate;
    private final String secretKey;
    private final String priceId;
    private final String apiBaseUrl;

    public StripeClient(
            @Qualifier("externalRestTemplate") RestTemplate restTemplate,
            @Value("${magicminds.billing.stripe.secret-key:}") String secretKey,
            @Value("${magicminds.billing.stripe.price-id:}") String priceId,
            @Value("${magicminds.billing.stripe.api-base-url:https://api.stripe.com}") String apiBaseUrl
    ) {
        this.restTemplate = restTemplate;
        this.secretKey = secretKey;
        this.priceId = priceId;
        this.apiBaseUrl = apiBaseUrl;
    }

    public boolean isConfigured() {
        return StringUtils.hasText(secretKey) && StringUtils.hasText(priceId);
    }

    public String findOrCreateCustomer(String email, String name) {
        requireConfigured();
        URI searchUri = UriComponentsBuilder.fromHttpUrl(apiBaseUrl)
                .path("/v1/customers")
                .queryParam("email", "{email}")
                .queryParam("limit", 1)
                .encode()
                .buildAndExpand(email)
                .toUri();
        JsonNode existing = call(searchUri, HttpMethod.GET, new HttpEntity<>(headers(false)));
        JsonNode data = existing.path("data");
        if (data.isArray() && !data.isEmpty()) {
            return data.get(0).path("id").asText();
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("email", email);
        if (StringUtils.hasText(name)) {
            form.add("name", name);
        }
        JsonNode created = call(uri("/v1/customers"), HttpMethod.POST, new HttpEntity<>(form, headers(true)));
        return requireText(created, "id");
    }

    public String createSubscriptionCheckout(String customerId, String successUrl, String cancelUrl) {
        requireConfigured();
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("customer", customerId);
        form.add("mode", "subscription");
        form.add("line_items[0][price]", priceId);
        form.add("line_items[0][quantity]", "1");
        form.add("success_url", successUrl);
        form.add("cancel_url", cancelUrl);
        JsonNode session = call(uri("/v1/checkout/sessions"), HttpMethod.POST, new HttpEntity<>(form, headers(true)));
        return requireText(session, "url");
    }

    private void requireConfigured() {
        if (!isConfigured()) {
            throw new ProblemException(HttpStatus.SERVICE_UNAVAILABLE, "billing.not_configured",
                    "Stripe integration not configured");
        }
    }

    private JsonNode call(URI uri, HttpMethod method, HttpEntity<?> entity) {
        try {
            JsonNode body = restTemplate.exchange(uri, method, entity, JsonNode.class).getBody();
            if (body == null) {
                throw providerError("Stripe returned an empty response");
            }
            return body;
        } catch (RestClientException ex) {
            log.warn("Stripe call {} {} failed: {}", method, uri.getPath(), ex.getMessage());
            throw providerError("Stripe request failed");
        }
    }

    private String requireText(JsonNode node, String field) {
        String value = node.path(field).asText(null);
        if (!StringUtils.hasText(value)) {
            throw providerError("Stripe response is missing '" + field + "'");
        }
        return value;
    }

    private URI uri(String path) {
        return UriComponentsBuilder.fromHttpUrl(apiBaseUrl).path(path).build().toUri();
    }

    private HttpHeaders headers(boolean form) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(secretKey);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (form) {
            headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        }
        return headers;
    }

    private static ProblemException providerError(String detail) {
        return new ProblemException(HttpStatus.BAD_GATEWAY, "billing.provider_error", detail);
    }
}
