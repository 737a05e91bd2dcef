package com.magicminds.backend.global.config;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Outbound HTTP client shared by the identity, payment and speech adapters.
 * Every call is bounded by the configured timeouts and never retried.
 */
@Configuration
public class HttpClientConfig {

    @Bean("externalRestTemplate")
    public RestTemplate externalRestTemplate(
            @Value("${magicminds.http.connect-timeout:5s}") Duration connectTimeout,
            @Value("${magicminds.http.read-timeout:30s}") Duration readTimeout
    ) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeout);
        factory.setReadTimeout(readTimeout);
        return new RestTemplate(factory);
    }
}
