package com.koni.historyinjector.infrastructure.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * RestTemplate for the Home Assistant REST API.
 *
 * Requests are resolved against {@code injector.api.base-url} and carry the configured token as a
 * bearer credential.
 */
@Slf4j
@Configuration
public class EntityApiClientConfig {

    @Value("${injector.api.base-url}")
    private String baseUrl;

    @Value("${injector.api.token:}")
    private String token;

    @Value("${injector.api.connect-timeout:10s}")
    private Duration connectTimeout;

    @Value("${injector.api.read-timeout:10s}")
    private Duration readTimeout;

    @Bean
    public RestTemplate entityApiRestTemplate(RestTemplateBuilder builder) {
        if (token == null || token.isBlank()) {
            log.warn("No Home Assistant API token configured, missing entities cannot be created");
        }
        log.info("Initializing entityApiRestTemplate: baseUrl={}", baseUrl);
        return builder
                .rootUri(baseUrl)
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .additionalInterceptors((request, body, execution) -> {
                    if (token != null && !token.isBlank()) {
                        request.getHeaders().setBearerAuth(token);
                    }
                    return execution.execute(request, body);
                })
                .build();
    }
}
