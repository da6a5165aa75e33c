package com.koni.historyinjector.infrastructure.api;

import com.koni.historyinjector.application.port.EntityManagementClient;
import com.koni.historyinjector.domain.exception.EntityCreationFailedException;
import com.koni.historyinjector.domain.model.EntityIds;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Home Assistant REST implementation of the EntityManagementClient port.
 *
 * Features:
 * - Checks {@code GET /states/{entity_id}} first and skips creation when the entity exists
 * - Creates the entity with {@code POST /states/{entity_id}}, state {@code unknown}
 * - Adds a {@code friendly_name} derived from the object id when the attributes carry none
 * - Retries transient failures (I/O errors, 5xx) with exponential backoff behind the
 *   {@code entity-api} circuit breaker; 4xx answers fail immediately
 */
@Slf4j
@Component
public class HomeAssistantEntityClient implements EntityManagementClient {

    static final String STATE_PATH = "/states/{entityId}";
    static final String INITIAL_STATE = "unknown";

    private final RestTemplate restTemplate;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;
    private final String token;

    public HomeAssistantEntityClient(
            @Qualifier("entityApiRestTemplate") RestTemplate restTemplate,
            @Qualifier("entityApiRetry") Retry retry,
            @Qualifier("entityApiCircuitBreaker") CircuitBreaker circuitBreaker,
            @Value("${injector.api.token:}") String token) {
        this.restTemplate = restTemplate;
        this.retry = retry;
        this.circuitBreaker = circuitBreaker;
        this.token = token;

        retry.getEventPublisher().onRetry(event ->
                log.warn("Entity API call failed, retry attempt {} in {}ms: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
    }

    @Override
    public void createEntity(String entityId, Map<String, Object> initialAttributes) {
        if (token == null || token.isBlank()) {
            throw new EntityCreationFailedException("No Home Assistant API token provided, cannot create " + entityId);
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        if (initialAttributes != null) {
            attributes.putAll(initialAttributes);
        }
        attributes.putIfAbsent("friendly_name", EntityIds.defaultFriendlyName(entityId));

        Supplier<Void> call = () -> {
            if (exists(entityId)) {
                log.info("Entity {} already exists according to API", entityId);
                return null;
            }
            create(entityId, attributes);
            return null;
        };

        try {
            Retry.decorateSupplier(retry, CircuitBreaker.decorateSupplier(circuitBreaker, call)).get();
        } catch (CallNotPermittedException e) {
            log.warn("Entity API circuit breaker is OPEN, not creating {}", entityId);
            throw new EntityCreationFailedException("Entity API unavailable (circuit open), cannot create " + entityId, e);
        } catch (EntityApiUnavailableException e) {
            log.error("Entity API still unavailable after {} attempts: entityId={}",
                    retry.getRetryConfig().getMaxAttempts(), entityId, e);
            throw new EntityCreationFailedException("Entity API unavailable after "
                    + retry.getRetryConfig().getMaxAttempts() + " attempts: " + e.getMessage(), e);
        }
    }

    private boolean exists(String entityId) {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(STATE_PATH, String.class, entityId);
            return response.getStatusCode().is2xxSuccessful();
        } catch (HttpClientErrorException.NotFound e) {
            return false;
        } catch (RestClientException e) {
            log.error("Error checking entity {} via API, trying to create it: {}", entityId, e.getMessage());
            return false;
        }
    }

    private void create(String entityId, Map<String, Object> attributes) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("state", INITIAL_STATE);
        payload.put("attributes", attributes);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(STATE_PATH, payload, String.class, entityId);
            if (response.getStatusCode() != HttpStatus.OK && response.getStatusCode() != HttpStatus.CREATED) {
                throw new EntityCreationFailedException("Unexpected status " + response.getStatusCode()
                        + " creating " + entityId);
            }
            log.info("Successfully created entity {} via API", entityId);
        } catch (HttpClientErrorException e) {
            log.error("Failed to create entity via API: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new EntityCreationFailedException("Entity API refused to create " + entityId + ": "
                    + e.getStatusCode(), e);
        } catch (HttpServerErrorException | ResourceAccessException e) {
            throw new EntityApiUnavailableException("Entity API failed creating " + entityId + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new EntityCreationFailedException("Error creating entity " + entityId + " via API: "
                    + e.getMessage(), e);
        }
    }
}
