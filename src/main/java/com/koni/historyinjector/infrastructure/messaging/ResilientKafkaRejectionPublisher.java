package com.koni.historyinjector.infrastructure.messaging;

import com.koni.historyinjector.application.port.RejectionPublisher;
import com.koni.historyinjector.domain.event.RecordRejected;
import com.koni.historyinjector.domain.exception.KafkaUnavailableException;
import com.koni.historyinjector.infrastructure.observability.InjectionMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Resilient Kafka implementation of the RejectionPublisher port with Circuit Breaker pattern.
 *
 * Features:
 * - Uses the entity id as partition key so rejections of one entity stay ordered
 * - Circuit Breaker protection so an unavailable broker does not slow down ingestion
 * - Fallback logs the full event at ERROR; publishing never fails the caller
 */
@Slf4j
@Service
public class ResilientKafkaRejectionPublisher implements RejectionPublisher {

    private static final int TIMEOUT_SECONDS = 10;

    private final KafkaTemplate<String, RecordRejected> kafkaTemplate;
    private final CircuitBreaker circuitBreaker;
    private final InjectionMetrics metrics;
    private final String topic;

    public ResilientKafkaRejectionPublisher(
            KafkaTemplate<String, RecordRejected> rejectionKafkaTemplate,
            @Qualifier("kafkaCircuitBreaker") CircuitBreaker kafkaCircuitBreaker,
            InjectionMetrics metrics,
            @Value("${injector.messaging.rejection-topic:history-injector.rejected}") String topic) {
        this.kafkaTemplate = rejectionKafkaTemplate;
        this.circuitBreaker = kafkaCircuitBreaker;
        this.metrics = metrics;
        this.topic = topic;
    }

    @Override
    public void publish(RecordRejected event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }

        try {
            circuitBreaker.executeRunnable(() -> publishToKafka(event));
        } catch (CallNotPermittedException e) {
            log.warn("Circuit breaker is OPEN, rejection not published: eventId={}", event.getEventId());
            handleFallback(event);
        } catch (KafkaUnavailableException e) {
            log.warn("Kafka publish failed (circuit breaker recorded): eventId={}, error={}",
                    event.getEventId(), e.getMessage());
            handleFallback(event);
        }
    }

    private void publishToKafka(RecordRejected event) {
        try {
            CompletableFuture<SendResult<String, RecordRejected>> future =
                    kafkaTemplate.send(topic, event.getEntityId(), event);

            SendResult<String, RecordRejected> result = future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

            log.debug("Published rejection to Kafka: topic={}, partition={}, offset={}, eventId={}",
                    topic,
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventId());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KafkaUnavailableException("Interrupted while publishing rejection " + event.getEventId(), e);
        } catch (Exception e) {
            throw new KafkaUnavailableException("Failed to publish rejection to Kafka: " + e.getMessage(), e);
        }
    }

    private void handleFallback(RecordRejected event) {
        metrics.recordRejectionPublishFailed();
        log.error("Rejection could not be published: {}", event);
    }
}
