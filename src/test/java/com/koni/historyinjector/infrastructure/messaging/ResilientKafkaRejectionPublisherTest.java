package com.koni.historyinjector.infrastructure.messaging;

import com.koni.historyinjector.domain.event.RecordRejected;
import com.koni.historyinjector.domain.model.RejectionReason;
import com.koni.historyinjector.infrastructure.observability.InjectionMetrics;
import com.koni.historyinjector.tags.UnitTest;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ResilientKafkaRejectionPublisher.
 * Tests partition key usage and the fallback when Kafka is unavailable.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class ResilientKafkaRejectionPublisherTest {

    private static final String TOPIC = "history-injector.rejected";

    @Mock
    private KafkaTemplate<String, RecordRejected> kafkaTemplate;

    private CircuitBreaker circuitBreaker;
    private MeterRegistry meterRegistry;
    private ResilientKafkaRejectionPublisher publisher;

    @BeforeEach
    void setUp() {
        circuitBreaker = CircuitBreaker.of("kafka-test", CircuitBreakerConfig.ofDefaults());
        meterRegistry = new SimpleMeterRegistry();
        publisher = new ResilientKafkaRejectionPublisher(kafkaTemplate, circuitBreaker,
                new InjectionMetrics(meterRegistry), TOPIC);
    }

    private static RecordRejected event() {
        return new RecordRejected(UUID.randomUUID(), "sensor.bedroom_temperature",
                "homeassistant/history/sensor.bedroom_temperature", 2,
                RejectionReason.TIMESTAMP_OUT_OF_WINDOW, "too old", Instant.parse("2023-04-20T00:00:00Z"));
    }

    @Test
    void shouldPublishWithEntityIdAsPartitionKey() {
        // Given
        RecordRejected event = event();
        CompletableFuture<SendResult<String, RecordRejected>> future = CompletableFuture.completedFuture(
                new SendResult<>(new ProducerRecord<>(TOPIC, event.getEntityId(), event),
                        new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0)));
        when(kafkaTemplate.send(TOPIC, "sensor.bedroom_temperature", event)).thenReturn(future);

        // When
        publisher.publish(event);

        // Then
        verify(kafkaTemplate).send(eq(TOPIC), eq("sensor.bedroom_temperature"), eq(event));
        assertThat(meterRegistry.get("history.rejections.publish_failed.total").counter().count()).isZero();
    }

    @Test
    void shouldFallBackWhenKafkaFails() {
        // Given
        CompletableFuture<SendResult<String, RecordRejected>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new RuntimeException("broker down"));
        when(kafkaTemplate.send(anyString(), anyString(), any(RecordRejected.class))).thenReturn(failed);

        // When / Then
        assertThatCode(() -> publisher.publish(event())).doesNotThrowAnyException();
        assertThat(meterRegistry.get("history.rejections.publish_failed.total").counter().count()).isEqualTo(1.0);
        assertThat(circuitBreaker.getMetrics().getNumberOfFailedCalls()).isEqualTo(1);
    }

    @Test
    void shouldSkipKafkaWhenCircuitIsOpen() {
        // Given
        circuitBreaker.transitionToOpenState();

        // When
        publisher.publish(event());

        // Then
        verify(kafkaTemplate, never()).send(anyString(), anyString(), any(RecordRejected.class));
        assertThat(meterRegistry.get("history.rejections.publish_failed.total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldRejectNullEvent() {
        assertThatThrownBy(() -> publisher.publish(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
