package com.koni.historyinjector.infrastructure.messaging;

import com.koni.historyinjector.domain.exception.FatalSchemaMismatchException;
import com.koni.historyinjector.infrastructure.observability.InjectionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.TopicPartition;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.ConsumerRecordRecoverer;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;

import java.nio.charset.StandardCharsets;

/**
 * Kafka error handling configuration for Dead Letter Queue (DLQ) support.
 *
 * Only unexpected failures reach this handler: decode errors and record rejections are reported
 * by the dispatcher and acknowledged.
 * - Exponential backoff retry strategy (1s, 2s, 4s)
 * - Maximum 3 retry attempts before sending to the dead-letter topic
 * - {@link FatalSchemaMismatchException} is neither retried nor dead-lettered; the message stays
 *   uncommitted so it is consumed again once ingestion restarts against a compatible store
 */
@Slf4j
@Configuration
public class KafkaErrorHandlingConfig {

    private static final long INITIAL_INTERVAL = 1000L; // 1 second
    private static final double MULTIPLIER = 2.0; // doubles each retry
    private static final int MAX_ATTEMPTS = 3;

    private final InjectionMetrics metrics;
    private final String deadLetterTopic;

    public KafkaErrorHandlingConfig(
            InjectionMetrics metrics,
            @Value("${injector.messaging.dead-letter-topic:history-injector.dlq}") String deadLetterTopic) {
        this.metrics = metrics;
        this.deadLetterTopic = deadLetterTopic;
    }

    @Bean
    public CommonErrorHandler errorHandler(KafkaTemplate<String, byte[]> deadLetterKafkaTemplate) {
        DeadLetterPublishingRecoverer deadLetterRecoverer = new DeadLetterPublishingRecoverer(
                deadLetterKafkaTemplate,
                (consumerRecord, exception) -> {
                    log.error("Sending message to DLQ after {} retries. Topic: {}, Key: {}, Offset: {}, Error: {}",
                            MAX_ATTEMPTS,
                            consumerRecord.topic(),
                            consumerRecord.key(),
                            consumerRecord.offset(),
                            exception.getMessage(),
                            exception);
                    metrics.recordDlqMessageSent();
                    return new TopicPartition(deadLetterTopic, -1);
                }
        );

        ConsumerRecordRecoverer recoverer = (consumerRecord, exception) -> {
            if (isFatal(exception)) {
                log.error("Ingestion halted, leaving message uncommitted: topic={}, partition={}, offset={}",
                        consumerRecord.topic(), consumerRecord.partition(), consumerRecord.offset());
                throw new FatalSchemaMismatchException("Message left uncommitted, ingestion halted", exception);
            }
            deadLetterRecoverer.accept(consumerRecord, exception);
        };

        ExponentialBackOff backOff = new ExponentialBackOff(INITIAL_INTERVAL, MULTIPLIER);
        backOff.setMaxAttempts(MAX_ATTEMPTS);

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer, backOff);
        errorHandler.addNotRetryableExceptions(FatalSchemaMismatchException.class);

        errorHandler.setRetryListeners((consumerRecord, exception, deliveryAttempt) -> {
            log.warn("Retry attempt {} for message: topic={}, key={}, offset={}, error={}",
                    deliveryAttempt,
                    consumerRecord.topic(),
                    consumerRecord.key(),
                    consumerRecord.offset(),
                    exception.getMessage());

            consumerRecord.headers().add("retry-count",
                    String.valueOf(deliveryAttempt).getBytes(StandardCharsets.UTF_8));
            consumerRecord.headers().add("exception-message",
                    String.valueOf(exception.getMessage()).getBytes(StandardCharsets.UTF_8));
        });

        return errorHandler;
    }

    static boolean isFatal(Throwable exception) {
        Throwable current = exception;
        while (current != null) {
            if (current instanceof FatalSchemaMismatchException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
