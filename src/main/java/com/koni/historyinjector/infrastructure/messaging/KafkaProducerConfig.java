package com.koni.historyinjector.infrastructure.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.historyinjector.domain.event.RecordRejected;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer configuration.
 *
 * Two templates:
 * - rejection events, serialized as JSON without type headers
 * - dead-letter records, forwarded as the raw bytes that were consumed
 */
@Configuration
public class KafkaProducerConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    @Value("${spring.kafka.producer.acks:all}")
    private String acks;

    @Value("${spring.kafka.producer.retries:3}")
    private Integer retries;

    @Value("${injector.messaging.max-block-ms:10000}")
    private Integer maxBlockMs;

    @Bean
    public ProducerFactory<String, RecordRejected> rejectionProducerFactory(ObjectMapper objectMapper) {
        JsonSerializer<RecordRejected> valueSerializer = new JsonSerializer<>(objectMapper);
        valueSerializer.setAddTypeInfo(false);
        return new DefaultKafkaProducerFactory<>(baseProps(), new StringSerializer(), valueSerializer);
    }

    @Bean
    public KafkaTemplate<String, RecordRejected> rejectionKafkaTemplate(
            ProducerFactory<String, RecordRejected> rejectionProducerFactory) {
        return new KafkaTemplate<>(rejectionProducerFactory);
    }

    @Bean
    public ProducerFactory<String, byte[]> deadLetterProducerFactory() {
        return new DefaultKafkaProducerFactory<>(baseProps(), new StringSerializer(), new ByteArraySerializer());
    }

    @Bean
    public KafkaTemplate<String, byte[]> deadLetterKafkaTemplate(
            ProducerFactory<String, byte[]> deadLetterProducerFactory) {
        return new KafkaTemplate<>(deadLetterProducerFactory);
    }

    private Map<String, Object> baseProps() {
        Map<String, Object> configProps = new HashMap<>();

        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);

        // Reliability settings
        configProps.put(ProducerConfig.ACKS_CONFIG, acks);
        configProps.put(ProducerConfig.RETRIES_CONFIG, retries);
        configProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);

        // bound the time send() may block on metadata when the broker is gone
        configProps.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMs);

        return configProps;
    }
}
