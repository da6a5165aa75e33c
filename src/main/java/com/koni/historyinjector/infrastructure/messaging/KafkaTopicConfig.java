package com.koni.historyinjector.infrastructure.messaging;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic configuration for the topics this service writes to.
 *
 * Inbound history topics are owned by the bridge that publishes them and are not declared here.
 */
@Configuration
public class KafkaTopicConfig {

    @Value("${injector.messaging.rejection-topic:history-injector.rejected}")
    private String rejectionTopic;

    @Value("${injector.messaging.dead-letter-topic:history-injector.dlq}")
    private String deadLetterTopic;

    @Value("${injector.messaging.partitions:1}")
    private int partitions;

    @Value("${injector.messaging.replication-factor:1}")
    private short replicationFactor;

    @Bean
    public NewTopic rejectionTopic() {
        return TopicBuilder.name(rejectionTopic)
                .partitions(partitions)
                .replicas(replicationFactor)
                .build();
    }

    @Bean
    public NewTopic deadLetterTopic() {
        return TopicBuilder.name(deadLetterTopic)
                .partitions(partitions)
                .replicas(replicationFactor)
                .build();
    }
}
