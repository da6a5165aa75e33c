package com.koni.historyinjector.application.consumer;

import com.koni.historyinjector.application.ingest.HistoryIngestionDispatcher;
import com.koni.historyinjector.domain.exception.FatalSchemaMismatchException;
import com.koni.historyinjector.domain.model.DispatchReport;
import com.koni.historyinjector.infrastructure.messaging.IngestionHaltSwitch;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

/**
 * HistoryMessageConsumer receives raw history payloads from Kafka.
 *
 * The originating topic is taken from the record key when present, since MQTT bridges carry the
 * MQTT topic (e.g. {@code homeassistant/history/sensor.bedroom_temperature}) there. Otherwise the
 * Kafka topic name is used, with the Kafka topic prefix ({@code homeassistant.history.}) mapped
 * to the MQTT one so {@code homeassistant.history.sensor.bedroom_temperature} names the same entity.
 *
 * Offsets are committed manually once the dispatcher has reached a terminal state for every
 * record. Dropped messages and records are acknowledged too: they are reported, not retried.
 * Unexpected exceptions propagate to the container's error handler, which retries with backoff
 * and then routes the message to the dead-letter topic.
 */
@Service
@Slf4j
public class HistoryMessageConsumer {

    public static final String LISTENER_ID = "historyListener";

    private final HistoryIngestionDispatcher dispatcher;
    private final IngestionHaltSwitch haltSwitch;
    private final String kafkaTopicPrefix;
    private final String topicPrefix;

    public HistoryMessageConsumer(
            HistoryIngestionDispatcher dispatcher,
            IngestionHaltSwitch haltSwitch,
            @Value("${injector.messaging.kafka-topic-prefix:homeassistant.history.}") String kafkaTopicPrefix,
            @Value("${injector.messaging.topic-prefix:homeassistant/history/}") String topicPrefix) {
        this.dispatcher = dispatcher;
        this.haltSwitch = haltSwitch;
        this.kafkaTopicPrefix = kafkaTopicPrefix;
        this.topicPrefix = topicPrefix;
    }

    @KafkaListener(
            id = LISTENER_ID,
            topicPattern = "${injector.messaging.topic-pattern}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, byte[]> record, Acknowledgment acknowledgment) {
        String topic = originatingTopic(record);
        log.debug("Received history message: kafkaTopic={}, partition={}, offset={}, topic={}",
                record.topic(), record.partition(), record.offset(), topic);

        if (haltSwitch.isHalted()) {
            throw new FatalSchemaMismatchException("Ingestion is halted: " + haltSwitch.getHaltReason());
        }

        try {
            DispatchReport report = dispatcher.dispatch(topic, record.value());
            if (report.isMessageRejected()) {
                log.warn("Message on topic {} dropped: {}", topic, report.getMessageDetail());
            } else {
                log.info("Processed history message: topic={}, committed={}, rejected={}",
                        topic, report.committedCount(), report.rejectedCount());
            }
            acknowledgment.acknowledge();
        } catch (FatalSchemaMismatchException e) {
            haltSwitch.halt(e);
            throw e;
        } catch (Exception e) {
            log.error("Error processing history message: topic={}, offset={}", topic, record.offset(), e);
            // Don't acknowledge - let the error handler retry
            throw e;
        }
    }

    String originatingTopic(ConsumerRecord<String, byte[]> record) {
        String key = record.key();
        if (key != null && !key.isBlank()) {
            return key;
        }
        String kafkaTopic = record.topic();
        if (kafkaTopic.startsWith(kafkaTopicPrefix)) {
            return topicPrefix + kafkaTopic.substring(kafkaTopicPrefix.length());
        }
        return kafkaTopic;
    }
}
