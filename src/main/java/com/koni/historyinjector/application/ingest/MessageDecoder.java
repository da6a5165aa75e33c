package com.koni.historyinjector.application.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.historyinjector.domain.exception.DecodeException;
import com.koni.historyinjector.domain.model.EntityIds;
import com.koni.historyinjector.domain.model.HistoryRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Decodes raw inbound payloads into history records.
 *
 * Two payload shapes are accepted:
 * - a single record: {@code {"state": ..., "timestamp": ..., "attributes": {...}}}
 * - a batch: {@code {"records": [ {...}, {...} ]}}
 *
 * The entity id is the part of the originating topic that follows the configured prefix.
 * When the topic carries no entity id, the payload's {@code entity_id} is used, then
 * {@code device_id} with the default entity id prefix.
 */
@Slf4j
@Component
public class MessageDecoder {

    static final int MAX_STATE_LENGTH = 255;

    private static final TypeReference<Map<String, Object>> ATTRIBUTES_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final String topicPrefix;
    private final String defaultEntityIdPrefix;

    public MessageDecoder(
            ObjectMapper objectMapper,
            @Value("${injector.messaging.topic-prefix:homeassistant/history/}") String topicPrefix,
            @Value("${injector.default-entity-id-prefix:sensor.}") String defaultEntityIdPrefix) {
        this.objectMapper = objectMapper;
        this.topicPrefix = topicPrefix;
        this.defaultEntityIdPrefix = defaultEntityIdPrefix;
    }

    /**
     * Decodes one message.
     *
     * @param topic the originating topic, may be null
     * @param payload the raw UTF-8 JSON payload
     * @return the records in payload order; a single-record message yields a list of one
     * @throws DecodeException if the payload is malformed or a record misses a required field
     */
    public List<HistoryRecord> decode(String topic, byte[] payload) {
        JsonNode root = parse(payload);
        if (!root.isObject()) {
            throw new DecodeException("Payload must be a JSON object");
        }

        String entityId = resolveEntityId(topic, root);

        JsonNode records = root.get("records");
        if (records == null || records.isNull()) {
            return List.of(toRecord(entityId, 0, root));
        }
        if (!records.isArray()) {
            throw new DecodeException("'records' must be an array");
        }
        if (records.isEmpty()) {
            throw new DecodeException("'records' must not be empty");
        }

        List<HistoryRecord> decoded = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            JsonNode record = records.get(i);
            if (!record.isObject()) {
                throw new DecodeException("records[" + i + "] must be a JSON object");
            }
            decoded.add(toRecord(entityId, i, record));
        }
        log.debug("Decoded batch of {} records for entityId={}", decoded.size(), entityId);
        return Collections.unmodifiableList(decoded);
    }

    private JsonNode parse(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new DecodeException("Payload is empty");
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(payload))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("Payload is not valid UTF-8", e);
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    String resolveEntityId(String topic, JsonNode root) {
        String entityId = null;
        if (topic != null && topic.startsWith(topicPrefix)) {
            String suffix = topic.substring(topicPrefix.length());
            if (!suffix.isEmpty()) {
                entityId = suffix;
            }
        }
        if (entityId == null && root.hasNonNull("entity_id")) {
            entityId = root.get("entity_id").asText();
        }
        if (entityId == null && root.hasNonNull("device_id")) {
            entityId = defaultEntityIdPrefix + root.get("device_id").asText();
        }
        if (entityId == null) {
            throw new DecodeException("Could not determine entity id from topic '" + topic + "' or payload");
        }
        if (!EntityIds.isValid(entityId)) {
            throw new DecodeException("Invalid entity id '" + entityId + "'");
        }
        return entityId;
    }

    private HistoryRecord toRecord(String entityId, int index, JsonNode node) {
        String state = readState(index, node.get("state"));
        String timestamp = readTimestamp(index, node.get("timestamp"));
        Map<String, Object> attributes = readAttributes(index, node.get("attributes"));
        return new HistoryRecord(entityId, index, state, timestamp, attributes);
    }

    private String readState(int index, JsonNode state) {
        if (state == null || state.isNull()) {
            throw new DecodeException("records[" + index + "] is missing 'state'");
        }
        if (!state.isValueNode()) {
            throw new DecodeException("records[" + index + "] 'state' must be a string, number or boolean");
        }
        String text = state.asText();
        if (text.isEmpty()) {
            throw new DecodeException("records[" + index + "] 'state' must not be empty");
        }
        if (text.length() > MAX_STATE_LENGTH) {
            throw new DecodeException("records[" + index + "] 'state' exceeds " + MAX_STATE_LENGTH + " characters");
        }
        return text;
    }

    private String readTimestamp(int index, JsonNode timestamp) {
        if (timestamp == null || timestamp.isNull()) {
            throw new DecodeException("records[" + index + "] is missing 'timestamp'");
        }
        if (!timestamp.isTextual()) {
            throw new DecodeException("records[" + index + "] 'timestamp' must be a string");
        }
        return timestamp.asText();
    }

    private Map<String, Object> readAttributes(int index, JsonNode attributes) {
        if (attributes == null || attributes.isNull()) {
            return Map.of();
        }
        if (!attributes.isObject()) {
            throw new DecodeException("records[" + index + "] 'attributes' must be a JSON object");
        }
        return objectMapper.convertValue(attributes, ATTRIBUTES_TYPE);
    }
}
