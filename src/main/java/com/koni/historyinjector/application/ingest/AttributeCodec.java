package com.koni.historyinjector.application.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.koni.historyinjector.domain.model.AttributeBlob;
import com.koni.historyinjector.domain.repository.HistorySchemaAdapter;
import com.koni.historyinjector.infrastructure.observability.InjectionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Canonicalizes attribute mappings and stores them as content-addressed blobs.
 *
 * Canonical form is compact JSON with object keys sorted at every level and non-ASCII characters
 * kept literal, so semantically equal mappings always encode to the same bytes and therefore
 * resolve to the same stored blob.
 */
@Slf4j
@Component
public class AttributeCodec {

    private final HistorySchemaAdapter schemaAdapter;
    private final InjectionMetrics metrics;
    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .build();

    public AttributeCodec(HistorySchemaAdapter schemaAdapter, InjectionMetrics metrics) {
        this.schemaAdapter = schemaAdapter;
        this.metrics = metrics;
    }

    /**
     * Keys are sorted and whitespace removed. Values are written as received: {@code 1} and
     * {@code 1.0} stay distinct, as they do in the JSON Home Assistant itself stores, so such
     * mappings get separate blobs.
     *
     * @return the canonical JSON encoding of the mapping; an empty mapping encodes as {@code {}}
     */
    public String canonicalize(Map<String, Object> attributes) {
        try {
            return canonicalMapper.writeValueAsString(attributes == null ? Map.of() : attributes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Attributes cannot be encoded as JSON", e);
        }
    }

    /**
     * Finds the blob for the mapping, inserting it on first occurrence.
     * Must run inside the caller's store transaction.
     *
     * @param attributes the attribute mapping of a record
     * @return the stored blob
     */
    public AttributeBlob encode(Map<String, Object> attributes) {
        String encoded = canonicalize(attributes);
        long hash = schemaAdapter.attributeHash(encoded.getBytes(StandardCharsets.UTF_8));

        Optional<Long> existing = schemaAdapter.findAttributesId(hash, encoded);
        if (existing.isPresent()) {
            metrics.recordBlobReused();
            log.debug("Reusing attribute blob: attributesId={}, hash={}", existing.get(), hash);
            return new AttributeBlob(existing.get(), hash, encoded, true);
        }

        long attributesId = schemaAdapter.insertAttributes(hash, encoded);
        metrics.recordBlobCreated();
        log.debug("Stored new attribute blob: attributesId={}, hash={}", attributesId, hash);
        return new AttributeBlob(attributesId, hash, encoded, false);
    }

    /**
     * @return how many state rows reference the blob
     */
    public long referenceCount(long attributesId) {
        return schemaAdapter.countAttributeReferences(attributesId);
    }
}
