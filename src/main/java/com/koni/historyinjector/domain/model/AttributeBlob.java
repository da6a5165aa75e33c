package com.koni.historyinjector.domain.model;

import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * Content-addressed attribute set as stored in the target schema.
 * A blob is never mutated once stored; any number of state rows may reference it.
 */
@Getter
public class AttributeBlob {

    private final long attributesId;
    private final long hash;
    private final String encoded;
    private final boolean reused;

    /**
     * @param attributesId the store identifier of the blob
     * @param hash the content digest of {@code encoded}
     * @param encoded the canonical JSON encoding
     * @param reused true when an existing blob was found instead of inserting a new one
     */
    public AttributeBlob(long attributesId, long hash, String encoded, boolean reused) {
        this.attributesId = attributesId;
        this.hash = hash;
        this.encoded = encoded;
        this.reused = reused;
    }

    public byte[] getEncodedBytes() {
        return encoded.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "AttributeBlob{" +
                "attributesId=" + attributesId +
                ", hash=" + hash +
                ", reused=" + reused +
                '}';
    }
}
