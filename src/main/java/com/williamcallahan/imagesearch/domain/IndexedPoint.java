package com.williamcallahan.imagesearch.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * A vector index point: deterministic id, embedding and typed payload.
 *
 * @param id point identifier derived from the content hash
 * @param vector embedding vector
 * @param payload searchable payload
 * @param key blob store key of the original bytes
 */
public record IndexedPoint(UUID id, float[] vector, SearchPayload payload, StoredObjectKey key) {

    public IndexedPoint {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(vector, "vector");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(key, "key");
        if (vector.length == 0) {
            throw new IllegalArgumentException("Point vector must not be empty");
        }
    }

    /**
     * Builds the point for stored content, deriving the id from its hash.
     */
    public static IndexedPoint forContent(ContentHash hash, float[] vector, SearchPayload payload, StoredObjectKey key) {
        Objects.requireNonNull(hash, "hash");
        return new IndexedPoint(hash.pointId(), vector, payload, key);
    }
}
