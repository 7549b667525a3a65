package com.vectorkit.index;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Caller-supplied unit of insertion. The index never dereferences {@code ownerId}; it is passed through
 * into search results together with the metadata. A missing id or timestamp is generated.
 */
public record VectorDocument(UUID id, UUID ownerId, float[] vector, Map<String, String> metadata, Instant createdAt) {
    public VectorDocument {
        id = id == null ? UUID.randomUUID() : id;
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(vector, "vector");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public static VectorDocument of(UUID ownerId, float[] vector, Map<String, String> metadata) {
        return new VectorDocument(null, ownerId, vector, metadata, null);
    }
}
