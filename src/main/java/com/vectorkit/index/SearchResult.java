package com.vectorkit.index;

import java.util.Map;
import java.util.UUID;

public record SearchResult(
        UUID id,
        UUID documentId,
        UUID ownerId,
        double similarity,
        double distance,
        Map<String, String> metadata) {

    static SearchResult fromDistance(UUID documentId, UUID ownerId, double distance, Map<String, String> metadata) {
        return new SearchResult(UUID.randomUUID(), documentId, ownerId, 1.0 / (1.0 + distance), distance, metadata);
    }
}
