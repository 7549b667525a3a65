package com.vectorkit.index;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Index-internal copy of an inserted document plus one neighbor list per layer it takes part in.
 * Only {@link HnswIndex} mutates neighbor lists, under its write lock.
 */
final class GraphNode {
    private final UUID id;
    private final UUID ownerId;
    private final float[] vector;
    private final Map<String, String> metadata;
    private final Instant createdAt;
    private final long sequence;
    private final List<List<UUID>> neighbors;

    GraphNode(UUID id, UUID ownerId, float[] vector, Map<String, String> metadata, Instant createdAt, long sequence, int level) {
        this.id = id;
        this.ownerId = ownerId;
        this.vector = vector;
        this.metadata = metadata;
        this.createdAt = createdAt;
        this.sequence = sequence;
        this.neighbors = new ArrayList<>(level + 1);
        for (int l = 0; l <= level; l++) {
            neighbors.add(new ArrayList<>());
        }
    }

    static GraphNode fromDocument(VectorDocument document, long sequence, int level) {
        return new GraphNode(
                document.id(),
                document.ownerId(),
                document.vector().clone(),
                document.metadata(),
                document.createdAt(),
                sequence,
                level);
    }

    UUID id() {
        return id;
    }

    UUID ownerId() {
        return ownerId;
    }

    float[] vector() {
        return vector;
    }

    Map<String, String> metadata() {
        return metadata;
    }

    Instant createdAt() {
        return createdAt;
    }

    long sequence() {
        return sequence;
    }

    int level() {
        return neighbors.size() - 1;
    }

    /**
     * Neighbor ids at {@code layer}, or an empty list when the node does not reach that layer.
     */
    List<UUID> neighbors(int layer) {
        if (layer < 0 || layer >= neighbors.size()) {
            return List.of();
        }
        return neighbors.get(layer);
    }

    void setNeighbors(int layer, List<UUID> ids) {
        List<UUID> list = neighbors.get(layer);
        list.clear();
        list.addAll(ids);
    }

    List<List<UUID>> allNeighbors() {
        return neighbors;
    }

    int neighborCount() {
        int count = 0;
        for (List<UUID> layer : neighbors) {
            count += layer.size();
        }
        return count;
    }
}
