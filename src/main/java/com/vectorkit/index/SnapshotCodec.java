package com.vectorkit.index;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Reads and writes the full node set as a single JSON array. Timestamps are ISO-8601 strings.
 */
class SnapshotCodec {
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    void write(Path path, List<NodeRecord> records) throws IOException {
        Path target = path.toAbsolutePath();
        Path directory = target.getParent();
        if (directory != null) {
            Files.createDirectories(directory);
        }
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), records);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw new IOException("Failed to write index snapshot " + path, e);
        }
    }

    List<NodeRecord> read(Path path) throws IOException {
        List<NodeRecord> records;
        try {
            records = objectMapper.readValue(path.toFile(), new TypeReference<List<NodeRecord>>() {
            });
        } catch (IOException e) {
            throw new IOException("Failed to read index snapshot " + path, e);
        }
        if (records == null) {
            throw new IOException("Index snapshot " + path + " does not contain a node array");
        }
        return records;
    }

    /**
     * Persisted form of one graph node. {@code documentId} duplicates {@code id}.
     */
    record NodeRecord(
            UUID id,
            UUID documentId,
            UUID ownerId,
            float[] vector,
            List<List<UUID>> neighbors,
            Map<String, String> metadata,
            Instant createdAt) {
    }
}
