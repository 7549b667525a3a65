package com.vectorkit.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.vectorkit.index.VectorDocument;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentSpillCacheTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldStoreAndLoadDocument() throws IOException {
        DocumentSpillCache cache = new DocumentSpillCache(tempDir.resolve("spill"));
        VectorDocument document = new VectorDocument(UUID.randomUUID(), UUID.randomUUID(),
                new float[] { 0.25f, -1f, 3f }, Map.of("source", "notes.md"), Instant.parse("2025-11-02T10:15:30Z"));

        cache.store(document);
        Optional<VectorDocument> loaded = cache.load(document.id());

        assertTrue(loaded.isPresent());
        assertEquals(document.id(), loaded.get().id());
        assertEquals(document.ownerId(), loaded.get().ownerId());
        assertArrayEquals(document.vector(), loaded.get().vector());
        assertEquals(document.metadata(), loaded.get().metadata());
        assertEquals(document.createdAt(), loaded.get().createdAt());
    }

    @Test
    void shouldReturnEmptyForUnknownDocument() throws IOException {
        DocumentSpillCache cache = new DocumentSpillCache(tempDir);

        assertFalse(cache.load(UUID.randomUUID()).isPresent());
        assertFalse(cache.remove(UUID.randomUUID()));
    }

    @Test
    void shouldClearOnlySpilledFiles() throws IOException {
        DocumentSpillCache cache = new DocumentSpillCache(tempDir);
        cache.store(VectorDocument.of(UUID.randomUUID(), new float[] { 1f }, Map.of()));
        cache.store(VectorDocument.of(UUID.randomUUID(), new float[] { 2f }, Map.of()));
        Path unrelated = Files.writeString(tempDir.resolve("notes.txt"), "keep");

        assertEquals(2, cache.clearAll());
        assertTrue(Files.exists(unrelated));
        assertEquals(0, new DocumentSpillCache(tempDir.resolve("absent")).clearAll());
    }
}
