package com.vectorkit.storage;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.vectorkit.index.VectorDocument;

/**
 * One JSON file per document under a cache directory, used to park documents that no longer fit
 * in the storage manager's memory cache.
 */
public class DocumentSpillCache {
    private static final String EXTENSION = ".vec";

    private final Path directory;
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public DocumentSpillCache(Path directory) {
        this.directory = directory;
    }

    public void store(VectorDocument document) throws IOException {
        Files.createDirectories(directory);
        objectMapper.writeValue(fileFor(document.id()).toFile(), document);
    }

    public Optional<VectorDocument> load(UUID id) throws IOException {
        Path file = fileFor(id);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(file.toFile(), VectorDocument.class));
    }

    public boolean remove(UUID id) throws IOException {
        return Files.deleteIfExists(fileFor(id));
    }

    public int clearAll() throws IOException {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : files) {
                Files.deleteIfExists(file);
                removed++;
            }
        }
        return removed;
    }

    public Path directory() {
        return directory;
    }

    private Path fileFor(UUID id) {
        return directory.resolve(id + EXTENSION);
    }
}
