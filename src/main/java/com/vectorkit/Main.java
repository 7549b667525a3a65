package com.vectorkit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vectorkit.index.HnswIndex;
import com.vectorkit.index.HnswParameters;
import com.vectorkit.index.SearchResult;
import com.vectorkit.index.VectorDocument;
import com.vectorkit.index.VectorIndexException;
import com.vectorkit.index.VectorIndexStats;
import com.vectorkit.runtime.AppConfig;
import com.vectorkit.storage.DocumentSpillCache;
import com.vectorkit.storage.IndexingProgress;
import com.vectorkit.storage.VectorStorageManager;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "vectorkit",
        mixinStandardHelpOptions = true,
        version = "vectorkit 0.1.0",
        description = "Builds, queries and maintains a local HNSW vector index snapshot.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_STORAGE_FAILURE = 3;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "stats")
    Mode mode;

    @Option(names = "--index-path", description = "Index snapshot file, overrides storage.indexPath")
    Path indexPath;

    @Option(names = "--cache-dir", description = "Spill directory for cached documents, overrides storage.cacheDirectory")
    Path cacheDir;

    @Option(names = "--documents", description = "JSON array of documents to insert in index mode")
    Path documentsPath;

    @Option(names = "--query", description = "Comma-separated query vector used in search mode")
    String query;

    @Option(names = "--top-k", description = "Top results to return", defaultValue = "5")
    int topK;

    @Option(names = "--id", description = "Document id removed in remove mode")
    UUID documentId;

    private final ObjectMapper documentMapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    enum Mode {
        index,
        search,
        remove,
        stats,
        clear
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        HnswParameters parameters;
        try {
            parameters = config.getIndex().toParameters();
        } catch (VectorIndexException e) {
            log.error("Invalid index configuration in {}: {}", configPath, e.getMessage());
            return EXIT_USAGE_ERROR;
        }

        Path snapshot = indexPath != null ? indexPath : config.getStorage().indexFile();
        Path spillDir = cacheDir != null ? cacheDir : config.getStorage().cacheDir();
        log.info("Starting vectorkit in {} mode", mode);
        log.info("Index snapshot={} cacheDir={} M={} mMax={} efConstruction={} efSearch={} metric={}",
                snapshot,
                spillDir,
                parameters.m(),
                parameters.mMax(),
                parameters.efConstruction(),
                parameters.efSearch(),
                parameters.metric());

        try {
            VectorStorageManager manager = createStorageManager(config, parameters, snapshot, spillDir);
            manager.loadIndex();
            return run(manager);
        } catch (VectorIndexException | IllegalArgumentException e) {
            log.error("{} failed: {}", mode, e.getMessage());
            return EXIT_USAGE_ERROR;
        } catch (IOException e) {
            log.error("Index storage failed for {}", snapshot, e);
            return EXIT_STORAGE_FAILURE;
        }
    }

    private int run(VectorStorageManager manager) throws IOException {
        if (mode == Mode.index) {
            if (documentsPath == null || !Files.exists(documentsPath)) {
                log.error("--documents must point to an existing JSON file in index mode");
                return EXIT_USAGE_ERROR;
            }
            List<VectorDocument> documents;
            try {
                documents = documentMapper.readValue(documentsPath.toFile(),
                        new TypeReference<List<VectorDocument>>() {
                        });
            } catch (JsonProcessingException e) {
                log.error("Invalid documents file {}: {}", documentsPath, e.getOriginalMessage());
                return EXIT_USAGE_ERROR;
            }
            IndexingProgress progress = manager.indexDocuments(documents, update ->
                    log.info("Indexing progress {}% ({}/{} batches)",
                            String.format(Locale.ROOT, "%.0f", update.fraction() * 100),
                            update.completedBatches(),
                            update.totalBatches()));
            log.info("Indexed documents={} batches={}", progress.indexedDocuments(), progress.totalBatches());
        }
        if (mode == Mode.search) {
            if (query == null || query.isBlank()) {
                log.error("--query is required in search mode");
                return EXIT_USAGE_ERROR;
            }
            List<SearchResult> results = manager.searchSimilar(parseVector(query), topK);
            for (int i = 0; i < results.size(); i++) {
                SearchResult result = results.get(i);
                log.info("Result #{} document={} owner={} similarity={} distance={} metadata={}",
                        i + 1,
                        result.documentId(),
                        result.ownerId(),
                        String.format(Locale.ROOT, "%.4f", result.similarity()),
                        String.format(Locale.ROOT, "%.4f", result.distance()),
                        result.metadata());
            }
        }
        if (mode == Mode.remove) {
            if (documentId == null) {
                log.error("--id is required in remove mode");
                return EXIT_USAGE_ERROR;
            }
            boolean removed = manager.removeDocument(documentId);
            log.info("Remove document={} removed={}", documentId, removed);
        }
        if (mode == Mode.clear) {
            manager.clearIndex();
        }
        if (mode == Mode.stats) {
            VectorIndexStats stats = manager.stats();
            log.info("Index documents={} dimension={} memoryBytes={} buildTimeSeconds={}",
                    stats.documentCount(),
                    stats.vectorDimension(),
                    stats.memoryUsage(),
                    String.format(Locale.ROOT, "%.3f", stats.buildTime()));
        }
        return EXIT_OK;
    }

    VectorStorageManager createStorageManager(AppConfig config, HnswParameters parameters, Path snapshot, Path spillDir) {
        Long seed = config.getIndex().getSeed();
        Random random = seed == null ? new Random() : new Random(seed);
        HnswIndex index = new HnswIndex(parameters, random, Clock.systemUTC());
        return new VectorStorageManager(
                index,
                snapshot,
                new DocumentSpillCache(spillDir),
                config.getStorage().getBatchSize(),
                config.getStorage().getMemoryCacheLimit());
    }

    static float[] parseVector(String value) {
        String[] parts = value.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                vector[i] = Float.parseFloat(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid vector component '" + parts[i].trim() + "' in --query", e);
            }
        }
        return vector;
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
