package com.vectorkit.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vectorkit.index.DimensionMismatchException;
import com.vectorkit.index.InvalidParameterException;
import com.vectorkit.index.SearchResult;
import com.vectorkit.index.VectorDocument;
import com.vectorkit.index.VectorIndex;
import com.vectorkit.index.VectorIndexStats;

/**
 * Owns one {@link VectorIndex} together with its snapshot file and a bounded cache of the indexed
 * documents. Every mutation is persisted before the call returns.
 */
public class VectorStorageManager {
    private static final Logger log = LoggerFactory.getLogger(VectorStorageManager.class);

    private final VectorIndex index;
    private final Path indexPath;
    private final DocumentSpillCache spillCache;
    private final int batchSize;
    private final int memoryCacheLimit;
    private final Map<UUID, VectorDocument> memoryCache = new LinkedHashMap<>();
    private volatile boolean indexing;

    public VectorStorageManager(
            VectorIndex index,
            Path indexPath,
            DocumentSpillCache spillCache,
            int batchSize,
            int memoryCacheLimit) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        }
        if (memoryCacheLimit < 1) {
            throw new IllegalArgumentException("memoryCacheLimit must be >= 1, got " + memoryCacheLimit);
        }
        this.index = index;
        this.indexPath = indexPath;
        this.spillCache = spillCache;
        this.batchSize = batchSize;
        this.memoryCacheLimit = memoryCacheLimit;
    }

    /**
     * @return {@code false} when there is no snapshot to load yet
     */
    public synchronized boolean loadIndex() throws IOException {
        if (!Files.exists(indexPath) || Files.size(indexPath) == 0L) {
            log.info("No index snapshot at {}, starting empty", indexPath);
            return false;
        }
        index.load(indexPath);
        return true;
    }

    public synchronized IndexingProgress indexDocuments(List<VectorDocument> documents, IndexingListener listener)
            throws IOException {
        if (documents.isEmpty()) {
            return new IndexingProgress(0, 0, 0);
        }
        validateRequest(documents);

        int totalBatches = (documents.size() + batchSize - 1) / batchSize;
        IndexingProgress progress = new IndexingProgress(0, totalBatches, 0);
        indexing = true;
        try {
            for (int batch = 0; batch < totalBatches; batch++) {
                int start = batch * batchSize;
                int end = Math.min(start + batchSize, documents.size());
                List<VectorDocument> slice = documents.subList(start, end);

                index.add(slice);
                for (VectorDocument document : slice) {
                    memoryCache.put(document.id(), document);
                }
                while (memoryCache.size() > memoryCacheLimit) {
                    spillToDisk();
                }

                progress = new IndexingProgress(batch + 1, totalBatches, end);
                log.debug("Indexed batch {}/{} ({} documents)", batch + 1, totalBatches, end);
                listener.onBatchIndexed(progress);
            }
        } finally {
            indexing = false;
        }

        index.save(indexPath);
        log.info("Indexed {} documents in {} batches, snapshot saved to {}",
                documents.size(), totalBatches, indexPath);
        return progress;
    }

    public List<SearchResult> searchSimilar(float[] query, int limit) {
        return index.search(query, limit);
    }

    public List<List<SearchResult>> batchSearch(List<BatchQuery> queries, int limit) {
        List<List<SearchResult>> results = new ArrayList<>(queries.size());
        for (BatchQuery query : queries) {
            results.add(searchSimilar(query.vector(), Math.min(limit, query.limit())));
        }
        return results;
    }

    public synchronized boolean removeDocument(UUID id) throws IOException {
        memoryCache.remove(id);
        spillCache.remove(id);
        boolean removed = index.remove(id);
        if (removed) {
            index.save(indexPath);
        }
        return removed;
    }

    public synchronized void clearIndex() throws IOException {
        memoryCache.clear();
        int spilled = spillCache.clearAll();
        index.clear();
        index.save(indexPath);
        log.info("Cleared index and {} spilled documents", spilled);
    }

    public synchronized Optional<VectorDocument> cachedDocument(UUID id) throws IOException {
        VectorDocument cached = memoryCache.get(id);
        if (cached != null) {
            return Optional.of(cached);
        }
        return spillCache.load(id);
    }

    public VectorIndexStats stats() {
        return index.stats();
    }

    public boolean isIndexing() {
        return indexing;
    }

    int memoryCacheSize() {
        return memoryCache.size();
    }

    /**
     * Rejects the whole request before the first batch reaches the index.
     */
    private void validateRequest(List<VectorDocument> documents) {
        int expected = index.dimension() == 0 ? documents.get(0).vector().length : index.dimension();
        Set<UUID> ids = new HashSet<>();
        for (VectorDocument document : documents) {
            if (document.vector().length != expected) {
                throw new DimensionMismatchException(expected, document.vector().length);
            }
            if (!ids.add(document.id()) || index.contains(document.id())) {
                throw new InvalidParameterException("Duplicate document id " + document.id());
            }
        }
    }

    /**
     * Moves the oldest third of the memory cache to the spill directory.
     */
    private void spillToDisk() throws IOException {
        int spillCount = Math.max(1, memoryCache.size() / 3);
        Iterator<VectorDocument> oldest = memoryCache.values().iterator();
        for (int i = 0; i < spillCount && oldest.hasNext(); i++) {
            spillCache.store(oldest.next());
            oldest.remove();
        }
        log.info("Spilled {} documents to {}", spillCount, spillCache.directory());
    }
}
