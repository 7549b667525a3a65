package com.vectorkit.index;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

public interface VectorIndex {
    /**
     * Inserts a batch of documents. The batch is validated as a whole before the graph is touched.
     *
     * @throws DimensionMismatchException if a vector length differs from the index dimension
     * @throws InvalidParameterException if an id is already indexed or repeated within the batch
     */
    void add(List<VectorDocument> documents);

    /**
     * @return {@code false} when no document with this id is indexed
     */
    boolean remove(UUID id);

    /**
     * Approximate nearest neighbors of {@code query}, closest first. An empty index yields an empty list.
     */
    List<SearchResult> search(float[] query, int limit);

    default SearchResult nearest(float[] query) {
        List<SearchResult> results = search(query, 1);
        if (results.isEmpty()) {
            throw new EmptyIndexException("Cannot look up a nearest neighbor in an empty index");
        }
        return results.get(0);
    }

    boolean contains(UUID id);

    void save(Path path) throws IOException;

    /**
     * Replaces the whole index with the snapshot at {@code path}. On failure the index is left as it was.
     */
    void load(Path path) throws IOException;

    void clear();

    /**
     * @return the established vector length, or 0 before the first insert
     */
    int dimension();

    VectorIndexStats stats();
}
