package com.vectorkit.index;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hierarchical Navigable Small World graph over fixed-dimension float vectors.
 *
 * <p>Nodes live in an arena addressed by dense position with an id to position map, so following an
 * edge is a hash lookup. Upper layers hold exponentially fewer nodes; queries descend greedily from
 * the top-level entry point and finish with a bounded best-first search on layer 0.
 *
 * <p>All state is guarded by a read/write lock: inserts, removals, loads and clears are exclusive,
 * searches, stats and snapshot capture are shared.
 */
public class HnswIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(HnswIndex.class);

    static final long NODE_OVERHEAD_BYTES = 64L;
    static final long ID_BYTES = 16L;
    static final long FLOAT_BYTES = 4L;

    private static final Comparator<Candidate> CLOSEST_FIRST = Comparator
            .comparingDouble(Candidate::distance)
            .thenComparingLong(candidate -> candidate.node().sequence());

    private final HnswParameters parameters;
    private final LevelGenerator levelGenerator;
    private final Clock clock;
    private final Instant buildStartTime;
    private final SnapshotCodec codec = new SnapshotCodec();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final List<GraphNode> nodes = new ArrayList<>();
    private final Map<UUID, Integer> positions = new HashMap<>();
    private GraphNode entryPoint;
    private int dimension;
    private long nextSequence;

    public HnswIndex() {
        this(HnswParameters.defaults());
    }

    public HnswIndex(HnswParameters parameters) {
        this(parameters, new Random(), Clock.systemUTC());
    }

    public HnswIndex(HnswParameters parameters, Random random, Clock clock) {
        this.parameters = parameters;
        this.levelGenerator = new LevelGenerator(random, parameters.maxLevel());
        this.clock = clock;
        this.buildStartTime = clock.instant();
    }

    @Override
    public void add(List<VectorDocument> documents) {
        if (documents == null || documents.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            int batchDimension = dimension == 0 ? documents.get(0).vector().length : dimension;
            validateBatch(documents, batchDimension);
            dimension = batchDimension;
            for (VectorDocument document : documents) {
                insert(GraphNode.fromDocument(document, nextSequence++, levelGenerator.nextLevel()));
            }
            log.debug("Inserted {} documents, index now holds {} nodes (top level {})",
                    documents.size(), nodes.size(), entryPoint.level());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean remove(UUID id) {
        lock.writeLock().lock();
        try {
            Integer position = positions.get(id);
            if (position == null) {
                log.debug("Remove ignored, {} is not indexed", id);
                return false;
            }
            GraphNode removed = nodes.get(position);
            detach(position);
            repairAfterRemoval(removed);
            if (entryPoint == removed) {
                entryPoint = electEntryPoint(nodes);
            }
            log.debug("Removed {}, index now holds {} nodes", id, nodes.size());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<SearchResult> search(float[] query, int limit) {
        if (limit < 0) {
            throw new InvalidParameterException("limit must be >= 0, got " + limit);
        }
        lock.readLock().lock();
        try {
            if (nodes.isEmpty() || limit == 0) {
                return List.of();
            }
            if (query.length != dimension) {
                throw new DimensionMismatchException(dimension, query.length);
            }
            GraphNode current = entryPoint;
            for (int layer = entryPoint.level(); layer > 0; layer--) {
                current = greedyClosest(query, current, layer);
            }
            List<Candidate> found = searchLayer(query, List.of(current), Math.max(parameters.efSearch(), limit), 0);
            return found.stream()
                    .limit(limit)
                    .map(candidate -> SearchResult.fromDistance(
                            candidate.node().id(),
                            candidate.node().ownerId(),
                            candidate.distance(),
                            candidate.node().metadata()))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean contains(UUID id) {
        lock.readLock().lock();
        try {
            return positions.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void save(Path path) throws IOException {
        List<SnapshotCodec.NodeRecord> records;
        lock.readLock().lock();
        try {
            records = nodes.stream()
                    .sorted(Comparator.comparingLong(GraphNode::sequence))
                    .map(HnswIndex::toRecord)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
        codec.write(path, records);
        log.info("Saved {} nodes to {}", records.size(), path);
    }

    @Override
    public void load(Path path) throws IOException {
        List<SnapshotCodec.NodeRecord> records = codec.read(path);
        List<GraphNode> loaded = rebuild(records, path);

        lock.writeLock().lock();
        try {
            nodes.clear();
            positions.clear();
            for (GraphNode node : loaded) {
                positions.put(node.id(), nodes.size());
                nodes.add(node);
            }
            entryPoint = electEntryPoint(nodes);
            dimension = loaded.isEmpty() ? 0 : loaded.get(0).vector().length;
            nextSequence = loaded.size();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Loaded {} nodes (dimension {}) from {}", loaded.size(), dimension, path);
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            nodes.clear();
            positions.clear();
            entryPoint = null;
            dimension = 0;
            nextSequence = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int dimension() {
        lock.readLock().lock();
        try {
            return dimension;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public VectorIndexStats stats() {
        lock.readLock().lock();
        try {
            long memoryUsage = 0L;
            for (GraphNode node : nodes) {
                memoryUsage += NODE_OVERHEAD_BYTES;
                memoryUsage += node.vector().length * FLOAT_BYTES;
                memoryUsage += node.neighborCount() * ID_BYTES;
            }
            double buildTime = Duration.between(buildStartTime, clock.instant()).toNanos() / 1_000_000_000d;
            return new VectorIndexStats(nodes.size(), dimension, memoryUsage, buildTime);
        } finally {
            lock.readLock().unlock();
        }
    }

    UUID entryPointId() {
        lock.readLock().lock();
        try {
            return entryPoint == null ? null : entryPoint.id();
        } finally {
            lock.readLock().unlock();
        }
    }

    int levelOf(UUID id) {
        lock.readLock().lock();
        try {
            GraphNode node = node(id);
            return node == null ? -1 : node.level();
        } finally {
            lock.readLock().unlock();
        }
    }

    List<UUID> neighborsOf(UUID id, int layer) {
        lock.readLock().lock();
        try {
            GraphNode node = node(id);
            return node == null ? List.of() : List.copyOf(node.neighbors(layer));
        } finally {
            lock.readLock().unlock();
        }
    }

    private void validateBatch(List<VectorDocument> documents, int expectedDimension) {
        if (expectedDimension == 0) {
            throw new InvalidParameterException("Vectors must have at least one component");
        }
        Set<UUID> batchIds = new HashSet<>();
        for (VectorDocument document : documents) {
            if (document.vector().length != expectedDimension) {
                throw new DimensionMismatchException(expectedDimension, document.vector().length);
            }
            if (positions.containsKey(document.id()) || !batchIds.add(document.id())) {
                throw new InvalidParameterException("Duplicate document id " + document.id());
            }
        }
    }

    private void insert(GraphNode node) {
        positions.put(node.id(), nodes.size());
        nodes.add(node);
        if (entryPoint == null) {
            entryPoint = node;
            return;
        }

        float[] query = node.vector();
        int level = node.level();
        int topLevel = entryPoint.level();

        GraphNode current = entryPoint;
        for (int layer = topLevel; layer > level; layer--) {
            current = greedyClosest(query, current, layer);
        }

        List<GraphNode> entryPoints = List.of(current);
        for (int layer = Math.min(level, topLevel); layer >= 0; layer--) {
            List<Candidate> candidates = searchLayer(query, entryPoints, parameters.efConstruction(), layer);
            List<UUID> selected = new ArrayList<>(parameters.m());
            for (Candidate candidate : candidates) {
                if (selected.size() == parameters.m()) {
                    break;
                }
                if (candidate.node() != node) {
                    selected.add(candidate.node().id());
                }
            }
            node.setNeighbors(layer, selected);
            for (UUID neighborId : selected) {
                linkBack(node(neighborId), node.id(), layer);
            }
            entryPoints = candidates.stream().map(Candidate::node).toList();
        }

        if (level > topLevel) {
            entryPoint = node;
        }
    }

    private void linkBack(GraphNode neighbor, UUID id, int layer) {
        if (neighbor == null || neighbor.level() < layer) {
            return;
        }
        List<UUID> links = neighbor.neighbors(layer);
        if (!links.contains(id)) {
            links.add(id);
        }
        if (links.size() > parameters.mMax()) {
            prune(neighbor, layer);
        }
    }

    /**
     * Keeps the {@code mMax} closest live neighbors of {@code owner} at {@code layer}.
     */
    private void prune(GraphNode owner, int layer) {
        List<Candidate> ranked = new ArrayList<>();
        for (UUID id : owner.neighbors(layer)) {
            GraphNode neighbor = node(id);
            if (neighbor != null) {
                ranked.add(new Candidate(neighbor, distance(owner.vector(), neighbor.vector())));
            }
        }
        ranked.sort(CLOSEST_FIRST);
        owner.setNeighbors(layer, ranked.stream()
                .limit(parameters.mMax())
                .map(candidate -> candidate.node().id())
                .toList());
    }

    /**
     * Moves to a strictly closer neighbor until none improves on the current position.
     */
    private GraphNode greedyClosest(float[] query, GraphNode start, int layer) {
        GraphNode current = start;
        double currentDistance = distance(query, current.vector());
        boolean improved = true;
        while (improved) {
            improved = false;
            for (UUID id : current.neighbors(layer)) {
                GraphNode neighbor = node(id);
                if (neighbor == null) {
                    continue;
                }
                double d = distance(query, neighbor.vector());
                if (d < currentDistance) {
                    current = neighbor;
                    currentDistance = d;
                    improved = true;
                }
            }
        }
        return current;
    }

    /**
     * Best-first search of one layer, returning at most {@code bound} nodes closest first.
     */
    private List<Candidate> searchLayer(float[] query, List<GraphNode> entryPoints, int bound, int layer) {
        Set<UUID> visited = new HashSet<>();
        PriorityQueue<Candidate> candidates = new PriorityQueue<>(CLOSEST_FIRST);
        PriorityQueue<Candidate> results = new PriorityQueue<>(CLOSEST_FIRST.reversed());

        for (GraphNode entry : entryPoints) {
            if (visited.add(entry.id())) {
                Candidate candidate = new Candidate(entry, distance(query, entry.vector()));
                candidates.add(candidate);
                results.add(candidate);
                if (results.size() > bound) {
                    results.poll();
                }
            }
        }

        while (!candidates.isEmpty()) {
            Candidate closest = candidates.poll();
            if (results.size() >= bound && CLOSEST_FIRST.compare(closest, results.peek()) > 0) {
                break;
            }
            for (UUID id : closest.node().neighbors(layer)) {
                if (!visited.add(id)) {
                    continue;
                }
                GraphNode neighbor = node(id);
                if (neighbor == null) {
                    continue;
                }
                Candidate candidate = new Candidate(neighbor, distance(query, neighbor.vector()));
                if (results.size() < bound || CLOSEST_FIRST.compare(candidate, results.peek()) < 0) {
                    candidates.add(candidate);
                    results.add(candidate);
                    if (results.size() > bound) {
                        results.poll();
                    }
                }
            }
        }

        List<Candidate> ordered = new ArrayList<>(results);
        ordered.sort(CLOSEST_FIRST);
        return ordered;
    }

    private void detach(int position) {
        GraphNode removed = nodes.get(position);
        int last = nodes.size() - 1;
        if (position != last) {
            GraphNode moved = nodes.get(last);
            nodes.set(position, moved);
            positions.put(moved.id(), position);
        }
        nodes.remove(last);
        positions.remove(removed.id());
    }

    /**
     * Scrubs the removed id from every neighbor list and offers the removed node's own neighbors
     * at that layer as replacements.
     */
    private void repairAfterRemoval(GraphNode removed) {
        for (GraphNode node : nodes) {
            for (int layer = 0; layer <= node.level(); layer++) {
                List<UUID> links = node.neighbors(layer);
                if (!links.remove(removed.id())) {
                    continue;
                }
                for (UUID replacement : removed.neighbors(layer)) {
                    if (!replacement.equals(node.id()) && !links.contains(replacement) && positions.containsKey(replacement)) {
                        links.add(replacement);
                    }
                }
                if (links.size() > parameters.mMax()) {
                    prune(node, layer);
                }
            }
        }
    }

    private List<GraphNode> rebuild(List<SnapshotCodec.NodeRecord> records, Path path) throws IOException {
        List<GraphNode> loaded = new ArrayList<>(records.size());
        Set<UUID> ids = new HashSet<>();
        int expectedDimension = 0;
        for (SnapshotCodec.NodeRecord record : records) {
            if (record == null || record.id() == null || record.vector() == null || record.vector().length == 0) {
                throw new IOException("Index snapshot " + path + " contains an incomplete node record");
            }
            if (record.metadata() != null
                    && (record.metadata().containsKey(null) || record.metadata().containsValue(null))) {
                throw new IOException("Index snapshot " + path + " contains null metadata on node " + record.id());
            }
            if (!ids.add(record.id())) {
                throw new IOException("Index snapshot " + path + " contains duplicate node " + record.id());
            }
            if (expectedDimension == 0) {
                expectedDimension = record.vector().length;
            } else if (record.vector().length != expectedDimension) {
                throw new IOException("Index snapshot " + path + " mixes vector dimensions "
                        + expectedDimension + " and " + record.vector().length);
            }
        }

        for (SnapshotCodec.NodeRecord record : records) {
            List<List<UUID>> layers = record.neighbors() == null || record.neighbors().isEmpty()
                    ? List.of(List.of())
                    : record.neighbors();
            GraphNode node = new GraphNode(
                    record.id(),
                    record.ownerId() == null ? record.documentId() : record.ownerId(),
                    record.vector(),
                    record.metadata() == null ? Map.of() : Map.copyOf(record.metadata()),
                    record.createdAt(),
                    loaded.size(),
                    layers.size() - 1);
            for (int layer = 0; layer < layers.size(); layer++) {
                Set<UUID> links = new LinkedHashSet<>();
                if (layers.get(layer) != null) {
                    for (UUID id : layers.get(layer)) {
                        if (id != null && ids.contains(id) && !id.equals(record.id())) {
                            links.add(id);
                        }
                    }
                }
                node.setNeighbors(layer, new ArrayList<>(links));
            }
            loaded.add(node);
        }

        Map<UUID, GraphNode> byId = new HashMap<>();
        for (GraphNode node : loaded) {
            byId.put(node.id(), node);
        }
        for (GraphNode node : loaded) {
            for (int layer = 0; layer <= node.level(); layer++) {
                if (node.neighbors(layer).size() > parameters.mMax()) {
                    log.warn("Node {} has {} neighbors at layer {} in {}, pruning to {}",
                            node.id(), node.neighbors(layer).size(), layer, path, parameters.mMax());
                    pruneDetached(node, layer, byId);
                }
            }
        }
        return loaded;
    }

    private void pruneDetached(GraphNode owner, int layer, Map<UUID, GraphNode> byId) {
        List<Candidate> ranked = new ArrayList<>();
        for (UUID id : owner.neighbors(layer)) {
            GraphNode neighbor = byId.get(id);
            ranked.add(new Candidate(neighbor, distance(owner.vector(), neighbor.vector())));
        }
        ranked.sort(CLOSEST_FIRST);
        owner.setNeighbors(layer, ranked.stream()
                .limit(parameters.mMax())
                .map(candidate -> candidate.node().id())
                .toList());
    }

    /**
     * Highest level wins, earliest insertion breaks ties.
     */
    private static GraphNode electEntryPoint(List<GraphNode> candidates) {
        GraphNode best = null;
        for (GraphNode node : candidates) {
            if (best == null
                    || node.level() > best.level()
                    || (node.level() == best.level() && node.sequence() < best.sequence())) {
                best = node;
            }
        }
        return best;
    }

    private static SnapshotCodec.NodeRecord toRecord(GraphNode node) {
        List<List<UUID>> layers = node.allNeighbors().stream()
                .map(List::copyOf)
                .toList();
        return new SnapshotCodec.NodeRecord(
                node.id(),
                node.id(),
                node.ownerId(),
                node.vector().clone(),
                layers,
                node.metadata(),
                node.createdAt());
    }

    private GraphNode node(UUID id) {
        Integer position = positions.get(id);
        return position == null ? null : nodes.get(position);
    }

    private double distance(float[] a, float[] b) {
        return parameters.metric().distance(a, b);
    }

    private record Candidate(GraphNode node, double distance) {
    }
}
