package com.vectorkit.index;

/**
 * Structural constants of an {@link HnswIndex}.
 *
 * @param maxLevel highest layer a node may be assigned to
 * @param m neighbors linked per layer when a node is inserted
 * @param mMax hard cap on the neighbor list of any node at any layer
 * @param efConstruction candidate breadth while inserting
 * @param efSearch candidate breadth while querying
 * @param metric distance used for construction and ranking
 */
public record HnswParameters(int maxLevel, int m, int mMax, int efConstruction, int efSearch, DistanceMetric metric) {
    public static final int DEFAULT_MAX_LEVEL = 16;
    public static final int DEFAULT_M = 16;
    public static final int DEFAULT_M_MAX = 32;
    public static final int DEFAULT_EF_CONSTRUCTION = 200;
    public static final int DEFAULT_EF_SEARCH = 100;

    public HnswParameters {
        if (maxLevel < 0) {
            throw new InvalidParameterException("maxLevel must be >= 0, got " + maxLevel);
        }
        if (m < 1) {
            throw new InvalidParameterException("m must be >= 1, got " + m);
        }
        if (mMax < m) {
            throw new InvalidParameterException("mMax must be >= m (" + m + "), got " + mMax);
        }
        if (efConstruction < 1) {
            throw new InvalidParameterException("efConstruction must be >= 1, got " + efConstruction);
        }
        if (efSearch < 1) {
            throw new InvalidParameterException("efSearch must be >= 1, got " + efSearch);
        }
        if (metric == null) {
            throw new InvalidParameterException("metric is required");
        }
    }

    public static HnswParameters defaults() {
        return new HnswParameters(
                DEFAULT_MAX_LEVEL,
                DEFAULT_M,
                DEFAULT_M_MAX,
                DEFAULT_EF_CONSTRUCTION,
                DEFAULT_EF_SEARCH,
                DistanceMetric.SQUARED_EUCLIDEAN);
    }

    public HnswParameters withMetric(DistanceMetric value) {
        return new HnswParameters(maxLevel, m, mMax, efConstruction, efSearch, value);
    }
}
