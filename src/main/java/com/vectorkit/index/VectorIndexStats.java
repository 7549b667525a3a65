package com.vectorkit.index;

/**
 * @param memoryUsage estimated bytes held by nodes, vectors and neighbor lists
 * @param buildTime seconds elapsed since the index was constructed
 */
public record VectorIndexStats(int documentCount, int vectorDimension, long memoryUsage, double buildTime) {
}
