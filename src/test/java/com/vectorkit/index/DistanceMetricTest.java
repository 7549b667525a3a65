package com.vectorkit.index;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DistanceMetricTest {

    @Test
    void shouldComputeSquaredEuclideanDistance() {
        assertEquals(181.0, DistanceMetric.SQUARED_EUCLIDEAN.distance(new float[] { 0f, 1f }, new float[] { 10f, 10f }), 1e-9);
        assertEquals(0.0, DistanceMetric.SQUARED_EUCLIDEAN.distance(new float[] { 3f, 4f }, new float[] { 3f, 4f }), 1e-9);
    }

    @Test
    void shouldCompareOverShorterVector() {
        assertEquals(1.0, DistanceMetric.SQUARED_EUCLIDEAN.distance(new float[] { 1f }, new float[] { 2f, 100f }), 1e-9);
    }

    @Test
    void shouldComputeCosineDistance() {
        assertEquals(0.0, DistanceMetric.COSINE.distance(new float[] { 1f, 0f }, new float[] { 5f, 0f }), 1e-6);
        assertEquals(1.0, DistanceMetric.COSINE.distance(new float[] { 1f, 0f }, new float[] { 0f, 3f }), 1e-6);
        assertEquals(2.0, DistanceMetric.COSINE.distance(new float[] { 1f, 0f }, new float[] { -1f, 0f }), 1e-6);
    }

    @Test
    void shouldTreatZeroVectorAsUnrelatedUnderCosine() {
        assertEquals(1.0, DistanceMetric.COSINE.distance(new float[] { 0f, 0f }, new float[] { 1f, 1f }), 1e-9);
    }
}
