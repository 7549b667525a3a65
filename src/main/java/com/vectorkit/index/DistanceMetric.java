package com.vectorkit.index;

/**
 * Dissimilarity scores used for graph construction and result ranking. Lower is closer.
 * Both metrics compare over the shorter of the two vectors.
 */
public enum DistanceMetric {
    /**
     * Sum of squared component differences. Skips the square root, which keeps the ordering.
     */
    SQUARED_EUCLIDEAN {
        @Override
        public double distance(float[] a, float[] b) {
            int len = Math.min(a.length, b.length);
            float sum = 0f;
            for (int i = 0; i < len; i++) {
                float diff = a[i] - b[i];
                sum += diff * diff;
            }
            return sum;
        }
    },

    /**
     * {@code 1 - cosine similarity}; a zero vector scores 1.
     */
    COSINE {
        @Override
        public double distance(float[] a, float[] b) {
            int len = Math.min(a.length, b.length);
            float dot = 0f;
            float aNorm = 0f;
            float bNorm = 0f;
            for (int i = 0; i < len; i++) {
                dot += a[i] * b[i];
                aNorm += a[i] * a[i];
                bNorm += b[i] * b[i];
            }
            if (aNorm == 0f || bNorm == 0f) {
                return 1.0;
            }
            return 1.0 - dot / Math.sqrt((double) aNorm * bNorm);
        }
    };

    public abstract double distance(float[] a, float[] b);
}
