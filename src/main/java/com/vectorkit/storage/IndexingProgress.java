package com.vectorkit.storage;

public record IndexingProgress(int completedBatches, int totalBatches, int indexedDocuments) {
    public double fraction() {
        return totalBatches == 0 ? 1.0 : (double) completedBatches / totalBatches;
    }
}
