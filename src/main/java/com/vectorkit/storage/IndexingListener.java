package com.vectorkit.storage;

@FunctionalInterface
public interface IndexingListener {
    IndexingListener NONE = progress -> {
    };

    void onBatchIndexed(IndexingProgress progress);
}
