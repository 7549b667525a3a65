package com.vectorkit.index;

/**
 * Raised by operations that have no meaning on an index without documents.
 * {@link VectorIndex#search(float[], int)} does not use it and returns an empty list instead.
 */
public class EmptyIndexException extends VectorIndexException {
    public EmptyIndexException(String message) {
        super(message);
    }
}
