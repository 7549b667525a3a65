package com.vectorkit.index;

/**
 * Base type for structural and input errors raised by a {@link VectorIndex}.
 */
public class VectorIndexException extends RuntimeException {
    public VectorIndexException(String message) {
        super(message);
    }

    public VectorIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
