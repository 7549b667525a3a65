package com.vectorkit.index;

public class InvalidParameterException extends VectorIndexException {
    public InvalidParameterException(String message) {
        super(message);
    }
}
