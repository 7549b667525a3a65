package com.vectorkit.storage;

public record BatchQuery(float[] vector, int limit) {
}
