package com.faceregistry.exception;

import lombok.Getter;

@Getter
public class EmbeddingDimensionMismatchException extends RegistryException {

    private final int expected;
    private final int actual;

    public EmbeddingDimensionMismatchException(int expected, int actual) {
        super("Embedding dimension mismatch: expected " + expected + " but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }
}
