package com.adlanda.docretrieval.exception;

/**
 * The embedding provider returned a different number of vectors than texts submitted.
 * The batch is rejected and the store is left unchanged.
 */
public class EmbeddingMismatchException extends RetrievalException {

    private final int expected;
    private final int actual;

    public EmbeddingMismatchException(int expected, int actual) {
        super("Embedding provider returned " + actual + " vectors for " + expected + " texts");
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
