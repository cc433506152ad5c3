package com.adlanda.docretrieval.exception;

/**
 * A vector's width differs from the store's fixed embedding dimension.
 */
public class DimensionMismatchException extends RetrievalException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Expected vector of dimension " + expected + " but got " + actual);
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
