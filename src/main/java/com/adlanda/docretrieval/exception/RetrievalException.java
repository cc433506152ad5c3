package com.adlanda.docretrieval.exception;

/**
 * Base type for failures raised by the retrieval core.
 */
public class RetrievalException extends RuntimeException {

    public RetrievalException(String message) {
        super(message);
    }

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
