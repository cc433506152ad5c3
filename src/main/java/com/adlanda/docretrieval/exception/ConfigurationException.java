package com.adlanda.docretrieval.exception;

/**
 * The store cannot be built: unknown embedding dimension, unavailable embedding
 * model or an unknown tokenizer encoding. Fatal at startup.
 */
public class ConfigurationException extends RetrievalException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
