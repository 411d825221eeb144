package com.raditha.competitors.exception;

/**
 * The embedding model could not produce vectors for a batch.
 * Thrown by models for a single failed call, and by the fuser once the retry
 * budget for a batch is exhausted.
 */
public class EmbeddingException extends PipelineException {

    public EmbeddingException(String message) {
        super("embedding", message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super("embedding", message, cause);
    }
}
