package com.williamcallahan.imagesearch.service.vector;

/**
 * Signals a failed, interrupted or timed-out vector index call.
 */
public class VectorIndexException extends RuntimeException {

    public VectorIndexException(String message) {
        super(message);
    }

    public VectorIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
