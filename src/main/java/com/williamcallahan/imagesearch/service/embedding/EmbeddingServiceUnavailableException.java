package com.williamcallahan.imagesearch.service.embedding;

/**
 * Signals that the embedding runtime failed or returned an invalid response.
 *
 * <p>This exception is thrown instead of returning partial vectors so that a failed batch is
 * reported as a whole and never misaligns vectors with their images.</p>
 */
public class EmbeddingServiceUnavailableException extends RuntimeException {

    /**
     * Creates an exception with a human-readable message.
     *
     * @param message explanation of the embedding failure
     */
    public EmbeddingServiceUnavailableException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and the original cause.
     *
     * @param message explanation of the embedding failure
     * @param cause underlying exception from the runtime call
     */
    public EmbeddingServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
