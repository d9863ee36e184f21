package com.williamcallahan.imagesearch.pipeline;

import java.util.Objects;

/**
 * Wraps a per-item failure with the pipeline phase it happened in.
 */
public class ItemProcessingException extends Exception {

    private final String phase;

    public ItemProcessingException(String phase, String message) {
        super(message);
        this.phase = Objects.requireNonNull(phase, "phase");
    }

    public ItemProcessingException(String phase, Exception cause) {
        super(cause.getMessage(), cause);
        this.phase = Objects.requireNonNull(phase, "phase");
    }

    public String getPhase() {
        return phase;
    }

    /**
     * Returns the exception that explains the failure, unwrapping this phase marker.
     */
    public Exception rootFailure() {
        return getCause() instanceof Exception cause ? cause : this;
    }
}
