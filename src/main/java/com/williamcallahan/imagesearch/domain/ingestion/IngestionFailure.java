package com.williamcallahan.imagesearch.domain.ingestion;

import java.util.Objects;

/**
 * Captures a single per-item pipeline failure with file and phase context so triage is faster.
 *
 * @param filePath absolute file path (or tag name for query-group failures)
 * @param phase pipeline phase that failed
 * @param details failure details for diagnostics
 */
public record IngestionFailure(String filePath, String phase, String details) {

    public IngestionFailure {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("File path is required");
        }
        if (phase == null || phase.isBlank()) {
            throw new IllegalArgumentException("Failure phase is required");
        }
        Objects.requireNonNull(details, "Failure details are required");
    }
}
