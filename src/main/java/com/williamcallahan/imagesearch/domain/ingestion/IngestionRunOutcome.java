package com.williamcallahan.imagesearch.domain.ingestion;

import java.util.List;
import java.util.Objects;

/**
 * Represents the outcome of an ingest run so operators can assess partial failures.
 *
 * @param status status indicator ("success" or "partial-success")
 * @param dir ingested directory path
 * @param discovered number of image files found
 * @param indexed number of items uploaded and upserted during this run
 * @param skipped number of items short-circuited because their content was already stored
 * @param failures per-item failures encountered during ingestion
 */
public record IngestionRunOutcome(
        String status, String dir, int discovered, int indexed, int skipped, List<IngestionFailure> failures) {
    private static final String STATUS_SUCCESS = "success";
    private static final String STATUS_PARTIAL_SUCCESS = "partial-success";

    public IngestionRunOutcome {
        Objects.requireNonNull(status, "Status is required");
        if (discovered < 0 || indexed < 0 || skipped < 0) {
            throw new IllegalArgumentException("Counts must be non-negative");
        }
        if (dir == null || dir.isBlank()) {
            throw new IllegalArgumentException("Ingested directory is required");
        }
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    /**
     * Creates an outcome whose status reflects whether any item failed.
     */
    public static IngestionRunOutcome of(
            String dir, int discovered, int indexed, int skipped, List<IngestionFailure> failures) {
        boolean hasFailures = failures != null && !failures.isEmpty();
        String status = hasFailures ? STATUS_PARTIAL_SUCCESS : STATUS_SUCCESS;
        return new IngestionRunOutcome(status, dir, discovered, indexed, skipped, failures);
    }
}
