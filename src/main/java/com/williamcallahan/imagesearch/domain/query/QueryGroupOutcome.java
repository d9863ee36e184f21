package com.williamcallahan.imagesearch.domain.query;

import com.williamcallahan.imagesearch.domain.ingestion.IngestionFailure;
import java.util.List;

/**
 * Result of searching one tag group.
 *
 * @param tag group name
 * @param probeCount number of probe images that produced a vector
 * @param queryVectorCount number of positive vectors sent after reduction
 * @param matched number of results returned by the index
 * @param downloaded number of matches written to disk
 * @param failures per-item failures (decode, download) of this group
 */
public record QueryGroupOutcome(
        String tag, int probeCount, int queryVectorCount, int matched, int downloaded, List<IngestionFailure> failures) {

    public QueryGroupOutcome {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Tag is required");
        }
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
