package com.williamcallahan.imagesearch.service.ingestion;

import com.williamcallahan.imagesearch.domain.ingestion.IngestionFailure;
import java.util.List;

/**
 * Outcome of uploading and upserting one embedded batch.
 *
 * @param indexed items whose point was upserted
 * @param failures items that failed upload or upsert
 */
record IndexBatchResult(int indexed, List<IngestionFailure> failures) {

    IndexBatchResult {
        failures = List.copyOf(failures);
    }
}
