package com.williamcallahan.imagesearch.domain.query;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.imagesearch.domain.ingestion.IngestionFailure;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies that query outcomes surface item and group failures alike.
 */
class QueryRunOutcomeTest {

    @Test
    void itemFailuresInsideAGroupMakeTheRunPartial() {
        IngestionFailure downloadFailure = new IngestionFailure("a.png", "download", "BlobStoreException");
        QueryGroupOutcome group = new QueryGroupOutcome("cats", 2, 2, 3, 2, List.of(downloadFailure));

        QueryRunOutcome outcome = QueryRunOutcome.of("/out", List.of(group), List.of());

        assertEquals("partial-success", outcome.status());
        assertEquals(List.of(downloadFailure), outcome.allFailures());
    }

    @Test
    void listsGroupFailuresBeforeItemFailures() {
        IngestionFailure groupFailure = new IngestionFailure("dogs", "decode", "No decodable probe images");
        IngestionFailure itemFailure = new IngestionFailure("b.png", "decode", "ImageDecodeException");
        QueryGroupOutcome group = new QueryGroupOutcome("cats", 1, 1, 0, 0, List.of(itemFailure));

        QueryRunOutcome outcome = QueryRunOutcome.of("/out", List.of(group), List.of(groupFailure));

        assertEquals(List.of(groupFailure, itemFailure), outcome.allFailures());
    }

    @Test
    void cleanRunIsSuccessful() {
        QueryGroupOutcome group = new QueryGroupOutcome("cats", 1, 1, 1, 1, List.of());

        assertEquals("success", QueryRunOutcome.of("/out", List.of(group), List.of()).status());
    }
}
