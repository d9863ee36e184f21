package com.williamcallahan.imagesearch.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.williamcallahan.imagesearch.domain.ingestion.IngestionFailure;
import com.williamcallahan.imagesearch.domain.ingestion.IngestionRunOutcome;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies status derivation for ingest run outcomes.
 */
class IngestionRunOutcomeTest {

    @Test
    void reportsSuccessWithoutFailures() {
        IngestionRunOutcome outcome = IngestionRunOutcome.of("/data", 3, 2, 1, List.of());

        assertEquals("success", outcome.status());
    }

    @Test
    void reportsPartialSuccessWhenAnyItemFailed() {
        IngestionFailure failure = new IngestionFailure("/data/a.png", "decode", "ImageDecodeException");

        IngestionRunOutcome outcome = IngestionRunOutcome.of("/data", 3, 2, 0, List.of(failure));

        assertEquals("partial-success", outcome.status());
        assertEquals(List.of(failure), outcome.failures());
    }

    @Test
    void rejectsNegativeCounts() {
        assertThrows(IllegalArgumentException.class, () -> IngestionRunOutcome.of("/data", -1, 0, 0, List.of()));
    }
}
