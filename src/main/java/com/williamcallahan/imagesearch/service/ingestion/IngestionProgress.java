package com.williamcallahan.imagesearch.service.ingestion;

import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-run counters updated concurrently by the pipeline's connector threads.
 */
final class IngestionProgress {
    private static final Logger log = LoggerFactory.getLogger(IngestionProgress.class);
    private static final int LOG_INTERVAL = 100;

    private final int discovered;
    private final AtomicInteger indexedCount = new AtomicInteger(0);
    private final AtomicInteger skippedCount = new AtomicInteger(0);
    private final AtomicInteger failedCount = new AtomicInteger(0);
    private final AtomicInteger processedCount = new AtomicInteger(0);

    IngestionProgress(int discovered) {
        this.discovered = discovered;
    }

    void markSkipped() {
        skippedCount.incrementAndGet();
        advance(1);
    }

    void markIndexed(int items) {
        indexedCount.addAndGet(items);
        advance(items);
    }

    void markFailed() {
        failedCount.incrementAndGet();
        advance(1);
    }

    int getIndexedCount() { return indexedCount.get(); }
    int getSkippedCount() { return skippedCount.get(); }
    int getFailedCount() { return failedCount.get(); }

    double percentComplete() {
        if (discovered <= 0) return 100.0;
        return Math.max(0.0, Math.min(100.0, (processedCount.get() * 100.0) / discovered));
    }

    String formatPercent() {
        return String.format("%.1f%%", percentComplete());
    }

    private void advance(int items) {
        if (items <= 0) {
            return;
        }
        int before = processedCount.getAndAdd(items);
        if (before / LOG_INTERVAL != (before + items) / LOG_INTERVAL) {
            log.info("[INGEST] Progress {} ({}/{}; indexed={}, skipped={}, failed={})",
                    formatPercent(), before + items, discovered,
                    indexedCount.get(), skippedCount.get(), failedCount.get());
        }
    }
}
