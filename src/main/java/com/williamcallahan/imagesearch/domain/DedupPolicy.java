package com.williamcallahan.imagesearch.domain;

/**
 * Decides what ingest does with content whose bytes already exist in the blob store.
 */
public enum DedupPolicy {
    /** Stored content is treated as fully processed: no decode, embedding, upload or upsert. */
    SKIP,
    /**
     * Stored content is checked against the vector index; a missing point is re-embedded and
     * upserted without re-uploading the blob.
     */
    HEAL
}
