package com.williamcallahan.imagesearch.domain;

/**
 * Parameters forwarded to the vector index recommend query.
 *
 * @param limit maximum number of results
 * @param scoreThreshold minimum similarity score of returned results
 * @param exact true for exhaustive search instead of the approximate index
 * @param hnswEf search width of the approximate index
 */
public record SearchParameters(int limit, float scoreThreshold, boolean exact, long hnswEf) {

    public SearchParameters {
        if (limit <= 0) {
            throw new IllegalArgumentException("Search limit must be positive");
        }
        if (hnswEf <= 0) {
            throw new IllegalArgumentException("hnsw_ef must be positive");
        }
    }
}
