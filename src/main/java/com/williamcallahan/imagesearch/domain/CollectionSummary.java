package com.williamcallahan.imagesearch.domain;

/**
 * Collection facts reported by the vector index.
 *
 * @param name collection name
 * @param vectorSize configured vector dimensionality, or 0 when the collection uses named vectors
 * @param pointsCount number of stored points
 * @param status index-reported status
 */
public record CollectionSummary(String name, long vectorSize, long pointsCount, String status) {}
