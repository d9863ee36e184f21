package com.williamcallahan.imagesearch.domain;

/**
 * Shape of a cosine-distance collection created on first use.
 *
 * @param name collection name
 * @param dimension vector dimensionality, equal to the embedding output size
 * @param onDisk store vectors on disk instead of RAM
 * @param scalarQuantization enable int8 scalar quantization
 */
public record CollectionSpec(String name, int dimension, boolean onDisk, boolean scalarQuantization) {

    public CollectionSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Collection name is required");
        }
        if (dimension <= 0) {
            throw new IllegalArgumentException("Collection dimension must be positive");
        }
    }
}
