package com.williamcallahan.imagesearch.service.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compresses an ordered list of probe vectors into at most the recommend query's example cap.
 *
 * <p>Up to {@code maxVectors} inputs pass through unchanged. Larger inputs are split into
 * contiguous chunks of {@code 1 + ceil(n / maxVectors)} vectors and each chunk is replaced by its
 * componentwise mean. The extra element per chunk leaves the result somewhat below the cap.</p>
 */
public final class VectorReducer {

    private VectorReducer() {}

    /**
     * Reduces the vectors to at most {@code maxVectors} representatives.
     *
     * @param vectors ordered probe vectors of equal length
     * @param maxVectors example cap of the recommend query
     * @return the input when within the cap, otherwise the chunk means in order
     */
    public static List<float[]> reduce(List<float[]> vectors, int maxVectors) {
        Objects.requireNonNull(vectors, "vectors");
        if (maxVectors <= 0) {
            throw new IllegalArgumentException("maxVectors must be positive");
        }
        int count = vectors.size();
        if (count <= maxVectors) {
            return List.copyOf(vectors);
        }

        int chunkSize = chunkSize(count, maxVectors);
        List<float[]> reduced = new ArrayList<>((count + chunkSize - 1) / chunkSize);
        for (int start = 0; start < count; start += chunkSize) {
            reduced.add(mean(vectors.subList(start, Math.min(start + chunkSize, count))));
        }
        return List.copyOf(reduced);
    }

    static int chunkSize(int count, int maxVectors) {
        return 1 + (count + maxVectors - 1) / maxVectors;
    }

    private static float[] mean(List<float[]> chunk) {
        int dimension = chunk.get(0).length;
        double[] sum = new double[dimension];
        for (float[] vector : chunk) {
            if (vector.length != dimension) {
                throw new IllegalArgumentException(
                        "Vector dimension mismatch: expected " + dimension + " but received " + vector.length);
            }
            for (int i = 0; i < dimension; i++) {
                sum[i] += vector[i];
            }
        }
        float[] mean = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            mean[i] = (float) (sum[i] / chunk.size());
        }
        return mean;
    }
}
