package com.williamcallahan.imagesearch.service.embedding;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Defines the application's image embedding port independent from any inference runtime.
 *
 * <p>Implementations are shared by every in-flight pipeline item and must tolerate concurrent calls.</p>
 */
public interface ImageEmbeddingService {

    /**
     * Produces one embedding vector per input image, preserving input order.
     *
     * @param images decoded images
     * @return embedding vectors in the same order as {@code images}
     */
    List<float[]> predictBatch(List<BufferedImage> images);

    /**
     * Produces an embedding vector for a single image.
     *
     * @param image decoded image
     * @return embedding vector
     */
    default float[] predict(BufferedImage image) {
        List<float[]> vectors = predictBatch(List.of(image));
        if (vectors.isEmpty()) {
            throw new EmbeddingServiceUnavailableException("Embedding response was empty");
        }
        return vectors.get(0);
    }

    /**
     * Returns the dimensionality of every produced vector.
     *
     * @return embedding vector dimensions
     */
    int outputSize();

    /**
     * Returns the side length of the square canvas the model expects.
     *
     * @return input resolution in pixels
     */
    int targetSize();
}
