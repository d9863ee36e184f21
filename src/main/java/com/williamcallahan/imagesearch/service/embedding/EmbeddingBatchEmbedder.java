package com.williamcallahan.imagesearch.service.embedding;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Batches embedding requests while preserving input ordering guarantees.
 *
 * <p>Centralizing batch execution keeps embedding failures contextualized by item range and
 * ensures callers receive vectors aligned with item positions.</p>
 */
public final class EmbeddingBatchEmbedder {

    private EmbeddingBatchEmbedder() {}

    /**
     * Embeds items in consecutive sub-batches of at most {@code batchSize} images.
     *
     * @param embeddingService shared embedding service
     * @param items items carrying decoded images
     * @param imageOf extracts the decoded image of an item
     * @param labelOf describes an item for error messages
     * @param batchSize maximum images per inference call
     * @param <T> item type
     * @return one vector per item, in item order
     */
    public static <T> List<float[]> embedAll(
            ImageEmbeddingService embeddingService,
            List<T> items,
            Function<T, BufferedImage> imageOf,
            Function<T, String> labelOf,
            int batchSize) {
        Objects.requireNonNull(embeddingService, "embeddingService");
        Objects.requireNonNull(items, "items");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (items.isEmpty()) {
            return List.of();
        }

        List<float[]> allEmbeddings = new ArrayList<>(items.size());
        for (int batchStartIndex = 0; batchStartIndex < items.size(); batchStartIndex += batchSize) {
            int batchEndIndex = Math.min(batchStartIndex + batchSize, items.size());
            List<T> batch = items.subList(batchStartIndex, batchEndIndex);
            allEmbeddings.addAll(embedBatch(embeddingService, batch, imageOf, labelOf, batchStartIndex));
        }
        return List.copyOf(allEmbeddings);
    }

    /**
     * Embeds one batch with contextual error wrapping.
     *
     * <p>Re-wraps embedding failures with batch range and item labels so upstream callers can
     * identify which images caused the failure. A response whose size differs from the batch is
     * rejected for the whole batch.</p>
     *
     * @param batchStartIndex position of the first item within the caller's sequence, for messages
     */
    public static <T> List<float[]> embedBatch(
            ImageEmbeddingService embeddingService,
            List<T> batch,
            Function<T, BufferedImage> imageOf,
            Function<T, String> labelOf,
            int batchStartIndex) {
        Objects.requireNonNull(embeddingService, "embeddingService");
        Objects.requireNonNull(batch, "batch");
        if (batch.isEmpty()) {
            return List.of();
        }
        int batchEndIndex = batchStartIndex + batch.size();
        List<BufferedImage> images = batch.stream().map(imageOf).toList();

        List<float[]> batchEmbeddings;
        try {
            batchEmbeddings = embeddingService.predictBatch(images);
        } catch (RuntimeException embeddingFailure) {
            throw new EmbeddingServiceUnavailableException(
                    "Embedding failed for batch ["
                            + batchStartIndex
                            + ".."
                            + (batchEndIndex - 1)
                            + "] (first="
                            + labelOf.apply(batch.get(0))
                            + ", last="
                            + labelOf.apply(batch.get(batch.size() - 1))
                            + ")",
                    embeddingFailure);
        }

        if (batchEmbeddings == null || batchEmbeddings.size() != batch.size()) {
            throw new EmbeddingServiceUnavailableException("Embedding response count mismatch: expected "
                    + batch.size()
                    + " but received "
                    + (batchEmbeddings == null ? 0 : batchEmbeddings.size())
                    + " for batch ["
                    + batchStartIndex
                    + ".."
                    + (batchEndIndex - 1)
                    + "]");
        }
        int expectedDimensions = embeddingService.outputSize();
        for (int i = 0; i < batchEmbeddings.size(); i++) {
            float[] vector = batchEmbeddings.get(i);
            if (vector == null || vector.length != expectedDimensions) {
                throw new EmbeddingServiceUnavailableException("Embedding dimension mismatch for "
                        + labelOf.apply(batch.get(i)) + ": expected " + expectedDimensions
                        + " but received " + (vector == null ? 0 : vector.length));
            }
        }
        return batchEmbeddings;
    }
}
