package com.williamcallahan.imagesearch.service.embedding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.junit.jupiter.api.Test;

/**
 * Verifies batching, ordering and failure context of batch embedding.
 */
class EmbeddingBatchEmbedderTest {

    private static final Function<Item, BufferedImage> IMAGE_OF = Item::image;
    private static final Function<Item, String> LABEL_OF = Item::label;

    @Test
    void splitsItemsIntoBatchesAndPreservesOrder() {
        RecordingEmbeddingService embeddingService = new RecordingEmbeddingService();
        List<Item> items = items(5);

        List<float[]> vectors = EmbeddingBatchEmbedder.embedAll(embeddingService, items, IMAGE_OF, LABEL_OF, 2);

        assertEquals(List.of(2, 2, 1), embeddingService.batchSizes);
        assertEquals(5, vectors.size());
        for (int i = 0; i < items.size(); i++) {
            assertEquals(i, vectors.get(i)[0]);
        }
    }

    @Test
    void emptyInputNeverCallsTheModel() {
        RecordingEmbeddingService embeddingService = new RecordingEmbeddingService();

        List<float[]> vectors = EmbeddingBatchEmbedder.embedAll(embeddingService, List.of(), IMAGE_OF, LABEL_OF, 4);

        assertTrue(vectors.isEmpty());
        assertTrue(embeddingService.batchSizes.isEmpty());
    }

    @Test
    void wrapsRuntimeFailuresWithBatchRange() {
        ImageEmbeddingService embeddingService = mock(ImageEmbeddingService.class);
        IllegalStateException runtimeFailure = new IllegalStateException("CUDA out of memory");
        when(embeddingService.predictBatch(anyList())).thenThrow(runtimeFailure);
        List<Item> items = items(3);

        EmbeddingServiceUnavailableException thrown = assertThrows(
                EmbeddingServiceUnavailableException.class,
                () -> EmbeddingBatchEmbedder.embedBatch(embeddingService, items, IMAGE_OF, LABEL_OF, 10));

        assertSame(runtimeFailure, thrown.getCause());
        assertTrue(thrown.getMessage().contains("[10..12]"));
        assertTrue(thrown.getMessage().contains("first=item-0"));
        assertTrue(thrown.getMessage().contains("last=item-2"));
    }

    @Test
    void rejectsResponsesWithTheWrongCount() {
        ImageEmbeddingService embeddingService = mock(ImageEmbeddingService.class);
        when(embeddingService.outputSize()).thenReturn(1);
        when(embeddingService.predictBatch(anyList())).thenReturn(List.of(new float[] {1f}));
        List<Item> items = items(2);

        assertThrows(
                EmbeddingServiceUnavailableException.class,
                () -> EmbeddingBatchEmbedder.embedBatch(embeddingService, items, IMAGE_OF, LABEL_OF, 0));
    }

    @Test
    void rejectsVectorsOfTheWrongDimension() {
        ImageEmbeddingService embeddingService = mock(ImageEmbeddingService.class);
        when(embeddingService.outputSize()).thenReturn(3);
        when(embeddingService.predictBatch(anyList())).thenReturn(List.of(new float[] {1f, 2f}));
        List<Item> items = items(1);

        EmbeddingServiceUnavailableException thrown = assertThrows(
                EmbeddingServiceUnavailableException.class,
                () -> EmbeddingBatchEmbedder.embedBatch(embeddingService, items, IMAGE_OF, LABEL_OF, 0));

        assertTrue(thrown.getMessage().contains("item-0"));
    }

    @Test
    void rejectsNonPositiveBatchSize() {
        RecordingEmbeddingService embeddingService = new RecordingEmbeddingService();
        List<Item> items = items(1);

        assertThrows(
                IllegalArgumentException.class,
                () -> EmbeddingBatchEmbedder.embedAll(embeddingService, items, IMAGE_OF, LABEL_OF, 0));
    }

    private static List<Item> items(int count) {
        List<Item> items = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            BufferedImage image = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
            image.setRGB(0, 0, i);
            items.add(new Item("item-" + i, image));
        }
        return items;
    }

    private record Item(String label, BufferedImage image) {}

    /** Emits the first pixel value of each image so order can be checked. */
    private static final class RecordingEmbeddingService implements ImageEmbeddingService {
        private final List<Integer> batchSizes = new ArrayList<>();

        @Override
        public List<float[]> predictBatch(List<BufferedImage> images) {
            batchSizes.add(images.size());
            List<float[]> vectors = new ArrayList<>(images.size());
            for (BufferedImage image : images) {
                vectors.add(new float[] {image.getRGB(0, 0) & 0xFFFFFF});
            }
            return vectors;
        }

        @Override
        public int outputSize() {
            return 1;
        }

        @Override
        public int targetSize() {
            return 1;
        }
    }
}
