package com.williamcallahan.imagesearch.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.imagesearch.config.AppProperties;
import com.williamcallahan.imagesearch.domain.CollectionSpec;
import com.williamcallahan.imagesearch.service.vector.CollectionConfigurationException;
import com.williamcallahan.imagesearch.service.vector.InMemoryVectorIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies collections are created on first use and mismatched dimensions fail before any work.
 */
class CollectionBootstrapperTest {

    private InMemoryVectorIndex vectorIndex;
    private CollectionBootstrapper collectionBootstrapper;

    @BeforeEach
    void setUp() {
        vectorIndex = new InMemoryVectorIndex();
        collectionBootstrapper = new CollectionBootstrapper(vectorIndex, new AppProperties());
    }

    @Test
    void createsMissingCollectionWithModelDimension() {
        collectionBootstrapper.ensureCollection("images", 768);

        assertTrue(vectorIndex.collectionExists("images"));
        assertEquals(768, vectorIndex.describeCollection("images").vectorSize());
    }

    @Test
    void reusesMatchingCollection() {
        vectorIndex.createCollection(new CollectionSpec("images", 3, true, true));

        assertDoesNotThrow(() -> collectionBootstrapper.ensureCollection("images", 3));
    }

    @Test
    void rejectsExistingCollectionWithAnotherDimension() {
        vectorIndex.createCollection(new CollectionSpec("images", 512, true, true));

        CollectionConfigurationException thrown = assertThrows(
                CollectionConfigurationException.class, () -> collectionBootstrapper.ensureCollection("images", 768));

        assertTrue(thrown.getMessage().contains("512"));
        assertTrue(thrown.getMessage().contains("768"));
    }

    @Test
    void queryRequiresAnExistingCollection() {
        assertThrows(
                CollectionConfigurationException.class,
                () -> collectionBootstrapper.requireCompatibleCollection("images", 3));
    }
}
