package com.williamcallahan.imagesearch.service.ingestion;

import com.williamcallahan.imagesearch.config.AppProperties;
import com.williamcallahan.imagesearch.domain.CollectionSpec;
import com.williamcallahan.imagesearch.domain.CollectionSummary;
import com.williamcallahan.imagesearch.service.vector.CollectionConfigurationException;
import com.williamcallahan.imagesearch.service.vector.VectorIndex;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates the target collection on first use and verifies an existing one fits the model.
 */
@Service
public class CollectionBootstrapper {
    private static final Logger log = LoggerFactory.getLogger(CollectionBootstrapper.class);

    private final VectorIndex vectorIndex;
    private final AppProperties appProperties;

    public CollectionBootstrapper(VectorIndex vectorIndex, AppProperties appProperties) {
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
        this.appProperties = Objects.requireNonNull(appProperties, "appProperties");
    }

    /**
     * Ensures the collection exists with the given dimensionality.
     *
     * @param collection collection name
     * @param dimension embedding output size
     * @throws CollectionConfigurationException when an existing collection has another dimensionality
     */
    public void ensureCollection(String collection, int dimension) {
        if (!vectorIndex.collectionExists(collection)) {
            AppProperties.Qdrant qdrant = appProperties.getQdrant();
            vectorIndex.createCollection(
                    new CollectionSpec(collection, dimension, qdrant.isOnDisk(), qdrant.isScalarQuantization()));
            log.info("[INGEST] Created collection '{}' with {} dimensions", collection, dimension);
            return;
        }
        CollectionSummary summary = describeMatching(collection, dimension);
        log.info("[INGEST] Using collection '{}' ({} points, status={})",
                collection, summary.pointsCount(), summary.status());
    }

    /**
     * Verifies that a collection to be searched exists and matches the model's dimensionality.
     *
     * @throws CollectionConfigurationException when it is missing or sized differently
     */
    public void requireCompatibleCollection(String collection, int dimension) {
        if (!vectorIndex.collectionExists(collection)) {
            throw new CollectionConfigurationException(
                    "Collection '" + collection + "' does not exist; ingest images before querying");
        }
        describeMatching(collection, dimension);
    }

    private CollectionSummary describeMatching(String collection, int dimension) {
        CollectionSummary summary = vectorIndex.describeCollection(collection);
        if (summary.vectorSize() != dimension) {
            throw new CollectionConfigurationException("Collection '" + collection + "' stores "
                    + summary.vectorSize() + "-dimensional vectors but the model produces " + dimension);
        }
        return summary;
    }
}
