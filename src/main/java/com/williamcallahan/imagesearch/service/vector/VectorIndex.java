package com.williamcallahan.imagesearch.service.vector;

import com.williamcallahan.imagesearch.domain.CollectionSpec;
import com.williamcallahan.imagesearch.domain.CollectionSummary;
import com.williamcallahan.imagesearch.domain.IndexedPoint;
import com.williamcallahan.imagesearch.domain.SearchMatch;
import com.williamcallahan.imagesearch.domain.SearchParameters;
import java.util.List;
import java.util.UUID;

/**
 * Vector database port: collection lifecycle, point upsert and multi-example recommend queries.
 *
 * <p>A single instance is shared by all pipeline workers and must be safe under concurrent
 * invocation. Call failures surface as {@link VectorIndexException}.</p>
 */
public interface VectorIndex {

    boolean collectionExists(String collection);

    /**
     * Creates a cosine-distance collection with the given dimensionality and storage options.
     */
    void createCollection(CollectionSpec spec);

    /**
     * Returns dimensionality, point count and status of an existing collection.
     */
    CollectionSummary describeCollection(String collection);

    List<String> listCollections();

    void deleteCollection(String collection);

    /**
     * Inserts or overwrites points, sending them in chunks of {@code chunkWidth}.
     *
     * @param collection target collection
     * @param points points keyed by deterministic ids
     * @param chunkWidth maximum points per network call
     */
    void upsert(String collection, List<IndexedPoint> points, int chunkWidth);

    /**
     * Reports whether a point with the id is present.
     */
    boolean pointExists(String collection, UUID pointId);

    /**
     * Finds points similar to all positive example vectors.
     *
     * @param collection collection to search
     * @param positiveVectors example vectors, at most the index's accepted cardinality
     * @param parameters limit, score threshold, exactness and search width
     * @return score-ordered matches with typed payloads
     */
    List<SearchMatch> recommend(String collection, List<float[]> positiveVectors, SearchParameters parameters);
}
