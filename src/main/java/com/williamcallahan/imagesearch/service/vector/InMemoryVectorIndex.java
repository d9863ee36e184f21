package com.williamcallahan.imagesearch.service.vector;

import com.williamcallahan.imagesearch.domain.CollectionSpec;
import com.williamcallahan.imagesearch.domain.CollectionSummary;
import com.williamcallahan.imagesearch.domain.IndexedPoint;
import com.williamcallahan.imagesearch.domain.SearchMatch;
import com.williamcallahan.imagesearch.domain.SearchParameters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory vector index used for local runs without a Qdrant server.
 * Recommend scores every stored point by cosine similarity to the mean of the example vectors.
 */
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    private final Map<String, StoredCollection> collections = new ConcurrentHashMap<>();

    public InMemoryVectorIndex() {
        logger.info("Using in-memory vector index; points are lost when the process exits");
    }

    @Override
    public boolean collectionExists(String collection) {
        return collections.containsKey(collection);
    }

    @Override
    public void createCollection(CollectionSpec spec) {
        Objects.requireNonNull(spec, "spec");
        StoredCollection previous = collections.putIfAbsent(spec.name(), new StoredCollection(spec.dimension()));
        if (previous != null) {
            throw new VectorIndexException("Collection already exists: " + spec.name());
        }
    }

    @Override
    public CollectionSummary describeCollection(String collection) {
        StoredCollection stored = require(collection);
        return new CollectionSummary(collection, stored.dimension, stored.points.size(), "Green");
    }

    @Override
    public List<String> listCollections() {
        return collections.keySet().stream().sorted().toList();
    }

    @Override
    public void deleteCollection(String collection) {
        if (collections.remove(collection) == null) {
            throw new VectorIndexException("Collection not found: " + collection);
        }
    }

    @Override
    public void upsert(String collection, List<IndexedPoint> points, int chunkWidth) {
        Objects.requireNonNull(points, "points");
        if (chunkWidth <= 0) {
            throw new IllegalArgumentException("chunkWidth must be positive");
        }
        StoredCollection stored = require(collection);
        for (IndexedPoint point : points) {
            if (point.vector().length != stored.dimension) {
                throw new VectorIndexException("Vector dimension " + point.vector().length
                        + " does not match collection dimension " + stored.dimension);
            }
        }
        for (IndexedPoint point : points) {
            stored.points.put(point.id(), point);
        }
        logger.debug("Upserted {} points into in-memory collection '{}'", points.size(), collection);
    }

    @Override
    public boolean pointExists(String collection, UUID pointId) {
        return require(collection).points.containsKey(pointId);
    }

    @Override
    public List<SearchMatch> recommend(String collection, List<float[]> positiveVectors, SearchParameters parameters) {
        Objects.requireNonNull(positiveVectors, "positiveVectors");
        Objects.requireNonNull(parameters, "parameters");
        StoredCollection stored = require(collection);
        if (positiveVectors.isEmpty() || stored.points.isEmpty()) {
            return List.of();
        }

        float[] target = mean(positiveVectors, stored.dimension);
        List<SearchMatch> scored = new ArrayList<>();
        for (IndexedPoint point : stored.points.values()) {
            float similarity = (float) cosineSimilarity(target, point.vector());
            if (similarity >= parameters.scoreThreshold()) {
                scored.add(new SearchMatch(point.id(), similarity, point.payload()));
            }
        }
        scored.sort(Comparator.comparingDouble(SearchMatch::score).reversed());
        return scored.stream().limit(parameters.limit()).toList();
    }

    private StoredCollection require(String collection) {
        StoredCollection stored = collections.get(collection);
        if (stored == null) {
            throw new VectorIndexException("Collection not found: " + collection);
        }
        return stored;
    }

    private static float[] mean(List<float[]> vectors, int dimension) {
        float[] sum = new float[dimension];
        for (float[] vector : vectors) {
            if (vector.length != dimension) {
                throw new VectorIndexException("Example vector dimension " + vector.length
                        + " does not match collection dimension " + dimension);
            }
            for (int i = 0; i < dimension; i++) {
                sum[i] += vector[i];
            }
        }
        for (int i = 0; i < dimension; i++) {
            sum[i] /= vectors.size();
        }
        return sum;
    }

    /**
     * Calculate cosine similarity between two vectors.
     */
    private static double cosineSimilarity(float[] a, float[] b) {
        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static final class StoredCollection {
        private final int dimension;
        private final Map<UUID, IndexedPoint> points = new ConcurrentHashMap<>();

        private StoredCollection(int dimension) {
            this.dimension = dimension;
        }
    }
}
