package com.williamcallahan.imagesearch.service.vector;

import static com.williamcallahan.imagesearch.service.vector.QdrantFutureAwaiter.awaitFuture;
import static io.qdrant.client.ConditionFactory.hasId;
import static io.qdrant.client.PointIdFactory.id;
import static io.qdrant.client.VectorFactory.vector;
import static io.qdrant.client.VectorsFactory.vectors;

import com.google.common.collect.Lists;
import com.williamcallahan.imagesearch.domain.CollectionSpec;
import com.williamcallahan.imagesearch.domain.CollectionSummary;
import com.williamcallahan.imagesearch.domain.IndexedPoint;
import com.williamcallahan.imagesearch.domain.SearchMatch;
import com.williamcallahan.imagesearch.domain.SearchParameters;
import com.williamcallahan.imagesearch.support.RetryPolicy;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.grpc.Collections.CollectionInfo;
import io.qdrant.client.grpc.Collections.CreateCollection;
import io.qdrant.client.grpc.Collections.Distance;
import io.qdrant.client.grpc.Collections.QuantizationConfig;
import io.qdrant.client.grpc.Collections.QuantizationType;
import io.qdrant.client.grpc.Collections.ScalarQuantization;
import io.qdrant.client.grpc.Collections.VectorParams;
import io.qdrant.client.grpc.Collections.VectorsConfig;
import io.qdrant.client.grpc.Common.Filter;
import io.qdrant.client.grpc.Points.PointStruct;
import io.qdrant.client.grpc.Points.RecommendPoints;
import io.qdrant.client.grpc.Points.ScoredPoint;
import io.qdrant.client.grpc.Points.SearchParams;
import io.qdrant.client.grpc.Points.UpsertPoints;
import io.qdrant.client.grpc.Points.WithPayloadSelector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link VectorIndex} over the Qdrant gRPC client.
 *
 * <p>Every call is awaited with the configured timeout and wrapped in the retry policy. Upserts
 * wait for the write to be applied so a point is queryable as soon as the call returns.</p>
 */
public class QdrantVectorIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(QdrantVectorIndex.class);

    private final QdrantClient qdrantClient;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;

    /**
     * Wires the gRPC client with per-call timeout and retry.
     *
     * @param qdrantClient shared Qdrant gRPC client
     * @param timeout maximum wait for each call
     * @param retryPolicy retry applied to each call
     */
    public QdrantVectorIndex(QdrantClient qdrantClient, Duration timeout, RetryPolicy retryPolicy) {
        this.qdrantClient = Objects.requireNonNull(qdrantClient, "qdrantClient");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    @Override
    public boolean collectionExists(String collection) {
        Boolean exists = retryPolicy.execute(
                () -> awaitFuture(qdrantClient.collectionExistsAsync(collection), timeout, "collection exists"),
                "Qdrant collection exists");
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public void createCollection(CollectionSpec spec) {
        Objects.requireNonNull(spec, "spec");
        VectorParams vectorParams = VectorParams.newBuilder()
                .setSize(spec.dimension())
                .setDistance(Distance.Cosine)
                .setOnDisk(spec.onDisk())
                .build();
        CreateCollection.Builder request = CreateCollection.newBuilder()
                .setCollectionName(spec.name())
                .setVectorsConfig(VectorsConfig.newBuilder().setParams(vectorParams).build());
        if (spec.scalarQuantization()) {
            request.setQuantizationConfig(QuantizationConfig.newBuilder()
                    .setScalar(ScalarQuantization.newBuilder()
                            .setType(QuantizationType.Int8)
                            .setAlwaysRam(true)
                            .build())
                    .build());
        }
        CreateCollection createCollection = request.build();
        retryPolicy.execute(
                () -> awaitFuture(qdrantClient.createCollectionAsync(createCollection), timeout, "create collection"),
                "Qdrant create collection");
        log.info("[QDRANT] Created collection '{}' (dimensions={}, onDisk={}, int8={})",
                spec.name(), spec.dimension(), spec.onDisk(), spec.scalarQuantization());
    }

    @Override
    public CollectionSummary describeCollection(String collection) {
        CollectionInfo info = retryPolicy.execute(
                () -> awaitFuture(qdrantClient.getCollectionInfoAsync(collection), timeout, "collection info"),
                "Qdrant collection info");
        VectorsConfig vectorsConfig = info.getConfig().getParams().getVectorsConfig();
        long vectorSize = vectorsConfig.hasParams() ? vectorsConfig.getParams().getSize() : 0L;
        return new CollectionSummary(collection, vectorSize, info.getPointsCount(), info.getStatus().name());
    }

    @Override
    public List<String> listCollections() {
        List<String> names = retryPolicy.execute(
                () -> awaitFuture(qdrantClient.listCollectionsAsync(), timeout, "list collections"),
                "Qdrant list collections");
        return List.copyOf(names);
    }

    @Override
    public void deleteCollection(String collection) {
        retryPolicy.execute(
                () -> awaitFuture(qdrantClient.deleteCollectionAsync(collection), timeout, "delete collection"),
                "Qdrant delete collection");
        log.info("[QDRANT] Deleted collection '{}'", collection);
    }

    @Override
    public void upsert(String collection, List<IndexedPoint> points, int chunkWidth) {
        Objects.requireNonNull(points, "points");
        if (chunkWidth <= 0) {
            throw new IllegalArgumentException("chunkWidth must be positive");
        }
        if (points.isEmpty()) {
            return;
        }
        for (List<IndexedPoint> chunk : Lists.partition(points, chunkWidth)) {
            List<PointStruct> pointStructs = new ArrayList<>(chunk.size());
            for (IndexedPoint point : chunk) {
                pointStructs.add(toPointStruct(point));
            }
            UpsertPoints request = UpsertPoints.newBuilder()
                    .setCollectionName(collection)
                    .addAllPoints(pointStructs)
                    .setWait(true)
                    .build();
            retryPolicy.execute(
                    () -> awaitFuture(qdrantClient.upsertAsync(request), timeout, "upsert"),
                    "Qdrant upsert");
        }
        log.debug("[QDRANT] Upserted {} points into '{}'", points.size(), collection);
    }

    @Override
    public boolean pointExists(String collection, UUID pointId) {
        Objects.requireNonNull(pointId, "pointId");
        Filter filter = Filter.newBuilder().addMust(hasId(id(pointId))).build();
        Long count = retryPolicy.execute(
                () -> awaitFuture(qdrantClient.countAsync(collection, filter, true), timeout, "count"),
                "Qdrant count by id");
        return count != null && count > 0;
    }

    @Override
    public List<SearchMatch> recommend(String collection, List<float[]> positiveVectors, SearchParameters parameters) {
        Objects.requireNonNull(positiveVectors, "positiveVectors");
        Objects.requireNonNull(parameters, "parameters");
        if (positiveVectors.isEmpty()) {
            return List.of();
        }
        RecommendPoints.Builder request = RecommendPoints.newBuilder()
                .setCollectionName(collection)
                .setLimit(parameters.limit())
                .setScoreThreshold(parameters.scoreThreshold())
                .setWithPayload(WithPayloadSelector.newBuilder().setEnable(true).build())
                .setParams(SearchParams.newBuilder()
                        .setExact(parameters.exact())
                        .setHnswEf(parameters.hnswEf())
                        .build());
        for (float[] positiveVector : positiveVectors) {
            request.addPositiveVectors(vector(positiveVector));
        }
        RecommendPoints recommendPoints = request.build();
        List<ScoredPoint> scoredPoints = retryPolicy.execute(
                () -> awaitFuture(qdrantClient.recommendAsync(recommendPoints), timeout, "recommend"),
                "Qdrant recommend");

        List<SearchMatch> matches = new ArrayList<>(scoredPoints.size());
        for (ScoredPoint scoredPoint : scoredPoints) {
            matches.add(QdrantPayloadMapper.toMatch(scoredPoint));
        }
        log.debug("[QDRANT] Recommend over {} example vectors returned {} matches",
                positiveVectors.size(), matches.size());
        return List.copyOf(matches);
    }

    private static PointStruct toPointStruct(IndexedPoint point) {
        return PointStruct.newBuilder()
                .setId(id(point.id()))
                .setVectors(vectors(point.vector()))
                .putAllPayload(QdrantPayloadMapper.toPayload(point))
                .build();
    }
}
