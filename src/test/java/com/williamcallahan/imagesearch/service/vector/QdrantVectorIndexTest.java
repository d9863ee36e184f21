package com.williamcallahan.imagesearch.service.vector;

import static io.qdrant.client.PointIdFactory.id;
import static io.qdrant.client.ValueFactory.value;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.notNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.SettableFuture;
import com.williamcallahan.imagesearch.domain.CollectionSpec;
import com.williamcallahan.imagesearch.domain.CollectionSummary;
import com.williamcallahan.imagesearch.domain.ContentHash;
import com.williamcallahan.imagesearch.domain.IndexedPoint;
import com.williamcallahan.imagesearch.domain.SearchMatch;
import com.williamcallahan.imagesearch.domain.SearchParameters;
import com.williamcallahan.imagesearch.domain.SearchPayload;
import com.williamcallahan.imagesearch.domain.StoredObjectKey;
import com.williamcallahan.imagesearch.support.RetryPolicy;
import io.grpc.Status;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.grpc.Collections.CollectionConfig;
import io.qdrant.client.grpc.Collections.CollectionInfo;
import io.qdrant.client.grpc.Collections.CollectionOperationResponse;
import io.qdrant.client.grpc.Collections.CollectionParams;
import io.qdrant.client.grpc.Collections.CollectionStatus;
import io.qdrant.client.grpc.Collections.CreateCollection;
import io.qdrant.client.grpc.Collections.Distance;
import io.qdrant.client.grpc.Collections.QuantizationType;
import io.qdrant.client.grpc.Collections.VectorParams;
import io.qdrant.client.grpc.Collections.VectorsConfig;
import io.qdrant.client.grpc.Common.Filter;
import io.qdrant.client.grpc.Points.RecommendPoints;
import io.qdrant.client.grpc.Points.ScoredPoint;
import io.qdrant.client.grpc.Points.UpdateResult;
import io.qdrant.client.grpc.Points.UpsertPoints;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies request shaping, chunking and error handling of the Qdrant-backed index.
 */
class QdrantVectorIndexTest {

    private static final String COLLECTION = "images";

    private QdrantClient qdrantClient;
    private QdrantVectorIndex vectorIndex;

    @BeforeEach
    void setUp() {
        qdrantClient = mock(QdrantClient.class);
        vectorIndex = new QdrantVectorIndex(qdrantClient, Duration.ofSeconds(5), RetryPolicy.none());
    }

    @Test
    void createsCosineCollectionWithInt8Quantization() {
        List<CreateCollection> captured = new ArrayList<>();
        doAnswer(invocation -> {
                    captured.add(invocation.getArgument(0));
                    return Futures.immediateFuture(CollectionOperationResponse.getDefaultInstance());
                })
                .when(qdrantClient)
                .createCollectionAsync(any(CreateCollection.class));

        vectorIndex.createCollection(new CollectionSpec(COLLECTION, 768, true, true));

        assertEquals(1, captured.size());
        CreateCollection request = captured.get(0);
        VectorParams params = request.getVectorsConfig().getParams();
        assertEquals(COLLECTION, request.getCollectionName());
        assertEquals(768, params.getSize());
        assertEquals(Distance.Cosine, params.getDistance());
        assertTrue(params.getOnDisk());
        assertEquals(QuantizationType.Int8, request.getQuantizationConfig().getScalar().getType());
        assertTrue(request.getQuantizationConfig().getScalar().getAlwaysRam());
    }

    @Test
    void omitsQuantizationWhenDisabled() {
        List<CreateCollection> captured = new ArrayList<>();
        doAnswer(invocation -> {
                    captured.add(invocation.getArgument(0));
                    return Futures.immediateFuture(CollectionOperationResponse.getDefaultInstance());
                })
                .when(qdrantClient)
                .createCollectionAsync(any(CreateCollection.class));

        vectorIndex.createCollection(new CollectionSpec(COLLECTION, 3, false, false));

        assertFalse(captured.get(0).hasQuantizationConfig());
        assertFalse(captured.get(0).getVectorsConfig().getParams().getOnDisk());
    }

    @Test
    void describesVectorSizeAndPointCount() {
        CollectionInfo info = CollectionInfo.newBuilder()
                .setStatus(CollectionStatus.Green)
                .setPointsCount(7)
                .setConfig(CollectionConfig.newBuilder()
                        .setParams(CollectionParams.newBuilder()
                                .setVectorsConfig(VectorsConfig.newBuilder()
                                        .setParams(VectorParams.newBuilder()
                                                .setSize(3)
                                                .setDistance(Distance.Cosine)))))
                .build();
        when(qdrantClient.getCollectionInfoAsync(COLLECTION)).thenReturn(Futures.immediateFuture(info));

        CollectionSummary summary = vectorIndex.describeCollection(COLLECTION);

        assertEquals(new CollectionSummary(COLLECTION, 3, 7, "Green"), summary);
    }

    @Test
    void upsertsInChunksAndWaitsForEachWrite() {
        List<UpsertPoints> captured = new ArrayList<>();
        doAnswer(invocation -> {
                    captured.add(invocation.getArgument(0));
                    return Futures.immediateFuture(UpdateResult.getDefaultInstance());
                })
                .when(qdrantClient)
                .upsertAsync(any(UpsertPoints.class));

        vectorIndex.upsert(COLLECTION, points(70), 32);

        assertEquals(List.of(32, 32, 6), captured.stream().map(UpsertPoints::getPointsCount).toList());
        for (UpsertPoints request : captured) {
            assertTrue(request.getWait());
            assertEquals(COLLECTION, request.getCollectionName());
        }
        assertTrue(captured.get(0).getPoints(0).getPayloadMap().containsKey(QdrantPayloadMapper.PAYLOAD_KEY));
    }

    @Test
    void emptyUpsertSkipsTheServer() {
        vectorIndex.upsert(COLLECTION, List.of(), 32);

        verify(qdrantClient, times(0)).upsertAsync(any(UpsertPoints.class));
    }

    @Test
    void pointExistsCountsByIdExactly() {
        ContentHash hash = hash(1);
        when(qdrantClient.countAsync(eq(COLLECTION), any(Filter.class), anyBoolean()))
                .thenReturn(Futures.immediateFuture(1L));

        assertTrue(vectorIndex.pointExists(COLLECTION, hash.pointId()));
        verify(qdrantClient).countAsync(eq(COLLECTION), notNull(), eq(true));
    }

    @Test
    void pointAbsentWhenCountIsZero() {
        when(qdrantClient.countAsync(eq(COLLECTION), any(Filter.class), anyBoolean()))
                .thenReturn(Futures.immediateFuture(0L));

        assertFalse(vectorIndex.pointExists(COLLECTION, hash(2).pointId()));
    }

    @Test
    void recommendSendsEveryExampleAndSearchParameters() {
        ContentHash hash = hash(3);
        ScoredPoint scoredPoint = ScoredPoint.newBuilder()
                .setId(id(hash.pointId()))
                .setScore(0.91f)
                .putPayload(QdrantPayloadMapper.PAYLOAD_PATH, value("fox.png"))
                .putPayload(QdrantPayloadMapper.PAYLOAD_HASH, value(hash.hex()))
                .putPayload(QdrantPayloadMapper.PAYLOAD_URL, value("http://blobs.test/fox.png"))
                .build();
        List<RecommendPoints> captured = new ArrayList<>();
        doAnswer(invocation -> {
                    captured.add(invocation.getArgument(0));
                    return Futures.immediateFuture(List.of(scoredPoint));
                })
                .when(qdrantClient)
                .recommendAsync(any(RecommendPoints.class));

        List<SearchMatch> matches = vectorIndex.recommend(
                COLLECTION,
                List.of(new float[] {1f, 0f, 0f}, new float[] {0f, 1f, 0f}),
                new SearchParameters(10, 0.25f, true, 64));

        RecommendPoints request = captured.get(0);
        assertEquals(2, request.getPositiveVectorsCount());
        assertEquals(10, request.getLimit());
        assertEquals(0.25f, request.getScoreThreshold());
        assertTrue(request.getParams().getExact());
        assertEquals(64, request.getParams().getHnswEf());
        assertTrue(request.getWithPayload().getEnable());
        assertEquals(1, matches.size());
        assertEquals(hash.pointId(), matches.get(0).id());
        assertEquals("fox.png", matches.get(0).payload().path());
    }

    @Test
    void recommendWithoutExamplesReturnsNothing() {
        List<SearchMatch> matches = vectorIndex.recommend(COLLECTION, List.of(), new SearchParameters(5, 0f, false, 32));

        assertTrue(matches.isEmpty());
        verify(qdrantClient, times(0)).recommendAsync(any(RecommendPoints.class));
    }

    @Test
    void timesOutPendingCalls() {
        SettableFuture<Boolean> neverCompletes = SettableFuture.create();
        when(qdrantClient.collectionExistsAsync(COLLECTION)).thenReturn(neverCompletes);
        QdrantVectorIndex impatientIndex =
                new QdrantVectorIndex(qdrantClient, Duration.ofMillis(50), RetryPolicy.none());

        VectorIndexException thrown =
                assertThrows(VectorIndexException.class, () -> impatientIndex.collectionExists(COLLECTION));

        assertTrue(thrown.getCause() instanceof TimeoutException);
        assertTrue(neverCompletes.isCancelled());
    }

    @Test
    void retriesTransientFailures() {
        AtomicInteger attempts = new AtomicInteger();
        doAnswer(invocation -> {
                    if (attempts.incrementAndGet() == 1) {
                        return Futures.immediateFailedFuture(
                                Status.UNAVAILABLE.withDescription("connection refused").asRuntimeException());
                    }
                    return Futures.immediateFuture(UpdateResult.getDefaultInstance());
                })
                .when(qdrantClient)
                .upsertAsync(any(UpsertPoints.class));
        QdrantVectorIndex retryingIndex =
                new QdrantVectorIndex(qdrantClient, Duration.ofSeconds(5), new RetryPolicy(3, Duration.ZERO));

        retryingIndex.upsert(COLLECTION, points(1), 32);

        assertEquals(2, attempts.get());
    }

    @Test
    void failedCallsSurfaceAsVectorIndexException() {
        when(qdrantClient.listCollectionsAsync())
                .thenReturn(Futures.immediateFailedFuture(new IllegalStateException("boom")));

        VectorIndexException thrown = assertThrows(VectorIndexException.class, () -> vectorIndex.listCollections());

        assertTrue(thrown.getMessage().contains("boom"));
    }

    private static List<IndexedPoint> points(int count) {
        List<IndexedPoint> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ContentHash hash = hash(i);
            StoredObjectKey key = StoredObjectKey.of(hash, "img-" + i + ".png");
            SearchPayload payload = new SearchPayload("img-" + i + ".png", hash.hex(), "http://blobs.test/" + key);
            points.add(IndexedPoint.forContent(hash, new float[] {i, 1f, 0f}, payload, key));
        }
        return points;
    }

    private static ContentHash hash(int seed) {
        byte[] digest = new byte[32];
        digest[0] = (byte) (seed >> 8);
        digest[31] = (byte) seed;
        return new ContentHash(HexFormat.of().formatHex(digest));
    }
}
