package com.williamcallahan.imagesearch.service.ingestion;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.williamcallahan.imagesearch.config.AppProperties;
import com.williamcallahan.imagesearch.domain.ContentHash;
import com.williamcallahan.imagesearch.domain.DedupPolicy;
import com.williamcallahan.imagesearch.domain.IndexedPoint;
import com.williamcallahan.imagesearch.domain.SearchPayload;
import com.williamcallahan.imagesearch.domain.StoredObjectKey;
import com.williamcallahan.imagesearch.domain.ingestion.IngestionFailure;
import com.williamcallahan.imagesearch.domain.ingestion.IngestionRunOutcome;
import com.williamcallahan.imagesearch.pipeline.ItemProcessingException;
import com.williamcallahan.imagesearch.pipeline.StageOutcome;
import com.williamcallahan.imagesearch.pipeline.WorkerPool;
import com.williamcallahan.imagesearch.service.ContentHasher;
import com.williamcallahan.imagesearch.service.ImageDecoder;
import com.williamcallahan.imagesearch.service.ImageDiscovery;
import com.williamcallahan.imagesearch.service.blob.BlobStore;
import com.williamcallahan.imagesearch.service.embedding.EmbeddingBatchEmbedder;
import com.williamcallahan.imagesearch.service.embedding.ImageEmbeddingService;
import com.williamcallahan.imagesearch.service.vector.VectorIndex;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ingests a directory tree of images: hash and dedup-check, batch-embed, then upload and index.
 *
 * <p>Each phase runs in its own bounded {@link WorkerPool}. Connector threads drain one stage in
 * completion order and feed the next, so a slow stage throttles the ones before it. Per-item
 * failures are recorded and never abort sibling items or the run.</p>
 */
@Service
public class IngestPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestPipeline.class);

    static final String PHASE_HASH = "hash";
    static final String PHASE_DEDUP_CHECK = "dedup-check";
    static final String PHASE_DECODE = "decode";
    static final String PHASE_EMBED = "embed";
    static final String PHASE_UPLOAD = "upload";
    static final String PHASE_INDEX = "index";

    private final ContentHasher contentHasher;
    private final ImageDiscovery imageDiscovery;
    private final ImageEmbeddingService embeddingService;
    private final BlobStore blobStore;
    private final VectorIndex vectorIndex;
    private final CollectionBootstrapper collectionBootstrapper;
    private final IngestionFailureFactory failureFactory;
    private final AppProperties appProperties;

    public IngestPipeline(
            ContentHasher contentHasher,
            ImageDiscovery imageDiscovery,
            ImageEmbeddingService embeddingService,
            BlobStore blobStore,
            VectorIndex vectorIndex,
            CollectionBootstrapper collectionBootstrapper,
            IngestionFailureFactory failureFactory,
            AppProperties appProperties) {
        this.contentHasher = Objects.requireNonNull(contentHasher, "contentHasher");
        this.imageDiscovery = Objects.requireNonNull(imageDiscovery, "imageDiscovery");
        this.embeddingService = Objects.requireNonNull(embeddingService, "embeddingService");
        this.blobStore = Objects.requireNonNull(blobStore, "blobStore");
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
        this.collectionBootstrapper = Objects.requireNonNull(collectionBootstrapper, "collectionBootstrapper");
        this.failureFactory = Objects.requireNonNull(failureFactory, "failureFactory");
        this.appProperties = Objects.requireNonNull(appProperties, "appProperties");
    }

    /**
     * Ensures every image under the root is stored and indexed exactly once.
     *
     * @param root directory to ingest
     * @return counts and per-item failures of the run
     * @throws IOException if directory walking fails
     */
    public IngestionRunOutcome ingest(Path root) throws IOException {
        Objects.requireNonNull(root, "root");
        Path absoluteRoot = root.toAbsolutePath().normalize();
        String collection = appProperties.getQdrant().getCollection();
        collectionBootstrapper.ensureCollection(collection, embeddingService.outputSize());

        List<Path> images = imageDiscovery.findImages(absoluteRoot);
        log.info("[INGEST] Discovered {} images under {}", images.size(), absoluteRoot);
        if (images.isEmpty()) {
            return IngestionRunOutcome.of(absoluteRoot.toString(), 0, 0, 0, List.of());
        }

        AppProperties.Ingest settings = appProperties.getIngest();
        IngestionProgress progress = new IngestionProgress(images.size());
        List<IngestionFailure> failures = Collections.synchronizedList(new ArrayList<>());
        ExecutorService connectors = Executors.newFixedThreadPool(
                2, new ThreadFactoryBuilder().setNameFormat("ingest-connector-%d").setDaemon(true).build());

        try (WorkerPool<Path, HashedItem> hashStage =
                        new WorkerPool<>("ingest-hash", settings.resolveHashConcurrency(),
                                path -> hashAndCheck(collection, path));
                WorkerPool<List<HashedItem>, List<EmbeddedItem>> embedStage =
                        new WorkerPool<>("ingest-embed", settings.resolveEmbedConcurrency(), this::embed);
                WorkerPool<List<EmbeddedItem>, IndexBatchResult> indexStage =
                        new WorkerPool<>("ingest-index", settings.resolveUploadConcurrency(),
                                batch -> uploadAndIndex(collection, batch))) {

            hashStage.feedAll(images);
            Future<?> batcher = connectors.submit(
                    () -> batchForEmbedding(hashStage, embedStage, settings.getEmbedBatchSize(), progress, failures));
            Future<?> forwarder = connectors.submit(() -> forwardToIndex(embedStage, indexStage, progress, failures));

            collectIndexed(indexStage, progress, failures);
            awaitConnector(batcher, "batcher");
            awaitConnector(forwarder, "forwarder");
        } finally {
            connectors.shutdownNow();
        }

        IngestionRunOutcome outcome = IngestionRunOutcome.of(
                absoluteRoot.toString(),
                images.size(),
                progress.getIndexedCount(),
                progress.getSkippedCount(),
                List.copyOf(failures));
        log.info("[INGEST] Finished {}: discovered={}, indexed={}, skipped={}, failed={}",
                outcome.status(), outcome.discovered(), outcome.indexed(), outcome.skipped(), outcome.failures().size());
        return outcome;
    }

    HashedItem hashAndCheck(String collection, Path path) throws ItemProcessingException {
        // One read feeds the hash, the decode and the upload, so the key always matches the bytes.
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException readFailure) {
            throw new ItemProcessingException(PHASE_HASH, readFailure);
        }
        ContentHash hash = contentHasher.hash(bytes);
        StoredObjectKey key = StoredObjectKey.of(hash, path);

        boolean stored;
        try {
            stored = blobStore.exists(key);
            if (stored) {
                if (appProperties.getIngest().getDedupPolicy() == DedupPolicy.SKIP
                        || vectorIndex.pointExists(collection, hash.pointId())) {
                    return HashedItem.alreadyStored(path, hash, key);
                }
                log.info("[INGEST] Healing missing point for stored object {}", key);
            }
        } catch (RuntimeException checkFailure) {
            throw new ItemProcessingException(PHASE_DEDUP_CHECK, checkFailure);
        }

        try {
            BufferedImage image = ImageDecoder.decode(bytes, path);
            return HashedItem.toIndex(path, hash, key, image, stored ? null : bytes);
        } catch (IOException decodeFailure) {
            throw new ItemProcessingException(PHASE_DECODE, decodeFailure);
        }
    }

    List<EmbeddedItem> embed(List<HashedItem> batch) throws ItemProcessingException {
        List<float[]> vectors;
        try {
            vectors = EmbeddingBatchEmbedder.embedBatch(
                    embeddingService, batch, HashedItem::image, item -> item.path().toString(), 0);
        } catch (RuntimeException embedFailure) {
            throw new ItemProcessingException(PHASE_EMBED, embedFailure);
        }
        List<EmbeddedItem> embedded = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            embedded.add(new EmbeddedItem(batch.get(i), vectors.get(i)));
        }
        return embedded;
    }

    IndexBatchResult uploadAndIndex(String collection, List<EmbeddedItem> batch) {
        List<IngestionFailure> batchFailures = new ArrayList<>();
        List<IndexedPoint> points = new ArrayList<>(batch.size());
        List<Path> pointSources = new ArrayList<>(batch.size());

        for (EmbeddedItem embedded : batch) {
            HashedItem item = embedded.item();
            if (item.needsUpload()) {
                try {
                    blobStore.put(item.key(), item.bytes());
                } catch (RuntimeException uploadFailure) {
                    batchFailures.add(failureFactory.failure(item.path().toString(), PHASE_UPLOAD, uploadFailure));
                    continue;
                }
            }
            SearchPayload payload = new SearchPayload(
                    item.path().getFileName().toString(), item.hash().hex(), blobStore.urlFor(item.key()));
            points.add(IndexedPoint.forContent(item.hash(), embedded.vector(), payload, item.key()));
            pointSources.add(item.path());
        }

        try {
            vectorIndex.upsert(collection, points, appProperties.getQdrant().getUpsertChunkSize());
        } catch (RuntimeException upsertFailure) {
            for (Path source : pointSources) {
                batchFailures.add(failureFactory.failure(source.toString(), PHASE_INDEX, upsertFailure));
            }
            return new IndexBatchResult(0, batchFailures);
        }
        return new IndexBatchResult(points.size(), batchFailures);
    }

    private void batchForEmbedding(
            WorkerPool<Path, HashedItem> hashStage,
            WorkerPool<List<HashedItem>, List<EmbeddedItem>> embedStage,
            int batchSize,
            IngestionProgress progress,
            List<IngestionFailure> failures) {
        try {
            List<HashedItem> pending = new ArrayList<>(batchSize);
            Optional<StageOutcome<Path, HashedItem>> next = hashStage.next();
            while (next.isPresent()) {
                StageOutcome<Path, HashedItem> outcome = next.get();
                if (!outcome.isSuccess()) {
                    recordFailure(failureFactory.failure(outcome.input(), outcome.failure(), PHASE_HASH),
                            progress, failures);
                } else if (outcome.output().isAlreadyStored()) {
                    log.debug("[INGEST] Skipping already stored {}", outcome.output().key());
                    progress.markSkipped();
                } else {
                    pending.add(outcome.output());
                    if (pending.size() >= batchSize) {
                        embedStage.submit(List.copyOf(pending));
                        pending.clear();
                    }
                }
                next = hashStage.next();
            }
            if (!pending.isEmpty()) {
                embedStage.submit(List.copyOf(pending));
            }
        } finally {
            embedStage.complete();
        }
    }

    private void forwardToIndex(
            WorkerPool<List<HashedItem>, List<EmbeddedItem>> embedStage,
            WorkerPool<List<EmbeddedItem>, IndexBatchResult> indexStage,
            IngestionProgress progress,
            List<IngestionFailure> failures) {
        try {
            Optional<StageOutcome<List<HashedItem>, List<EmbeddedItem>>> next = embedStage.next();
            while (next.isPresent()) {
                StageOutcome<List<HashedItem>, List<EmbeddedItem>> outcome = next.get();
                if (outcome.isSuccess()) {
                    indexStage.submit(outcome.output());
                } else {
                    for (HashedItem item : outcome.input()) {
                        recordFailure(failureFactory.failure(item.path(), outcome.failure(), PHASE_EMBED),
                                progress, failures);
                    }
                }
                next = embedStage.next();
            }
        } finally {
            indexStage.complete();
        }
    }

    private void collectIndexed(
            WorkerPool<List<EmbeddedItem>, IndexBatchResult> indexStage,
            IngestionProgress progress,
            List<IngestionFailure> failures) {
        Optional<StageOutcome<List<EmbeddedItem>, IndexBatchResult>> next = indexStage.next();
        while (next.isPresent()) {
            StageOutcome<List<EmbeddedItem>, IndexBatchResult> outcome = next.get();
            if (outcome.isSuccess()) {
                progress.markIndexed(outcome.output().indexed());
                outcome.output().failures().forEach(failure -> recordFailure(failure, progress, failures));
            } else {
                for (EmbeddedItem item : outcome.input()) {
                    recordFailure(failureFactory.failure(item.item().path(), outcome.failure(), PHASE_INDEX),
                            progress, failures);
                }
            }
            next = indexStage.next();
        }
    }

    private static void recordFailure(
            IngestionFailure failure, IngestionProgress progress, List<IngestionFailure> failures) {
        log.warn("[INGEST] Failed {} during {}: {}", failure.filePath(), failure.phase(), failure.details());
        failures.add(failure);
        progress.markFailed();
    }

    private static void awaitConnector(Future<?> connector, String role) {
        try {
            connector.get();
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for ingest " + role, interrupted);
        } catch (ExecutionException executionException) {
            Throwable cause = executionException.getCause() == null ? executionException : executionException.getCause();
            throw new IllegalStateException("Ingest " + role + " failed: " + cause.getMessage(), cause);
        }
    }
}
