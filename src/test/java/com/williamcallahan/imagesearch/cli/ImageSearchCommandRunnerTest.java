package com.williamcallahan.imagesearch.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.imagesearch.config.AppProperties;
import com.williamcallahan.imagesearch.domain.CollectionSpec;
import com.williamcallahan.imagesearch.domain.ContentHash;
import com.williamcallahan.imagesearch.domain.StoredObjectKey;
import com.williamcallahan.imagesearch.domain.ingestion.IngestionFailure;
import com.williamcallahan.imagesearch.domain.ingestion.IngestionRunOutcome;
import com.williamcallahan.imagesearch.domain.query.QueryGroupOutcome;
import com.williamcallahan.imagesearch.domain.query.QueryRunOutcome;
import com.williamcallahan.imagesearch.service.ingestion.IngestPipeline;
import com.williamcallahan.imagesearch.service.query.QueryPipeline;
import com.williamcallahan.imagesearch.service.vector.InMemoryVectorIndex;
import com.williamcallahan.imagesearch.testing.InMemoryBlobStore;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies command dispatch and the summaries printed for each sub-command.
 */
class ImageSearchCommandRunnerTest {

    private IngestPipeline ingestPipeline;
    private QueryPipeline queryPipeline;
    private InMemoryVectorIndex vectorIndex;
    private InMemoryBlobStore blobStore;
    private ByteArrayOutputStream printed;
    private ImageSearchCommandRunner runner;

    @BeforeEach
    void setUp() {
        ingestPipeline = mock(IngestPipeline.class);
        queryPipeline = mock(QueryPipeline.class);
        vectorIndex = new InMemoryVectorIndex();
        blobStore = new InMemoryBlobStore();
        printed = new ByteArrayOutputStream();
        runner = new ImageSearchCommandRunner(
                ingestPipeline,
                queryPipeline,
                vectorIndex,
                blobStore,
                new AppProperties(),
                new PrintStream(printed, true, StandardCharsets.UTF_8));
    }

    @Test
    void ingestPrintsCountsAndFailures() throws IOException {
        IngestionFailure failure = new IngestionFailure("/data/bad.png", "decode", "ImageDecodeException");
        when(ingestPipeline.ingest(Path.of("/data")))
                .thenReturn(IngestionRunOutcome.of("/data", 3, 1, 1, List.of(failure)));

        runner.run(List.of("ingest", "/data"));

        String output = output();
        assertTrue(output.contains("partial-success: discovered=3 indexed=1 skipped=1 failed=1"));
        assertTrue(output.contains("failed /data/bad.png [decode]"));
    }

    @Test
    void queryWithoutOutputUsesTheDefault() throws IOException {
        QueryGroupOutcome group = new QueryGroupOutcome("cats", 2, 2, 5, 5, List.of());
        when(queryPipeline.query(Path.of("/probes"), null))
                .thenReturn(QueryRunOutcome.of("/output", List.of(group), List.of()));

        runner.run(List.of("query", "/probes"));

        verify(queryPipeline).query(eq(Path.of("/probes")), isNull());
        assertTrue(output().contains("cats: probes=2 queryVectors=2 matched=5 downloaded=5"));
    }

    @Test
    void collectionsListAndInfo() throws IOException {
        vectorIndex.createCollection(new CollectionSpec("images", 3, true, true));

        runner.run(List.of("collections", "list"));
        runner.run(List.of("collections", "info"));

        String output = output();
        assertTrue(output.contains("images"));
        assertTrue(output.contains("images: vectorSize=3 points=0 status=Green"));
    }

    @Test
    void collectionsDeleteRemovesTheCollection() throws IOException {
        vectorIndex.createCollection(new CollectionSpec("old", 3, true, true));

        runner.run(List.of("collections", "delete", "old"));

        assertFalse(vectorIndex.collectionExists("old"));
    }

    @Test
    void blobsListFiltersByPrefix() throws IOException {
        ContentHash first = new ContentHash("a".repeat(64));
        ContentHash second = new ContentHash("b".repeat(64));
        blobStore.preload(StoredObjectKey.of(first, "x.png"), new byte[] {1});
        blobStore.preload(StoredObjectKey.of(second, "y.png"), new byte[] {2});

        runner.run(List.of("blobs", "list", "aaa"));

        String output = output();
        assertTrue(output.contains(first.hex() + ".png"));
        assertFalse(output.contains(second.hex()));
    }

    @Test
    void rejectsUnknownCommands() {
        IllegalArgumentException thrown =
                assertThrows(IllegalArgumentException.class, () -> runner.run(List.of("reindex")));

        assertTrue(thrown.getMessage().contains("Usage:"));
    }

    @Test
    void rejectsMissingOperands() {
        assertThrows(IllegalArgumentException.class, () -> runner.run(List.of()));
        assertThrows(IllegalArgumentException.class, () -> runner.run(List.of("ingest")));
        assertThrows(IllegalArgumentException.class, () -> runner.run(List.of("collections", "delete")));
    }

    @Test
    void usageListsEveryCommand() {
        assertEquals(5, ImageSearchCommandRunner.USAGE.split(System.lineSeparator()).length);
    }

    private String output() {
        return printed.toString(StandardCharsets.UTF_8);
    }
}
