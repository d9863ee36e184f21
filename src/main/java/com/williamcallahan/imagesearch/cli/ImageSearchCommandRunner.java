package com.williamcallahan.imagesearch.cli;

import com.williamcallahan.imagesearch.config.AppProperties;
import com.williamcallahan.imagesearch.domain.CollectionSummary;
import com.williamcallahan.imagesearch.domain.ingestion.IngestionFailure;
import com.williamcallahan.imagesearch.domain.ingestion.IngestionRunOutcome;
import com.williamcallahan.imagesearch.domain.query.QueryGroupOutcome;
import com.williamcallahan.imagesearch.domain.query.QueryRunOutcome;
import com.williamcallahan.imagesearch.service.blob.BlobStore;
import com.williamcallahan.imagesearch.service.ingestion.IngestPipeline;
import com.williamcallahan.imagesearch.service.query.QueryPipeline;
import com.williamcallahan.imagesearch.service.vector.VectorIndex;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Dispatches the first non-option argument to a sub-command.
 *
 * <p>Options are ordinary Spring Boot properties, for example {@code --app.query.limit=10}.
 * Usage errors throw {@link IllegalArgumentException} so the process exits non-zero; per-item
 * failures are reported but never change the exit status.</p>
 */
@Component
public class ImageSearchCommandRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ImageSearchCommandRunner.class);

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  ingest <input-dir>",
            "  query <input> [output-dir]",
            "  collections list | info [name] | delete <name>",
            "  blobs list [prefix]");

    private final IngestPipeline ingestPipeline;
    private final QueryPipeline queryPipeline;
    private final VectorIndex vectorIndex;
    private final BlobStore blobStore;
    private final AppProperties appProperties;
    private final PrintStream out;

    @Autowired
    public ImageSearchCommandRunner(
            IngestPipeline ingestPipeline,
            QueryPipeline queryPipeline,
            VectorIndex vectorIndex,
            BlobStore blobStore,
            AppProperties appProperties) {
        this(ingestPipeline, queryPipeline, vectorIndex, blobStore, appProperties, System.out);
    }

    ImageSearchCommandRunner(
            IngestPipeline ingestPipeline,
            QueryPipeline queryPipeline,
            VectorIndex vectorIndex,
            BlobStore blobStore,
            AppProperties appProperties,
            PrintStream out) {
        this.ingestPipeline = Objects.requireNonNull(ingestPipeline, "ingestPipeline");
        this.queryPipeline = Objects.requireNonNull(queryPipeline, "queryPipeline");
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
        this.blobStore = Objects.requireNonNull(blobStore, "blobStore");
        this.appProperties = Objects.requireNonNull(appProperties, "appProperties");
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        run(args.getNonOptionArgs());
    }

    void run(List<String> arguments) throws IOException {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("No command given." + System.lineSeparator() + USAGE);
        }
        String command = arguments.get(0);
        List<String> operands = arguments.subList(1, arguments.size());
        switch (command) {
            case "ingest" -> ingest(operands);
            case "query" -> query(operands);
            case "collections" -> collections(operands);
            case "blobs" -> blobs(operands);
            default -> throw new IllegalArgumentException("Unknown command: " + command + System.lineSeparator() + USAGE);
        }
    }

    private void ingest(List<String> operands) throws IOException {
        requireOperands(operands, 1, 1, "ingest <input-dir>");
        IngestionRunOutcome outcome = ingestPipeline.ingest(Path.of(operands.get(0)));
        out.printf("%s: discovered=%d indexed=%d skipped=%d failed=%d%n",
                outcome.status(), outcome.discovered(), outcome.indexed(), outcome.skipped(), outcome.failures().size());
        printFailures(outcome.failures());
    }

    private void query(List<String> operands) throws IOException {
        requireOperands(operands, 1, 2, "query <input> [output-dir]");
        Path output = operands.size() > 1 ? Path.of(operands.get(1)) : null;
        QueryRunOutcome outcome = queryPipeline.query(Path.of(operands.get(0)), output);
        out.printf("%s: output=%s%n", outcome.status(), outcome.outputDir());
        for (QueryGroupOutcome group : outcome.groups()) {
            out.printf("  %s: probes=%d queryVectors=%d matched=%d downloaded=%d%n",
                    group.tag(), group.probeCount(), group.queryVectorCount(), group.matched(), group.downloaded());
        }
        printFailures(outcome.allFailures());
    }

    private void collections(List<String> operands) {
        requireOperands(operands, 1, 2, "collections list | info [name] | delete <name>");
        String action = operands.get(0);
        switch (action) {
            case "list" -> {
                requireOperands(operands, 1, 1, "collections list");
                vectorIndex.listCollections().forEach(out::println);
            }
            case "info" -> {
                String name = operands.size() > 1 ? operands.get(1) : appProperties.getQdrant().getCollection();
                CollectionSummary summary = vectorIndex.describeCollection(name);
                out.printf("%s: vectorSize=%d points=%d status=%s%n",
                        summary.name(), summary.vectorSize(), summary.pointsCount(), summary.status());
            }
            case "delete" -> {
                requireOperands(operands, 2, 2, "collections delete <name>");
                vectorIndex.deleteCollection(operands.get(1));
                log.info("Deleted collection {}", operands.get(1));
                out.println("deleted " + operands.get(1));
            }
            default -> throw new IllegalArgumentException("Unknown collections action: " + action);
        }
    }

    private void blobs(List<String> operands) {
        requireOperands(operands, 1, 2, "blobs list [prefix]");
        if (!"list".equals(operands.get(0))) {
            throw new IllegalArgumentException("Unknown blobs action: " + operands.get(0));
        }
        String prefix = operands.size() > 1 ? operands.get(1) : null;
        blobStore.list(prefix).forEach(out::println);
    }

    private void printFailures(List<IngestionFailure> failures) {
        for (IngestionFailure failure : failures) {
            out.printf("  failed %s [%s]: %s%n", failure.filePath(), failure.phase(), failure.details());
        }
    }

    private static void requireOperands(List<String> operands, int min, int max, String usage) {
        if (operands.size() < min || operands.size() > max) {
            throw new IllegalArgumentException("Usage: " + usage);
        }
    }
}
