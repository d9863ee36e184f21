package com.williamcallahan.imagesearch.service.query;

import com.williamcallahan.imagesearch.config.AppProperties;
import com.williamcallahan.imagesearch.domain.SearchMatch;
import com.williamcallahan.imagesearch.domain.SearchParameters;
import com.williamcallahan.imagesearch.domain.TagGroup;
import com.williamcallahan.imagesearch.domain.ingestion.IngestionFailure;
import com.williamcallahan.imagesearch.domain.query.QueryGroupOutcome;
import com.williamcallahan.imagesearch.domain.query.QueryRunOutcome;
import com.williamcallahan.imagesearch.pipeline.ItemProcessingException;
import com.williamcallahan.imagesearch.pipeline.StageOutcome;
import com.williamcallahan.imagesearch.pipeline.WorkerPool;
import com.williamcallahan.imagesearch.service.ImageDecoder;
import com.williamcallahan.imagesearch.service.ImageDiscovery;
import com.williamcallahan.imagesearch.service.embedding.EmbeddingBatchEmbedder;
import com.williamcallahan.imagesearch.service.embedding.ImageEmbeddingService;
import com.williamcallahan.imagesearch.service.ingestion.CollectionBootstrapper;
import com.williamcallahan.imagesearch.service.ingestion.IngestionFailureFactory;
import com.williamcallahan.imagesearch.service.vector.VectorIndex;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Searches the index with each tag group of probe images and downloads the matches.
 *
 * <p>Groups are processed one after another and never share results. Within a group, probes are
 * decoded concurrently, embedded in ordered batches, reduced to the recommend query's example
 * cap and searched with a single call.</p>
 */
@Service
public class QueryPipeline {
    private static final Logger log = LoggerFactory.getLogger(QueryPipeline.class);

    static final String PHASE_DECODE = "decode";
    static final String PHASE_EMBED = "embed";
    static final String PHASE_SEARCH = "search";
    static final String DEFAULT_OUTPUT_DIR = "output";

    private final ImageDiscovery imageDiscovery;
    private final ImageEmbeddingService embeddingService;
    private final VectorIndex vectorIndex;
    private final MatchDownloader matchDownloader;
    private final CollectionBootstrapper collectionBootstrapper;
    private final IngestionFailureFactory failureFactory;
    private final AppProperties appProperties;

    public QueryPipeline(
            ImageDiscovery imageDiscovery,
            ImageEmbeddingService embeddingService,
            VectorIndex vectorIndex,
            MatchDownloader matchDownloader,
            CollectionBootstrapper collectionBootstrapper,
            IngestionFailureFactory failureFactory,
            AppProperties appProperties) {
        this.imageDiscovery = Objects.requireNonNull(imageDiscovery, "imageDiscovery");
        this.embeddingService = Objects.requireNonNull(embeddingService, "embeddingService");
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
        this.matchDownloader = Objects.requireNonNull(matchDownloader, "matchDownloader");
        this.collectionBootstrapper = Objects.requireNonNull(collectionBootstrapper, "collectionBootstrapper");
        this.failureFactory = Objects.requireNonNull(failureFactory, "failureFactory");
        this.appProperties = Objects.requireNonNull(appProperties, "appProperties");
    }

    /**
     * Runs one search per tag group found in the input.
     *
     * @param input probe image or directory of probe folders
     * @param output output root, or null for the default next to the input
     * @return per-group outcomes and failures
     * @throws IOException if the input cannot be walked or the output root cannot be created
     */
    public QueryRunOutcome query(Path input, Path output) throws IOException {
        Objects.requireNonNull(input, "input");
        Path absoluteInput = input.toAbsolutePath().normalize();
        if (!Files.exists(absoluteInput)) {
            throw new IllegalArgumentException("Query input does not exist: " + input);
        }
        String collection = appProperties.getQdrant().getCollection();
        collectionBootstrapper.requireCompatibleCollection(collection, embeddingService.outputSize());

        Path outputRoot = (output == null ? defaultOutput(absoluteInput) : output).toAbsolutePath().normalize();
        Files.createDirectories(outputRoot);
        List<TagGroup> groups = imageDiscovery.tagGroups(absoluteInput);
        log.info("[QUERY] Searching {} tag groups from {} into {}", groups.size(), absoluteInput, outputRoot);

        List<QueryGroupOutcome> outcomes = new ArrayList<>(groups.size());
        List<IngestionFailure> groupFailures = new ArrayList<>();
        for (TagGroup group : groups) {
            try {
                QueryGroupOutcome outcome = searchGroup(collection, group, outputRoot.resolve(group.tag()));
                log.info("[QUERY] {}: {} probes -> {} query vectors, {} matches, {} downloaded",
                        outcome.tag(), outcome.probeCount(), outcome.queryVectorCount(),
                        outcome.matched(), outcome.downloaded());
                outcomes.add(outcome);
            } catch (ItemProcessingException groupFailure) {
                IngestionFailure failure =
                        failureFactory.failure(group.tag(), groupFailure.getPhase(), groupFailure.rootFailure());
                log.warn("[QUERY] Group {} failed during {}: {}", group.tag(), failure.phase(), failure.details());
                groupFailures.add(failure);
            }
        }

        QueryRunOutcome outcome = QueryRunOutcome.of(outputRoot.toString(), outcomes, groupFailures);
        log.info("[QUERY] Finished {}: groups={}, failed groups={}, failures={}",
                outcome.status(), outcome.groups().size(), outcome.groupFailures().size(), outcome.allFailures().size());
        return outcome;
    }

    /**
     * Returns {@code <parent>/output} for a directory input and the parent folder for a file input.
     */
    static Path defaultOutput(Path input) {
        Path parent = input.toAbsolutePath().normalize().getParent();
        if (parent == null) {
            throw new IllegalArgumentException("Cannot derive an output directory for " + input);
        }
        return Files.isDirectory(input) ? parent.resolve(DEFAULT_OUTPUT_DIR) : parent;
    }

    QueryGroupOutcome searchGroup(String collection, TagGroup group, Path groupDir) throws ItemProcessingException {
        List<IngestionFailure> failures = new ArrayList<>();
        List<DecodedProbe> probes = decodeProbes(group, failures);
        if (probes.isEmpty()) {
            throw new ItemProcessingException(PHASE_DECODE, "No decodable probe images in group " + group.tag());
        }

        AppProperties.Query settings = appProperties.getQuery();
        List<float[]> vectors;
        try {
            vectors = EmbeddingBatchEmbedder.embedAll(
                    embeddingService,
                    probes,
                    DecodedProbe::image,
                    probe -> probe.path().toString(),
                    settings.getEmbedBatchSize());
        } catch (RuntimeException embedFailure) {
            throw new ItemProcessingException(PHASE_EMBED, embedFailure);
        }

        List<float[]> queryVectors = VectorReducer.reduce(vectors, settings.getMaxPositiveVectors());
        SearchParameters parameters = new SearchParameters(
                settings.getLimit(), settings.getScoreThreshold(), settings.isExact(), settings.getHnswEf());
        List<SearchMatch> matches;
        try {
            matches = vectorIndex.recommend(collection, queryVectors, parameters);
        } catch (RuntimeException searchFailure) {
            throw new ItemProcessingException(PHASE_SEARCH, searchFailure);
        }

        DownloadResult downloads = matchDownloader.download(matches, groupDir);
        failures.addAll(downloads.failures());
        return new QueryGroupOutcome(
                group.tag(), probes.size(), queryVectors.size(), matches.size(), downloads.written().size(), failures);
    }

    private List<DecodedProbe> decodeProbes(TagGroup group, List<IngestionFailure> failures) {
        if (group.images().isEmpty()) {
            return List.of();
        }
        List<Probe> probes = new ArrayList<>(group.images().size());
        for (int i = 0; i < group.images().size(); i++) {
            probes.add(new Probe(i, group.images().get(i)));
        }
        DecodedProbe[] decoded = new DecodedProbe[probes.size()];
        int workers = Math.min(appProperties.getIngest().resolveHashConcurrency(), probes.size());

        try (WorkerPool<Probe, DecodedProbe> decodeStage = new WorkerPool<>("query-decode", workers,
                probe -> new DecodedProbe(probe.index(), probe.path(), ImageDecoder.decode(probe.path())))) {
            decodeStage.feedAll(probes);
            Optional<StageOutcome<Probe, DecodedProbe>> next = decodeStage.next();
            while (next.isPresent()) {
                StageOutcome<Probe, DecodedProbe> outcome = next.get();
                if (outcome.isSuccess()) {
                    decoded[outcome.output().index()] = outcome.output();
                } else {
                    IngestionFailure failure =
                            failureFactory.failure(outcome.input().path(), outcome.failure(), PHASE_DECODE);
                    log.warn("[QUERY] Skipping probe {}: {}", failure.filePath(), failure.details());
                    failures.add(failure);
                }
                next = decodeStage.next();
            }
        }

        List<DecodedProbe> ordered = new ArrayList<>(decoded.length);
        for (DecodedProbe probe : decoded) {
            if (probe != null) {
                ordered.add(probe);
            }
        }
        return ordered;
    }

    private record Probe(int index, Path path) {}

    private record DecodedProbe(int index, Path path, BufferedImage image) {

        @Override
        public String toString() {
            return path.toString();
        }
    }
}
