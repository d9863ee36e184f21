package com.williamcallahan.imagesearch.service.query;

import com.williamcallahan.imagesearch.config.AppProperties;
import com.williamcallahan.imagesearch.domain.DownloadMode;
import com.williamcallahan.imagesearch.domain.SearchMatch;
import com.williamcallahan.imagesearch.domain.SearchPayload;
import com.williamcallahan.imagesearch.domain.ingestion.IngestionFailure;
import com.williamcallahan.imagesearch.pipeline.ItemProcessingException;
import com.williamcallahan.imagesearch.pipeline.StageOutcome;
import com.williamcallahan.imagesearch.pipeline.WorkerPool;
import com.williamcallahan.imagesearch.service.blob.BlobStore;
import com.williamcallahan.imagesearch.service.blob.BlobStoreException;
import com.williamcallahan.imagesearch.service.ingestion.IngestionFailureFactory;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Writes matched files under a group's output directory with a small pool of concurrent transfers.
 */
@Service
public class MatchDownloader {
    private static final Logger log = LoggerFactory.getLogger(MatchDownloader.class);

    static final String PHASE_DOWNLOAD = "download";

    private final BlobStore blobStore;
    private final RestTemplate restTemplate;
    private final IngestionFailureFactory failureFactory;
    private final AppProperties appProperties;

    public MatchDownloader(
            BlobStore blobStore,
            RestTemplate restTemplate,
            IngestionFailureFactory failureFactory,
            AppProperties appProperties) {
        this.blobStore = Objects.requireNonNull(blobStore, "blobStore");
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.failureFactory = Objects.requireNonNull(failureFactory, "failureFactory");
        this.appProperties = Objects.requireNonNull(appProperties, "appProperties");
    }

    /**
     * Fetches every match and writes it to {@code groupDir/<payload path>}.
     *
     * @param matches recommend results of one group
     * @param groupDir output directory of the group
     * @return written files and per-match failures
     */
    public DownloadResult download(List<SearchMatch> matches, Path groupDir) {
        Objects.requireNonNull(matches, "matches");
        Path root = groupDir.toAbsolutePath().normalize();
        if (matches.isEmpty()) {
            return new DownloadResult(List.of(), List.of());
        }
        DownloadMode mode = appProperties.getQuery().getDownloadMode();
        int concurrency = Math.min(appProperties.getQuery().getDownloadConcurrency(), matches.size());

        List<Path> written = new ArrayList<>(matches.size());
        List<IngestionFailure> failures = new ArrayList<>();
        try (WorkerPool<SearchMatch, Path> downloads =
                new WorkerPool<>("query-download", concurrency, match -> downloadOne(match, root, mode))) {
            downloads.feedAll(matches);
            Optional<StageOutcome<SearchMatch, Path>> next = downloads.next();
            while (next.isPresent()) {
                StageOutcome<SearchMatch, Path> outcome = next.get();
                if (outcome.isSuccess()) {
                    written.add(outcome.output());
                } else {
                    IngestionFailure failure = failureFactory.failure(
                            outcome.input().payload().path(), outcome.failure(), PHASE_DOWNLOAD);
                    log.warn("[QUERY] Failed to download {}: {}", failure.filePath(), failure.details());
                    failures.add(failure);
                }
                next = downloads.next();
            }
        }
        return new DownloadResult(written, failures);
    }

    Path downloadOne(SearchMatch match, Path root, DownloadMode mode) throws ItemProcessingException {
        SearchPayload payload = match.payload();
        Path destination = resolveDestination(root, payload.path());
        byte[] bytes = fetch(payload, mode);
        try {
            Path parent = destination.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(destination, bytes);
        } catch (IOException writeFailure) {
            throw new ItemProcessingException("write", writeFailure);
        }
        log.debug("[QUERY] Wrote {} (score={})", destination, match.score());
        return destination;
    }

    /**
     * Resolves the payload path under the group directory, rejecting paths that leave it.
     */
    static Path resolveDestination(Path root, String payloadPath) throws ItemProcessingException {
        Path destination;
        try {
            destination = root.resolve(payloadPath).normalize();
        } catch (RuntimeException invalidPath) {
            throw new ItemProcessingException(PHASE_DOWNLOAD, invalidPath);
        }
        if (!destination.startsWith(root) || destination.equals(root)) {
            throw new ItemProcessingException(
                    PHASE_DOWNLOAD, "Payload path escapes the output directory: " + payloadPath);
        }
        return destination;
    }

    private byte[] fetch(SearchPayload payload, DownloadMode mode) throws ItemProcessingException {
        try {
            if (mode == DownloadMode.HTTP) {
                byte[] body = restTemplate.getForObject(URI.create(payload.url()), byte[].class);
                if (body == null) {
                    throw new ItemProcessingException(PHASE_DOWNLOAD, "Empty response body from " + payload.url());
                }
                return body;
            }
            return blobStore.get(payload.storedObjectKey());
        } catch (RestClientException | BlobStoreException | IllegalArgumentException fetchFailure) {
            throw new ItemProcessingException(PHASE_DOWNLOAD, fetchFailure);
        }
    }
}
