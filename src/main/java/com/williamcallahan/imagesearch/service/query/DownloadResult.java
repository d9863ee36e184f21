package com.williamcallahan.imagesearch.service.query;

import com.williamcallahan.imagesearch.domain.ingestion.IngestionFailure;
import java.nio.file.Path;
import java.util.List;

/**
 * Files written for one group's matches and the matches that could not be fetched.
 *
 * @param written destination files, in completion order
 * @param failures per-match failures
 */
public record DownloadResult(List<Path> written, List<IngestionFailure> failures) {

    public DownloadResult {
        written = List.copyOf(written);
        failures = List.copyOf(failures);
    }
}
