package com.williamcallahan.imagesearch.domain.query;

import com.williamcallahan.imagesearch.domain.ingestion.IngestionFailure;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a query run across all tag groups.
 *
 * @param status "success" when every group and item succeeded, otherwise "partial-success"
 * @param outputDir root directory holding one subdirectory per tag
 * @param groups per-group outcomes of the groups that reached the search step
 * @param groupFailures groups that failed before producing results
 */
public record QueryRunOutcome(
        String status, String outputDir, List<QueryGroupOutcome> groups, List<IngestionFailure> groupFailures) {
    private static final String STATUS_SUCCESS = "success";
    private static final String STATUS_PARTIAL_SUCCESS = "partial-success";

    public QueryRunOutcome {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(outputDir, "Output directory is required");
        groups = groups == null ? List.of() : List.copyOf(groups);
        groupFailures = groupFailures == null ? List.of() : List.copyOf(groupFailures);
    }

    public static QueryRunOutcome of(
            String outputDir, List<QueryGroupOutcome> groups, List<IngestionFailure> groupFailures) {
        boolean itemFailures = groups != null && groups.stream().anyMatch(group -> !group.failures().isEmpty());
        boolean hasFailures = itemFailures || (groupFailures != null && !groupFailures.isEmpty());
        return new QueryRunOutcome(
                hasFailures ? STATUS_PARTIAL_SUCCESS : STATUS_SUCCESS, outputDir, groups, groupFailures);
    }

    /**
     * Returns every failure of the run, group-level ones first.
     */
    public List<IngestionFailure> allFailures() {
        List<IngestionFailure> all = new ArrayList<>(groupFailures);
        groups.forEach(group -> all.addAll(group.failures()));
        return List.copyOf(all);
    }
}
