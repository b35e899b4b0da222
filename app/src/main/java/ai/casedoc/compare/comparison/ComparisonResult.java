package ai.casedoc.compare.comparison;

import ai.casedoc.compare.catalog.VersionDescriptor;
import ai.casedoc.compare.diff.DiffSummary;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Everything one comparison call produced. The summary aggregates the compared pairs only.
 */
public record ComparisonResult(
        String caseId,
        ComparisonMode mode,
        List<VersionDescriptor> versions,
        List<VersionPairComparison> pairs,
        DiffSummary summary,
        List<VersionFailure> perVersionErrors,
        Instant generatedAt
) {

    public ComparisonResult {
        Objects.requireNonNull(caseId, "caseId");
        Objects.requireNonNull(mode, "mode");
        versions = List.copyOf(versions);
        pairs = List.copyOf(pairs);
        Objects.requireNonNull(summary, "summary");
        perVersionErrors = List.copyOf(perVersionErrors);
        Objects.requireNonNull(generatedAt, "generatedAt");
    }

    public boolean hasErrors() {
        return !perVersionErrors.isEmpty();
    }
}
