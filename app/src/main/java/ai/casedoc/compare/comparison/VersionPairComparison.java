package ai.casedoc.compare.comparison;

import ai.casedoc.compare.catalog.VersionDescriptor;
import ai.casedoc.compare.diff.DiffSummary;
import ai.casedoc.compare.diff.DocumentDiff;
import ai.casedoc.compare.diff.SectionDiff;
import java.util.List;
import java.util.Objects;

/**
 * Result for one (older, newer) pair.
 */
public record VersionPairComparison(
        VersionDescriptor older,
        VersionDescriptor newer,
        PairStatus status,
        List<SectionDiff> sectionDiffs,
        DiffSummary summary,
        List<VersionFailure> failures
) {

    public VersionPairComparison {
        Objects.requireNonNull(older, "older");
        Objects.requireNonNull(newer, "newer");
        Objects.requireNonNull(status, "status");
        sectionDiffs = List.copyOf(sectionDiffs);
        Objects.requireNonNull(summary, "summary");
        failures = List.copyOf(failures);
        if (status == PairStatus.NOT_COMPARABLE && (!sectionDiffs.isEmpty() || failures.isEmpty())) {
            throw new IllegalArgumentException("A pair that is not comparable carries failures and no section diffs");
        }
    }

    public static VersionPairComparison compared(VersionDescriptor older, VersionDescriptor newer, DocumentDiff diff) {
        return new VersionPairComparison(older, newer, PairStatus.COMPARED, diff.sections(), diff.summary(), List.of());
    }

    public static VersionPairComparison notComparable(VersionDescriptor older, VersionDescriptor newer,
                                                      List<VersionFailure> failures) {
        return new VersionPairComparison(older, newer, PairStatus.NOT_COMPARABLE, List.of(), DiffSummary.EMPTY, failures);
    }

    public boolean isComparable() {
        return status == PairStatus.COMPARED;
    }
}
