package ai.casedoc.compare.diff;

import java.util.List;
import java.util.Objects;

/**
 * Comparison of one section. {@code changes} is the full edit script in document order; the three line
 * collections partition its non-unchanged steps.
 */
public record SectionDiff(
        String sectionName,
        SectionStatus status,
        List<String> addedLines,
        List<String> removedLines,
        List<ModifiedPair> modifiedPairs,
        List<LineChange> changes
) {

    public SectionDiff {
        Objects.requireNonNull(sectionName, "sectionName");
        Objects.requireNonNull(status, "status");
        addedLines = List.copyOf(addedLines);
        removedLines = List.copyOf(removedLines);
        modifiedPairs = List.copyOf(modifiedPairs);
        changes = List.copyOf(changes);
    }

    public boolean hasChanges() {
        return status != SectionStatus.UNCHANGED;
    }
}
