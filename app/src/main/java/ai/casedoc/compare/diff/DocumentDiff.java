package ai.casedoc.compare.diff;

import java.util.List;
import java.util.Objects;

/**
 * Section diffs of two documents, ordered left-document sections first, then right-only sections.
 */
public record DocumentDiff(List<SectionDiff> sections, DiffSummary summary) {

    public DocumentDiff {
        sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
        Objects.requireNonNull(summary, "summary");
    }

    public static DocumentDiff of(List<SectionDiff> sections) {
        return new DocumentDiff(sections, DiffSummary.of(sections));
    }
}
