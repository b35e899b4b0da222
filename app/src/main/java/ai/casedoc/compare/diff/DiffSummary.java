package ai.casedoc.compare.diff;

import java.util.Collection;

/**
 * Section counts by status.
 */
public record DiffSummary(int total, int added, int removed, int modified, int unchanged) {

    public static final DiffSummary EMPTY = new DiffSummary(0, 0, 0, 0, 0);

    public DiffSummary {
        if (total != added + removed + modified + unchanged) {
            throw new IllegalArgumentException("total must equal the sum of the status counts");
        }
    }

    public static DiffSummary of(Collection<SectionDiff> sections) {
        int added = 0;
        int removed = 0;
        int modified = 0;
        int unchanged = 0;
        for (SectionDiff section : sections) {
            switch (section.status()) {
                case ADDED -> added++;
                case REMOVED -> removed++;
                case MODIFIED -> modified++;
                case UNCHANGED -> unchanged++;
            }
        }
        return new DiffSummary(sections.size(), added, removed, modified, unchanged);
    }

    public DiffSummary plus(DiffSummary other) {
        return new DiffSummary(total + other.total, added + other.added, removed + other.removed,
                modified + other.modified, unchanged + other.unchanged);
    }

    public int changed() {
        return added + removed + modified;
    }
}
