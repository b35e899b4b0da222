package ai.casedoc.compare.comparison;

import java.util.List;
import java.util.Objects;

/**
 * What to compare for one case. Sequential requests carry no version ids.
 */
public record ComparisonRequest(ComparisonMode mode, List<String> versionIds) {

    public ComparisonRequest {
        Objects.requireNonNull(mode, "mode");
        versionIds = List.copyOf(Objects.requireNonNull(versionIds, "versionIds"));
        if (mode == ComparisonMode.SEQUENTIAL && !versionIds.isEmpty()) {
            throw new IllegalArgumentException("Sequential comparison takes every catalog version; do not pass version ids");
        }
    }

    public static ComparisonRequest selective(List<String> versionIds) {
        return new ComparisonRequest(ComparisonMode.SELECTIVE, versionIds);
    }

    public static ComparisonRequest sequential() {
        return new ComparisonRequest(ComparisonMode.SEQUENTIAL, List.of());
    }
}
