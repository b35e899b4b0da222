package ai.casedoc.compare.comparison;

import java.util.Locale;

/**
 * How version pairs are chosen for a comparison.
 */
public enum ComparisonMode {
    /** Caller-chosen versions; only the first and the last of the given order are compared. */
    SELECTIVE,
    /** Every catalog version, compared with its chronological successor. */
    SEQUENTIAL;

    public static ComparisonMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Comparison mode must be provided");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("ALL")) {
            return SEQUENTIAL;
        }
        for (ComparisonMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported comparison mode: " + raw);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
