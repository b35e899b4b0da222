package ai.casedoc.compare.diff;

import java.util.Locale;

/**
 * Change status of a section between an older and a newer document.
 */
public enum SectionStatus {
    ADDED,
    REMOVED,
    MODIFIED,
    UNCHANGED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
