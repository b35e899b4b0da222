package ai.casedoc.compare.comparison;

public enum PairStatus {
    /** Both sides were extracted and diffed. */
    COMPARED,
    /** At least one side failed to fetch or extract; no section diffs exist. */
    NOT_COMPARABLE
}
