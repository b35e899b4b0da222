package ai.casedoc.compare.diff;

public enum LineChangeKind {
    ADDED,
    REMOVED,
    UNCHANGED
}
