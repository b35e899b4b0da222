package ai.casedoc.compare.diff;

import java.util.Objects;

/**
 * One step of a line-level edit script.
 */
public record LineChange(LineChangeKind kind, String content) {

    public LineChange {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(content, "content");
    }

    public static LineChange added(String content) {
        return new LineChange(LineChangeKind.ADDED, content);
    }

    public static LineChange removed(String content) {
        return new LineChange(LineChangeKind.REMOVED, content);
    }

    public static LineChange unchanged(String content) {
        return new LineChange(LineChangeKind.UNCHANGED, content);
    }
}
