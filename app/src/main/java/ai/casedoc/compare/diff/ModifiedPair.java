package ai.casedoc.compare.diff;

import java.util.Objects;

/**
 * A removed line and the added line that replaced it at the same position of a change hunk.
 */
public record ModifiedPair(String oldLine, String newLine) {

    public ModifiedPair {
        Objects.requireNonNull(oldLine, "oldLine");
        Objects.requireNonNull(newLine, "newLine");
    }
}
