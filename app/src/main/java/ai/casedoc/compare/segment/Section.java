package ai.casedoc.compare.segment;

import java.util.Objects;

/**
 * Named, contiguous span of a document. {@code orderIndex} is the position in the source text.
 */
public record Section(String name, int orderIndex, String body) {

    public Section {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        if (orderIndex < 0) {
            throw new IllegalArgumentException("orderIndex must be zero or greater");
        }
    }
}
