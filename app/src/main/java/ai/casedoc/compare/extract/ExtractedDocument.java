package ai.casedoc.compare.extract;

import java.util.Objects;

/**
 * Plain text of one version together with the strategy that produced it.
 */
public record ExtractedDocument(String versionId, String rawText, String extractionMethod) {

    public ExtractedDocument {
        Objects.requireNonNull(versionId, "versionId");
        Objects.requireNonNull(rawText, "rawText");
        Objects.requireNonNull(extractionMethod, "extractionMethod");
    }
}
