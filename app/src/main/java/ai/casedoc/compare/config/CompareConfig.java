package ai.casedoc.compare.config;

import ai.casedoc.compare.report.ReportEncoding;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record CompareConfig(
        Path storageRoot,
        List<String> documentTypes,
        CompareSettings settings,
        ReportEncoding reportEncoding,
        LogFormat logFormat
) {

    public CompareConfig {
        Objects.requireNonNull(storageRoot, "storageRoot");
        documentTypes = List.copyOf(Objects.requireNonNull(documentTypes, "documentTypes"));
        if (documentTypes.isEmpty()) {
            throw new IllegalArgumentException("documentTypes must not be empty");
        }
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(reportEncoding, "reportEncoding");
        Objects.requireNonNull(logFormat, "logFormat");
    }
}
