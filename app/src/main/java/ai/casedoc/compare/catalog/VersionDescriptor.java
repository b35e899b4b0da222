package ai.casedoc.compare.catalog;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One stored rendition of a case document.
 *
 * @param id        storage key, unique within the case
 * @param caseId    owning case
 * @param timestamp version instant parsed from the key, or the object's last-modified time (UTC)
 * @param size      object size in bytes
 * @param fileName  last segment of the key
 * @param kind      report or ground truth
 */
public record VersionDescriptor(String id, String caseId, LocalDateTime timestamp, long size, String fileName,
                                VersionKind kind) {

    public VersionDescriptor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(caseId, "caseId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(kind, "kind");
    }
}
