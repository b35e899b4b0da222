package ai.casedoc.compare.storage;

import java.time.Instant;
import java.util.Objects;

/**
 * Listing entry for one object in the store.
 */
public record StoredObject(String key, long size, Instant lastModified) {

    public StoredObject {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(lastModified, "lastModified");
        if (size < 0) {
            throw new IllegalArgumentException("size must be zero or greater");
        }
    }

    /** Last {@code /}-separated segment of the key. */
    public String fileName() {
        int idx = key.lastIndexOf('/');
        return idx < 0 ? key : key.substring(idx + 1);
    }
}
