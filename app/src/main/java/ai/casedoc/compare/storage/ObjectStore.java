package ai.casedoc.compare.storage;

import java.util.List;

/**
 * Minimal object-store contract the comparison engine depends on. Keys are {@code /}-separated.
 */
public interface ObjectStore {

    /**
     * Lists every object whose key starts with {@code prefix}.
     *
     * @throws ObjectNotFoundException   if the namespace denoted by the prefix does not exist
     * @throws TransientStorageException if the backend cannot be reached
     */
    List<StoredObject> listObjects(String prefix);

    /**
     * Reads the full content of one object.
     *
     * @throws ObjectNotFoundException   if no object has this key
     * @throws TransientStorageException if the read failed in a way that may succeed on retry
     */
    byte[] getObject(String key);
}
