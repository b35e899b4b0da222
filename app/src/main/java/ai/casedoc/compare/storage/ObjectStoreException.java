package ai.casedoc.compare.storage;

/**
 * Base type for failures reported by an {@link ObjectStore}.
 */
public abstract class ObjectStoreException extends RuntimeException {

    protected ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
