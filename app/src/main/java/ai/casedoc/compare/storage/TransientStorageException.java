package ai.casedoc.compare.storage;

public class TransientStorageException extends ObjectStoreException {

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
