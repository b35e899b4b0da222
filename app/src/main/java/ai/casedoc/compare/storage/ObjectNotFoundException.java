package ai.casedoc.compare.storage;

public class ObjectNotFoundException extends ObjectStoreException {

    public ObjectNotFoundException(String key) {
        super("No object found for key " + key, null);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
