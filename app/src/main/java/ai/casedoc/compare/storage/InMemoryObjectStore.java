package ai.casedoc.compare.storage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed store for demos and tests. Individual keys can be primed to fail transiently a number
 * of times, and the whole store can be marked unavailable.
 */
public class InMemoryObjectStore implements ObjectStore {

    private final ConcurrentSkipListMap<String, Entry> objects = new ConcurrentSkipListMap<>();
    private final Map<String, AtomicInteger> pendingFailures = new ConcurrentHashMap<>();
    private final AtomicLong reads = new AtomicLong();
    private volatile boolean available = true;

    public InMemoryObjectStore put(String key, byte[] content, Instant lastModified) {
        objects.put(key, new Entry(content.clone(), lastModified));
        return this;
    }

    public InMemoryObjectStore failTransiently(String key, int times) {
        pendingFailures.put(key, new AtomicInteger(times));
        return this;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public long readCount() {
        return reads.get();
    }

    @Override
    public List<StoredObject> listObjects(String prefix) {
        ensureAvailable();
        List<StoredObject> listed = new ArrayList<>();
        for (Map.Entry<String, Entry> entry : objects.tailMap(prefix, true).entrySet()) {
            if (!entry.getKey().startsWith(prefix)) {
                break;
            }
            listed.add(new StoredObject(entry.getKey(), entry.getValue().content().length, entry.getValue().lastModified()));
        }
        if (listed.isEmpty() && !namespaceExists(prefix)) {
            throw new ObjectNotFoundException(prefix);
        }
        return listed;
    }

    @Override
    public byte[] getObject(String key) {
        ensureAvailable();
        reads.incrementAndGet();
        AtomicInteger failures = pendingFailures.get(key);
        if (failures != null && failures.getAndDecrement() > 0) {
            throw new TransientStorageException("Simulated transient failure reading " + key, null);
        }
        Entry entry = objects.get(key);
        if (entry == null) {
            throw new ObjectNotFoundException(key);
        }
        return entry.content().clone();
    }

    private boolean namespaceExists(String prefix) {
        int idx = prefix.indexOf('/');
        if (idx < 0) {
            return !objects.isEmpty();
        }
        String namespace = prefix.substring(0, idx + 1);
        String next = objects.ceilingKey(namespace);
        return next != null && next.startsWith(namespace);
    }

    private void ensureAvailable() {
        if (!available) {
            throw new TransientStorageException("Object store is unavailable", null);
        }
    }

    private record Entry(byte[] content, Instant lastModified) {
    }
}
