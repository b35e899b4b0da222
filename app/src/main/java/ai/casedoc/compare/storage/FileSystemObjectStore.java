package ai.casedoc.compare.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Object store backed by a directory tree: the key {@code 3424/Output/report.pdf} maps to
 * {@code <root>/3424/Output/report.pdf}.
 */
public class FileSystemObjectStore implements ObjectStore {

    private final Path root;

    public FileSystemObjectStore(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    @Override
    public List<StoredObject> listObjects(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        if (!Files.isDirectory(root)) {
            throw new TransientStorageException("Storage root " + root + " is not available", null);
        }
        Path start = namespaceOf(prefix);
        if (!Files.isDirectory(start)) {
            throw new ObjectNotFoundException(prefix);
        }
        List<StoredObject> objects = new ArrayList<>();
        try (Stream<Path> paths = Files.walk(start)) {
            paths.filter(Files::isRegularFile)
                    .map(this::describe)
                    .filter(object -> object.key().startsWith(prefix))
                    .forEach(objects::add);
        } catch (IOException | UncheckedIOException ex) {
            throw new TransientStorageException("Failed to list objects under " + prefix, ex);
        }
        objects.sort(Comparator.comparing(StoredObject::key));
        return objects;
    }

    @Override
    public byte[] getObject(String key) {
        Path path = resolve(key);
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException ex) {
            throw new ObjectNotFoundException(key);
        } catch (IOException ex) {
            throw new TransientStorageException("Failed to read object " + key, ex);
        }
    }

    private Path namespaceOf(String prefix) {
        int idx = prefix.lastIndexOf('/');
        return idx < 0 ? root : resolve(prefix.substring(0, idx));
    }

    private Path resolve(String key) {
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("Key escapes storage root: " + key);
        }
        return path;
    }

    private StoredObject describe(Path path) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            String key = root.relativize(path).toString().replace('\\', '/');
            return new StoredObject(key, attributes.size(), attributes.lastModifiedTime().toInstant());
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
