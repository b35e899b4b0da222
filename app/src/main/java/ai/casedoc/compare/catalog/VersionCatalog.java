package ai.casedoc.compare.catalog;

import ai.casedoc.compare.storage.ObjectNotFoundException;
import ai.casedoc.compare.storage.ObjectStore;
import ai.casedoc.compare.storage.StoredObject;
import ai.casedoc.compare.storage.TransientStorageException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates the document versions stored for a case, oldest first.
 */
public class VersionCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(VersionCatalog.class);
    private static final Pattern CASE_ID = Pattern.compile("[A-Za-z0-9_-]+");
    private static final Comparator<VersionDescriptor> CHRONOLOGICAL = Comparator
            .comparing(VersionDescriptor::timestamp)
            .thenComparing(VersionDescriptor::id);

    private final ObjectStore objectStore;
    private final VersionKeyParser keyParser;

    public VersionCatalog(ObjectStore objectStore, VersionKeyParser keyParser) {
        this.objectStore = Objects.requireNonNull(objectStore, "objectStore");
        this.keyParser = Objects.requireNonNull(keyParser, "keyParser");
    }

    /**
     * Lists the versions of a case in ascending timestamp order (ties broken by key). A case whose
     * namespace exists but holds no matching objects yields an empty list.
     *
     * @throws CatalogException if the id is malformed, the case namespace does not exist, or the store
     *                          cannot be reached
     */
    public List<VersionDescriptor> listVersions(String caseId) {
        requireValidCaseId(caseId);
        List<StoredObject> objects;
        try {
            objects = objectStore.listObjects(caseId + "/");
        } catch (ObjectNotFoundException ex) {
            throw new CatalogException(CatalogException.Reason.CASE_NOT_FOUND, caseId, "Case " + caseId + " not found", ex);
        } catch (TransientStorageException ex) {
            LOGGER.error("Object store unreachable while listing case {}", caseId, ex);
            throw new CatalogException(CatalogException.Reason.STORAGE_UNAVAILABLE, caseId,
                    "Object store unreachable while listing case " + caseId, ex);
        }

        List<VersionDescriptor> versions = new ArrayList<>();
        for (StoredObject object : objects) {
            Optional<VersionDescriptor> parsed = keyParser.parse(caseId, object);
            if (parsed.isPresent()) {
                versions.add(parsed.get());
            } else {
                LOGGER.debug("Ignoring {}: not a version document", object.key());
            }
        }
        versions.sort(CHRONOLOGICAL);
        LOGGER.info("Found {} version(s) among {} object(s) for case {}", versions.size(), objects.size(), caseId);
        return List.copyOf(versions);
    }

    /**
     * Lists the case ids present in the store, in ascending order.
     */
    public List<String> listCases() {
        List<StoredObject> objects;
        try {
            objects = objectStore.listObjects("");
        } catch (ObjectNotFoundException ex) {
            return List.of();
        } catch (TransientStorageException ex) {
            throw new CatalogException(CatalogException.Reason.STORAGE_UNAVAILABLE, null,
                    "Object store unreachable while listing cases", ex);
        }
        TreeSet<String> cases = new TreeSet<>();
        for (StoredObject object : objects) {
            int idx = object.key().indexOf('/');
            if (idx > 0) {
                String candidate = object.key().substring(0, idx);
                if (CASE_ID.matcher(candidate).matches()) {
                    cases.add(candidate);
                }
            }
        }
        return List.copyOf(cases);
    }

    static void requireValidCaseId(String caseId) {
        if (caseId == null || !CASE_ID.matcher(caseId).matches()) {
            throw new CatalogException(CatalogException.Reason.INVALID_CASE_ID, caseId,
                    "Case id must be a non-empty token of letters, digits, '_' or '-': " + caseId, null);
        }
    }
}
