package ai.casedoc.compare.catalog;

import java.util.Objects;

/**
 * Raised when the catalog of a case cannot be produced at all.
 */
public class CatalogException extends RuntimeException {

    public enum Reason {
        INVALID_CASE_ID,
        CASE_NOT_FOUND,
        STORAGE_UNAVAILABLE
    }

    private final Reason reason;
    private final String caseId;

    public CatalogException(Reason reason, String caseId, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.caseId = caseId;
    }

    public Reason reason() {
        return reason;
    }

    public String caseId() {
        return caseId;
    }
}
