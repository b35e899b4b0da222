package ai.casedoc.compare.comparison;

import java.util.List;

/**
 * Fewer than two usable versions remained after dropping failed ones.
 */
public class InsufficientVersionsException extends ComparisonException {

    private final int usableVersions;

    public InsufficientVersionsException(String caseId, int usableVersions, List<VersionFailure> failures) {
        super("Need at least 2 usable versions to compare case " + caseId + " but found " + usableVersions,
                failures, null);
        this.usableVersions = usableVersions;
    }

    public int usableVersions() {
        return usableVersions;
    }
}
