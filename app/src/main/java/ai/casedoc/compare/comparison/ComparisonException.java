package ai.casedoc.compare.comparison;

import java.util.List;

/**
 * Base failure of a comparison call. Carries the per-version failures gathered before the call gave up.
 */
public class ComparisonException extends RuntimeException {

    private final List<VersionFailure> failures;

    public ComparisonException(String message, List<VersionFailure> failures, Throwable cause) {
        super(message, cause);
        this.failures = List.copyOf(failures == null ? List.of() : failures);
    }

    public List<VersionFailure> failures() {
        return failures;
    }
}
