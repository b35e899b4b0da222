package ai.casedoc.compare.comparison;

import java.time.Duration;
import java.util.List;

public class ComparisonTimeoutException extends ComparisonException {

    public ComparisonTimeoutException(String caseId, Duration timeout, Throwable cause) {
        super("Comparison of case " + caseId + " did not finish within " + timeout, List.of(), cause);
    }
}
