package ai.casedoc.compare.comparison;

import java.util.Objects;

/**
 * Why a version could not take part in a comparison.
 */
public record VersionFailure(String versionId, FailureStage stage, String message) {

    public VersionFailure {
        Objects.requireNonNull(versionId, "versionId");
        Objects.requireNonNull(stage, "stage");
        message = message == null ? "" : message;
    }
}
