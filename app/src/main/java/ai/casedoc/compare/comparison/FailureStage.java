package ai.casedoc.compare.comparison;

public enum FailureStage {
    FETCH,
    EXTRACTION
}
