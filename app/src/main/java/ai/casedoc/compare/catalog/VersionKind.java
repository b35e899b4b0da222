package ai.casedoc.compare.catalog;

/**
 * Origin of a stored rendition.
 */
public enum VersionKind {
    /** Generated report named {@code <timestamp>-<caseId>-<type>.pdf}. */
    REPORT,
    /** Reference document carrying the ground-truth marker in its name. */
    GROUND_TRUTH
}
