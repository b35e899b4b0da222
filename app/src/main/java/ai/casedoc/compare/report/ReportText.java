package ai.casedoc.compare.report;

import ai.casedoc.compare.catalog.VersionDescriptor;
import ai.casedoc.compare.comparison.ComparisonResult;
import ai.casedoc.compare.comparison.VersionFailure;
import ai.casedoc.compare.comparison.VersionPairComparison;
import ai.casedoc.compare.diff.SectionStatus;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Wording shared by every report encoding so the HTML and PDF reports read the same.
 */
final class ReportText {

    static final String TITLE = "LCP Version Comparison Report";
    static final String NOT_COMPARABLE = "NOT COMPARABLE";

    private static final DateTimeFormatter GENERATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'", Locale.ROOT)
            .withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter VERSION_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm", Locale.ROOT);

    private ReportText() {
    }

    static String generated(ComparisonResult result) {
        return GENERATED.format(result.generatedAt());
    }

    static String mode(ComparisonResult result) {
        String label = result.mode().label();
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }

    /** File names of every version that is an endpoint of some pair, in pair order. */
    static List<String> versionsCompared(ComparisonResult result) {
        Set<String> names = new LinkedHashSet<>();
        for (VersionPairComparison pair : result.pairs()) {
            names.add(pair.older().fileName());
            names.add(pair.newer().fileName());
        }
        return List.copyOf(names);
    }

    static String pairTitle(VersionPairComparison pair) {
        return version(pair.older()) + "  ->  " + version(pair.newer());
    }

    static String version(VersionDescriptor version) {
        return version.fileName() + " (" + VERSION_TIME.format(version.timestamp()) + ")";
    }

    static String badge(SectionStatus status) {
        return status.name();
    }

    static String failure(VersionFailure failure) {
        return failure.versionId() + " [" + failure.stage().name().toLowerCase(Locale.ROOT) + " failed]: " + failure.message();
    }

    static String noChanges() {
        return "No changes detected in this section.";
    }
}
