package ai.casedoc.compare.report;

import ai.casedoc.compare.comparison.ComparisonResult;
import ai.casedoc.compare.comparison.VersionFailure;
import ai.casedoc.compare.comparison.VersionPairComparison;
import ai.casedoc.compare.diff.DiffSummary;
import ai.casedoc.compare.diff.ModifiedPair;
import ai.casedoc.compare.diff.SectionDiff;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Self-contained HTML page: inline styles, collapsible section cards and a status filter.
 */
class HtmlReportWriter implements ReportWriter {

    private static final String STYLE = """
            body { font-family: 'Segoe UI', Tahoma, Geneva, Verdana, sans-serif; max-width: 1200px; margin: 0 auto; padding: 20px; background: #f5f5f5; }
            .header { background: linear-gradient(135deg, #667eea 0%, #764ba2 100%); color: white; padding: 30px; border-radius: 10px; margin-bottom: 30px; }
            .pair { margin-bottom: 40px; }
            .summary { border-collapse: collapse; margin: 10px 0 20px; background: white; }
            .summary th, .summary td { border: 1px solid #ddd; padding: 6px 14px; text-align: center; }
            details.section { background: white; padding: 14px 20px; margin-bottom: 14px; border-radius: 8px; box-shadow: 0 2px 4px rgba(0,0,0,0.1); }
            details.section > summary { font-size: 1.15em; font-weight: bold; cursor: pointer; color: #333; }
            .status-badge { display: inline-block; padding: 4px 12px; border-radius: 20px; font-size: 0.8em; font-weight: bold; margin-left: 10px; }
            .status-added { background: #d4edda; color: #155724; }
            .status-removed { background: #f8d7da; color: #721c24; }
            .status-modified { background: #fff3cd; color: #856404; }
            .status-unchanged { background: #d1ecf1; color: #0c5460; }
            .status-not-comparable { background: #e2e3e5; color: #383d41; }
            .change-item { margin: 10px 0; padding: 10px; border-left: 3px solid #ddd; background: #f9f9f9; }
            .change-item.added { border-left-color: #28a745; background: #eaf6ec; }
            .change-item.removed { border-left-color: #dc3545; background: #fbecee; }
            .change-item.changed { border-left-color: #ffc107; background: #fff8e1; }
            .change-label { font-weight: bold; margin-bottom: 5px; }
            .line { font-family: monospace; white-space: pre-wrap; margin: 2px 0; }
            .errors { background: #fff; border-left: 4px solid #dc3545; padding: 10px 20px; margin-bottom: 30px; }
            .filters button { margin-right: 6px; }
            """;

    private static final String FILTER_SCRIPT = """
            function filterSections(status) {
              document.querySelectorAll('details.section').forEach(function (el) {
                el.style.display = (status === 'all' || el.dataset.status === status) ? '' : 'none';
              });
            }
            """;

    @Override
    public byte[] write(ComparisonResult result) {
        StringBuilder html = new StringBuilder(8192);
        html.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n<meta charset=\"UTF-8\">\n");
        html.append("<title>").append(escape(ReportText.TITLE)).append(" - Case ").append(escape(result.caseId())).append("</title>\n");
        html.append("<style>\n").append(STYLE).append("</style>\n");
        html.append("<script>\n").append(FILTER_SCRIPT).append("</script>\n");
        html.append("</head>\n<body>\n");

        appendHeader(html, result);
        appendErrors(html, result.perVersionErrors());
        html.append("<div class=\"filters\">Show: ");
        for (String status : List.of("all", "added", "removed", "modified", "unchanged")) {
            html.append("<button type=\"button\" onclick=\"filterSections('").append(status).append("')\">")
                    .append(status).append("</button>");
        }
        html.append("</div>\n");

        for (VersionPairComparison pair : result.pairs()) {
            appendPair(html, pair);
        }
        html.append("</body>\n</html>\n");
        return html.toString().getBytes(StandardCharsets.UTF_8);
    }

    private void appendHeader(StringBuilder html, ComparisonResult result) {
        html.append("<div class=\"header\">\n");
        html.append("<h1>").append(escape(ReportText.TITLE)).append("</h1>\n");
        html.append("<p><strong>Case ID:</strong> ").append(escape(result.caseId())).append("</p>\n");
        html.append("<p><strong>Comparison Mode:</strong> ").append(escape(ReportText.mode(result))).append("</p>\n");
        html.append("<p><strong>Generated:</strong> ").append(escape(ReportText.generated(result))).append("</p>\n");
        html.append("<p><strong>Versions Compared:</strong> ")
                .append(escape(String.join(", ", ReportText.versionsCompared(result)))).append("</p>\n");
        html.append("</div>\n");
        appendSummary(html, "Overall", result.summary());
    }

    private void appendErrors(StringBuilder html, List<VersionFailure> failures) {
        if (failures.isEmpty()) {
            return;
        }
        html.append("<div class=\"errors\">\n<h3>Versions that could not be compared</h3>\n<ul>\n");
        for (VersionFailure failure : failures) {
            html.append("<li>").append(escape(ReportText.failure(failure))).append("</li>\n");
        }
        html.append("</ul>\n</div>\n");
    }

    private void appendPair(StringBuilder html, VersionPairComparison pair) {
        html.append("<div class=\"pair\" data-pair-status=\"").append(pair.status().name().toLowerCase(Locale.ROOT)).append("\">\n");
        html.append("<h2>").append(escape(ReportText.pairTitle(pair))).append("</h2>\n");
        if (!pair.isComparable()) {
            html.append("<p><span class=\"status-badge status-not-comparable\">").append(ReportText.NOT_COMPARABLE)
                    .append("</span></p>\n<ul>\n");
            for (VersionFailure failure : pair.failures()) {
                html.append("<li>").append(escape(ReportText.failure(failure))).append("</li>\n");
            }
            html.append("</ul>\n</div>\n");
            return;
        }
        appendSummary(html, "Sections", pair.summary());
        for (SectionDiff section : pair.sectionDiffs()) {
            appendSection(html, section);
        }
        html.append("</div>\n");
    }

    private void appendSummary(StringBuilder html, String caption, DiffSummary summary) {
        html.append("<table class=\"summary\"><caption>").append(escape(caption)).append("</caption>\n")
                .append("<tr><th>Total</th><th>Added</th><th>Removed</th><th>Modified</th><th>Unchanged</th></tr>\n")
                .append("<tr>")
                .append("<td class=\"count-total\">").append(summary.total()).append("</td>")
                .append("<td class=\"count-added\">").append(summary.added()).append("</td>")
                .append("<td class=\"count-removed\">").append(summary.removed()).append("</td>")
                .append("<td class=\"count-modified\">").append(summary.modified()).append("</td>")
                .append("<td class=\"count-unchanged\">").append(summary.unchanged()).append("</td>")
                .append("</tr>\n</table>\n");
    }

    private void appendSection(StringBuilder html, SectionDiff section) {
        String status = section.status().label();
        html.append("<details class=\"section\" data-status=\"").append(status).append('"');
        if (section.hasChanges()) {
            html.append(" open");
        }
        html.append(">\n<summary>").append(escape(section.sectionName()))
                .append("<span class=\"status-badge status-").append(status).append("\">")
                .append(ReportText.badge(section.status())).append("</span></summary>\n");
        switch (section.status()) {
            case UNCHANGED -> html.append("<p>").append(ReportText.noChanges()).append("</p>\n");
            case ADDED -> appendLines(html, "added", "Section Added", section.addedLines());
            case REMOVED -> appendLines(html, "removed", "Section Removed", section.removedLines());
            case MODIFIED -> {
                appendLines(html, "added", "Added Lines", section.addedLines());
                appendLines(html, "removed", "Removed Lines", section.removedLines());
                appendPairs(html, section.modifiedPairs());
            }
        }
        html.append("</details>\n");
    }

    private void appendLines(StringBuilder html, String cssClass, String label, List<String> lines) {
        if (lines.isEmpty()) {
            return;
        }
        html.append("<div class=\"change-item ").append(cssClass).append("\"><div class=\"change-label\">")
                .append(label).append(" (").append(lines.size()).append(")</div>\n");
        String marker = cssClass.equals("added") ? "+ " : "- ";
        for (String line : lines) {
            html.append("<p class=\"line\">").append(marker).append(escape(line)).append("</p>\n");
        }
        html.append("</div>\n");
    }

    private void appendPairs(StringBuilder html, List<ModifiedPair> pairs) {
        if (pairs.isEmpty()) {
            return;
        }
        html.append("<div class=\"change-item changed\"><div class=\"change-label\">Modified Lines (")
                .append(pairs.size()).append(")</div>\n");
        for (ModifiedPair pair : pairs) {
            html.append("<p class=\"line\"><strong>Old:</strong> ").append(escape(pair.oldLine())).append("</p>\n");
            html.append("<p class=\"line\"><strong>New:</strong> ").append(escape(pair.newLine())).append("</p>\n");
            html.append("<hr>\n");
        }
        html.append("</div>\n");
    }

    static String escape(String value) {
        StringBuilder escaped = new StringBuilder(value.length() + 16);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(ch);
            }
        }
        return escaped.toString();
    }
}
