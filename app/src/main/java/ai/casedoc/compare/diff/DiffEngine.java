package ai.casedoc.compare.diff;

import ai.casedoc.compare.segment.SectionSegmenter;
import ai.casedoc.compare.segment.SegmentedDocument;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes section-level and line-level differences between an older (left) and a newer (right)
 * document. Section status depends only on presence and on equality of normalised line sequences.
 */
public class DiffEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(DiffEngine.class);

    private final LineDiffer lineDiffer;

    public DiffEngine() {
        this(new LineDiffer());
    }

    public DiffEngine(LineDiffer lineDiffer) {
        this.lineDiffer = Objects.requireNonNull(lineDiffer, "lineDiffer");
    }

    /**
     * Compares two segmented documents. When either side has no recognised headings the two whole texts
     * are compared as one {@value SectionSegmenter#FULL_DOCUMENT} section; an empty side never triggers
     * this, so every section of the other side is reported as wholly added or removed.
     */
    public DocumentDiff diff(SegmentedDocument left, SegmentedDocument right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        if (!left.isEmpty() && !right.isEmpty() && (left.isImplicit() || right.isImplicit())) {
            LOGGER.debug("Comparing whole texts: at least one side has no section headings");
            return diffSections(Map.of(SectionSegmenter.FULL_DOCUMENT, left.fullText()),
                    Map.of(SectionSegmenter.FULL_DOCUMENT, right.fullText()));
        }
        return diffSections(left.asMap(), right.asMap());
    }

    /**
     * Compares two ordered name to body mappings. Output follows left iteration order, followed by the
     * names only present on the right in right iteration order.
     */
    public DocumentDiff diffSections(Map<String, String> left, Map<String, String> right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");

        Map<String, Boolean> names = new LinkedHashMap<>();
        left.keySet().forEach(name -> names.put(name, Boolean.TRUE));
        right.keySet().forEach(name -> names.putIfAbsent(name, Boolean.FALSE));

        List<SectionDiff> sections = new ArrayList<>(names.size());
        for (String name : names.keySet()) {
            SectionDiff section = diffSection(name, left.get(name), right.get(name));
            LOGGER.debug("Section '{}' is {}", name, section.status().label());
            sections.add(section);
        }
        return DocumentDiff.of(sections);
    }

    private SectionDiff diffSection(String name, String leftBody, String rightBody) {
        if (rightBody == null) {
            List<String> lines = normalize(leftBody);
            return new SectionDiff(name, SectionStatus.REMOVED, List.of(), lines, List.of(),
                    lines.stream().map(LineChange::removed).toList());
        }
        if (leftBody == null) {
            List<String> lines = normalize(rightBody);
            return new SectionDiff(name, SectionStatus.ADDED, lines, List.of(), List.of(),
                    lines.stream().map(LineChange::added).toList());
        }
        List<String> leftLines = normalize(leftBody);
        List<String> rightLines = normalize(rightBody);
        if (leftLines.equals(rightLines)) {
            return new SectionDiff(name, SectionStatus.UNCHANGED, List.of(), List.of(), List.of(),
                    leftLines.stream().map(LineChange::unchanged).toList());
        }
        return collapse(name, lineDiffer.diff(leftLines, rightLines));
    }

    /**
     * Pairs removals and additions by position inside each change hunk; surplus lines of a hunk are
     * reported as independent additions or removals.
     */
    private SectionDiff collapse(String name, List<LineChange> script) {
        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<ModifiedPair> pairs = new ArrayList<>();
        List<String> hunkRemoved = new ArrayList<>();
        List<String> hunkAdded = new ArrayList<>();
        for (LineChange change : script) {
            switch (change.kind()) {
                case REMOVED -> hunkRemoved.add(change.content());
                case ADDED -> hunkAdded.add(change.content());
                case UNCHANGED -> closeHunk(hunkRemoved, hunkAdded, removed, added, pairs);
            }
        }
        closeHunk(hunkRemoved, hunkAdded, removed, added, pairs);
        return new SectionDiff(name, SectionStatus.MODIFIED, added, removed, pairs, script);
    }

    private static void closeHunk(List<String> hunkRemoved, List<String> hunkAdded, List<String> removed,
                                  List<String> added, List<ModifiedPair> pairs) {
        int paired = Math.min(hunkRemoved.size(), hunkAdded.size());
        for (int i = 0; i < paired; i++) {
            pairs.add(new ModifiedPair(hunkRemoved.get(i), hunkAdded.get(i)));
        }
        removed.addAll(hunkRemoved.subList(paired, hunkRemoved.size()));
        added.addAll(hunkAdded.subList(paired, hunkAdded.size()));
        hunkRemoved.clear();
        hunkAdded.clear();
    }

    /** Splits a body into lines with trailing whitespace removed, dropping blank lines. */
    static List<String> normalize(String body) {
        List<String> lines = new ArrayList<>();
        for (String line : body.replace("\r\n", "\n").replace('\r', '\n').split("\n")) {
            String trimmed = line.stripTrailing();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return lines;
    }
}
