package ai.casedoc.compare.segment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sections of one document in source order.
 */
public final class SegmentedDocument {

    private final List<Section> sections;
    private final Map<String, Section> byName;
    private final Optional<String> grammar;
    private final String text;

    SegmentedDocument(String text, List<Section> sections, Optional<String> grammar) {
        this.text = Objects.requireNonNull(text, "text");
        this.sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        Map<String, Section> index = new LinkedHashMap<>();
        for (Section section : this.sections) {
            if (index.putIfAbsent(section.name(), section) != null) {
                throw new IllegalArgumentException("Duplicate section name: " + section.name());
            }
        }
        this.byName = Collections.unmodifiableMap(index);
    }

    public static SegmentedDocument empty() {
        return new SegmentedDocument("", List.of(), Optional.empty());
    }

    public List<Section> sections() {
        return sections;
    }

    public Optional<Section> section(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /** Ordered name to body view. */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        sections.forEach(section -> map.put(section.name(), section.body()));
        return Collections.unmodifiableMap(map);
    }

    /** Name of the heading rule that segmented this document, empty when no heading was recognised. */
    public Optional<String> grammar() {
        return grammar;
    }

    /** True when no heading matched and the whole text forms a single section. */
    public boolean isImplicit() {
        return grammar.isEmpty() && sections.size() == 1
                && sections.get(0).name().equals(SectionSegmenter.FULL_DOCUMENT);
    }

    public boolean isEmpty() {
        return sections.isEmpty();
    }

    /** Source text the sections were cut from, headings included. */
    public String fullText() {
        return text;
    }
}
