package ai.casedoc.compare.diff;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class LineDifferTest {

    private final LineDiffer differ = new LineDiffer();

    @Test
    void identicalInputsAreAllUnchanged() {
        List<LineChange> script = differ.diff(List.of("a", "b", "c"), List.of("a", "b", "c"));

        assertThat(script).extracting(LineChange::kind).containsOnly(LineChangeKind.UNCHANGED).hasSize(3);
    }

    @Test
    void producesMinimalScriptForInsertion() {
        List<LineChange> script = differ.diff(List.of("a", "b", "c"), List.of("a", "x", "b", "c"));

        assertThat(script).containsExactly(
                LineChange.unchanged("a"),
                LineChange.added("x"),
                LineChange.unchanged("b"),
                LineChange.unchanged("c"));
    }

    @Test
    void listsRemovalsBeforeAdditionsWithinHunk() {
        List<LineChange> script = differ.diff(List.of("keep", "old one", "old two", "tail"),
                List.of("keep", "new one", "tail"));

        assertThat(script).containsExactly(
                LineChange.unchanged("keep"),
                LineChange.removed("old one"),
                LineChange.removed("old two"),
                LineChange.added("new one"),
                LineChange.unchanged("tail"));
    }

    @Test
    void keepsCommonLinesAndReconstructsBothSides() {
        List<String> left = List.of("a", "b", "c", "a", "b", "b", "a");
        List<String> right = List.of("c", "b", "a", "b", "a", "c");

        List<LineChange> script = differ.diff(left, right);

        long unchanged = script.stream().filter(change -> change.kind() == LineChangeKind.UNCHANGED).count();
        assertThat(unchanged).isGreaterThanOrEqualTo(3);
        assertThat(script.stream().filter(change -> change.kind() != LineChangeKind.ADDED).map(LineChange::content))
                .containsExactlyElementsOf(left);
        assertThat(script.stream().filter(change -> change.kind() != LineChangeKind.REMOVED).map(LineChange::content))
                .containsExactlyElementsOf(right);
    }

    @Test
    void handlesEmptySides() {
        assertThat(differ.diff(List.of(), List.of("x", "y")))
                .containsExactly(LineChange.added("x"), LineChange.added("y"));
        assertThat(differ.diff(List.of("x"), List.of()))
                .containsExactly(LineChange.removed("x"));
        assertThat(differ.diff(List.of(), List.of())).isEmpty();
    }

    @Test
    void sameInputsProduceSameScript() {
        List<String> left = List.of("one", "two", "three", "four", "five");
        List<String> right = List.of("zero", "two", "four", "five", "six");

        assertThat(differ.diff(left, right)).isEqualTo(differ.diff(left, right));
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void rewrittenDocumentWithNoSharedLinesStaysWithinMemory() {
        List<String> left = new ArrayList<>();
        List<String> right = new ArrayList<>();
        for (int i = 0; i < 12_000; i++) {
            left.add("old clause " + i);
            right.add("new clause " + i);
        }

        List<LineChange> script = differ.diff(left, right);

        assertThat(script).hasSize(24_000);
        assertThat(script.subList(0, 12_000)).extracting(LineChange::kind).containsOnly(LineChangeKind.REMOVED);
        assertThat(script.subList(12_000, 24_000)).extracting(LineChange::kind).containsOnly(LineChangeKind.ADDED);
        assertThat(script.get(12_000)).isEqualTo(LineChange.added("new clause 0"));
    }
}
