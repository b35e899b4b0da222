package ai.casedoc.compare.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.diff.Sequence;
import org.eclipse.jgit.diff.SequenceComparator;

/**
 * Line-oriented diff backed by JGit's linear-space Myers implementation. Within every change hunk
 * removals are listed before additions, so equal inputs always produce the same script.
 */
public class LineDiffer {

    private static final DiffAlgorithm ALGORITHM =
            DiffAlgorithm.getAlgorithm(DiffAlgorithm.SupportedAlgorithm.MYERS);

    public List<LineChange> diff(List<String> left, List<String> right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");

        EditList edits = ALGORITHM.diff(LineComparator.INSTANCE, new Lines(left), new Lines(right));

        List<LineChange> script = new ArrayList<>(Math.max(left.size(), right.size()));
        int position = 0;
        for (Edit edit : edits) {
            for (int i = position; i < edit.getBeginA(); i++) {
                script.add(LineChange.unchanged(left.get(i)));
            }
            for (int i = edit.getBeginA(); i < edit.getEndA(); i++) {
                script.add(LineChange.removed(left.get(i)));
            }
            for (int i = edit.getBeginB(); i < edit.getEndB(); i++) {
                script.add(LineChange.added(right.get(i)));
            }
            position = edit.getEndA();
        }
        for (int i = position; i < left.size(); i++) {
            script.add(LineChange.unchanged(left.get(i)));
        }
        return groupHunks(script);
    }

    /** Rewrites every maximal run of non-unchanged steps as its removals followed by its additions. */
    static List<LineChange> groupHunks(List<LineChange> script) {
        List<LineChange> grouped = new ArrayList<>(script.size());
        List<LineChange> added = new ArrayList<>();
        for (LineChange change : script) {
            switch (change.kind()) {
                case REMOVED -> grouped.add(change);
                case ADDED -> added.add(change);
                case UNCHANGED -> {
                    grouped.addAll(added);
                    added.clear();
                    grouped.add(change);
                }
            }
        }
        grouped.addAll(added);
        return grouped;
    }

    private static final class Lines extends Sequence {

        private final List<String> lines;

        private Lines(List<String> lines) {
            this.lines = lines;
        }

        @Override
        public int size() {
            return lines.size();
        }

        private String get(int index) {
            return lines.get(index);
        }
    }

    private static final class LineComparator extends SequenceComparator<Lines> {

        private static final LineComparator INSTANCE = new LineComparator();

        @Override
        public boolean equals(Lines a, int ai, Lines b, int bi) {
            return a.get(ai).equals(b.get(bi));
        }

        @Override
        public int hash(Lines seq, int ptr) {
            return seq.get(ptr).hashCode();
        }
    }
}
