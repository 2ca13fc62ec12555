package software.amazon.event.matcher;

import javax.annotation.concurrent.Immutable;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * An immutable, point-in-time view of a whole machine: the FieldMatcher graph reachable from the root, plus the
 * paths and path steps used by its patterns. A match call reads one Snapshot from start to finish.
 */
@Immutable
final class Snapshot {

    static final FieldMatcher ROOT = new FieldMatcher(0);

    private static final Snapshot EMPTY = new Snapshot(FieldMatcherTable.withRoot(), Collections.emptySet(),
            Collections.emptySet());

    private final FieldMatcherTable table;

    // full dotted paths used by any pattern
    private final Set<String> pathsUsed;

    // the individual steps of those paths; the event flattener skips subtrees whose step is not among them
    private final Set<String> stepsUsed;

    private Snapshot(final FieldMatcherTable table, final Set<String> pathsUsed, final Set<String> stepsUsed) {
        this.table = table;
        this.pathsUsed = pathsUsed;
        this.stepsUsed = stepsUsed;
    }

    static Snapshot empty() {
        return EMPTY;
    }

    FieldTransitions transitionsOf(final FieldMatcher fieldMatcher) {
        return table.get(fieldMatcher);
    }

    boolean isFieldStepUsed(final String step) {
        return stepsUsed.contains(step);
    }

    Set<String> getPathsUsed() {
        return pathsUsed;
    }

    int fieldMatcherCount() {
        return table.size();
    }

    boolean isEmpty() {
        return table.size() == 1 && table.get(ROOT).isEmpty();
    }

    Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Derives the next snapshot. Nothing done through a Builder is visible to readers until build() and publication.
     */
    static final class Builder {
        private final FieldMatcherTable.Editor editor;
        private final Snapshot base;
        private Set<String> pathsUsed;
        private Set<String> stepsUsed;

        private Builder(final Snapshot base) {
            this.base = base;
            this.editor = base.table.edit();
            this.pathsUsed = base.pathsUsed;
            this.stepsUsed = base.stepsUsed;
        }

        FieldTransitions get(final FieldMatcher fieldMatcher) {
            return editor.get(fieldMatcher);
        }

        void put(final FieldMatcher fieldMatcher, final FieldTransitions transitions) {
            editor.put(fieldMatcher, transitions);
        }

        FieldMatcher newFieldMatcher() {
            return editor.allocate();
        }

        void recordPath(final String path) {
            if (pathsUsed.contains(path)) {
                return;
            }
            if (pathsUsed == base.pathsUsed) {
                pathsUsed = new HashSet<>(pathsUsed);
                stepsUsed = new HashSet<>(stepsUsed);
            }
            pathsUsed.add(path);
            Collections.addAll(stepsUsed, path.split("\\."));
        }

        Snapshot build() {
            return new Snapshot(editor.build(), Collections.unmodifiableSet(pathsUsed),
                    Collections.unmodifiableSet(stepsUsed));
        }
    }
}
