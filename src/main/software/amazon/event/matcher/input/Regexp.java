package software.amazon.event.matcher.input;

import javax.annotation.concurrent.Immutable;
import java.util.Collections;
import java.util.List;

/**
 * Parsed form of a regular expression: an alternation of branches, each branch a sequence of quantified atoms.
 * Groups nest another Regexp inside an atom.
 */
@Immutable
public final class Regexp {

    private final List<List<Atom>> branches;

    Regexp(final List<List<Atom>> branches) {
        this.branches = Collections.unmodifiableList(branches);
    }

    public List<List<Atom>> getBranches() {
        return branches;
    }

    /**
     * How many character steps the automaton for this expression needs once every bounded repetition is unrolled.
     * Saturates at Long.MAX_VALUE.
     */
    long expandedSize() {
        long size = 0;
        for (List<Atom> branch : branches) {
            for (Atom atom : branch) {
                final long inner = atom.isGroup() ? atom.group.expandedSize() : 1;
                final long copies = atom.max == Atom.UNBOUNDED ? Math.max(atom.min, 1) : atom.max;
                size = saturatedAdd(size, saturatedMultiply(inner, copies));
            }
        }
        return size;
    }

    private static long saturatedAdd(final long a, final long b) {
        final long sum = a + b;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }

    private static long saturatedMultiply(final long a, final long b) {
        if (a != 0 && b > Long.MAX_VALUE / a) {
            return Long.MAX_VALUE;
        }
        return a * b;
    }

    @Override
    public String toString() {
        return branches.toString();
    }

    /**
     * A character set or a group, repeated between min and max times.
     */
    @Immutable
    public static final class Atom {
        public static final int UNBOUNDED = -1;

        private final CodePointSet characters;
        private final Regexp group;
        private final int min;
        private final int max;

        Atom(final CodePointSet characters, final Regexp group, final int min, final int max) {
            this.characters = characters;
            this.group = group;
            this.min = min;
            this.max = max;
        }

        Atom withRepetition(final int newMin, final int newMax) {
            return new Atom(characters, group, newMin, newMax);
        }

        public boolean isGroup() {
            return group != null;
        }

        public CodePointSet getCharacters() {
            return characters;
        }

        public Regexp getGroup() {
            return group;
        }

        public int getMin() {
            return min;
        }

        public int getMax() {
            return max;
        }

        @Override
        public String toString() {
            final String body = isGroup() ? "(" + group + ")" : characters.toString();
            return body + "{" + min + "," + (max == UNBOUNDED ? "" : max) + "}";
        }
    }
}
