package software.amazon.event.matcher;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Produces an automaton accepting the union of the languages of two others. Neither input is changed: new states with
 * new tables are synthesized for byte ranges both inputs handle, while ranges only one input handles keep pointing at
 * that input's existing states.
 *
 * Each pair of input states is merged at most once per merge; the memo is what keeps merging automata that loop
 * (wildcards, regexp repetition) from multiplying states.
 */
final class AutomatonMerger {

    private static final Logger LOG = Logger.getLogger(AutomatonMerger.class.getName());

    private AutomatonMerger() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    static ByteState merge(final ByteState first, final ByteState second) {
        if (first == second) {
            return first;
        }

        final Map<StatePair, ByteState> merged = new HashMap<>();
        final Deque<StatePair> pending = new ArrayDeque<>();
        final ByteState result = combined(new StatePair(first, second), merged, pending);

        while (!pending.isEmpty()) {
            final StatePair pair = pending.pop();
            final ByteMap left = pair.left.getMap();
            final ByteMap right = pair.right.getMap();
            final ByteMap.Builder table = new ByteMap.Builder();

            // walk both ceiling lists range by range
            int leftRun = 0;
            int rightRun = 0;
            while (leftRun < left.runCount() && rightRun < right.runCount()) {
                final int leftCeiling = left.ceiling(leftRun);
                final int rightCeiling = right.ceiling(rightRun);
                final ByteState leftNext = left.state(leftRun);
                final ByteState rightNext = right.state(rightRun);

                final ByteState next;
                if (leftNext == null) {
                    next = rightNext;
                } else if (rightNext == null || leftNext == rightNext) {
                    next = leftNext;
                } else {
                    next = combined(new StatePair(leftNext, rightNext), merged, pending);
                }
                table.appendRun(Math.min(leftCeiling, rightCeiling), next);

                if (leftCeiling <= rightCeiling) {
                    leftRun++;
                }
                if (rightCeiling <= leftCeiling) {
                    rightRun++;
                }
            }
            merged.get(pair).setMap(table.build());
        }

        if (LOG.isLoggable(Level.FINER)) {
            LOG.finer("Merge synthesized " + merged.size() + " states");
        }
        return result;
    }

    // the state standing for both members of the pair; its table is filled in when the pair is taken off 'pending'
    private static ByteState combined(final StatePair pair, final Map<StatePair, ByteState> merged,
                                      final Deque<StatePair> pending) {
        ByteState state = merged.get(pair);
        if (state == null) {
            state = new ByteState();
            for (ByteState epsilon : pair.left.getEpsilons()) {
                state.addEpsilon(epsilon);
            }
            for (ByteState epsilon : pair.right.getEpsilons()) {
                if (!pair.left.getEpsilons().contains(epsilon)) {
                    state.addEpsilon(epsilon);
                }
            }
            for (FieldMatcher terminal : pair.left.getTerminals()) {
                state.addTerminal(terminal);
            }
            for (FieldMatcher terminal : pair.right.getTerminals()) {
                state.addTerminal(terminal);
            }
            merged.put(pair, state);
            pending.push(pair);
        }
        return state;
    }

    /**
     * Identity-keyed pair of states.
     */
    private static final class StatePair {
        final ByteState left;
        final ByteState right;

        StatePair(final ByteState left, final ByteState right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof StatePair)) {
                return false;
            }
            final StatePair other = (StatePair) o;
            return left == other.left && right == other.right;
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(left) + System.identityHashCode(right);
        }
    }
}
