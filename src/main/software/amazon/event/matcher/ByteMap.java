package software.amazon.event.matcher;

import javax.annotation.concurrent.Immutable;
import java.util.Arrays;

/**
 * Maps byte values to next ByteStates. Designed to perform well given the constraints that most ByteStates have a
 * very small number of transitions, and that for support of wildcards and regexes, we need to efficiently represent
 * the condition where wide ranges of byte values (including *all* of them) transition to a common next ByteState.
 *
 * A ByteMap is never modified; the with* methods return a new map.
 */
@Immutable
final class ByteMap {

    static final int BYTE_CEILING = 256;

    private static final ByteMap EMPTY = new ByteMap(new int[] { BYTE_CEILING }, new ByteState[] { null });

    /*
     * Each entry represents one or more byte values that share a next state. Null means no transition. The ceiling is
     * exclusive; all byte values below it and greater than or equal to the previous entry's ceiling (or zero, for the
     * zeroth entry) map to the associated state. Ceilings strictly increase and the last one is always BYTE_CEILING.
     */
    private final int[] ceilings;
    private final ByteState[] states;

    private ByteMap(final int[] ceilings, final ByteState[] states) {
        this.ceilings = ceilings;
        this.states = states;
    }

    static ByteMap empty() {
        return EMPTY;
    }

    static ByteMap allTo(final ByteState state) {
        return new ByteMap(new int[] { BYTE_CEILING }, new ByteState[] { state });
    }

    static ByteMap pack(final ByteState[] unpacked) {
        final Builder builder = new Builder();
        for (int b = 0; b < BYTE_CEILING; b++) {
            builder.appendRun(b + 1, unpacked[b]);
        }
        return builder.build();
    }

    ByteState[] unpack() {
        final ByteState[] unpacked = new ByteState[BYTE_CEILING];
        int floor = 0;
        for (int i = 0; i < ceilings.length; i++) {
            Arrays.fill(unpacked, floor, ceilings[i], states[i]);
            floor = ceilings[i];
        }
        return unpacked;
    }

    ByteMap with(final int utf8byte, final ByteState state) {
        return withRange(utf8byte, utf8byte, state);
    }

    /**
     * @param lo lowest byte value to map, inclusive
     * @param hi highest byte value to map, inclusive
     */
    ByteMap withRange(final int lo, final int hi, final ByteState state) {
        final ByteState[] unpacked = unpack();
        Arrays.fill(unpacked, lo, hi + 1, state);
        return pack(unpacked);
    }

    ByteState step(final int utf8byte) {
        int low = 0;
        int high = ceilings.length - 1;
        while (low < high) {
            final int mid = (low + high) >>> 1;
            if (ceilings[mid] > utf8byte) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return states[low];
    }

    boolean isEmpty() {
        return ceilings.length == 1 && states[0] == null;
    }

    int runCount() {
        return ceilings.length;
    }

    int ceiling(final int run) {
        return ceilings[run];
    }

    ByteState state(final int run) {
        return states[run];
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        int floor = 0;
        for (int i = 0; i < ceilings.length; i++) {
            if (states[i] != null) {
                sb.append(String.format("%02x-%02x->%s ", floor, ceilings[i] - 1, states[i].name()));
            }
            floor = ceilings[i];
        }
        return sb.toString().trim();
    }

    /**
     * Accumulates runs in ascending ceiling order, merging a run into its predecessor when both map to the same state.
     */
    static final class Builder {
        private int[] ceilings = new int[4];
        private ByteState[] states = new ByteState[4];
        private int size = 0;

        void appendRun(final int ceiling, final ByteState state) {
            if (size > 0 && states[size - 1] == state) {
                ceilings[size - 1] = ceiling;
                return;
            }
            if (size == ceilings.length) {
                ceilings = Arrays.copyOf(ceilings, size * 2);
                states = Arrays.copyOf(states, size * 2);
            }
            ceilings[size] = ceiling;
            states[size] = state;
            size++;
        }

        ByteMap build() {
            if (size == 0 || ceilings[size - 1] != BYTE_CEILING) {
                throw new IllegalStateException("ByteMap runs must end at " + BYTE_CEILING);
            }
            if (size == 1 && states[0] == null) {
                return EMPTY;
            }
            return new ByteMap(Arrays.copyOf(ceilings, size), Arrays.copyOf(states, size));
        }
    }
}
