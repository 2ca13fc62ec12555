package software.amazon.event.matcher.input;

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A set of Unicode scalar values, stored as sorted, disjoint, non-adjacent inclusive ranges.
 * Surrogate code points are never members.
 */
@Immutable
public final class CodePointSet {

    public static final int MAX_CODE_POINT = 0x10FFFF;
    static final int MIN_SURROGATE = 0xD800;
    static final int MAX_SURROGATE = 0xDFFF;

    // lo0, hi0, lo1, hi1, ...
    private final int[] bounds;

    private CodePointSet(final int[] bounds) {
        this.bounds = bounds;
    }

    public static CodePointSet of(final int codePoint) {
        return range(codePoint, codePoint);
    }

    public static CodePointSet range(final int lo, final int hi) {
        if (lo > hi) {
            throw new ParseException("Invalid character range " + describe(lo) + "-" + describe(hi));
        }
        return normalize(new int[] { lo, hi });
    }

    public static CodePointSet empty() {
        return new CodePointSet(new int[0]);
    }

    public CodePointSet union(final CodePointSet other) {
        final int[] both = Arrays.copyOf(bounds, bounds.length + other.bounds.length);
        System.arraycopy(other.bounds, 0, both, bounds.length, other.bounds.length);
        return normalize(both);
    }

    public CodePointSet complement() {
        final List<Integer> result = new ArrayList<>();
        int next = 0;
        for (int i = 0; i < bounds.length; i += 2) {
            if (bounds[i] > next) {
                result.add(next);
                result.add(bounds[i] - 1);
            }
            next = bounds[i + 1] + 1;
        }
        if (next <= MAX_CODE_POINT) {
            result.add(next);
            result.add(MAX_CODE_POINT);
        }
        return normalize(result.stream().mapToInt(Integer::intValue).toArray());
    }

    public boolean contains(final int codePoint) {
        for (int i = 0; i < bounds.length; i += 2) {
            if (codePoint >= bounds[i] && codePoint <= bounds[i + 1]) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return bounds.length == 0;
    }

    public int rangeCount() {
        return bounds.length / 2;
    }

    public int rangeLow(final int range) {
        return bounds[range * 2];
    }

    public int rangeHigh(final int range) {
        return bounds[range * 2 + 1];
    }

    // sorts, coalesces and cuts out surrogates
    private static CodePointSet normalize(final int[] raw) {
        final int count = raw.length / 2;
        final int[][] ranges = new int[count][];
        for (int i = 0; i < count; i++) {
            ranges[i] = new int[] { raw[i * 2], raw[i * 2 + 1] };
        }
        Arrays.sort(ranges, (a, b) -> Integer.compare(a[0], b[0]));

        final List<int[]> merged = new ArrayList<>();
        for (int[] range : ranges) {
            final int[] last = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (last != null && range[0] <= last[1] + 1) {
                last[1] = Math.max(last[1], range[1]);
            } else {
                merged.add(new int[] { range[0], range[1] });
            }
        }

        final List<Integer> result = new ArrayList<>();
        for (int[] range : merged) {
            if (range[1] < MIN_SURROGATE || range[0] > MAX_SURROGATE) {
                result.add(range[0]);
                result.add(range[1]);
                continue;
            }
            if (range[0] < MIN_SURROGATE) {
                result.add(range[0]);
                result.add(MIN_SURROGATE - 1);
            }
            if (range[1] > MAX_SURROGATE) {
                result.add(MAX_SURROGATE + 1);
                result.add(range[1]);
            }
        }
        return new CodePointSet(result.stream().mapToInt(Integer::intValue).toArray());
    }

    private static String describe(final int codePoint) {
        return new String(Character.toChars(codePoint));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(bounds, ((CodePointSet) o).bounds);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bounds);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < bounds.length; i += 2) {
            sb.append(String.format("%X-%X", bounds[i], bounds[i + 1]));
            if (i + 2 < bounds.length) {
                sb.append(',');
            }
        }
        return sb.append(']').toString();
    }
}
