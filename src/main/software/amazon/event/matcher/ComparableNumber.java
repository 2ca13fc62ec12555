package software.amazon.event.matcher;

import ch.randelshofer.fastdoubleparser.JavaBigDecimalParser;

import java.math.BigDecimal;

/**
 * Gives numbers a canonical byte form, so that 35, 35.0 and 3.5e1 are the same value to an automaton.
 * <br/>
 * The text is parsed as a {@code BigDecimal} and must be exactly representable as a double; the double's bits are
 * flipped into unsigned order and written as ten base-128 digits. The form is prefixed with
 * {@link #CANONICAL_MARKER}, a byte that never occurs in UTF-8, so it cannot collide with any value's text.
 * <br/>
 * Numbers without a canonical form (too precise, too large, or not numbers at all) are matched by their text only.
 */
final class ComparableNumber {

    static final int CANONICAL_MARKER = 0xF8;
    static final int MAX_LENGTH_IN_BYTES = 10;
    private static final int BASE_128_BITMASK = 0x7f;

    private ComparableNumber() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    /**
     * @param text a number's JSON text
     * @return the canonical bytes, or null if the text has no canonical form
     */
    static byte[] canonical(final String text) {
        try {
            return generate(text);
        } catch (IllegalArgumentException e) {
            // NumberFormatException included: such values still match by their text
            return null;
        }
    }

    /**
     * @throws NumberFormatException if the text isn't a number
     * @throws IllegalArgumentException if the number can't be held exactly by a double
     */
    static byte[] generate(final String text) {
        final BigDecimal bigDecimal = JavaBigDecimalParser.parseBigDecimal(text);
        final double doubleValue = bigDecimal.doubleValue();
        if (Double.isNaN(doubleValue) || Double.isInfinite(doubleValue)
                || BigDecimal.valueOf(doubleValue).compareTo(bigDecimal) != 0) {
            throw new IllegalArgumentException("Cannot compare number : " + text);
        }

        // -0.0 and 0.0 are the same number
        final long bits = Double.doubleToLongBits(doubleValue == 0.0 ? 0.0 : doubleValue);

        // positive: set the sign bit; negative: invert everything, so unsigned order is numeric order
        final long mask = ((bits >>> 63) * 0xFFFFFFFFFFFFFFFFL) | (1L << 63);
        return numbits(bits ^ mask);
    }

    private static byte[] numbits(long value) {
        final byte[] result = new byte[MAX_LENGTH_IN_BYTES + 1];
        result[0] = (byte) CANONICAL_MARKER;
        for (int index = MAX_LENGTH_IN_BYTES; index >= 1; index--) {
            result[index] = (byte) (value & BASE_128_BITMASK);
            value >>>= 7;
        }
        return result;
    }
}
