package software.amazon.event.matcher.input;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A parser to be used specifically for equals-ignore-case patterns. For characters where lower and upper case UTF-8
 * representations do not differ, we will parse into InputBytes. Otherwise, we will use InputMultiByteSet.
 *
 * Note that there are characters whose upper-case/lower-case UTF-8 representations differ in number of bytes,
 * e.g. ⱥ and Ⱥ. InputMultiByteSet handles differing byte lengths per character.
 */
public class EqualsIgnoreCaseParser implements StringValueParser {

    EqualsIgnoreCaseParser() { }

    @Override
    public InputCharacter[] parse(final String value) {
        final List<InputCharacter> result = new ArrayList<>(value.length());
        int i = 0;
        while (i < value.length()) {
            final int codePoint = value.codePointAt(i);
            final String c = new String(Character.toChars(codePoint));
            i += Character.charCount(codePoint);

            final byte[] lowerCaseUtf8bytes = c.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
            final byte[] upperCaseUtf8bytes = c.toUpperCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
            if (Arrays.equals(lowerCaseUtf8bytes, upperCaseUtf8bytes)) {
                for (byte b : lowerCaseUtf8bytes) {
                    result.add(new InputByte(b));
                }
            } else {
                final Set<MultiByte> multiBytes = new HashSet<>();
                multiBytes.add(new MultiByte(lowerCaseUtf8bytes));
                multiBytes.add(new MultiByte(upperCaseUtf8bytes));
                result.add(new InputMultiByteSet(multiBytes));
            }
        }
        return result.toArray(new InputCharacter[0]);
    }
}
