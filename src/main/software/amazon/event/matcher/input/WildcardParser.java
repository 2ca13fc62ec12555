package software.amazon.event.matcher.input;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static software.amazon.event.matcher.input.DefaultParser.ASTERISK_BYTE;
import static software.amazon.event.matcher.input.DefaultParser.BACKSLASH_BYTE;

/**
 * Parses wildcard pattern values. A '*' stands for any run of bytes. A backslash makes the following '*' or
 * backslash literal and may not precede anything else.
 */
public class WildcardParser implements StringValueParser {

    WildcardParser() { }

    @Override
    public InputCharacter[] parse(final String value) {
        final byte[] raw = value.getBytes(StandardCharsets.UTF_8);
        final List<InputCharacter> parsed = new ArrayList<>(raw.length);
        int pos = 0;
        while (pos < raw.length) {
            final byte current = raw[pos];
            final byte next = pos + 1 < raw.length ? raw[pos + 1] : 0;
            switch (current) {
                case ASTERISK_BYTE:
                    if (next == ASTERISK_BYTE) {
                        throw new ParseException("Consecutive wildcard characters at pos " + pos);
                    }
                    parsed.add(new InputWildcard());
                    pos++;
                    break;
                case BACKSLASH_BYTE:
                    if (next != ASTERISK_BYTE && next != BACKSLASH_BYTE) {
                        throw new ParseException("Invalid escape character at pos " + pos);
                    }
                    parsed.add(new InputByte(next));
                    pos += 2;
                    break;
                default:
                    parsed.add(new InputByte(current));
                    pos++;
            }
        }
        return parsed.toArray(new InputCharacter[0]);
    }
}
