package software.amazon.event.matcher.input;

import java.nio.charset.StandardCharsets;

import static software.amazon.event.matcher.input.DefaultParser.ASTERISK_BYTE;

/**
 * A parser for shell-style patterns. Every '*' is a wildcard; there is no escape character.
 */
public class ShellStyleParser implements StringValueParser {

    ShellStyleParser() { }

    @Override
    public InputCharacter[] parse(final String value) {
        final byte[] utf8Bytes = value.getBytes(StandardCharsets.UTF_8);
        final InputCharacter[] result = new InputCharacter[utf8Bytes.length];
        for (int i = 0; i < utf8Bytes.length; i++) {
            if (utf8Bytes[i] == ASTERISK_BYTE) {
                if (i + 1 < utf8Bytes.length && utf8Bytes[i + 1] == ASTERISK_BYTE) {
                    throw new ParseException("Consecutive wildcard characters at pos " + i);
                }
                result[i] = new InputWildcard();
            } else {
                result[i] = new InputByte(utf8Bytes[i]);
            }
        }
        return result;
    }
}
