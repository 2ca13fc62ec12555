package software.amazon.event.matcher.input;

import software.amazon.event.matcher.MatchType;

import java.nio.charset.StandardCharsets;

/**
 * Parses the value for a pattern into InputCharacters that are used to add the pattern to the Machine. Most characters
 * from a pattern's value are treated by their byte representation, but certain characters, such as wildcards or
 * case-insensitive letters, need to be represented differently so the automaton builders understand their meaning.
 */
public class DefaultParser {

    static final byte ASTERISK_BYTE = 0x2A;
    static final byte BACKSLASH_BYTE = 0x5C;

    private static final DefaultParser SINGLETON = new DefaultParser();
    private final WildcardParser wildcardParser;
    private final ShellStyleParser shellStyleParser;
    private final EqualsIgnoreCaseParser equalsIgnoreCaseParser;

    DefaultParser() {
        this(new WildcardParser(), new ShellStyleParser(), new EqualsIgnoreCaseParser());
    }

    DefaultParser(WildcardParser wildcardParser, ShellStyleParser shellStyleParser,
                  EqualsIgnoreCaseParser equalsIgnoreCaseParser) {
        this.wildcardParser = wildcardParser;
        this.shellStyleParser = shellStyleParser;
        this.equalsIgnoreCaseParser = equalsIgnoreCaseParser;
    }

    public static DefaultParser getParser() {
        return SINGLETON;
    }

    public InputCharacter[] parse(final MatchType type, final String value) {
        switch (type) {
            case WILDCARD:
                return wildcardParser.parse(value);
            case SHELL_STYLE:
                return shellStyleParser.parse(value);
            case EQUALS_IGNORE_CASE:
                return equalsIgnoreCaseParser.parse(value);
            default:
                break;
        }

        final byte[] utf8bytes = value.getBytes(StandardCharsets.UTF_8);
        final InputCharacter[] result = new InputCharacter[utf8bytes.length];
        for (int i = 0; i < utf8bytes.length; i++) {
            result[i] = new InputByte(utf8bytes[i]);
        }
        return result;
    }
}
