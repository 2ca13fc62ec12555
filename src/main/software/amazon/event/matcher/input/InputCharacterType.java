package software.amazon.event.matcher.input;

/**
 * The different types of InputCharacters, created from a pattern value, that are used to build a value automaton.
 */
public enum InputCharacterType {
    BYTE,
    MULTI_BYTE_SET,
    WILDCARD
}
