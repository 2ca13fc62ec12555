package software.amazon.event.matcher.input;

/**
 * One unit of a parsed pattern value. Most are plain bytes, but some carry a special meaning to the automaton
 * builders, like a wildcard or a set of case-variant byte sequences.
 */
public abstract class InputCharacter {

    public abstract InputCharacterType getType();
}
