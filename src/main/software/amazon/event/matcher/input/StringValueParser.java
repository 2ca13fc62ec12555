package software.amazon.event.matcher.input;

/**
 * Turns the text of one pattern value into the InputCharacters an automaton builder consumes.
 */
public interface StringValueParser {

    InputCharacter[] parse(String value);
}
