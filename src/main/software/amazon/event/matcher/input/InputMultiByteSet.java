package software.amazon.event.matcher.input;

import java.util.Collections;
import java.util.Set;

import static software.amazon.event.matcher.input.InputCharacterType.MULTI_BYTE_SET;

/**
 * Alternative byte sequences for one position of a pattern value; a value matches here if it continues with any
 * one of them. The sequences may differ in length.
 */
public class InputMultiByteSet extends InputCharacter {

    private final Set<MultiByte> alternatives;

    InputMultiByteSet(final Set<MultiByte> alternatives) {
        this.alternatives = Collections.unmodifiableSet(alternatives);
    }

    public static InputMultiByteSet cast(InputCharacter character) {
        return (InputMultiByteSet) character;
    }

    public Set<MultiByte> getMultiBytes() {
        return alternatives;
    }

    @Override
    public InputCharacterType getType() {
        return MULTI_BYTE_SET;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof InputMultiByteSet && ((InputMultiByteSet) o).alternatives.equals(alternatives);
    }

    @Override
    public int hashCode() {
        return alternatives.hashCode();
    }

    @Override
    public String toString() {
        return "oneOf" + alternatives;
    }
}
