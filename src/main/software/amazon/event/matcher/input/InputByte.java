package software.amazon.event.matcher.input;

import static software.amazon.event.matcher.input.InputCharacterType.BYTE;

/**
 * A plain byte of a pattern value, matched literally.
 */
public class InputByte extends InputCharacter {

    private final byte value;

    InputByte(final byte value) {
        this.value = value;
    }

    public static InputByte cast(InputCharacter character) {
        return (InputByte) character;
    }

    /** The byte as a transition index in 0..255. */
    public int unsigned() {
        return value & 0xFF;
    }

    @Override
    public InputCharacterType getType() {
        return BYTE;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof InputByte && ((InputByte) o).value == value;
    }

    @Override
    public int hashCode() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("0x%02X", unsigned());
    }
}
