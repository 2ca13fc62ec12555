package software.amazon.event.matcher;

import javax.annotation.concurrent.Immutable;
import java.nio.charset.StandardCharsets;

/**
 * Represents the name and value of a data field in an event that the Machine will match.
 *
 * The name is the dotted path of the field; the value is held as UTF-8 bytes in event encoding, that is strings
 *  wrapped in '"' and numbers, booleans and null as their literal text. Also provided for each field is information
 *  about its position in any arrays the event may contain. This is used to guard against a pattern matching a set of
 *  fields which are in peer elements of an array, a situation which users perceive as a bug.
 *
 * Number fields also carry their canonical form, when they have one, so that numerically equal values match.
 */
@Immutable
public final class Field {
    private static final ArrayMembership NO_ARRAYS = new ArrayMembership();

    final String name;
    final byte[] val;
    final ArrayMembership arrayMembership;
    final byte[] canonicalNumber;

    Field(final String name, final String val, final ArrayMembership arrayMembership) {
        this(name, val, arrayMembership, null);
    }

    private Field(final String name, final String val, final ArrayMembership arrayMembership,
                  final byte[] canonicalNumber) {
        this.name = name;
        this.val = val.getBytes(StandardCharsets.UTF_8);
        this.arrayMembership = arrayMembership;
        this.canonicalNumber = canonicalNumber;
    }

    static Field numberField(final String name, final String number, final ArrayMembership arrayMembership) {
        return new Field(name, number, arrayMembership, ComparableNumber.canonical(number));
    }

    public static Field string(final String path, final String value) {
        return string(path, value, NO_ARRAYS);
    }

    public static Field string(final String path, final String value, final ArrayMembership arrayMembership) {
        return new Field(path, Patterns.quoted(value), new ArrayMembership(arrayMembership));
    }

    public static Field number(final String path, final String number) {
        return number(path, number, NO_ARRAYS);
    }

    public static Field number(final String path, final String number, final ArrayMembership arrayMembership) {
        return numberField(path, number, new ArrayMembership(arrayMembership));
    }

    // true, false, null
    public static Field literal(final String path, final String literal) {
        return literal(path, literal, NO_ARRAYS);
    }

    public static Field literal(final String path, final String literal, final ArrayMembership arrayMembership) {
        return new Field(path, literal, new ArrayMembership(arrayMembership));
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return new String(val, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return name + "=" + getValue() + (arrayMembership.isEmpty() ? "" : " " + arrayMembership.toString().trim());
    }
}
