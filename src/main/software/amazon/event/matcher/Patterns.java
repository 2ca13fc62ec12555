package software.amazon.event.matcher;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The Patterns deal with pre-processing of value shapes for the eventual matching against events.
 * It has subclasses for the different match types (ValuePatterns, AnythingBut).
 * This class also acts as the factory to build patterns, which is useful if you have
 * key value pairs and would like to build your patterns directly instead of using the JSON
 * pattern language (and its compiler). Once you build them, add them via `Machine.addPattern()`.
 *
 * Event values arrive with strings wrapped in '"' characters, and numbers, booleans and null as their bare
 * literal text. The string factories below therefore take the raw string and store it in that wrapped form.
 */
public class Patterns {

    private final MatchType type;

    Patterns(final MatchType type) {
        this.type = type;
    }

    public MatchType type() {
        return type;
    }

    public static ValuePatterns exactMatch(final String value) {
        return new ValuePatterns(MatchType.EXACT, quoted(value));
    }

    public static ValuePatterns numericMatch(final String number) {
        return new ValuePatterns(MatchType.NUMERIC, number);
    }

    // true, false, null
    public static ValuePatterns literalMatch(final String literal) {
        return new ValuePatterns(MatchType.LITERAL, literal);
    }

    // the starting '"' is preserved, because that's how string field values are passed around, but there is no
    // closing one, which would break the prefix semantics
    public static ValuePatterns prefixMatch(final String prefix) {
        return new ValuePatterns(MatchType.PREFIX, '"' + prefix);
    }

    public static ValuePatterns shellStyleMatch(final String value) {
        return new ValuePatterns(MatchType.SHELL_STYLE, quoted(value));
    }

    public static ValuePatterns wildcardMatch(final String value) {
        return new ValuePatterns(MatchType.WILDCARD, quoted(value));
    }

    public static ValuePatterns equalsIgnoreCaseMatch(final String value) {
        return new ValuePatterns(MatchType.EQUALS_IGNORE_CASE, quoted(value));
    }

    // the expression applies to the string between the quotes, so it is kept as given
    public static ValuePatterns regexpMatch(final String regexp) {
        return new ValuePatterns(MatchType.REGEXP, regexp);
    }

    public static AnythingBut anythingButMatch(final String anythingBut) {
        return new AnythingBut(Collections.singleton(quoted(anythingBut)));
    }

    public static AnythingBut anythingButMatch(final Set<String> anythingButs) {
        final Set<String> values = new LinkedHashSet<>();
        for (String value : anythingButs) {
            values.add(quoted(value));
        }
        return new AnythingBut(values);
    }

    public static Patterns existencePatterns() {
        return new Patterns(MatchType.EXISTS);
    }

    public static Patterns absencePatterns() {
        return new Patterns(MatchType.ABSENT);
    }

    static String quoted(final String value) {
        return '"' + value + '"';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || !o.getClass().equals(getClass())) {
            return false;
        }

        Patterns patterns = (Patterns) o;

        return type == patterns.type;
    }

    @Override
    public int hashCode() {
        return type != null ? type.hashCode() : 0;
    }

    @Override
    public String toString() {
        return "T:" + type;
    }
}
