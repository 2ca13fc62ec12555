package software.amazon.event.matcher.input;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the I-Regexp (RFC 9485) subset of regular expressions: literal characters, '.', bracket classes with ranges
 * and negation, alternation, groups, and the quantifiers ?, *, +, {n}, {n,} and {n,m}. Matching is always anchored on
 * the whole value. Backreferences, lookaround, non-capturing groups and Unicode property escapes are rejected.
 */
public class RegexpParser {

    private static final RegexpParser SINGLETON = new RegexpParser();

    // bounded repetitions are unrolled into states, so nesting them multiplies
    static final int MAX_EXPANDED_SIZE = 10_000;

    // '.' matches anything but newline and carriage return
    private static final CodePointSet DOT = CodePointSet.of('\n').union(CodePointSet.of('\r')).complement();

    RegexpParser() { }

    public static RegexpParser getParser() {
        return SINGLETON;
    }

    public Regexp parse(final String value) {
        final Cursor cursor = new Cursor(value.codePoints().toArray());
        final Regexp regexp = parseAlternation(cursor);
        if (!cursor.atEnd()) {
            // the only way to stop early is an unbalanced ')'
            throw new ParseException("Unmatched ')' at pos " + cursor.pos);
        }
        if (regexp.expandedSize() > MAX_EXPANDED_SIZE) {
            throw new ParseException("Regular expression expands to more than " + MAX_EXPANDED_SIZE
                    + " character steps");
        }
        return regexp;
    }

    private Regexp parseAlternation(final Cursor cursor) {
        final List<List<Regexp.Atom>> branches = new ArrayList<>();
        branches.add(parseBranch(cursor));
        while (!cursor.atEnd() && cursor.peek() == '|') {
            cursor.next();
            branches.add(parseBranch(cursor));
        }
        return new Regexp(branches);
    }

    private List<Regexp.Atom> parseBranch(final Cursor cursor) {
        final List<Regexp.Atom> atoms = new ArrayList<>();
        while (!cursor.atEnd() && cursor.peek() != '|' && cursor.peek() != ')') {
            Regexp.Atom atom = parseAtom(cursor);
            if (!cursor.atEnd()) {
                atom = parseQuantifier(cursor, atom);
            }
            atoms.add(atom);
        }
        return atoms;
    }

    private Regexp.Atom parseAtom(final Cursor cursor) {
        final int start = cursor.pos;
        final int c = cursor.next();
        switch (c) {
            case '(':
                if (!cursor.atEnd() && cursor.peek() == '?') {
                    throw new ParseException("Lookaround and non-capturing groups are not supported at pos " + start);
                }
                final Regexp group = parseAlternation(cursor);
                if (cursor.atEnd() || cursor.next() != ')') {
                    throw new ParseException("Unclosed '(' at pos " + start);
                }
                return new Regexp.Atom(null, group, 1, 1);
            case '.':
                return new Regexp.Atom(DOT, null, 1, 1);
            case '[':
                return new Regexp.Atom(parseCharacterClass(cursor, start), null, 1, 1);
            case '\\':
                return new Regexp.Atom(parseEscape(cursor, start), null, 1, 1);
            case '*':
            case '+':
            case '?':
            case '{':
                throw new ParseException("Quantifier '" + (char) c + "' without an operand at pos " + start);
            case ']':
            case '}':
                throw new ParseException("Unescaped '" + (char) c + "' at pos " + start);
            default:
                return new Regexp.Atom(CodePointSet.of(c), null, 1, 1);
        }
    }

    private Regexp.Atom parseQuantifier(final Cursor cursor, final Regexp.Atom atom) {
        switch (cursor.peek()) {
            case '?':
                cursor.next();
                return atom.withRepetition(0, 1);
            case '*':
                cursor.next();
                return atom.withRepetition(0, Regexp.Atom.UNBOUNDED);
            case '+':
                cursor.next();
                return atom.withRepetition(1, Regexp.Atom.UNBOUNDED);
            case '{':
                final int start = cursor.pos;
                cursor.next();
                final int min = parseNumber(cursor, start);
                int max = min;
                if (!cursor.atEnd() && cursor.peek() == ',') {
                    cursor.next();
                    max = (!cursor.atEnd() && cursor.peek() == '}') ? Regexp.Atom.UNBOUNDED : parseNumber(cursor, start);
                }
                if (cursor.atEnd() || cursor.next() != '}') {
                    throw new ParseException("Unclosed quantifier at pos " + start);
                }
                if (max != Regexp.Atom.UNBOUNDED && max < min) {
                    throw new ParseException("Quantifier maximum below minimum at pos " + start);
                }
                return atom.withRepetition(min, max);
            default:
                return atom;
        }
    }

    private int parseNumber(final Cursor cursor, final int start) {
        long value = 0;
        int digits = 0;
        while (!cursor.atEnd() && cursor.peek() >= '0' && cursor.peek() <= '9') {
            value = value * 10 + (cursor.next() - '0');
            if (value > Integer.MAX_VALUE) {
                throw new ParseException("Quantifier too large at pos " + start);
            }
            digits++;
        }
        if (digits == 0) {
            throw new ParseException("Quantifier bound must be a number at pos " + start);
        }
        return (int) value;
    }

    private CodePointSet parseCharacterClass(final Cursor cursor, final int start) {
        boolean negated = false;
        if (!cursor.atEnd() && cursor.peek() == '^') {
            cursor.next();
            negated = true;
        }

        CodePointSet members = CodePointSet.empty();
        boolean first = true;
        while (true) {
            if (cursor.atEnd()) {
                throw new ParseException("Unclosed '[' at pos " + start);
            }
            int c = cursor.next();
            if (c == ']' && !first) {
                break;
            }
            first = false;
            if (c == '[') {
                throw new ParseException("Unescaped '[' inside character class at pos " + (cursor.pos - 1));
            }

            final int lo = (c == '\\') ? singleCodePoint(parseEscape(cursor, cursor.pos - 1), cursor.pos) : c;
            if (!cursor.atEnd() && cursor.peek() == '-' && cursor.pos + 1 < cursor.codePoints.length
                    && cursor.codePoints[cursor.pos + 1] != ']') {
                cursor.next();
                c = cursor.next();
                final int hi = (c == '\\') ? singleCodePoint(parseEscape(cursor, cursor.pos - 1), cursor.pos) : c;
                members = members.union(CodePointSet.range(lo, hi));
            } else if (c == '\\') {
                members = members.union(CodePointSet.of(lo));
            } else {
                members = members.union(CodePointSet.of(c));
            }
        }
        return negated ? members.complement() : members;
    }

    private static int singleCodePoint(final CodePointSet set, final int pos) {
        if (set.rangeCount() != 1 || set.rangeLow(0) != set.rangeHigh(0)) {
            throw new ParseException("Class escape can not bound a range at pos " + pos);
        }
        return set.rangeLow(0);
    }

    private CodePointSet parseEscape(final Cursor cursor, final int start) {
        if (cursor.atEnd()) {
            throw new ParseException("Trailing backslash at pos " + start);
        }
        final int c = cursor.next();
        switch (c) {
            case 'n':
                return CodePointSet.of('\n');
            case 'r':
                return CodePointSet.of('\r');
            case 't':
                return CodePointSet.of('\t');
            case '(': case ')': case '*': case '+': case '-': case '.': case '?':
            case '[': case '\\': case ']': case '^': case '{': case '|': case '}':
                return CodePointSet.of(c);
            case 'p':
            case 'P':
                throw new ParseException("Unicode property escapes are not supported at pos " + start);
            default:
                if (c >= '0' && c <= '9') {
                    throw new ParseException("Backreferences are not supported at pos " + start);
                }
                throw new ParseException("Invalid escape '\\" + new String(Character.toChars(c)) + "' at pos " + start);
        }
    }

    private static final class Cursor {
        private final int[] codePoints;
        private int pos = 0;

        Cursor(final int[] codePoints) {
            this.codePoints = codePoints;
        }

        boolean atEnd() {
            return pos >= codePoints.length;
        }

        int peek() {
            return codePoints[pos];
        }

        int next() {
            return codePoints[pos++];
        }
    }
}
