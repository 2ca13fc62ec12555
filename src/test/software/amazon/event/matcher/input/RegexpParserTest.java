package software.amazon.event.matcher.input;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class RegexpParserTest {

    private final RegexpParser parser = RegexpParser.getParser();

    @Test
    public void testLiteralCharacters() {
        Regexp regexp = parser.parse("ab");
        assertEquals(1, regexp.getBranches().size());
        List<Regexp.Atom> atoms = regexp.getBranches().get(0);
        assertEquals(2, atoms.size());
        assertEquals(CodePointSet.of('a'), atoms.get(0).getCharacters());
        assertEquals(CodePointSet.of('b'), atoms.get(1).getCharacters());
        assertEquals(1, atoms.get(0).getMin());
        assertEquals(1, atoms.get(0).getMax());
    }

    @Test
    public void testEmptyExpressionMatchesEmptyValue() {
        Regexp regexp = parser.parse("");
        assertEquals(1, regexp.getBranches().size());
        assertTrue(regexp.getBranches().get(0).isEmpty());
    }

    @Test
    public void testAlternationAndGroups() {
        Regexp regexp = parser.parse("a|(b|c)d");
        assertEquals(2, regexp.getBranches().size());
        Regexp.Atom group = regexp.getBranches().get(1).get(0);
        assertTrue(group.isGroup());
        assertEquals(2, group.getGroup().getBranches().size());
        assertEquals(CodePointSet.of('d'), regexp.getBranches().get(1).get(1).getCharacters());
    }

    @Test
    public void testQuantifiers() {
        assertRepetition("a?", 0, 1);
        assertRepetition("a*", 0, Regexp.Atom.UNBOUNDED);
        assertRepetition("a+", 1, Regexp.Atom.UNBOUNDED);
        assertRepetition("a{3}", 3, 3);
        assertRepetition("a{2,}", 2, Regexp.Atom.UNBOUNDED);
        assertRepetition("a{2,5}", 2, 5);
    }

    private void assertRepetition(String expression, int min, int max) {
        Regexp.Atom atom = parser.parse(expression).getBranches().get(0).get(0);
        assertEquals(expression, min, atom.getMin());
        assertEquals(expression, max, atom.getMax());
    }

    @Test
    public void testCharacterClasses() {
        CodePointSet set = parser.parse("[a-cx\\]]").getBranches().get(0).get(0).getCharacters();
        assertTrue(set.contains('a'));
        assertTrue(set.contains('b'));
        assertTrue(set.contains('x'));
        assertTrue(set.contains(']'));
        assertFalse(set.contains('d'));

        CodePointSet negated = parser.parse("[^0-9]").getBranches().get(0).get(0).getCharacters();
        assertFalse(negated.contains('5'));
        assertTrue(negated.contains('a'));
        assertTrue(negated.contains(0x1F600));

        CodePointSet dashes = parser.parse("[-a-]").getBranches().get(0).get(0).getCharacters();
        assertTrue(dashes.contains('-'));
        assertTrue(dashes.contains('a'));
        assertFalse(dashes.contains('b'));
    }

    @Test
    public void testDotAndEscapes() {
        CodePointSet dot = parser.parse(".").getBranches().get(0).get(0).getCharacters();
        assertFalse(dot.contains('\n'));
        assertFalse(dot.contains('\r'));
        assertTrue(dot.contains('\t'));
        assertTrue(dot.contains(0x10FFFF));

        List<Regexp.Atom> atoms = parser.parse("\\n\\t\\.\\*").getBranches().get(0);
        assertEquals(CodePointSet.of('\n'), atoms.get(0).getCharacters());
        assertEquals(CodePointSet.of('\t'), atoms.get(1).getCharacters());
        assertEquals(CodePointSet.of('.'), atoms.get(2).getCharacters());
        assertEquals(CodePointSet.of('*'), atoms.get(3).getCharacters());
    }

    @Test
    public void testExpansionIsBounded() {
        assertEquals(100, parser.parse("a{100}").expandedSize());
        assertEquals(6, parser.parse("(ab|c){2}").expandedSize());
        assertEquals(2, parser.parse("a+b*").expandedSize());
        parser.parse("(a{100}){100}");

        String limit = "Regular expression expands to more than " + RegexpParser.MAX_EXPANDED_SIZE + " character steps";
        assertRejected("(((a{100}){100}){100}){100}", limit);
        assertRejected("((a{2147483647}){2147483647}){2147483647}", limit);
        assertRejected("(a{101}){100}", limit);
    }

    @Test
    public void testUnsupportedSyntaxIsRejected() {
        assertRejected("(?=a)", "Lookaround and non-capturing groups are not supported at pos 0");
        assertRejected("(a)\\1", "Backreferences are not supported at pos 3");
        assertRejected("\\p{Lu}", "Unicode property escapes are not supported at pos 0");
        assertRejected("\\d", "Invalid escape '\\d' at pos 0");
        assertRejected("a)", "Unmatched ')' at pos 1");
        assertRejected("(a", "Unclosed '(' at pos 0");
        assertRejected("[ab", "Unclosed '[' at pos 0");
        assertRejected("*a", "Quantifier '*' without an operand at pos 0");
        assertRejected("a]", "Unescaped ']' at pos 1");
        assertRejected("a{3,1}", "Quantifier maximum below minimum at pos 1");
        assertRejected("a{x}", "Quantifier bound must be a number at pos 1");
        assertRejected("[z-a]", "Invalid character range z-a");
        assertRejected("a\\", "Trailing backslash at pos 1");
    }

    private void assertRejected(String expression, String message) {
        try {
            parser.parse(expression);
            fail("Expected ParseException for " + expression);
        } catch (ParseException e) {
            assertEquals(message, e.getMessage());
        }
    }
}
