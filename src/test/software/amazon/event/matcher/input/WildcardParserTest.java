package software.amazon.event.matcher.input;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class WildcardParserTest {

    private WildcardParser parser;

    @Before
    public void setup() {
        parser = new WildcardParser();
    }

    @Test
    public void testParseNoSpecialCharacters() {
        assertArrayEquals(chars(b('x'), b('y')), parser.parse("xy"));
    }

    @Test
    public void testParseLeadingAndTrailingWildcards() {
        assertArrayEquals(chars(w(), b('m'), w()), parser.parse("*m*"));
    }

    @Test
    public void testParseEscapes() {
        assertArrayEquals(chars(b('1'), b('*'), b('2')), parser.parse("1\\*2"));
        assertArrayEquals(chars(b('1'), b('\\'), w()), parser.parse("1\\\\*"));
        assertArrayEquals(chars(b('*'), w()), parser.parse("\\**"));
    }

    @Test
    public void testParseMultiByteCharacterIsSplitIntoBytes() {
        InputCharacter[] parsed = parser.parse("é*");
        assertEquals(3, parsed.length);
        assertEquals(new InputByte((byte) 0xC3), parsed[0]);
        assertEquals(new InputByte((byte) 0xA9), parsed[1]);
        assertEquals(w(), parsed[2]);
    }

    @Test
    public void testParseRejectsConsecutiveWildcards() {
        try {
            parser.parse("ab**");
            fail("Expected ParseException");
        } catch (ParseException e) {
            assertEquals("Consecutive wildcard characters at pos 2", e.getMessage());
        }
    }

    @Test
    public void testParseRejectsInvalidEscapes() {
        for (String bad : new String[] { "a\\b", "a\\" }) {
            try {
                parser.parse(bad);
                fail("Expected ParseException for " + bad);
            } catch (ParseException e) {
                assertEquals("Invalid escape character at pos 1", e.getMessage());
            }
        }
    }

    static InputCharacter[] chars(InputCharacter... characters) {
        return characters;
    }

    static InputByte b(char c) {
        return new InputByte((byte) c);
    }

    static InputWildcard w() {
        return new InputWildcard();
    }
}
