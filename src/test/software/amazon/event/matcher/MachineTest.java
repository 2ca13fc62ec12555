package software.amazon.event.matcher;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;
import software.amazon.event.matcher.input.ParseException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class MachineTest {

    private static Map<String, List<Patterns>> pattern(Object... pathsAndShapes) {
        Map<String, List<Patterns>> pattern = new HashMap<>();
        for (int i = 0; i < pathsAndShapes.length; i += 2) {
            pattern.computeIfAbsent((String) pathsAndShapes[i], k -> new ArrayList<>())
                    .add((Patterns) pathsAndShapes[i + 1]);
        }
        return pattern;
    }

    @Test
    public void testExactMatch() {
        Machine machine = new Machine();
        machine.addPattern("r1", pattern("x", Patterns.exactMatch("S")));

        assertEquals(Collections.singleton("r1"), machine.matchesForFields(Collections.singletonList(Field.string("x", "S"))));
        assertThat(machine.matchesForFields(Collections.singletonList(Field.string("x", "S2"))), empty());
        assertThat(machine.matchesForFields(Collections.singletonList(Field.string("y", "S"))), empty());
        assertThat(machine.matchesForFields(Collections.singletonList(Field.number("x", "3"))), empty());
    }

    @Test
    public void testMultipleFieldsMustAllMatch() throws Exception {
        Machine machine = new Machine();
        machine.addPattern("r1", "{ \"source\": [\"orders\"], \"detail\": { \"state\": [\"shipped\", \"lost\"] } }");

        assertThat(machine.matchesForJSONEvent("{\"source\": \"orders\", \"detail\": {\"state\": \"lost\"}}"),
                containsInAnyOrder("r1"));
        assertThat(machine.matchesForJSONEvent("{\"source\": \"orders\", \"detail\": {\"state\": \"new\"}}"),
                empty());
        assertThat(machine.matchesForJSONEvent("{\"detail\": {\"state\": \"lost\"}}"), empty());
        assertThat(machine.matchesForJSONEvent(new ObjectMapper().readTree(
                "{\"extra\": 1, \"source\": \"orders\", \"detail\": {\"state\": \"shipped\", \"x\": [1]}}")),
                containsInAnyOrder("r1"));
    }

    @Test
    public void testFieldsMayBeGivenUnsorted() {
        Machine machine = new Machine();
        machine.addPattern("r1", pattern("a", Patterns.exactMatch("1"), "b", Patterns.exactMatch("2")));

        assertThat(machine.matchesForFields(Arrays.asList(Field.string("b", "2"), Field.string("a", "1"))),
                containsInAnyOrder("r1"));
    }

    @Test
    public void testOrderOfAdditionDoesNotMatter() throws Exception {
        String[] patterns = {
                "{ \"x\": [ \"foo\" ] }",
                "{ \"x\": [ { \"prefix\": \"fo\" } ] }",
                "{ \"x\": [ { \"anything-but\": \"foot\" } ] }",
                "{ \"x\": [ { \"wildcard\": \"*o*\" } ], \"y\": [ 1 ] }",
                "{ \"x\": [ { \"regexp\": \"f[aeiou]+\" } ] }",
                "{ \"x\": [ { \"equals-ignore-case\": \"FOO\" } ] }"
        };
        String[] events = {
                "{ \"x\": \"foo\" }",
                "{ \"x\": \"foot\", \"y\": 1 }",
                "{ \"x\": \"FOO\" }",
                "{ \"x\": \"bar\" }",
                "{ \"x\": \"fa\", \"y\": 2 }",
                "{ \"y\": 1 }"
        };

        Machine forward = new Machine();
        Machine backward = new Machine();
        for (int i = 0; i < patterns.length; i++) {
            forward.addPattern("p" + i, patterns[i]);
            backward.addPattern("p" + (patterns.length - 1 - i), patterns[patterns.length - 1 - i]);
        }
        for (String event : events) {
            assertEquals(event, forward.matchesForJSONEvent(event), backward.matchesForJSONEvent(event));
        }
        assertThat(forward.matchesForJSONEvent(events[0]), containsInAnyOrder("p0", "p1", "p2", "p4", "p5"));
        assertThat(forward.matchesForJSONEvent(events[1]), containsInAnyOrder("p1", "p3"));
        assertThat(forward.matchesForJSONEvent(events[3]), containsInAnyOrder("p2"));
    }

    @Test
    public void testAnythingButSet() {
        Machine machine = new Machine();
        machine.addPattern("r1", pattern("x", Patterns.anythingButMatch(new HashSet<>(Arrays.asList("a", "b")))));

        assertThat(matches(machine, "x", "ab"), containsInAnyOrder("r1"));
        assertThat(matches(machine, "x", "c"), containsInAnyOrder("r1"));
        assertThat(matches(machine, "x", "a"), empty());
        assertThat(matches(machine, "x", "b"), empty());
        assertThat(machine.matchesForFields(Collections.emptyList()), empty());
    }

    @Test
    public void testAnythingButAndLiteralOnOneField() {
        Machine machine = new Machine();
        machine.addPattern("notFoot", pattern("x", Patterns.anythingButMatch("foot")));
        machine.addPattern("foo", pattern("x", Patterns.exactMatch("foo")));

        assertThat(matches(machine, "x", "foo"), containsInAnyOrder("notFoot", "foo"));
        assertThat(matches(machine, "x", "foot"), empty());
        assertThat(matches(machine, "x", "fo"), containsInAnyOrder("notFoot"));
    }

    @Test
    public void testPrefix() {
        Machine machine = new Machine();
        machine.addPattern("r1", pattern("x", Patterns.prefixMatch("AC")));

        assertThat(matches(machine, "x", "ACME"), containsInAnyOrder("r1"));
        assertThat(matches(machine, "x", "AC"), containsInAnyOrder("r1"));
        assertThat(matches(machine, "x", "AB"), empty());
    }

    @Test
    public void testGlob() {
        Machine machine = new Machine();
        machine.addPattern("r1", pattern("x", Patterns.shellStyleMatch("*ab*")));

        assertThat(matches(machine, "x", "xaby"), containsInAnyOrder("r1"));
        assertThat(matches(machine, "x", "ab"), containsInAnyOrder("r1"));
        assertThat(matches(machine, "x", "a b"), empty());
        assertThat(matches(machine, "x", "ba"), empty());
    }

    @Test
    public void testRegexp() throws Exception {
        Machine machine = new Machine();
        machine.addPattern("r1", "{ \"id\": [ { \"regexp\": \"[A-Z]{2}-[0-9]+(-x)?\" } ] }");

        assertThat(matches(machine, "id", "AB-12"), containsInAnyOrder("r1"));
        assertThat(matches(machine, "id", "AB-12-x"), containsInAnyOrder("r1"));
        assertThat(matches(machine, "id", "AB-12-y"), empty());
        assertThat(matches(machine, "id", "ab-12"), empty());
        assertThat(machine.matchesForJSONEvent("{ \"id\": 12 }"), empty());
    }

    @Test
    public void testEqualsIgnoreCase() {
        Machine machine = new Machine();
        machine.addPattern("r1", pattern("x", Patterns.equalsIgnoreCaseMatch("Straße")));

        assertThat(matches(machine, "x", "STRAßE"), containsInAnyOrder("r1"));
        assertThat(matches(machine, "x", "straße"), containsInAnyOrder("r1"));
        assertThat(matches(machine, "x", "strasse"), empty());
    }

    @Test
    public void testNumbersAndLiterals() throws Exception {
        Machine machine = new Machine();
        machine.addPattern("r1", "{ \"n\": [ 42 ], \"b\": [ true ], \"z\": [ null ] }");

        assertThat(machine.matchesForJSONEvent("{ \"n\": 42, \"b\": true, \"z\": null }"), containsInAnyOrder("r1"));
        assertThat(machine.matchesForJSONEvent("{ \"n\": \"42\", \"b\": true, \"z\": null }"), empty());
        assertThat(machine.matchesForJSONEvent("{ \"n\": 42, \"b\": \"true\", \"z\": null }"), empty());
        assertThat(machine.matchesForJSONEvent("{ \"n\": 42.0, \"b\": true, \"z\": null }"),
                containsInAnyOrder("r1"));
        assertThat(machine.matchesForJSONEvent("{ \"n\": 42.5, \"b\": true, \"z\": null }"), empty());
    }

    @Test
    public void testNumericallyEqualNumbersMatch() throws Exception {
        Machine machine = new Machine();
        machine.addPattern("r35", "{ \"x\": [ 35 ] }");
        machine.addPattern("rNeg", "{ \"x\": [ -0.25 ] }");

        for (String same : Arrays.asList("35", "35.0", "3.5e1", "350E-1", "35.00000")) {
            assertThat(same, machine.matchesForJSONEvent("{ \"x\": " + same + " }"), containsInAnyOrder("r35"));
            assertThat(same, machine.matchesForFields(Collections.singletonList(Field.number("x", same))),
                    containsInAnyOrder("r35"));
        }
        assertThat(machine.matchesForJSONEvent("{ \"x\": -2.5e-1 }"), containsInAnyOrder("rNeg"));
        assertThat(machine.matchesForJSONEvent("{ \"x\": 35.000001 }"), empty());
        assertThat(machine.matchesForJSONEvent("{ \"x\": \"35\" }"), empty());
    }

    @Test
    public void testNumbersWithoutCanonicalFormMatchByText() throws Exception {
        Machine machine = new Machine();
        // more digits than a double holds
        machine.addPattern("big", "{ \"x\": [ 123456789012345678901234567890 ] }");

        assertThat(machine.matchesForJSONEvent("{ \"x\": 123456789012345678901234567890 }"),
                containsInAnyOrder("big"));
        assertThat(machine.matchesForJSONEvent("{ \"x\": 1.23456789012345678901234567890e29 }"), empty());
    }

    @Test
    public void testStringAndTreeEntryPointsAgreeOnNumbers() throws Exception {
        Machine machine = new Machine();
        machine.addPattern("r1", "{ \"x\": [ 1.50 ], \"y\": [ 1e2 ] }");

        String event = "{ \"x\": 1.50, \"y\": 100 }";
        assertThat(machine.matchesForJSONEvent(event), containsInAnyOrder("r1"));
        assertThat(machine.matchesForJSONEvent(new ObjectMapper().readTree(event)), containsInAnyOrder("r1"));

        String other = "{ \"x\": 1.5, \"y\": 100.0 }";
        assertEquals(machine.matchesForJSONEvent(other), machine.matchesForJSONEvent(new ObjectMapper().readTree(other)));
    }

    @Test
    public void testArrayConsistency() throws Exception {
        Machine machine = new Machine();
        machine.addPattern("wata-guitar",
                "{ \"bands\": { \"members\": { \"given\": [ \"Wata\" ], \"role\": [ \"guitar\" ] } } }");

        String mixed = "{ \"bands\": [ { \"name\": \"Boris\", \"members\": [" +
                "  { \"given\": \"Wata\", \"role\": \"drums\" }," +
                "  { \"given\": \"Atsuo\", \"role\": \"guitar\" } ] } ] }";
        String same = "{ \"bands\": [ { \"name\": \"Boris\", \"members\": [" +
                "  { \"given\": \"Atsuo\", \"role\": \"drums\" }," +
                "  { \"given\": \"Wata\", \"role\": \"guitar\" } ] } ] }";
        String acrossBands = "{ \"bands\": [" +
                "  { \"members\": [ { \"given\": \"Wata\", \"role\": \"bass\" } ] }," +
                "  { \"members\": [ { \"given\": \"Takeshi\", \"role\": \"guitar\" } ] } ] }";

        assertThat(machine.matchesForJSONEvent(mixed), empty());
        assertThat(machine.matchesForJSONEvent(same), containsInAnyOrder("wata-guitar"));
        assertThat(machine.matchesForJSONEvent(acrossBands), empty());
    }

    @Test
    public void testArrayConsistencyWithCallerFields() {
        Machine machine = new Machine();
        machine.addPattern("r1", pattern("m.given", Patterns.exactMatch("Wata"),
                "m.role", Patterns.exactMatch("guitar")));

        List<Field> apart = Arrays.asList(
                Field.string("m.given", "Wata", new ArrayMembership().putMembership(0, 0)),
                Field.string("m.role", "guitar", new ArrayMembership().putMembership(0, 1)));
        List<Field> together = Arrays.asList(
                Field.string("m.given", "Wata", new ArrayMembership().putMembership(0, 1)),
                Field.string("m.role", "guitar", new ArrayMembership().putMembership(0, 1)));

        assertThat(machine.matchesForFields(apart), empty());
        assertThat(machine.matchesForFields(together), containsInAnyOrder("r1"));

        machine.addPattern("r2", pattern("m.given", Patterns.exactMatch("Wata"),
                "m.active", Patterns.literalMatch("true")));
        List<Field> literalApart = Arrays.asList(
                Field.string("m.given", "Wata", new ArrayMembership().putMembership(0, 0)),
                Field.literal("m.active", "true", new ArrayMembership().putMembership(0, 1)));
        List<Field> literalTogether = Arrays.asList(
                Field.string("m.given", "Wata", new ArrayMembership().putMembership(0, 1)),
                Field.literal("m.active", "true", new ArrayMembership().putMembership(0, 1)));

        assertThat(machine.matchesForFields(literalApart), empty());
        assertThat(machine.matchesForFields(literalTogether), containsInAnyOrder("r2"));
    }

    @Test
    public void testExists() throws Exception {
        Machine machine = new Machine();
        machine.addPattern("hasA", "{ \"a\": [ { \"exists\": true } ], \"k\": [ \"v\" ] }");

        assertThat(machine.matchesForJSONEvent("{ \"a\": { \"deep\": 1 }, \"k\": \"v\" }"), empty());
        assertThat(machine.matchesForJSONEvent("{ \"a\": 1, \"k\": \"v\" }"), containsInAnyOrder("hasA"));
        assertThat(machine.matchesForJSONEvent("{ \"a\": [ 1, 2 ], \"k\": \"v\" }"), containsInAnyOrder("hasA"));
        assertThat(machine.matchesForJSONEvent("{ \"k\": \"v\" }"), empty());
    }

    @Test
    public void testExistsFalseWherePathSortsFirstMiddleAndLast() throws Exception {
        Machine machine = new Machine();
        machine.addPattern("noA", "{ \"a\": [ { \"exists\": false } ], \"m\": [ \"v\" ] }");
        machine.addPattern("noN", "{ \"n\": [ { \"exists\": false } ], \"m\": [ \"v\" ] }");
        machine.addPattern("noZ", "{ \"z\": [ { \"exists\": false } ], \"m\": [ \"v\" ] }");

        assertThat(machine.matchesForJSONEvent("{ \"m\": \"v\" }"), containsInAnyOrder("noA", "noN", "noZ"));
        assertThat(machine.matchesForJSONEvent("{ \"a\": 1, \"m\": \"v\" }"), containsInAnyOrder("noN", "noZ"));
        assertThat(machine.matchesForJSONEvent("{ \"m\": \"v\", \"n\": \"x\" }"), containsInAnyOrder("noA", "noZ"));
        assertThat(machine.matchesForJSONEvent("{ \"m\": \"v\", \"z\": [ false ] }"),
                containsInAnyOrder("noA", "noN"));
        assertThat(machine.matchesForJSONEvent("{ \"m\": \"w\" }"), empty());
    }

    @Test
    public void testExistsFalseAloneMatchesEmptyEvent() throws Exception {
        Machine machine = new Machine();
        machine.addPattern("noZ", pattern("z", Patterns.absencePatterns()));

        assertThat(machine.matchesForFields(Collections.emptyList()), containsInAnyOrder("noZ"));
        assertThat(machine.matchesForJSONEvent("{}"), containsInAnyOrder("noZ"));
        assertThat(machine.matchesForJSONEvent("{ \"a\": 1 }"), containsInAnyOrder("noZ"));
        assertThat(machine.matchesForJSONEvent("{ \"z\": \"anything\" }"), empty());
    }

    @Test
    public void testExistsFalseInsideArrays() throws Exception {
        Machine machine = new Machine();
        machine.addPattern("r1", "{ \"items\": { \"id\": [ 1 ], \"gone\": [ { \"exists\": false } ] } }");

        assertThat(machine.matchesForJSONEvent("{ \"items\": [ { \"id\": 1 }, { \"id\": 2 } ] }"),
                containsInAnyOrder("r1"));
        // present anywhere in the event defeats the absence
        assertThat(machine.matchesForJSONEvent("{ \"items\": [ { \"id\": 1 }, { \"id\": 2, \"gone\": 0 } ] }"),
                empty());
    }

    @Test
    public void testIdempotence() {
        Machine machine = new Machine();
        machine.addPattern("r1", pattern("x", Patterns.exactMatch("a")));
        int objects = machine.approximateObjectCount(10000);
        machine.addPattern("r1", pattern("x", Patterns.exactMatch("a")));
        machine.addPattern("r2", pattern("x", Patterns.wildcardMatch("*a*")));
        int withWildcard = machine.approximateObjectCount(10000);
        machine.addPattern("r2", pattern("x", Patterns.wildcardMatch("*a*")));

        assertEquals(withWildcard, machine.approximateObjectCount(10000));
        assertTrue(withWildcard > objects);
        Set<String> matched = machine.matchesForFields(Collections.singletonList(Field.string("x", "a")));
        assertEquals(new HashSet<>(Arrays.asList("r1", "r2")), matched);
    }

    @Test
    public void testSamePatternNameWithTwoPatternsMatchesEither() {
        Machine machine = new Machine();
        machine.addPattern("r1", pattern("x", Patterns.exactMatch("a")));
        machine.addPattern("r1", pattern("y", Patterns.exactMatch("b")));

        assertThat(matches(machine, "x", "a"), containsInAnyOrder("r1"));
        assertThat(matches(machine, "y", "b"), containsInAnyOrder("r1"));
        assertThat(machine.matchesForFields(Arrays.asList(Field.string("x", "a"), Field.string("y", "b"))),
                containsInAnyOrder("r1"));
    }

    @Test
    public void testRandomLiterals() {
        Random random = new Random(42);
        Machine machine = new Machine();
        Set<String> values = new HashSet<>();
        while (values.size() < 2000) {
            values.add(randomString(random));
        }
        for (String value : values) {
            machine.addPattern("p-" + value, pattern("f", Patterns.exactMatch(value)));
        }

        for (String value : values) {
            assertEquals(Collections.singleton("p-" + value), matches(machine, "f", value));
        }
        int misses = 0;
        while (misses < 500) {
            String value = randomString(random);
            if (!values.contains(value)) {
                assertThat(value, matches(machine, "f", value), empty());
                misses++;
            }
        }
    }

    private static String randomString(Random random) {
        int length = 1 + random.nextInt(12);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < length; i++) {
            switch (random.nextInt(4)) {
                case 0:
                    sb.append((char) ('à' + random.nextInt(20)));
                    break;
                case 1:
                    sb.append((char) ('0' + random.nextInt(10)));
                    break;
                default:
                    sb.append((char) ('a' + random.nextInt(26)));
                    break;
            }
        }
        return sb.toString();
    }

    @Test
    public void testRejectedPatternsLeaveMachineUnchanged() {
        Machine machine = new Machine();
        machine.addPattern("good", pattern("x", Patterns.exactMatch("a")));
        int objects = machine.approximateObjectCount(10000);

        Map<String, List<Patterns>> noValues = Collections.singletonMap("x", Collections.emptyList());
        Map<String, List<Patterns>> noFields = Collections.emptyMap();
        List<Map<String, List<Patterns>>> bad = Arrays.asList(
                pattern("x", Patterns.exactMatch("b"), "y", Patterns.wildcardMatch("a**")),
                pattern("x", Patterns.exactMatch("b"), "y", Patterns.regexpMatch("(a")),
                pattern("x", Patterns.exactMatch("b"), "y", Patterns.regexpMatch("(((a{100}){100}){100}){100}")),
                pattern("x", Patterns.exactMatch("b"), "y", Patterns.anythingButMatch(Collections.emptySet())),
                pattern("x", Patterns.exactMatch("b"), "x", Patterns.existencePatterns()),
                pattern("x", Patterns.anythingButMatch("b"), "x", Patterns.exactMatch("c")),
                pattern("x", Patterns.regexpMatch("b"), "x", Patterns.exactMatch("c")),
                noValues,
                noFields
        );
        for (Map<String, List<Patterns>> pattern : bad) {
            try {
                machine.addPattern("bad", pattern);
                fail("Expected rejection of " + pattern);
            } catch (IllegalArgumentException | ParseException e) {
                // expected
            }
        }
        try {
            machine.addPattern(null, pattern("x", Patterns.exactMatch("b")));
            fail("Expected rejection of null name");
        } catch (IllegalArgumentException e) {
            // expected
        }

        assertEquals(objects, machine.approximateObjectCount(10000));
        assertThat(matches(machine, "x", "b"), empty());
        assertThat(matches(machine, "x", "a"), containsInAnyOrder("good"));
    }

    @Test
    public void testBadJsonPatternIsRejected() {
        Machine machine = new Machine();
        try {
            machine.addPattern("bad", "{ \"x\": [ { \"regexp\": \"a{\" } ] }");
            fail("Expected IOException");
        } catch (IOException e) {
            assertTrue(machine.isEmpty());
        }
    }

    @Test
    public void testEmptyMachine() throws Exception {
        Machine machine = new Machine();
        assertTrue(machine.isEmpty());
        assertThat(machine.matchesForJSONEvent("{ \"a\": 1 }"), empty());
        machine.addPattern("r1", pattern("a", Patterns.numericMatch("1")));
        assertFalse(machine.isEmpty());
        assertThat(machine.matchesForJSONEvent("{ \"a\": 1 }"), containsInAnyOrder("r1"));
    }

    private static Set<String> matches(Machine machine, String path, String value) {
        return machine.matchesForFields(Collections.singletonList(Field.string(path, value)));
    }
}
