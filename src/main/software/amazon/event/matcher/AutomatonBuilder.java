package software.amazon.event.matcher;

import software.amazon.event.matcher.input.CodePointSet;
import software.amazon.event.matcher.input.DefaultParser;
import software.amazon.event.matcher.input.InputByte;
import software.amazon.event.matcher.input.InputCharacter;
import software.amazon.event.matcher.input.InputCharacterType;
import software.amazon.event.matcher.input.InputMultiByteSet;
import software.amazon.event.matcher.input.MultiByte;
import software.amazon.event.matcher.input.Regexp;
import software.amazon.event.matcher.input.RegexpParser;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the automaton fragment for one value shape. Every fragment has a single start state and ends in states whose
 * terminal is the target FieldMatcher. Apart from prefixes, which accept as soon as their bytes are consumed, the
 * target is only reached through the VALUE_TERMINATOR pseudo-byte, so a fragment never accepts a value that has bytes
 * left over.
 */
final class AutomatonBuilder {

    /**
     * Marks the end of a value. 0xF5 never occurs in well-formed UTF-8.
     */
    static final int VALUE_TERMINATOR = 0xF5;

    private static final int QUOTE = '"';

    private AutomatonBuilder() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    static ByteState build(final Patterns pattern, final FieldMatcher target) {
        switch (pattern.type()) {
            case EXACT:
            case LITERAL:
                return literal(((ValuePatterns) pattern).patternBytes(), target);
            case NUMERIC:
                return number(((ValuePatterns) pattern).pattern(), target);
            case PREFIX:
                return prefix(((ValuePatterns) pattern).patternBytes(), target);
            case SHELL_STYLE:
            case WILDCARD:
            case EQUALS_IGNORE_CASE:
                final InputCharacter[] characters =
                        DefaultParser.getParser().parse(pattern.type(), ((ValuePatterns) pattern).pattern());
                return fromInputCharacters(characters, target);
            case ANYTHING_BUT:
                return anythingBut(((AnythingBut) pattern).getValues(), target);
            case REGEXP:
                return regexp(RegexpParser.getParser().parse(((ValuePatterns) pattern).pattern()), target);
            default:
                throw new IllegalArgumentException("No automaton for match type " + pattern.type());
        }
    }

    static ByteState literal(final byte[] value, final FieldMatcher target) {
        final ByteState last = new ByteState();
        last.setMap(ByteMap.empty().with(VALUE_TERMINATOR, ByteState.acceptState(target)));
        return chain(value, value.length, last);
    }

    /*
     * A number is accepted by its text and, when it has one, by its canonical form.
     */
    static ByteState number(final String number, final FieldMatcher target) {
        final ByteState byText = literal(number.getBytes(StandardCharsets.UTF_8), target);
        final byte[] canonical = ComparableNumber.canonical(number);
        return canonical == null ? byText : AutomatonMerger.merge(byText, literal(canonical, target));
    }

    static ByteState prefix(final byte[] prefix, final FieldMatcher target) {
        return chain(prefix, prefix.length, ByteState.acceptState(target));
    }

    // built right-to-left so that no frame is spent per byte
    private static ByteState chain(final byte[] bytes, final int length, final ByteState end) {
        ByteState next = end;
        for (int i = length - 1; i >= 0; i--) {
            final ByteState state = new ByteState();
            state.setMap(ByteMap.empty().with(bytes[i] & 0xFF, next));
            next = state;
        }
        return next;
    }

    /**
     * Builds from parsed characters: plain bytes chain along, a multi-byte set fans out into alternative byte
     * sequences that converge again on the following state, and a wildcard becomes a spinner that loops on every byte
     * and escapes on the first byte of the following character.
     */
    static ByteState fromInputCharacters(final InputCharacter[] characters, final FieldMatcher target) {
        final ByteState start = new ByteState();
        ByteState state = start;

        for (int i = 0; i < characters.length; i++) {
            final InputCharacter character = characters[i];
            if (character.getType() == InputCharacterType.BYTE) {
                final ByteState next = new ByteState();
                state.setMap(state.getMap().with(InputByte.cast(character).unsigned(), next));
                state = next;

            } else if (character.getType() == InputCharacterType.MULTI_BYTE_SET) {
                final ByteState next = new ByteState();
                for (MultiByte multiByte : InputMultiByteSet.cast(character).getMultiBytes()) {
                    addAlternative(state, multiByte, next);
                }
                state = next;

            } else {
                final ByteState spinner = state;
                spinner.setMap(ByteMap.allTo(spinner));
                if (i + 1 == characters.length) {
                    break;
                }
                final InputCharacter following = characters[++i];
                if (following.getType() != InputCharacterType.BYTE) {
                    throw new IllegalStateException("A wildcard must be followed by a plain byte, not " + following);
                }
                final ByteState spinEscape = new ByteState();
                spinEscape.addEpsilon(spinner);
                spinner.setMap(spinner.getMap().with(InputByte.cast(following).unsigned(), spinEscape));
                state = spinEscape;
            }
        }

        state.setMap(state.getMap().with(VALUE_TERMINATOR, ByteState.acceptState(target)));
        return start;
    }

    // threads one byte sequence from 'from' to 'to', sharing intermediate states with earlier alternatives
    private static void addAlternative(final ByteState from, final MultiByte multiByte, final ByteState to) {
        ByteState state = from;
        for (int i = 0; i < multiByte.length(); i++) {
            final int utf8byte = multiByte.byteAt(i) & 0xFF;
            final ByteState existing = state.step(utf8byte);
            final boolean last = i == multiByte.length() - 1;

            if (last) {
                if (existing == null) {
                    state.setMap(state.getMap().with(utf8byte, to));
                } else if (existing != to) {
                    // a longer alternative already passes through here
                    existing.addEpsilon(to);
                }
            } else if (existing == null || existing == to) {
                final ByteState intermediate = new ByteState();
                if (existing == to) {
                    // a shorter alternative already ends here
                    intermediate.addEpsilon(to);
                }
                state.setMap(state.getMap().with(utf8byte, intermediate));
                state = intermediate;
            } else {
                state = existing;
            }
        }
    }

    /**
     * Builds one combined automaton for a whole set of excluded values. There is one table per depth: bytes that
     * continue some excluded value lead to the next depth, every other byte leads straight to success. Where an
     * excluded value ends, the value terminator leads nowhere. Building the automata per value and merging them would
     * give the union, "anything but A OR anything but B", which accepts everything.
     */
    static ByteState anythingBut(final Set<String> values, final FieldMatcher target) {
        final ByteState success = ByteState.acceptState(target);
        final List<byte[]> excluded = new ArrayList<>(values.size());
        for (String value : values) {
            excluded.add(value.getBytes(StandardCharsets.UTF_8));
        }

        final ByteState start = new ByteState();
        final Deque<Depth> pending = new ArrayDeque<>();
        pending.push(new Depth(start, excluded, 0, false));

        while (!pending.isEmpty()) {
            final Depth depth = pending.pop();
            final TreeMap<Integer, List<byte[]>> continuing = new TreeMap<>();
            final TreeSet<Integer> ending = new TreeSet<>();
            for (byte[] value : depth.values) {
                final int utf8byte = value[depth.index] & 0xFF;
                final List<byte[]> bucket = continuing.computeIfAbsent(utf8byte, k -> new ArrayList<>());
                if (depth.index == value.length - 1) {
                    ending.add(utf8byte);
                } else {
                    bucket.add(value);
                }
            }

            final ByteState[] unpacked = new ByteState[ByteMap.BYTE_CEILING];
            Arrays.fill(unpacked, success);
            if (depth.valueEndsHere) {
                unpacked[VALUE_TERMINATOR] = null;
            }
            for (Integer utf8byte : continuing.keySet()) {
                final ByteState child = new ByteState();
                unpacked[utf8byte] = child;
                pending.push(new Depth(child, continuing.get(utf8byte), depth.index + 1, ending.contains(utf8byte)));
            }
            depth.state.setMap(ByteMap.pack(unpacked));
        }
        return start;
    }

    private static final class Depth {
        final ByteState state;
        final List<byte[]> values;
        final int index;
        final boolean valueEndsHere;

        Depth(final ByteState state, final List<byte[]> values, final int index, final boolean valueEndsHere) {
            this.state = state;
            this.values = values;
            this.index = index;
            this.valueEndsHere = valueEndsHere;
        }
    }

    /**
     * Thompson construction of a regular expression between the opening and closing quote of a string value.
     */
    static ByteState regexp(final Regexp regexp, final FieldMatcher target) {
        final ByteState closed = new ByteState();
        closed.setMap(ByteMap.empty().with(VALUE_TERMINATOR, ByteState.acceptState(target)));
        final ByteState afterBody = new ByteState();
        afterBody.setMap(ByteMap.empty().with(QUOTE, closed));

        final ByteState body = alternation(regexp, afterBody);
        final ByteState start = new ByteState();
        start.setMap(ByteMap.empty().with(QUOTE, body));
        return start;
    }

    private static ByteState alternation(final Regexp regexp, final ByteState next) {
        final List<List<Regexp.Atom>> branches = regexp.getBranches();
        if (branches.size() == 1) {
            return branch(branches.get(0), next);
        }
        final ByteState fork = new ByteState();
        for (List<Regexp.Atom> atoms : branches) {
            fork.addEpsilon(branch(atoms, next));
        }
        return fork;
    }

    private static ByteState branch(final List<Regexp.Atom> atoms, final ByteState next) {
        ByteState state = next;
        for (int i = atoms.size() - 1; i >= 0; i--) {
            state = repeated(atoms.get(i), state);
        }
        return state;
    }

    private static ByteState repeated(final Regexp.Atom atom, final ByteState next) {
        ByteState state = next;
        if (atom.getMax() == Regexp.Atom.UNBOUNDED) {
            final ByteState loop = new ByteState();
            loop.addEpsilon(next);
            loop.addEpsilon(atom(atom, loop));
            state = loop;
        } else {
            for (int i = atom.getMin(); i < atom.getMax(); i++) {
                final ByteState optional = new ByteState();
                optional.addEpsilon(atom(atom, state));
                optional.addEpsilon(state);
                state = optional;
            }
        }
        for (int i = 0; i < atom.getMin(); i++) {
            state = atom(atom, state);
        }
        return state;
    }

    private static ByteState atom(final Regexp.Atom atom, final ByteState next) {
        return atom.isGroup() ? alternation(atom.getGroup(), next) : characters(atom.getCharacters(), next);
    }

    /**
     * Every code point range is cut into runs of UTF-8 sequences with per-position byte ranges, each run becomes a
     * chain to 'next', and the chains are merged, which takes care of runs sharing leading bytes.
     */
    private static ByteState characters(final CodePointSet characters, final ByteState next) {
        ByteState start = null;
        for (int r = 0; r < characters.rangeCount(); r++) {
            for (int[][] sequence : utf8Sequences(characters.rangeLow(r), characters.rangeHigh(r))) {
                ByteState state = next;
                for (int i = sequence.length - 1; i >= 0; i--) {
                    final ByteState previous = new ByteState();
                    previous.setMap(ByteMap.empty().withRange(sequence[i][0], sequence[i][1], state));
                    state = previous;
                }
                start = (start == null) ? state : AutomatonMerger.merge(start, state);
            }
        }
        return start == null ? new ByteState() : start;
    }

    /**
     * Splits a code point range into sequences of byte ranges, such that the UTF-8 encodings of exactly the code
     * points in the range are the byte strings matching one of the sequences.
     */
    static List<int[][]> utf8Sequences(final int low, final int high) {
        final List<int[][]> sequences = new ArrayList<>();
        final Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[] { low, high });

        nextRange:
        while (!pending.isEmpty()) {
            final int[] range = pending.pop();
            final int start = range[0];
            final int end = range[1];

            // split at encoded-length boundaries
            for (int boundary : new int[] { 0x7F, 0x7FF, 0xFFFF }) {
                if (start <= boundary && end > boundary) {
                    pending.push(new int[] { boundary + 1, end });
                    pending.push(new int[] { start, boundary });
                    continue nextRange;
                }
            }
            if (end <= 0x7F) {
                sequences.add(new int[][] { { start, end } });
                continue;
            }

            // split until all but the leading byte ranges cover full continuation-byte spans
            for (int i = 1; i < 4; i++) {
                final int mask = (1 << (6 * i)) - 1;
                if ((start & ~mask) != (end & ~mask)) {
                    if ((start & mask) != 0) {
                        pending.push(new int[] { (start | mask) + 1, end });
                        pending.push(new int[] { start, start | mask });
                        continue nextRange;
                    }
                    if ((end & mask) != mask) {
                        pending.push(new int[] { end & ~mask, end });
                        pending.push(new int[] { start, (end & ~mask) - 1 });
                        continue nextRange;
                    }
                }
            }

            final byte[] startBytes = new String(Character.toChars(start)).getBytes(StandardCharsets.UTF_8);
            final byte[] endBytes = new String(Character.toChars(end)).getBytes(StandardCharsets.UTF_8);
            final int[][] sequence = new int[startBytes.length][];
            for (int i = 0; i < startBytes.length; i++) {
                sequence[i] = new int[] { startBytes[i] & 0xFF, endBytes[i] & 0xFF };
            }
            sequences.add(sequence);
        }
        return Collections.unmodifiableList(sequences);
    }
}
