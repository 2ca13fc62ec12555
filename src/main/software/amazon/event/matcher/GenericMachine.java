package software.amazon.event.matcher;

import com.fasterxml.jackson.databind.JsonNode;
import software.amazon.event.matcher.input.DefaultParser;
import software.amazon.event.matcher.input.RegexpParser;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 *  Represents a state machine used to match name/value patterns to events.
 *  The machine is thread safe. The concurrency strategy is:
 *  Multi-thread access assumed, single-thread update enforced by synchronized on addPattern.
 *  Everything a reader touches hangs off one immutable Snapshot. A writer derives the next Snapshot, sharing every
 *  node the new pattern does not change, and publishes it through a volatile field. A match call reads that field
 *  once, so it sees the machine either entirely before or entirely after any addPattern, never half-built.
 *
 *  T is a type representing a pattern name, it should be an immutable class.
 */
@ThreadSafe
public class GenericMachine<T> {

    private static final Logger LOG = Logger.getLogger(GenericMachine.class.getName());

    /**
     * This could be increased but is an initial control
     */
    static final int DEFAULT_MAXIMUM_PATTERN_SIZE = 256;

    /**
     * Configuration for the Machine.
     */
    private final GenericMachineConfiguration configuration;

    /**
     * The published view of the machine. Only addPattern writes it.
     */
    private volatile Snapshot snapshot = Snapshot.empty();

    public GenericMachine() {
        this(builder().buildConfig());
    }

    protected GenericMachine(GenericMachineConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * Return the patterns that match the fields in the event in a way that is Array-Consistent (thus the "AC" on
     *  the names of implementing classes). Array-Consistent means that we reject matches where fields which are
     *  members of different elements of the same JSON array in the event are matched.
     * @param jsonEvent The JSON representation of the event
     * @return set of pattern names that match. The set may be empty but never null.
     * @throws IOException if the event isn't valid JSON
     * @throws IllegalArgumentException if the event isn't a JSON object
     */
    public Set<T> matchesForJSONEvent(final String jsonEvent) throws IOException {
        final Snapshot current = snapshot;
        return match(new Event(jsonEvent, current).fields, current);
    }

    public Set<T> matchesForJSONEvent(final JsonNode eventRoot) {
        final Snapshot current = snapshot;
        return match(new Event(eventRoot, current).fields, current);
    }

    /**
     * Return the patterns that match a list of fields.
     *
     * @param fields the fields of the event, in any order
     * @return set of pattern names that match. The set may be empty but never null.
     */
    public Set<T> matchesForFields(@Nonnull final List<Field> fields) {
        final List<Field> sorted = new ArrayList<>(fields);
        sorted.sort(Comparator.comparing(Field::getName));
        return match(sorted, snapshot);
    }

    @SuppressWarnings("unchecked")
    private Set<T> match(final List<Field> sortedFields, final Snapshot current) {
        return (Set<T>) ACFinder.matchPatterns(sortedFields, current);
    }

    /**
     * Add a pattern written in JSON.
     *
     * @param name pattern name
     * @param json the JSON form of the pattern
     * @throws IOException if the pattern isn't syntactically valid
     */
    public void addPattern(final T name, final String json) throws IOException {
        addPattern(name, JsonPatternCompiler.compile(json, configuration.isPathOverriding()));
    }

    /**
     * Add a pattern to the machine. A pattern is a set of dotted paths, each with the value shapes it may take.
     *  An event matches the pattern if every path is present with a value matching one of its shapes, except that
     *  a path with the absence shape matches only where the event lacks the path.
     *
     * If the pattern is rejected, the machine is left as it was.
     *
     * @param name pattern name
     * @param shapes the value shapes of each path
     * @throws IllegalArgumentException if the pattern is malformed
     * @throws software.amazon.event.matcher.input.ParseException if a value shape's text can't be parsed
     */
    public synchronized void addPattern(@Nonnull final T name, @Nonnull final Map<String, List<Patterns>> shapes) {
        try {
            validate(name, shapes);
        } catch (RuntimeException e) {
            LOG.warning("Rejected pattern " + name + ": " + e.getMessage());
            throw e;
        }

        // paths are added in sorted order, the order in which flattened events present them
        final Map<String, List<Patterns>> sortedShapes = new TreeMap<>(shapes);
        final Snapshot.Builder builder = snapshot.toBuilder();

        Set<FieldMatcher> frontier = Collections.singleton(Snapshot.ROOT);
        for (Map.Entry<String, List<Patterns>> entry : sortedShapes.entrySet()) {
            frontier = addPath(builder, frontier, entry.getKey(), entry.getValue());
            builder.recordPath(entry.getKey());
        }
        for (FieldMatcher last : frontier) {
            builder.put(last, builder.get(last).withMatch(name));
        }

        snapshot = builder.build();
        LOG.fine("Added pattern " + name + " with " + shapes.size() + " fields");
    }

    /*
     * Extend every FieldMatcher in the frontier with the path's shapes. The FieldMatchers the shapes lead to are the
     *  next frontier.
     */
    private static Set<FieldMatcher> addPath(final Snapshot.Builder builder, final Set<FieldMatcher> frontier,
                                             final String path, final List<Patterns> values) {
        final Set<FieldMatcher> next = new LinkedHashSet<>();
        for (FieldMatcher fieldMatcher : frontier) {
            FieldTransitions transitions = builder.get(fieldMatcher);
            for (Patterns value : values) {
                switch (value.type()) {
                    case EXISTS: {
                        FieldMatcher target = transitions.getExistenceTransition(path);
                        if (target == null) {
                            target = builder.newFieldMatcher();
                            transitions = transitions.withExistenceTransition(path, target);
                        }
                        next.add(target);
                        break;
                    }
                    case ABSENT: {
                        FieldMatcher target = transitions.getAbsenceTransitions().get(path);
                        if (target == null) {
                            target = builder.newFieldMatcher();
                            transitions = transitions.withAbsenceTransition(path, target);
                        }
                        next.add(target);
                        break;
                    }
                    default: {
                        final ValueMatcher valueMatcher = transitions.getValueMatcher(path);
                        final ValueMatcher.Transition transition =
                                (valueMatcher == null ? ValueMatcher.EMPTY : valueMatcher)
                                        .addTransition(value, builder::newFieldMatcher);
                        transitions = transitions.withValueMatcher(path, transition.matcher);
                        next.add(transition.target);
                        break;
                    }
                }
            }
            builder.put(fieldMatcher, transitions);
        }
        return next;
    }

    /*
     * Every check that can fail happens here, before anything is built.
     */
    private void validate(final T name, final Map<String, List<Patterns>> shapes) {
        if (name == null) {
            throw new IllegalArgumentException("Pattern name must not be null");
        }
        if (shapes == null || shapes.isEmpty()) {
            throw new IllegalArgumentException("Pattern must have at least one field");
        }
        if (shapes.size() > configuration.getMaximumPatternSize()) {
            throw new IllegalArgumentException("Size of pattern '" + name + "' exceeds max value of "
                    + configuration.getMaximumPatternSize());
        }
        for (Map.Entry<String, List<Patterns>> entry : shapes.entrySet()) {
            final String path = entry.getKey();
            final List<Patterns> values = entry.getValue();
            if (path == null || path.isEmpty()) {
                throw new IllegalArgumentException("Field names must not be empty");
            }
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("Field " + path + " has no values");
            }
            for (Patterns value : values) {
                validateValue(path, value, values.size());
            }
        }
    }

    private static void validateValue(final String path, final Patterns value, final int valueCount) {
        if (value == null || value.type() == null) {
            throw new IllegalArgumentException("Field " + path + " has a null value");
        }
        switch (value.type()) {
            case EXISTS:
            case ABSENT:
                requireAlone(path, value, valueCount);
                break;
            case ANYTHING_BUT:
                requireAlone(path, value, valueCount);
                if (!(value instanceof AnythingBut)) {
                    throw new IllegalArgumentException("Unrecognized value shape " + value + " for " + path);
                }
                if (((AnythingBut) value).getValues().isEmpty()) {
                    throw new IllegalArgumentException("Field " + path + " has an empty anything-but set");
                }
                break;
            case REGEXP:
                requireAlone(path, value, valueCount);
                RegexpParser.getParser().parse(valuePattern(path, value));
                break;
            case SHELL_STYLE:
            case WILDCARD:
            case EQUALS_IGNORE_CASE:
                DefaultParser.getParser().parse(value.type(), valuePattern(path, value));
                break;
            case EXACT:
            case NUMERIC:
            case LITERAL:
            case PREFIX:
                valuePattern(path, value);
                break;
            default:
                throw new IllegalArgumentException("Unrecognized value shape " + value + " for " + path);
        }
    }

    private static void requireAlone(final String path, final Patterns value, final int valueCount) {
        if (valueCount > 1) {
            throw new IllegalArgumentException(value.type() + " must be the only value of field " + path);
        }
    }

    private static String valuePattern(final String path, final Patterns value) {
        if (!(value instanceof ValuePatterns) || ((ValuePatterns) value).pattern() == null) {
            throw new IllegalArgumentException("Unrecognized value shape " + value + " for " + path);
        }
        return ((ValuePatterns) value).pattern();
    }

    public boolean isEmpty() {
        return snapshot.isEmpty();
    }

    /**
     * Gives roughly the number of objects within the machine. This is useful to identify large pattern-machines
     * that potentially require loads of memory. We count the FieldMatchers, ValueMatchers and automaton states
     * reachable in the published snapshot; each is counted once however many paths lead to it, so the loops that
     * wildcard and regexp automata contain are harmless.
     *
     * @param maxObjectCount Caps evaluation of objects at this threshold.
     */
    public int approximateObjectCount(int maxObjectCount) {
        final Snapshot current = snapshot;
        final Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        final Set<FieldMatcher> fieldMatchersSeen = new LinkedHashSet<>();
        final Deque<FieldMatcher> fieldMatchers = new ArrayDeque<>();
        final Deque<ByteState> states = new ArrayDeque<>();

        fieldMatchers.push(Snapshot.ROOT);
        while (!fieldMatchers.isEmpty() && seen.size() + fieldMatchersSeen.size() < maxObjectCount) {
            final FieldMatcher fieldMatcher = fieldMatchers.pop();
            if (!fieldMatchersSeen.add(fieldMatcher)) {
                continue;
            }
            final FieldTransitions transitions = current.transitionsOf(fieldMatcher);
            fieldMatchers.addAll(transitions.getExistenceTransitions().values());
            fieldMatchers.addAll(transitions.getAbsenceTransitions().values());
            for (ValueMatcher valueMatcher : transitions.getValueTransitions().values()) {
                if (!seen.add(valueMatcher)) {
                    continue;
                }
                fieldMatchers.addAll(valueMatcher.getTargets());
                if (valueMatcher.getStartState() != null) {
                    states.push(valueMatcher.getStartState());
                }
            }
            while (!states.isEmpty() && seen.size() + fieldMatchersSeen.size() < maxObjectCount) {
                final ByteState state = states.pop();
                if (!seen.add(state)) {
                    continue;
                }
                final ByteMap map = state.getMap();
                for (int run = 0; run < map.runCount(); run++) {
                    if (map.state(run) != null) {
                        states.push(map.state(run));
                    }
                }
                states.addAll(state.getEpsilons());
            }
        }
        return Math.min(seen.size() + fieldMatchersSeen.size(), maxObjectCount);
    }

    @Override
    public String toString() {
        final Snapshot current = snapshot;
        return "GenericMachine{" +
                "configuration={" + configuration + '}' +
                ", fieldMatchers=" + current.fieldMatcherCount() +
                ", pathsUsed=" + current.getPathsUsed() +
                '}';
    }

    public static <T> Builder<GenericMachine<T>, T> builder() {
        return new Builder<>();
    }

    public static class Builder<M extends GenericMachine<T>, T> {

        /**
         * The largest number of fields a pattern may have. Patterns with more are rejected.
         */
        private int maximumPatternSize = DEFAULT_MAXIMUM_PATTERN_SIZE;

        /**
         * If true, when encountering the same path twice in a JSON pattern, the compiler will accept the pattern and
         * keep the values from the last occurrence. For example:
         * <pre>
         * {@code
         *   {
         *     "a": [1, 2]
         *     "a": [3, 4]
         *   }
         * }
         * </pre>
         * Will have the same effect as:
         * <pre>
         *   {@code
         *   {
         *    "a": [3, 4]
         *    }
         * }
         * </pre>
         *
         * When set to false, patterns with repeated paths are rejected by the compiler. True by default.
         */
        private boolean pathOverriding = true;

        Builder() {}

        public Builder<M, T> withMaximumPatternSize(int maximumPatternSize) {
            if (maximumPatternSize < 1) {
                throw new IllegalArgumentException("Maximum pattern size must be positive: " + maximumPatternSize);
            }
            this.maximumPatternSize = maximumPatternSize;
            return this;
        }

        public Builder<M, T> withOverridesForDuplicatePaths(boolean pathOverriding) {
            this.pathOverriding = pathOverriding;
            return this;
        }

        @SuppressWarnings("unchecked")
        public M build() {
            return (M) new GenericMachine<T>(buildConfig());
        }

        protected GenericMachineConfiguration buildConfig() {
            return new GenericMachineConfiguration(maximumPatternSize, pathOverriding);
        }
    }
}
