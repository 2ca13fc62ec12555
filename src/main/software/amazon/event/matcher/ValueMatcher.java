package software.amazon.event.matcher;

import javax.annotation.concurrent.Immutable;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Matches the values of one field. A ValueMatcher is empty, holds a single literal (which needs no automaton), or
 * holds the start state of an automaton, and it only ever moves forward through those three forms.
 *
 * ValueMatchers are immutable: adding a value shape returns a new ValueMatcher and leaves this one, and every
 * automaton state it reaches, as it was.
 */
@Immutable
final class ValueMatcher {

    private static final Logger LOG = Logger.getLogger(ValueMatcher.class.getName());

    static final ValueMatcher EMPTY = new ValueMatcher(null, null, null, Collections.emptyMap(), false);

    // singleton form
    private final byte[] singletonValue;
    private final FieldMatcher singletonTarget;

    // automaton form
    private final ByteState startState;

    // every shape added so far, and where it leads
    private final Map<Patterns, FieldMatcher> targets;

    // whether the automaton accepts canonical number forms, so number fields are worth a second walk
    private final boolean hasCanonicalNumbers;

    private ValueMatcher(final byte[] singletonValue, final FieldMatcher singletonTarget, final ByteState startState,
                         final Map<Patterns, FieldMatcher> targets, final boolean hasCanonicalNumbers) {
        this.singletonValue = singletonValue;
        this.singletonTarget = singletonTarget;
        this.startState = startState;
        this.targets = targets;
        this.hasCanonicalNumbers = hasCanonicalNumbers;
    }

    boolean isEmpty() {
        return singletonTarget == null && startState == null;
    }

    boolean isSingleton() {
        return singletonTarget != null;
    }

    ByteState getStartState() {
        return startState;
    }

    Set<FieldMatcher> getTargets() {
        return new LinkedHashSet<>(targets.values());
    }

    /**
     * The result of adding a value shape: the ValueMatcher now in force, and the FieldMatcher the shape leads to.
     */
    static final class Transition {
        final ValueMatcher matcher;
        final FieldMatcher target;

        Transition(final ValueMatcher matcher, final FieldMatcher target) {
            this.matcher = matcher;
            this.target = target;
        }
    }

    /**
     * Adds a value shape. A shape that has been added before leads to the same FieldMatcher as before and leaves the
     * matcher unchanged.
     *
     * @param pattern the value shape; EXISTS and ABSENT are not value shapes
     * @param newTarget supplies a fresh FieldMatcher when the shape is new
     */
    Transition addTransition(final Patterns pattern, final Supplier<FieldMatcher> newTarget) {
        final FieldMatcher existing = targets.get(pattern);
        if (existing != null) {
            return new Transition(this, existing);
        }

        final FieldMatcher target = newTarget.get();
        final Map<Patterns, FieldMatcher> newTargets = new HashMap<>(targets);
        newTargets.put(pattern, target);

        final boolean canonicalNumber = pattern.type() == MatchType.NUMERIC
                && ComparableNumber.canonical(((ValuePatterns) pattern).pattern()) != null;
        if (isEmpty() && isLiteral(pattern) && !canonicalNumber) {
            final byte[] value = ((ValuePatterns) pattern).patternBytes();
            return new Transition(new ValueMatcher(value, target, null, newTargets, false), target);
        }

        final ByteState fragment = AutomatonBuilder.build(pattern, target);
        final ByteState newStart;
        if (isEmpty()) {
            newStart = fragment;
        } else if (isSingleton()) {
            LOG.fine("Promoting singleton value matcher to automaton for " + pattern);
            newStart = AutomatonMerger.merge(AutomatonBuilder.literal(singletonValue, singletonTarget), fragment);
        } else {
            newStart = AutomatonMerger.merge(startState, fragment);
        }
        return new Transition(new ValueMatcher(null, null, newStart, newTargets,
                hasCanonicalNumbers || canonicalNumber), target);
    }

    private static boolean isLiteral(final Patterns pattern) {
        final MatchType type = pattern.type();
        return type == MatchType.EXACT || type == MatchType.NUMERIC || type == MatchType.LITERAL;
    }

    /**
     * Returns the FieldMatchers reached by a field: those its text reaches and, for a number that has a canonical
     * form, those the canonical form reaches.
     */
    Set<FieldMatcher> transitionOn(final Field field) {
        final Set<FieldMatcher> reached = transitionOn(field.val);
        if (!hasCanonicalNumbers || field.canonicalNumber == null) {
            return reached;
        }
        final Set<FieldMatcher> byNumber = transitionOn(field.canonicalNumber);
        if (byNumber.isEmpty()) {
            return reached;
        }
        final Set<FieldMatcher> union = new LinkedHashSet<>(reached);
        union.addAll(byNumber);
        return union;
    }

    /**
     * Returns the FieldMatchers reached by a value. The automaton is walked as an NFA: the set of live states is
     * recomputed for every byte, closed over epsilon links and deduplicated by identity, and the terminals of every
     * state entered along the way are collected. The walk ends with the value terminator.
     */
    Set<FieldMatcher> transitionOn(final byte[] value) {
        if (isEmpty()) {
            return Collections.emptySet();
        }
        if (isSingleton()) {
            return Arrays.equals(singletonValue, value) ? Collections.singleton(singletonTarget)
                    : Collections.emptySet();
        }

        return walk(startState, value);
    }

    /**
     * Runs value, followed by the value terminator, through the automaton starting at start.
     */
    static Set<FieldMatcher> walk(final ByteState start, final byte[] value) {
        final Set<FieldMatcher> reached = new LinkedHashSet<>();
        List<ByteState> current = new ArrayList<>();
        addWithClosure(start, current, newIdentitySet(), reached);

        for (int i = 0; i <= value.length && !current.isEmpty(); i++) {
            final int utf8byte = (i == value.length) ? AutomatonBuilder.VALUE_TERMINATOR : value[i] & 0xFF;
            final List<ByteState> next = new ArrayList<>();
            final Set<ByteState> seen = newIdentitySet();
            for (ByteState state : current) {
                final ByteState stepped = state.step(utf8byte);
                if (stepped != null) {
                    addWithClosure(stepped, next, seen, reached);
                }
            }
            current = next;
        }
        return reached;
    }

    private static void addWithClosure(final ByteState state, final List<ByteState> states, final Set<ByteState> seen,
                                       final Set<FieldMatcher> reached) {
        final Deque<ByteState> todo = new ArrayDeque<>();
        todo.push(state);
        while (!todo.isEmpty()) {
            final ByteState candidate = todo.pop();
            if (!seen.add(candidate)) {
                continue;
            }
            reached.addAll(candidate.getTerminals());
            if (!candidate.getMap().isEmpty()) {
                states.add(candidate);
            }
            for (ByteState epsilon : candidate.getEpsilons()) {
                todo.push(epsilon);
            }
        }
    }

    private static Set<ByteState> newIdentitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "ValueMatcher{}";
        }
        if (isSingleton()) {
            return "ValueMatcher{singleton=" + new String(singletonValue, StandardCharsets.UTF_8)
                    + " -> " + singletonTarget + "}";
        }
        return "ValueMatcher{start=" + startState.name() + ", shapes=" + targets.keySet() + "}";
    }
}
