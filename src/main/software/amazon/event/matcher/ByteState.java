package software.amazon.event.matcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Represents a state in a value automaton. It maps utf-8 bytes to a next state through its ByteMap, may be linked by
 * epsilon to alternative states (which makes the automaton an NFA), and may carry terminal FieldMatchers that are
 * reached whenever a traversal enters this state.
 *
 * ByteStates are only changed by the builders and the merger that create them. Once an automaton has been published
 * in a snapshot, none of its states is changed again.
 */
final class ByteState {

    private static final AtomicLong SERIAL = new AtomicLong();

    private final long serial = SERIAL.incrementAndGet();
    private ByteMap map = ByteMap.empty();
    private List<ByteState> epsilons = Collections.emptyList();
    private List<FieldMatcher> terminals = Collections.emptyList();

    ByteState() { }

    static ByteState acceptState(final FieldMatcher target) {
        final ByteState state = new ByteState();
        state.addTerminal(target);
        return state;
    }

    ByteMap getMap() {
        return map;
    }

    void setMap(final ByteMap map) {
        this.map = map;
    }

    ByteState step(final int utf8byte) {
        return map.step(utf8byte);
    }

    List<ByteState> getEpsilons() {
        return epsilons;
    }

    void addEpsilon(final ByteState state) {
        if (epsilons.isEmpty()) {
            epsilons = new ArrayList<>(2);
        }
        epsilons.add(state);
    }

    List<FieldMatcher> getTerminals() {
        return terminals;
    }

    void addTerminal(final FieldMatcher target) {
        if (terminals.isEmpty()) {
            terminals = new ArrayList<>(1);
        }
        if (!terminals.contains(target)) {
            terminals.add(target);
        }
    }

    String name() {
        return "s" + serial;
    }

    @Override
    public String toString() {
        return name() + "{" + map + (epsilons.isEmpty() ? "" : " eps=" + epsilons.size())
                + (terminals.isEmpty() ? "" : " terminals=" + terminals) + "}";
    }
}
