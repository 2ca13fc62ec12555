package software.amazon.event.matcher;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * The current location in a traversal of a JSON object, as a dotted name. Both patterns and events are flattened into
 * name/value pairs, where the name is the path to the value.
 *
 * Each push records the complete dotted name, so name() costs nothing while values are being emitted.
 */
class Path {
    static final char SEPARATOR = '.';

    private final Deque<String> names = new ArrayDeque<>();

    void push(final String step) {
        names.push(extendedName(step));
    }

    void pop() {
        names.pop();
    }

    String name() {
        final String name = names.peek();
        return name == null ? "" : name;
    }

    /**
     * @param lastStep the next step, used but not pushed
     * @return the dotted name with lastStep appended
     */
    String extendedName(final String lastStep) {
        final String base = names.peek();
        return base == null ? lastStep : base + SEPARATOR + lastStep;
    }
}
