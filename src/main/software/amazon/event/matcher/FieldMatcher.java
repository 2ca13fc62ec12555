package software.amazon.event.matcher;

import javax.annotation.concurrent.Immutable;

/**
 * A stable handle on one node of the field-matching graph. The node's content, its FieldTransitions, lives in the
 * snapshot's FieldMatcherTable, so automata can point at a node while the node itself keeps evolving from one snapshot
 * to the next.
 */
@Immutable
final class FieldMatcher {

    private final int id;

    FieldMatcher(final int id) {
        this.id = id;
    }

    int id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o != null && o.getClass() == getClass() && ((FieldMatcher) o).id == id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "FM" + id;
    }
}
