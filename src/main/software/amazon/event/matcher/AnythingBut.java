package software.amazon.event.matcher;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;

/**
 * Represents a denylist-like pattern: any value matches if it's *not* in the anything-but set.
 * The values are held in event encoding, i.e. strings wrapped in '"'.
 */
public class AnythingBut extends Patterns {

    private final Set<String> values;

    AnythingBut(final Set<String> values) {
        super(MatchType.ANYTHING_BUT);
        this.values = Collections.unmodifiableSet(values);
    }

    public Set<String> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        if (!super.equals(o)) {
            return false;
        }

        AnythingBut that = (AnythingBut) o;

        return Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        int result = super.hashCode();
        result = 31 * result + (values != null ? values.hashCode() : 0);
        return result;
    }

    @Override
    public String toString() {
        return "AB:" + values + " (" + super.toString() + ")";
    }
}
