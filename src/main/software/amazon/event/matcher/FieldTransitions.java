package software.amazon.event.matcher;

import javax.annotation.concurrent.Immutable;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * The content of one FieldMatcher node: per path, the ValueMatcher for that path's values, the continuation taken
 * when the path exists, and the continuation taken when it is absent; plus the ids of the patterns that are complete
 * once matching reaches this node. Immutable; each with* method returns an updated copy.
 */
@Immutable
final class FieldTransitions {

    static final FieldTransitions EMPTY = new FieldTransitions(Collections.emptyMap(), Collections.emptyMap(),
            Collections.emptyMap(), Collections.emptySet());

    private final Map<String, ValueMatcher> valueTransitions;
    private final Map<String, FieldMatcher> existenceTransitions;
    private final Map<String, FieldMatcher> absenceTransitions;
    private final Set<Object> matches;

    private FieldTransitions(final Map<String, ValueMatcher> valueTransitions,
                             final Map<String, FieldMatcher> existenceTransitions,
                             final Map<String, FieldMatcher> absenceTransitions,
                             final Set<Object> matches) {
        this.valueTransitions = valueTransitions;
        this.existenceTransitions = existenceTransitions;
        this.absenceTransitions = absenceTransitions;
        this.matches = matches;
    }

    ValueMatcher getValueMatcher(final String path) {
        return valueTransitions.get(path);
    }

    Map<String, ValueMatcher> getValueTransitions() {
        return valueTransitions;
    }

    FieldMatcher getExistenceTransition(final String path) {
        return existenceTransitions.get(path);
    }

    Map<String, FieldMatcher> getExistenceTransitions() {
        return existenceTransitions;
    }

    Map<String, FieldMatcher> getAbsenceTransitions() {
        return absenceTransitions;
    }

    Set<Object> getMatches() {
        return matches;
    }

    boolean isEmpty() {
        return valueTransitions.isEmpty() && existenceTransitions.isEmpty() && absenceTransitions.isEmpty()
                && matches.isEmpty();
    }

    FieldTransitions withValueMatcher(final String path, final ValueMatcher valueMatcher) {
        if (valueTransitions.get(path) == valueMatcher) {
            return this;
        }
        return new FieldTransitions(with(valueTransitions, path, valueMatcher), existenceTransitions,
                absenceTransitions, matches);
    }

    FieldTransitions withExistenceTransition(final String path, final FieldMatcher target) {
        return new FieldTransitions(valueTransitions, with(existenceTransitions, path, target), absenceTransitions,
                matches);
    }

    FieldTransitions withAbsenceTransition(final String path, final FieldMatcher target) {
        return new FieldTransitions(valueTransitions, existenceTransitions, with(absenceTransitions, path, target),
                matches);
    }

    FieldTransitions withMatch(final Object patternId) {
        if (matches.contains(patternId)) {
            return this;
        }
        final Set<Object> newMatches = new HashSet<>(matches);
        newMatches.add(patternId);
        return new FieldTransitions(valueTransitions, existenceTransitions, absenceTransitions,
                Collections.unmodifiableSet(newMatches));
    }

    private static <V> Map<String, V> with(final Map<String, V> map, final String key, final V value) {
        final Map<String, V> copy = new HashMap<>(map);
        copy.put(key, value);
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "FieldTransitions{values=" + valueTransitions + ", exists=" + existenceTransitions
                + ", absent=" + absenceTransitions + ", matches=" + matches + '}';
    }
}
