package software.amazon.event.matcher;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Matches patterns to events in an array-consistent fashion, thus the AC prefix on the class name: matches where
 *  fields come from different elements of the same array are rejected.
 *
 * Work is kept in a queue of steps, each one a (field index, FieldMatcher, array membership so far) combination,
 *  rather than on the call stack.
 */
class ACFinder {

    private ACFinder() { }

    /**
     * @param fields the event's fields, sorted by path
     * @param snapshot the snapshot to match against
     * @return ids of the patterns that match; may be empty but never null
     */
    static Set<Object> matchPatterns(final List<Field> fields, final Snapshot snapshot) {
        final ACTask task = new ACTask(fields, snapshot);

        // bootstrap: root FieldMatcher, first field
        moveFrom(Snapshot.ROOT, 0, task, new ArrayMembership());

        // each iteration removes a Step and adds zero or more new ones
        while (task.stepsRemain()) {
            tryStep(task);
        }

        return task.getMatchedPatterns();
    }

    // remove a step from the work queue and see if there's a transition
    private static void tryStep(final ACTask task) {
        final ACStep step = task.nextStep();
        final Field field = task.fields.get(step.fieldIndex);

        // if we can step from where we are to the new field without violating array consistency
        final ArrayMembership newMembership =
                ArrayMembership.checkArrayConsistency(step.membershipSoFar, field.arrayMembership);
        if (newMembership == null) {
            return;
        }

        final FieldTransitions transitions = task.transitionsOf(step.fieldMatcher);
        final int nextFieldIndex = step.fieldIndex + 1;

        final FieldMatcher existenceTarget = transitions.getExistenceTransition(field.name);
        if (existenceTarget != null) {
            addFieldMatcher(existenceTarget, nextFieldIndex, task, newMembership);
        }

        final ValueMatcher valueMatcher = transitions.getValueMatcher(field.name);
        if (valueMatcher != null) {
            for (FieldMatcher next : valueMatcher.transitionOn(field)) {
                addFieldMatcher(next, nextFieldIndex, task, newMembership);
            }
        }
    }

    /*
     * An absence transition consumes no field, so matching carries on at the same index. It is tried at every
     * FieldMatcher reached, including after the last field, so a pattern whose remaining requirement is an absent
     * path sorting after every present one is still completed.
     */
    private static void tryMustNotExistMatch(final FieldMatcher fieldMatcher, final int fieldIndex, final ACTask task,
                                             final ArrayMembership membership) {
        final Map<String, FieldMatcher> absenceTransitions = task.transitionsOf(fieldMatcher).getAbsenceTransitions();
        for (Map.Entry<String, FieldMatcher> entry : absenceTransitions.entrySet()) {
            if (!task.isPathPresent(entry.getKey())) {
                addFieldMatcher(entry.getValue(), fieldIndex, task, membership);
            }
        }
    }

    // Move from a FieldMatcher. Give all the remaining event fields a chance to transition from it
    private static void moveFrom(final FieldMatcher fieldMatcher, final int fieldIndex, final ACTask task,
                                 final ArrayMembership membership) {
        tryMustNotExistMatch(fieldMatcher, fieldIndex, task, membership);
        for (int i = fieldIndex; i < task.fieldCount; i++) {
            task.addStep(i, fieldMatcher, membership);
        }
    }

    private static void addFieldMatcher(final FieldMatcher fieldMatcher, final int nextFieldIndex, final ACTask task,
                                        final ArrayMembership membership) {
        // this FieldMatcher might complete some patterns
        task.collectMatches(fieldMatcher);
        moveFrom(fieldMatcher, nextFieldIndex, task, membership);
    }
}
