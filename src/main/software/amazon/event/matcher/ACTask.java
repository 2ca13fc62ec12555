package software.amazon.event.matcher;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;

/**
 * Represents the state of an Array-Consistent pattern-finding project.
 */
class ACTask {

    // the event we're matching patterns to, and its field count
    final List<Field> fields;
    final int fieldCount;

    // the snapshot this task reads, for its whole life
    private final Snapshot snapshot;

    // every path present in the event, for exists:false checks
    private final Set<String> presentPaths = new HashSet<>();

    // the patterns that matched the event, if we find any
    private final Set<Object> matchingPatterns = new HashSet<>();

    // Steps queued up for processing, and every step ever queued
    private final Queue<ACStep> stepQueue = new ArrayDeque<>();
    private final Set<ACStep> seenSteps = new HashSet<>();

    ACTask(final List<Field> fields, final Snapshot snapshot) {
        this.fields = fields;
        this.snapshot = snapshot;
        this.fieldCount = fields.size();
        for (Field field : fields) {
            presentPaths.add(field.name);
        }
    }

    FieldTransitions transitionsOf(final FieldMatcher fieldMatcher) {
        return snapshot.transitionsOf(fieldMatcher);
    }

    boolean isPathPresent(final String path) {
        return presentPaths.contains(path);
    }

    ACStep nextStep() {
        return stepQueue.remove();
    }

    /*
     *  Add a step to the queue for later consideration, unless an identical one has been queued already
     */
    void addStep(final int fieldIndex, final FieldMatcher fieldMatcher, final ArrayMembership membershipSoFar) {
        final ACStep step = new ACStep(fieldIndex, fieldMatcher, membershipSoFar);
        if (seenSteps.add(step)) {
            stepQueue.add(step);
        }
    }

    boolean stepsRemain() {
        return !stepQueue.isEmpty();
    }

    Set<Object> getMatchedPatterns() {
        return matchingPatterns;
    }

    void collectMatches(final FieldMatcher fieldMatcher) {
        matchingPatterns.addAll(transitionsOf(fieldMatcher).getMatches());
    }
}
