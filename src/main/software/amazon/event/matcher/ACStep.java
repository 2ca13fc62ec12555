package software.amazon.event.matcher;

import java.util.Objects;

/**
 * Represents a suggestion of a FieldMatcher/field combo from which there might be a transition, in an
 * array-consistent fashion.
 */
class ACStep {
    final int fieldIndex;
    final FieldMatcher fieldMatcher;
    final ArrayMembership membershipSoFar;

    ACStep(final int fieldIndex, final FieldMatcher fieldMatcher, final ArrayMembership membershipSoFar) {
        this.fieldIndex = fieldIndex;
        this.fieldMatcher = fieldMatcher;
        this.membershipSoFar = membershipSoFar;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final ACStep step = (ACStep) o;
        return fieldIndex == step.fieldIndex && fieldMatcher.equals(step.fieldMatcher)
                && membershipSoFar.equals(step.membershipSoFar);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldIndex, fieldMatcher, membershipSoFar);
    }
}
