package software.amazon.event.matcher;

import it.unimi.dsi.fastutil.ints.Int2IntAVLTreeMap;
import it.unimi.dsi.fastutil.ints.Int2IntMap;

/**
 * Records, for one field value, the arrays it was found inside and the element index within each.
 * Arrays are numbered in the order the event parser first enters them, so the ids are unique per event.
 * <p>
 * Two fields are array-consistent unless they sit in the same array at different element indices.
 */
public class ArrayMembership {
    public static final int NO_VALUE = -1;

    private final Int2IntAVLTreeMap indexByArray;

    public ArrayMembership() {
        indexByArray = new Int2IntAVLTreeMap();
        indexByArray.defaultReturnValue(NO_VALUE);
    }

    ArrayMembership(final ArrayMembership source) {
        indexByArray = source.indexByArray.clone();
    }

    /**
     * Records that the field sits at position index of the array identified by array.
     */
    public ArrayMembership putMembership(int array, int index) {
        if (index == NO_VALUE) {
            indexByArray.remove(array);
        } else {
            indexByArray.put(array, index);
        }
        return this;
    }

    void deleteMembership(int array) {
        indexByArray.remove(array);
    }

    int getMembership(int array) {
        return indexByArray.get(array);
    }

    boolean isEmpty() {
        return indexByArray.isEmpty();
    }

    /**
     * Folds a field's memberships into those accumulated along a matching path.
     *
     * @param membershipSoFar what the path has committed to; never modified
     * @param fieldMembership memberships of the field about to be consumed
     * @return null when the two disagree about an element index, membershipSoFar itself when the field adds
     *  nothing new, otherwise a fresh membership holding the union
     */
    static ArrayMembership checkArrayConsistency(final ArrayMembership membershipSoFar,
                                                 final ArrayMembership fieldMembership) {
        if (fieldMembership.isEmpty()) {
            return membershipSoFar;
        }
        if (membershipSoFar.isEmpty()) {
            return new ArrayMembership(fieldMembership);
        }

        ArrayMembership union = null;
        for (Int2IntMap.Entry entry : fieldMembership.indexByArray.int2IntEntrySet()) {
            final int committed = membershipSoFar.getMembership(entry.getIntKey());
            if (committed == NO_VALUE) {
                if (union == null) {
                    union = new ArrayMembership(membershipSoFar);
                }
                union.indexByArray.put(entry.getIntKey(), entry.getIntValue());
            } else if (committed != entry.getIntValue()) {
                return null;
            }
        }
        return union == null ? membershipSoFar : union;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return indexByArray.equals(((ArrayMembership) o).indexByArray);
    }

    @Override
    public int hashCode() {
        return indexByArray.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Int2IntMap.Entry entry : indexByArray.int2IntEntrySet()) {
            sb.append(entry.getIntKey()).append('[').append(entry.getIntValue()).append("] ");
        }
        return sb.toString();
    }
}
