package software.amazon.event.matcher;

import javax.annotation.concurrent.Immutable;
import java.util.Arrays;

/**
 * Persistent arena holding the FieldTransitions of every FieldMatcher, indexed by the FieldMatcher's id. Storage is
 * split into fixed-size chunks, so an edit copies the chunk directory and only the chunks it writes to; everything
 * else is shared with the table it was derived from.
 */
@Immutable
final class FieldMatcherTable {

    private static final int CHUNK_BITS = 6;
    private static final int CHUNK_SIZE = 1 << CHUNK_BITS;
    private static final int CHUNK_MASK = CHUNK_SIZE - 1;

    private final FieldTransitions[][] chunks;
    private final int size;

    private FieldMatcherTable(final FieldTransitions[][] chunks, final int size) {
        this.chunks = chunks;
        this.size = size;
    }

    /**
     * A table holding one empty FieldMatcher with id 0, the root.
     */
    static FieldMatcherTable withRoot() {
        final FieldTransitions[] chunk = new FieldTransitions[CHUNK_SIZE];
        chunk[0] = FieldTransitions.EMPTY;
        return new FieldMatcherTable(new FieldTransitions[][] { chunk }, 1);
    }

    FieldTransitions get(final FieldMatcher fieldMatcher) {
        final int id = fieldMatcher.id();
        if (id >= size) {
            throw new IllegalStateException(fieldMatcher + " is not part of this table");
        }
        return chunks[id >>> CHUNK_BITS][id & CHUNK_MASK];
    }

    int size() {
        return size;
    }

    Editor edit() {
        return new Editor(this);
    }

    /**
     * Collects changes against a base table. The base is never touched; build() yields the changed table.
     */
    static final class Editor {
        private FieldTransitions[][] chunks;
        private boolean[] owned;
        private int size;

        private Editor(final FieldMatcherTable base) {
            this.chunks = Arrays.copyOf(base.chunks, base.chunks.length);
            this.owned = new boolean[chunks.length];
            this.size = base.size;
        }

        FieldTransitions get(final FieldMatcher fieldMatcher) {
            final int id = fieldMatcher.id();
            return chunks[id >>> CHUNK_BITS][id & CHUNK_MASK];
        }

        void put(final FieldMatcher fieldMatcher, final FieldTransitions transitions) {
            final int id = fieldMatcher.id();
            final int chunk = id >>> CHUNK_BITS;
            if (!owned[chunk]) {
                chunks[chunk] = Arrays.copyOf(chunks[chunk], CHUNK_SIZE);
                owned[chunk] = true;
            }
            chunks[chunk][id & CHUNK_MASK] = transitions;
        }

        FieldMatcher allocate() {
            final int id = size++;
            final int chunk = id >>> CHUNK_BITS;
            if (chunk == chunks.length) {
                chunks = Arrays.copyOf(chunks, chunks.length * 2);
                owned = Arrays.copyOf(owned, chunks.length);
            }
            if (chunks[chunk] == null) {
                chunks[chunk] = new FieldTransitions[CHUNK_SIZE];
                owned[chunk] = true;
            }
            final FieldMatcher fieldMatcher = new FieldMatcher(id);
            put(fieldMatcher, FieldTransitions.EMPTY);
            return fieldMatcher;
        }

        FieldMatcherTable build() {
            return new FieldMatcherTable(Arrays.copyOf(chunks, chunks.length), size);
        }
    }
}
