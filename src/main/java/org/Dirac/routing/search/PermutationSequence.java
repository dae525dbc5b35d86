package org.Dirac.routing.search;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy, restartable sequence of all orderings of {@code 0..size-1} in lexicographic order.
 *
 * <p>Each {@link #cursor()} or {@link #iterator()} starts again from the identity ordering and
 * holds O(size) state; the {@code size!} orderings are never materialized.</p>
 */
public final class PermutationSequence implements Iterable<int[]> {
    private final int size;

    private PermutationSequence(int size) {
        this.size = size;
    }

    /**
     * @param size number of elements, {@code >= 0}. Size 0 yields one empty ordering.
     */
    public static PermutationSequence of(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0: " + size);
        }
        return new PermutationSequence(size);
    }

    public int size() {
        return size;
    }

    /**
     * Total number of orderings, {@code size!}, saturating at {@link Long#MAX_VALUE}.
     */
    public long count() {
        long count = 1L;
        for (int i = 2; i <= size; i++) {
            if (count > Long.MAX_VALUE / i) {
                return Long.MAX_VALUE;
            }
            count *= i;
        }
        return count;
    }

    /**
     * Opens a fresh cursor positioned before the first ordering.
     */
    public Cursor cursor() {
        return new Cursor(size);
    }

    /**
     * Iterates copies of each ordering.
     */
    @Override
    public Iterator<int[]> iterator() {
        Cursor cursor = cursor();
        return new Iterator<>() {
            private boolean ready;
            private boolean hasNext;

            @Override
            public boolean hasNext() {
                if (!ready) {
                    hasNext = cursor.advance();
                    ready = true;
                }
                return hasNext;
            }

            @Override
            public int[] next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                ready = false;
                return cursor.snapshot();
            }
        };
    }

    /**
     * Mutable position in the sequence. Not thread-safe.
     */
    public static final class Cursor {
        private final int[] order;
        private boolean started;
        private boolean exhausted;

        private Cursor(int size) {
            this.order = new int[size];
            for (int i = 0; i < size; i++) {
                order[i] = i;
            }
        }

        /**
         * Moves to the next ordering; the first call lands on the identity ordering.
         *
         * @return false once every ordering has been visited.
         */
        public boolean advance() {
            if (exhausted) {
                return false;
            }
            if (!started) {
                started = true;
                return true;
            }
            if (!nextPermutation()) {
                exhausted = true;
                return false;
            }
            return true;
        }

        /**
         * Element at {@code position} of the current ordering.
         */
        public int get(int position) {
            return order[position];
        }

        public int size() {
            return order.length;
        }

        public int[] snapshot() {
            return order.clone();
        }

        /**
         * Makes the next {@link #advance()} skip every remaining ordering that shares the current
         * first {@code prefixLength} elements. Lexicographic order of the orderings still visited
         * is unchanged.
         */
        public void skipPrefix(int prefixLength) {
            if (prefixLength < 0 || prefixLength > order.length) {
                throw new IllegalArgumentException(
                        "prefixLength out of bounds: " + prefixLength + " [0, " + order.length + "]"
                );
            }
            if (!started || exhausted) {
                return;
            }
            // The last ordering with a given prefix has its suffix sorted descending.
            sortDescending(prefixLength);
        }

        private void sortDescending(int from) {
            // Insertion sort: suffixes are at most a handful of elements.
            for (int i = from + 1; i < order.length; i++) {
                int value = order[i];
                int j = i - 1;
                while (j >= from && order[j] < value) {
                    order[j + 1] = order[j];
                    j--;
                }
                order[j + 1] = value;
            }
        }

        private boolean nextPermutation() {
            int pivot = order.length - 2;
            while (pivot >= 0 && order[pivot] >= order[pivot + 1]) {
                pivot--;
            }
            if (pivot < 0) {
                return false;
            }
            int successor = order.length - 1;
            while (order[successor] <= order[pivot]) {
                successor--;
            }
            swap(pivot, successor);
            for (int left = pivot + 1, right = order.length - 1; left < right; left++, right--) {
                swap(left, right);
            }
            return true;
        }

        private void swap(int a, int b) {
            int tmp = order[a];
            order[a] = order[b];
            order[b] = tmp;
        }
    }
}
