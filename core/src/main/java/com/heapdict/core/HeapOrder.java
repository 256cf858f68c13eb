package com.heapdict.core;

import java.util.Comparator;

/**
 * Heap layout of an {@link IndexedPriorityQueue}, fixed at construction.
 */
public enum HeapOrder {
    /** Binary min-heap: minimum in O(1), maximum by an O(n) leaf scan. */
    MIN {
        @Override
        <K, P> HeapArray<K, P> newHeap(Comparator<? super P> comparator) {
            return new BinaryHeapArray<>(comparator, false);
        }
    },
    /** Binary max-heap: maximum in O(1), minimum by an O(n) leaf scan. */
    MAX {
        @Override
        <K, P> HeapArray<K, P> newHeap(Comparator<? super P> comparator) {
            return new BinaryHeapArray<>(comparator, true);
        }

        @Override
        boolean topIsMaximum() {
            return true;
        }
    },
    /** Min-max heap: both ends in O(1). */
    MIN_MAX {
        @Override
        <K, P> HeapArray<K, P> newHeap(Comparator<? super P> comparator) {
            return new MinMaxHeapArray<>(comparator);
        }
    };

    abstract <K, P> HeapArray<K, P> newHeap(Comparator<? super P> comparator);

    /** Whether {@link IndexedPriorityQueue#popItem()} takes the maximum rather than the minimum. */
    boolean topIsMaximum() {
        return false;
    }
}
