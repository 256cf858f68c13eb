package com.heapdict.core;

import java.util.Comparator;

/**
 * Single-order binary heap. The root holds the minimum for a min-heap and
 * the maximum for a max-heap; the other end lives somewhere in the leaves.
 */
final class BinaryHeapArray<K, P> extends HeapArray<K, P> {
    private final boolean maxHeap;

    BinaryHeapArray(Comparator<? super P> comparator, boolean maxHeap) {
        super(comparator);
        this.maxHeap = maxHeap;
    }

    // True if slot i belongs strictly above slot j
    private boolean above(int i, int j) {
        int cmp = compare(i, j);
        return maxHeap ? cmp > 0 : cmp < 0;
    }

    @Override
    void swim(int i) {
        while (i > 0) {
            int p = parent(i);
            if (!above(i, p))
                break;
            swap(i, p);
            i = p;
        }
    }

    @Override
    void sink(int i) {
        int size = size();
        while (leftChild(i) < size) {
            int left = leftChild(i);
            int right = left + 1;
            int j = left;
            if (right < size && above(right, left)) {
                j = right;
            }
            if (!above(j, i))
                break;
            swap(i, j);
            i = j;
        }
    }

    @Override
    int minIndex() {
        return maxHeap ? scanLeaves(false) : 0;
    }

    @Override
    int maxIndex() {
        return maxHeap ? 0 : scanLeaves(true);
    }
}
