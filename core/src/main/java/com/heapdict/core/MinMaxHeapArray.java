package com.heapdict.core;

import java.util.Comparator;

/**
 * Min-max heap (Atkinson, Sack, Santoro, Strothotte 1986).
 *
 * Levels alternate: the root is on a min level, its children on a max level,
 * and so on. A node on a min level is no larger than any of its
 * descendants; a node on a max level is no smaller than any of its
 * descendants. The minimum is therefore the root and the maximum is one of
 * the root's children.
 */
final class MinMaxHeapArray<K, P> extends HeapArray<K, P> {

    MinMaxHeapArray(Comparator<? super P> comparator) {
        super(comparator);
    }

    /** Depth of slot i, the root being level 0. */
    static int level(int i) {
        return 31 - Integer.numberOfLeadingZeros(i + 1);
    }

    static boolean isMinLevel(int i) {
        return (level(i) & 1) == 0;
    }

    // On a min level "a before b" means a < b, on a max level a > b
    private boolean before(int a, int b, boolean minLevel) {
        int cmp = compare(a, b);
        return minLevel ? cmp < 0 : cmp > 0;
    }

    @Override
    void swim(int i) {
        if (i == 0) {
            return;
        }
        boolean minLevel = isMinLevel(i);
        int p = parent(i);
        if (before(p, i, minLevel)) {
            // Out of order with the parent: the node belongs on the parent's levels
            swap(i, p);
            swimLevels(p, !minLevel);
        } else {
            swimLevels(i, minLevel);
        }
    }

    // Bubbles up through grandparents, staying on levels of one kind
    private void swimLevels(int i, boolean minLevel) {
        while (i > 2) {
            int g = parent(parent(i));
            if (!before(i, g, minLevel))
                break;
            swap(i, g);
            i = g;
        }
    }

    @Override
    void sink(int i) {
        int size = size();
        while (leftChild(i) < size) {
            boolean minLevel = isMinLevel(i);
            int m = extremeDescendant(i, minLevel);
            if (!before(m, i, minLevel))
                return;
            swap(m, i);
            if (parent(m) == i)
                return;
            // m is a grandchild; the node pushed down may now be out of order with m's parent
            int p = parent(m);
            if (before(p, m, minLevel)) {
                swap(m, p);
            }
            i = m;
        }
    }

    /**
     * Smallest (min level) or largest (max level) among the children and
     * grandchildren of slot i. Slot i must have at least one child.
     */
    private int extremeDescendant(int i, boolean minLevel) {
        int size = size();
        int child = leftChild(i);
        int best = child;
        if (child + 1 < size && before(child + 1, best, minLevel)) {
            best = child + 1;
        }
        int grandchild = leftChild(child);
        int end = Math.min(grandchild + 4, size);
        for (int g = grandchild; g < end; g++) {
            if (before(g, best, minLevel)) {
                best = g;
            }
        }
        return best;
    }

    @Override
    int minIndex() {
        return 0;
    }

    @Override
    int maxIndex() {
        int size = size();
        if (size == 1) {
            return 0;
        }
        if (size == 2) {
            return 1;
        }
        return compare(2, 1) > 0 ? 2 : 1;
    }
}
