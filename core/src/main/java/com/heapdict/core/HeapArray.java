package com.heapdict.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Dense array of nodes arranged as an implicit binary tree: slot 0 is the
 * root, the children of slot i are 2i+1 and 2i+2. Every move goes through
 * {@link #swap(int, int)} so the node's recorded slot always matches the
 * array.
 *
 * Subclasses decide what the heap order is by implementing {@link #swim(int)}
 * and {@link #sink(int)}.
 */
abstract class HeapArray<K, P> {
    private final Comparator<? super P> comparator;
    private final List<Node<K, P>> nodes = new ArrayList<>();

    HeapArray(Comparator<? super P> comparator) {
        this.comparator = comparator;
    }

    /** Moves the node at slot i toward the root until its parent relation holds. */
    abstract void swim(int i);

    /** Moves the node at slot i toward the leaves until its subtree is ordered. */
    abstract void sink(int i);

    /** Slot holding the smallest priority. Must not be called on an empty heap. */
    abstract int minIndex();

    /** Slot holding the largest priority. Must not be called on an empty heap. */
    abstract int maxIndex();

    int size() {
        return nodes.size();
    }

    Node<K, P> get(int i) {
        return nodes.get(i);
    }

    int compare(int i, int j) {
        return comparator.compare(nodes.get(i).priority, nodes.get(j).priority);
    }

    /**
     * Appends a node and sifts it toward the root. A fresh leaf can only
     * be out of order with its ancestors.
     */
    void add(Node<K, P> node) {
        append(node);
        swim(nodes.size() - 1);
    }

    /** Appends without restoring order; callers finish with {@link #heapify()}. */
    void append(Node<K, P> node) {
        node.index = nodes.size();
        nodes.add(node);
    }

    /**
     * Puts a node at an exact slot, used when cloning a heap layout. Slots
     * skipped over stay empty until they are placed too.
     */
    void place(Node<K, P> node, int i) {
        while (nodes.size() <= i) {
            nodes.add(null);
        }
        nodes.set(i, node);
        node.index = i;
    }

    /**
     * Restores order around slot i after its priority changed in either
     * direction. Both passes are no-ops when the node is already in place.
     */
    void update(int i) {
        swim(i);
        sink(i);
    }

    /**
     * Removes the node at slot i by swapping it with the last node. The node
     * moved into slot i may be out of order both ways, so it is sifted in
     * both directions.
     */
    void removeAt(int i) {
        int last = nodes.size() - 1;
        if (i != last) {
            swap(i, last);
        }
        nodes.remove(last).index = -1;
        if (i < last) {
            update(i);
        }
    }

    /** Bottom-up heap construction, O(n). */
    void heapify() {
        for (int i = (nodes.size() >>> 1) - 1; i >= 0; i--) {
            sink(i);
        }
    }

    void clear() {
        nodes.clear();
    }

    void swap(int i, int j) {
        Node<K, P> a = nodes.get(i);
        Node<K, P> b = nodes.get(j);
        nodes.set(i, b);
        nodes.set(j, a);
        // Update positions
        a.index = j;
        b.index = i;
    }

    static int parent(int i) {
        return (i - 1) >>> 1;
    }

    static int leftChild(int i) {
        return (i << 1) + 1;
    }

    /**
     * Linear scan over the leaf half of the array. Used to answer the end of
     * a single-order heap the layout does not keep at the root.
     *
     * @param largest true to find the largest priority, false for the smallest
     */
    int scanLeaves(boolean largest) {
        int size = nodes.size();
        int best = size >>> 1;
        for (int i = best + 1; i < size; i++) {
            int cmp = compare(i, best);
            if (largest ? cmp > 0 : cmp < 0) {
                best = i;
            }
        }
        return best;
    }
}
