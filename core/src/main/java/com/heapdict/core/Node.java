package com.heapdict.core;

/**
 * A single (key, priority) pair as stored by {@link IndexedPriorityQueue}.
 * The node is linked into the insertion-order list and remembers its
 * current slot in the heap array.
 */
final class Node<K, P> {
    final K key;
    P priority;
    int index = -1; // heap slot, -1 once removed
    Node<K, P> before;
    Node<K, P> after;

    Node(K key, P priority) {
        this.key = key;
        this.priority = priority;
    }

    @Override
    public String toString() {
        return key + "=" + priority + "@" + index;
    }
}
