package com.heapdict.core;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * A map from keys to priorities that is also a priority queue.
 *
 * <p>Entries are kept in three synchronized views: a doubly linked list in
 * insertion order (used for iteration, {@link #toString()} and equality), a
 * heap array ordered by priority, and a hash index from key to node, where
 * each node records its current heap slot. The heap layout is chosen by
 * {@link HeapOrder}; the default {@link HeapOrder#MIN_MAX} gives O(1) access
 * to both the smallest and the largest priority.
 *
 * <p>Complexity: key lookup O(1); {@link #peekMin()} and {@link #peekMax()}
 * O(1) for the ends the layout keeps at the top; {@link #put}, {@link #remove}
 * and the pop operations O(log n); bulk construction and {@link #copy()} O(n);
 * {@link #clear()} O(size).
 *
 * <p>Updating the priority of a present key keeps its position in iteration
 * order. Removing a key and putting it again moves it to the end.
 *
 * <p>Neither keys nor priorities may be {@code null}. Priorities are ordered
 * by their natural ordering unless a comparator is supplied.
 *
 * <p>This class is not thread-safe. Iterators are fail-fast: adding or
 * removing keys other than through the iterator itself makes the next
 * iterator call throw {@link ConcurrentModificationException}. Changing the
 * priority of a present key is not a structural modification.
 *
 * @param <K> key type
 * @param <P> priority type
 */
public class IndexedPriorityQueue<K, P> extends AbstractMap<K, P> {
    private final HeapOrder order;
    private final Comparator<? super P> comparator;
    private final HeapArray<K, P> heap;
    private final HashMap<K, Node<K, P>> index = new HashMap<>();

    // Insertion order
    private Node<K, P> head;
    private Node<K, P> tail;

    private int modCount;

    private Set<Map.Entry<K, P>> entrySet;
    private Set<K> keySet;

    /** Creates an empty min-max queue ordered by the priorities' natural ordering. */
    public IndexedPriorityQueue() {
        this(HeapOrder.MIN_MAX);
    }

    public IndexedPriorityQueue(HeapOrder order) {
        this(order, null);
    }

    /**
     * @param order heap layout
     * @param comparator priority ordering, or {@code null} for natural ordering
     */
    public IndexedPriorityQueue(HeapOrder order, Comparator<? super P> comparator) {
        this.order = Objects.requireNonNull(order, "order");
        this.comparator = comparator != null ? comparator : IndexedPriorityQueue.<P>naturalOrder();
        this.heap = order.newHeap(this.comparator);
    }

    /** Min-max queue with the entries of {@code source}, in its iteration order. */
    public IndexedPriorityQueue(Map<? extends K, ? extends P> source) {
        this(source, HeapOrder.MIN_MAX);
    }

    public IndexedPriorityQueue(Map<? extends K, ? extends P> source, HeapOrder order) {
        this(source, order, null);
    }

    public IndexedPriorityQueue(Map<? extends K, ? extends P> source, HeapOrder order,
            Comparator<? super P> comparator) {
        this(order, comparator);
        Objects.requireNonNull(source, "source");
        loadAll(source.entrySet());
        heap.heapify();
    }

    public IndexedPriorityQueue(Iterable<? extends Map.Entry<? extends K, ? extends P>> pairs) {
        this(pairs, HeapOrder.MIN_MAX);
    }

    public IndexedPriorityQueue(Iterable<? extends Map.Entry<? extends K, ? extends P>> pairs,
            HeapOrder order) {
        this(pairs, order, null);
    }

    /**
     * Builds a queue from (key, priority) pairs in O(n). When a key repeats,
     * the last priority wins and the key keeps the position of its first
     * occurrence.
     *
     * @throws IllegalArgumentException if an element of {@code pairs} is {@code null}
     * @throws NullPointerException if {@code pairs}, a key or a priority is {@code null}
     */
    public IndexedPriorityQueue(Iterable<? extends Map.Entry<? extends K, ? extends P>> pairs,
            HeapOrder order, Comparator<? super P> comparator) {
        this(order, comparator);
        Objects.requireNonNull(pairs, "pairs");
        loadAll(pairs);
        heap.heapify();
    }

    /**
     * Creates a queue holding every key of {@code keys} with the same priority.
     */
    public static <K, P> IndexedPriorityQueue<K, P> fromKeys(Iterable<? extends K> keys, P priority,
            HeapOrder order) {
        Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(priority, "priority");
        IndexedPriorityQueue<K, P> queue = new IndexedPriorityQueue<>(order);
        for (K key : keys) {
            queue.load(key, priority);
        }
        queue.heap.heapify();
        return queue;
    }

    public static <K, P> IndexedPriorityQueue<K, P> fromKeys(Iterable<? extends K> keys, P priority) {
        return fromKeys(keys, priority, HeapOrder.MIN_MAX);
    }

    /**
     * New queue with the entries of {@code left} followed by those of
     * {@code right}, using the layout and ordering of {@code right}. This is
     * the counterpart of {@link #union(Map)} for a plain map on the left.
     */
    public static <K, P> IndexedPriorityQueue<K, P> union(Map<? extends K, ? extends P> left,
            IndexedPriorityQueue<K, P> right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        IndexedPriorityQueue<K, P> result = new IndexedPriorityQueue<>(right.order, right.comparator);
        result.loadAll(left.entrySet());
        result.loadAll(right.entrySet());
        result.heap.heapify();
        return result;
    }

    @SuppressWarnings("unchecked")
    private static <P> Comparator<? super P> naturalOrder() {
        return (a, b) -> ((Comparable<Object>) a).compareTo(b);
    }

    // Adds or overwrites without restoring heap order
    private void loadAll(Iterable<? extends Map.Entry<? extends K, ? extends P>> pairs) {
        for (Map.Entry<? extends K, ? extends P> pair : pairs) {
            if (pair == null) {
                throw new IllegalArgumentException("Expected a (key, priority) pair but got null");
            }
            load(pair.getKey(), pair.getValue());
        }
    }

    private void load(K key, P priority) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(priority, "priority");
        Node<K, P> node = index.get(key);
        if (node != null) {
            node.priority = priority;
        } else {
            node = new Node<>(key, priority);
            index.put(key, node);
            linkLast(node);
            heap.append(node);
        }
    }

    public HeapOrder order() {
        return order;
    }

    public Comparator<? super P> comparator() {
        return comparator;
    }

    @Override
    public int size() {
        return index.size();
    }

    @Override
    public boolean isEmpty() {
        return index.isEmpty();
    }

    @Override
    public boolean containsKey(Object key) {
        return index.containsKey(key);
    }

    /** Returns the priority of {@code key}, or {@code null} if absent, as {@link Map#get} requires. */
    @Override
    public P get(Object key) {
        Node<K, P> node = index.get(key);
        return node == null ? null : node.priority;
    }

    /**
     * Returns the priority of {@code key}.
     *
     * @throws KeyNotFoundException if the key is absent
     */
    public P getPriority(K key) {
        Node<K, P> node = index.get(key);
        if (node == null) {
            throw new KeyNotFoundException(key);
        }
        return node.priority;
    }

    /**
     * Adds {@code key} or changes its priority. O(log n).
     *
     * <p>Either the call succeeds, or it throws and the queue is unchanged.
     *
     * @return the previous priority, or {@code null} if the key was absent
     * @throws NullPointerException if the key or the priority is {@code null}
     * @throws ClassCastException if the priority cannot be compared with the queue's priorities
     */
    @Override
    public P put(K key, P priority) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(priority, "priority");
        Node<K, P> node = index.get(key);
        if (node != null) {
            comparator.compare(priority, node.priority); // type check
            P previous = node.priority;
            node.priority = priority;
            heap.update(node.index);
            return previous;
        }
        if (heap.size() > 0) {
            comparator.compare(priority, heap.get(0).priority); // type check
        } else {
            comparator.compare(priority, priority);
        }
        node = new Node<>(key, priority);
        index.put(key, node);
        linkLast(node);
        heap.add(node);
        modCount++;
        return null;
    }

    /** Removes {@code key}, returning its priority or {@code null} if absent, as {@link Map#remove} requires. */
    @Override
    public P remove(Object key) {
        Node<K, P> node = index.get(key);
        if (node == null) {
            return null;
        }
        removeNode(node);
        return node.priority;
    }

    /**
     * Removes {@code key}.
     *
     * @throws KeyNotFoundException if the key is absent
     */
    public void delete(K key) {
        pop(key);
    }

    /**
     * Removes {@code key} and returns its priority.
     *
     * @throws KeyNotFoundException if the key is absent
     */
    public P pop(K key) {
        Node<K, P> node = index.get(key);
        if (node == null) {
            throw new KeyNotFoundException(key);
        }
        removeNode(node);
        return node.priority;
    }

    /** Removes {@code key} and returns its priority, or {@code fallback} if absent. */
    public P pop(K key, P fallback) {
        Node<K, P> node = index.get(key);
        if (node == null) {
            return fallback;
        }
        removeNode(node);
        return node.priority;
    }

    /**
     * Entry with the smallest priority. O(1), except on a {@link HeapOrder#MAX} queue.
     *
     * @throws EmptyQueueException if the queue is empty
     */
    public Map.Entry<K, P> peekMin() {
        return snapshot(minNode("peek min"));
    }

    public Map.Entry<K, P> peekMin(Map.Entry<K, P> fallback) {
        return isEmpty() ? fallback : peekMin();
    }

    /**
     * Entry with the largest priority. O(1), except on a {@link HeapOrder#MIN} queue.
     *
     * @throws EmptyQueueException if the queue is empty
     */
    public Map.Entry<K, P> peekMax() {
        return snapshot(maxNode("peek max"));
    }

    public Map.Entry<K, P> peekMax(Map.Entry<K, P> fallback) {
        return isEmpty() ? fallback : peekMax();
    }

    /**
     * Removes and returns the entry with the smallest priority.
     *
     * @throws EmptyQueueException if the queue is empty
     */
    public Map.Entry<K, P> popMin() {
        Node<K, P> node = minNode("pop min");
        removeNode(node);
        return snapshot(node);
    }

    public Map.Entry<K, P> popMin(Map.Entry<K, P> fallback) {
        return isEmpty() ? fallback : popMin();
    }

    /**
     * Removes and returns the entry with the largest priority.
     *
     * @throws EmptyQueueException if the queue is empty
     */
    public Map.Entry<K, P> popMax() {
        Node<K, P> node = maxNode("pop max");
        removeNode(node);
        return snapshot(node);
    }

    public Map.Entry<K, P> popMax(Map.Entry<K, P> fallback) {
        return isEmpty() ? fallback : popMax();
    }

    /**
     * Removes and returns the entry at the top of the heap: the maximum for a
     * {@link HeapOrder#MAX} queue, the minimum otherwise.
     *
     * @throws EmptyQueueException if the queue is empty
     */
    public Map.Entry<K, P> popItem() {
        return order.topIsMaximum() ? popMax() : popMin();
    }

    public Map.Entry<K, P> popItem(Map.Entry<K, P> fallback) {
        return isEmpty() ? fallback : popItem();
    }

    private Node<K, P> minNode(String operation) {
        if (heap.size() == 0) {
            throw new EmptyQueueException(operation);
        }
        return heap.get(heap.minIndex());
    }

    private Node<K, P> maxNode(String operation) {
        if (heap.size() == 0) {
            throw new EmptyQueueException(operation);
        }
        return heap.get(heap.maxIndex());
    }

    private static <K, P> Map.Entry<K, P> snapshot(Node<K, P> node) {
        return new AbstractMap.SimpleImmutableEntry<>(node.key, node.priority);
    }

    /** Removes every entry without touching heap order. O(size). */
    @Override
    public void clear() {
        index.clear();
        heap.clear();
        head = null;
        tail = null;
        modCount++;
    }

    /**
     * Independent copy with the same layout, ordering, insertion order and
     * heap shape. Keys and priorities themselves are shared. O(n).
     */
    public IndexedPriorityQueue<K, P> copy() {
        IndexedPriorityQueue<K, P> clone = new IndexedPriorityQueue<>(order, comparator);
        for (Node<K, P> node = head; node != null; node = node.after) {
            Node<K, P> copied = new Node<>(node.key, node.priority);
            clone.index.put(copied.key, copied);
            clone.linkLast(copied);
            clone.heap.place(copied, node.index);
        }
        return clone;
    }

    /**
     * New queue with this queue's entries followed by those of {@code other};
     * on a shared key the priority from {@code other} wins. Uses this queue's
     * layout and ordering. O(n + m).
     */
    public IndexedPriorityQueue<K, P> union(Map<? extends K, ? extends P> other) {
        Objects.requireNonNull(other, "other");
        IndexedPriorityQueue<K, P> result = new IndexedPriorityQueue<>(order, comparator);
        result.loadAll(entrySet());
        result.loadAll(other.entrySet());
        result.heap.heapify();
        return result;
    }

    /** Keys in reverse insertion order. Each call to {@code iterator()} starts a new traversal. */
    public Iterable<K> descendingKeys() {
        return () -> new KeyIterator(true);
    }

    @Override
    public Set<K> keySet() {
        Set<K> ks = keySet;
        if (ks == null) {
            ks = new KeySet();
            keySet = ks;
        }
        return ks;
    }

    @Override
    public Set<Map.Entry<K, P>> entrySet() {
        Set<Map.Entry<K, P>> es = entrySet;
        if (es == null) {
            es = new EntrySet();
            entrySet = es;
        }
        return es;
    }

    /** Renders as {@code IndexedPriorityQueue[MIN_MAX]({a: 5, b: 1})}, in insertion order. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName())
                .append('[').append(order).append("](");
        if (head != null) {
            sb.append('{');
            for (Node<K, P> node = head; node != null; node = node.after) {
                if (node != head) {
                    sb.append(", ");
                }
                sb.append(node.key).append(": ").append(node.priority);
            }
            sb.append('}');
        }
        return sb.append(')').toString();
    }

    // Package-private views for invariant checks in tests

    HeapArray<K, P> heapArray() {
        return heap;
    }

    Node<K, P> node(Object key) {
        return index.get(key);
    }

    private void removeNode(Node<K, P> node) {
        index.remove(node.key);
        unlink(node);
        heap.removeAt(node.index);
        modCount++;
    }

    private void linkLast(Node<K, P> node) {
        Node<K, P> last = tail;
        node.before = last;
        tail = node;
        if (last == null) {
            head = node;
        } else {
            last.after = node;
        }
    }

    private void unlink(Node<K, P> node) {
        Node<K, P> b = node.before;
        Node<K, P> a = node.after;
        if (b == null) {
            head = a;
        } else {
            b.after = a;
        }
        if (a == null) {
            tail = b;
        } else {
            a.before = b;
        }
        node.before = null;
        node.after = null;
    }

    private abstract class LinkedIterator<T> implements Iterator<T> {
        private final boolean descending;
        private Node<K, P> next;
        private Node<K, P> lastReturned;
        private int expectedModCount = modCount;

        LinkedIterator(boolean descending) {
            this.descending = descending;
            this.next = descending ? tail : head;
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        Node<K, P> nextNode() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            if (next == null) {
                throw new NoSuchElementException();
            }
            lastReturned = next;
            next = descending ? next.before : next.after;
            return lastReturned;
        }

        @Override
        public void remove() {
            if (lastReturned == null) {
                throw new IllegalStateException();
            }
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            removeNode(lastReturned);
            lastReturned = null;
            expectedModCount = modCount;
        }
    }

    private final class KeyIterator extends LinkedIterator<K> {
        KeyIterator(boolean descending) {
            super(descending);
        }

        @Override
        public K next() {
            return nextNode().key;
        }
    }

    private final class EntryIterator extends LinkedIterator<Map.Entry<K, P>> {
        EntryIterator() {
            super(false);
        }

        @Override
        public Map.Entry<K, P> next() {
            return new QueueEntry(nextNode());
        }
    }

    /** Live entry; {@link #setValue} goes through {@link #put} so heap order is kept. */
    private final class QueueEntry implements Map.Entry<K, P> {
        private final Node<K, P> node;

        QueueEntry(Node<K, P> node) {
            this.node = node;
        }

        @Override
        public K getKey() {
            return node.key;
        }

        @Override
        public P getValue() {
            return node.priority;
        }

        @Override
        public P setValue(P value) {
            if (node.index < 0) {
                throw new IllegalStateException("Entry is no longer in the queue");
            }
            return put(node.key, value);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Map.Entry)) {
                return false;
            }
            Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
            return Objects.equals(node.key, e.getKey()) && Objects.equals(node.priority, e.getValue());
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(node.key) ^ Objects.hashCode(node.priority);
        }

        @Override
        public String toString() {
            return node.key + "=" + node.priority;
        }
    }

    private final class KeySet extends AbstractSet<K> {
        @Override
        public Iterator<K> iterator() {
            return new KeyIterator(false);
        }

        @Override
        public int size() {
            return IndexedPriorityQueue.this.size();
        }

        @Override
        public boolean contains(Object o) {
            return containsKey(o);
        }

        @Override
        public boolean remove(Object o) {
            return IndexedPriorityQueue.this.remove(o) != null;
        }

        @Override
        public void clear() {
            IndexedPriorityQueue.this.clear();
        }
    }

    private final class EntrySet extends AbstractSet<Map.Entry<K, P>> {
        @Override
        public Iterator<Map.Entry<K, P>> iterator() {
            return new EntryIterator();
        }

        @Override
        public int size() {
            return IndexedPriorityQueue.this.size();
        }

        @Override
        public boolean contains(Object o) {
            if (!(o instanceof Map.Entry)) {
                return false;
            }
            Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
            Node<K, P> node = index.get(e.getKey());
            return node != null && node.priority.equals(e.getValue());
        }

        @Override
        public boolean remove(Object o) {
            if (!contains(o)) {
                return false;
            }
            IndexedPriorityQueue.this.remove(((Map.Entry<?, ?>) o).getKey());
            return true;
        }

        @Override
        public void clear() {
            IndexedPriorityQueue.this.clear();
        }
    }
}
