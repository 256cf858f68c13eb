package com.heapdict.core;

import java.util.NoSuchElementException;

/**
 * Thrown by the extremal accessors of an empty {@link IndexedPriorityQueue}
 * when no fallback value was supplied.
 */
public class EmptyQueueException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    public EmptyQueueException(String operation) {
        super("Can't " + operation + ": queue is empty");
    }
}
