package com.heapdict.core;

import java.util.NoSuchElementException;

/**
 * Thrown when a lookup or removal names a key that is not in the queue.
 */
public class KeyNotFoundException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    private final transient Object key;

    public KeyNotFoundException(Object key) {
        super("Key not found: " + key);
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
