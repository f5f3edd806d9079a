package com.example.medialibrary.common.cache;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed-capacity, access-ordered cache. Every read and write refreshes recency; inserting past
 * capacity evicts the least recently touched entry.
 *
 * <p>All operations synchronize on one lock per instance and the lock is held only for the map
 * operation itself. Callers must not compute values while holding it: look up, release, compute,
 * then {@link #put}.
 */
public class LruCache<K, V> {

    private final int capacity;
    private final Object lock = new Object();
    private final LinkedHashMap<K, V> entries;

    public LruCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<K, V>(Math.min(capacity, 128), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > LruCache.this.capacity;
            }
        };
    }

    public V get(K key) {
        synchronized (lock) {
            return entries.get(key);
        }
    }

    public void put(K key, V value) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("LruCache does not accept null keys or values");
        }
        synchronized (lock) {
            entries.put(key, value);
        }
    }

    public boolean containsKey(K key) {
        synchronized (lock) {
            return entries.containsKey(key);
        }
    }

    public V remove(K key) {
        synchronized (lock) {
            return entries.remove(key);
        }
    }

    public void clear() {
        synchronized (lock) {
            entries.clear();
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public int capacity() {
        return capacity;
    }
}
