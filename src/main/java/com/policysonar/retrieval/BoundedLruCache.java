package com.policysonar.retrieval;

import com.policysonar.errors.InvalidInputException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * BoundedLruCache - Capacity-bounded map that evicts the least recently used entry.
 *
 * <p>All bookkeeping runs under one lock. Values are computed outside the lock, so two callers
 * missing on the same key may both compute it; the first stored value wins and both callers
 * receive it.
 */
public class BoundedLruCache<K, V> {

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<K, V> entries;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public BoundedLruCache(int capacity) {
        if (capacity <= 0) {
            throw new InvalidInputException("Cache capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                boolean evict = size() > BoundedLruCache.this.capacity;
                if (evict) {
                    evictions.incrementAndGet();
                }
                return evict;
            }
        };
    }

    /**
     * Return the cached value (marking it recently used) or compute, store and return a new one.
     */
    public V getOrCompute(K key, Function<? super K, ? extends V> loader) {
        lock.lock();
        try {
            V cached = entries.get(key);
            if (cached != null) {
                hits.incrementAndGet();
                return cached;
            }
        } finally {
            lock.unlock();
        }

        misses.incrementAndGet();
        V computed = loader.apply(key);

        lock.lock();
        try {
            V raced = entries.get(key);
            if (raced != null) {
                return raced;
            }
            entries.put(key, computed);
            return computed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Counts as a hit or a miss, like {@link #getOrCompute}.
     */
    public Optional<V> getIfPresent(K key) {
        lock.lock();
        try {
            V cached = entries.get(key);
            if (cached != null) {
                hits.incrementAndGet();
            } else {
                misses.incrementAndGet();
            }
            return Optional.ofNullable(cached);
        } finally {
            lock.unlock();
        }
    }

    public void put(K key, V value) {
        lock.lock();
        try {
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(K key) {
        lock.lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public long evictions() {
        return evictions.get();
    }
}
