package com.policysonar.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * EmbeddingService - TF-IDF embeddings served through an LRU cache.
 *
 * <p>Lookups share a read lock; {@link #train(Collection)} holds the write lock while it
 * retrains the weighting and purges the cache, so a vector computed against the previous
 * table can never be inserted after the purge.
 */
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final TermWeighting weighting;
    private final EmbeddingCache cache;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public EmbeddingService() {
        this(EmbeddingCache.DEFAULT_CAPACITY);
    }

    public EmbeddingService(int cacheCapacity) {
        this(new TermWeighting(), cacheCapacity);
    }

    public EmbeddingService(TermWeighting weighting, int cacheCapacity) {
        this.weighting = weighting;
        this.cache = new EmbeddingCache(cacheCapacity, weighting::vectorize);
    }

    public void train(Collection<String> documents) {
        lock.writeLock().lock();
        try {
            weighting.train(documents);
            int purged = cache.stats().size;
            cache.clear();
            log.debug("Purged {} cached vectors after retraining", purged);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public TermVector embed(String text) {
        lock.readLock().lock();
        try {
            return cache.getOrCompute(text);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<TermVector> embedBatch(List<String> texts, int batchSize) {
        lock.readLock().lock();
        try {
            return cache.getBatch(texts, batchSize);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Run several lookups against one weighting table. Nested {@link #embed} and
     * {@link #embedBatch} calls re-enter the read lock, so a {@link #train} issued meanwhile
     * waits until the whole action has finished.
     */
    public <T> T withReadLock(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isCached(String text) {
        return cache.contains(text);
    }

    public TermWeighting weighting() {
        return weighting;
    }

    public CacheStats stats() {
        return cache.stats();
    }
}
