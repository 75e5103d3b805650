package com.policysonar.retrieval;

import com.policysonar.errors.InvalidInputException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * EmbeddingCache - LRU memo of term vectors keyed by the exact input text.
 */
public class EmbeddingCache {

    public static final int DEFAULT_CAPACITY = 2048;
    public static final int DEFAULT_BATCH_SIZE = 100;

    private final BoundedLruCache<String, TermVector> cache;
    private final Function<String, TermVector> vectorizer;
    private final AtomicLong totalComputed = new AtomicLong();
    private final AtomicLong batchCount = new AtomicLong();

    public EmbeddingCache(int capacity, Function<String, TermVector> vectorizer) {
        this.cache = new BoundedLruCache<>(capacity);
        this.vectorizer = vectorizer;
    }

    public TermVector getOrCompute(String text) {
        return cache.getOrCompute(text, this::compute);
    }

    /**
     * Same result as calling {@link #getOrCompute(String)} for each text in order;
     * the chunking only bounds how much work happens per step.
     */
    public List<TermVector> getBatch(List<String> texts, int batchSize) {
        if (batchSize <= 0) {
            throw new InvalidInputException("Batch size must be positive, got " + batchSize);
        }
        List<TermVector> vectors = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += batchSize) {
            batchCount.incrementAndGet();
            int end = Math.min(start + batchSize, texts.size());
            for (String text : texts.subList(start, end)) {
                vectors.add(getOrCompute(text));
            }
        }
        return vectors;
    }

    public List<TermVector> getBatch(List<String> texts) {
        return getBatch(texts, DEFAULT_BATCH_SIZE);
    }

    public boolean contains(String text) {
        return cache.contains(text);
    }

    public void clear() {
        cache.clear();
    }

    public CacheStats stats() {
        return new CacheStats(cache.hits(), cache.misses(), totalComputed.get(), batchCount.get(),
            cache.evictions(), cache.size(), cache.capacity());
    }

    private TermVector compute(String text) {
        totalComputed.incrementAndGet();
        return vectorizer.apply(text);
    }
}
