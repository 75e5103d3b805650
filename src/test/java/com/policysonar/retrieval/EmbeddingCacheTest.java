package com.policysonar.retrieval;

import com.policysonar.errors.InvalidInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddingCacheTest {

    private AtomicInteger vectorizations;
    private EmbeddingCache cache;

    @BeforeEach
    void setUp() {
        vectorizations = new AtomicInteger();
        cache = new EmbeddingCache(3, text -> {
            vectorizations.incrementAndGet();
            return new TermVector(List.of(text), Map.of(text, 1.0));
        });
    }

    @Test
    void shouldReuseCachedVector() {
        TermVector first = cache.getOrCompute("steel tariff");
        TermVector second = cache.getOrCompute("steel tariff");

        assertThat(second).isSameAs(first);
        assertThat(vectorizations.get()).isEqualTo(1);

        CacheStats stats = cache.stats();
        assertThat(stats.hits).isEqualTo(1);
        assertThat(stats.misses).isEqualTo(1);
        assertThat(stats.totalComputed).isEqualTo(1);
    }

    @Test
    void shouldReturnBatchInInputOrder() {
        // GIVEN
        List<String> texts = List.of("a", "b", "a", "c", "d");

        // WHEN
        List<TermVector> vectors = cache.getBatch(texts, 2);

        // THEN
        assertThat(vectors).hasSize(5);
        for (int i = 0; i < texts.size(); i++) {
            assertThat(vectors.get(i).tokens).containsExactly(texts.get(i));
        }
        assertThat(vectors.get(2)).isSameAs(vectors.get(0));
        assertThat(vectorizations.get()).isEqualTo(4);
        assertThat(cache.stats().batchCount).isEqualTo(3);
    }

    @Test
    void shouldEvictBeyondCapacity() {
        cache.getBatch(List.of("a", "b", "c", "d"));

        assertThat(cache.contains("a")).isFalse();
        assertThat(cache.contains("d")).isTrue();
        assertThat(cache.stats().size).isEqualTo(3);
        assertThat(cache.stats().evictions).isEqualTo(1);
    }

    @Test
    void shouldRejectNonPositiveBatchSize() {
        assertThatThrownBy(() -> cache.getBatch(List.of("a"), 0))
            .isInstanceOf(InvalidInputException.class);
    }
}
