package com.policysonar.retrieval;

import com.policysonar.errors.InvalidInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static com.policysonar.retrieval.PolicyFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SimilaritySearchTest {

    private EmbeddingService embeddings;
    private SimilaritySearch search;

    @BeforeEach
    void setUp() {
        embeddings = new EmbeddingService(64);
        search = new SimilaritySearch(embeddings);
    }

    private void train(List<PolicyRecord> corpus) {
        List<String> texts = new ArrayList<>();
        for (PolicyRecord record : corpus) {
            texts.add(record.text);
        }
        embeddings.train(texts);
    }

    @Test
    void shouldRankIdenticalPolicyFirst() {
        // GIVEN
        train(sampleCorpus());

        // WHEN
        List<SimilarityMatch> matches = search.findSimilar(RENEWABLE_CREDIT.text, sampleCorpus(), 0.1);

        // THEN
        assertThat(matches).isNotEmpty();
        assertThat(matches.get(0).record.id).isEqualTo("2");
        assertThat(matches.get(0).score).isCloseTo(1.0, within(1e-9));
        assertThat(matches).allSatisfy(m -> assertThat(m.score).isGreaterThanOrEqualTo(0.1));
    }

    @Test
    void shouldReturnNothingForEmptyCorpus() {
        train(sampleCorpus());

        for (double threshold : new double[] {0.0, 0.5, 1.0}) {
            assertThat(search.findSimilar("steel tariff", List.of(), threshold)).isEmpty();
        }
    }

    @Test
    void shouldSortDescendingAndNeverReturnBelowThreshold() {
        train(sampleCorpus());

        List<SimilarityMatch> all = search.findSimilar(RENEWABLE_CREDIT.text, sampleCorpus(), 0.0);
        assertThat(all).extracting(m -> m.record.id).containsExactly("2", "1", "3");
        for (int i = 1; i < all.size(); i++) {
            assertThat(all.get(i).score).isLessThanOrEqualTo(all.get(i - 1).score);
        }
        assertThat(all).allSatisfy(m -> assertThat(m.score).isBetween(0.0, 1.0));

        for (double threshold : new double[] {0.01, 0.02, 0.5, 1.0}) {
            assertThat(search.findSimilar(RENEWABLE_CREDIT.text, sampleCorpus(), threshold))
                .allSatisfy(m -> assertThat(m.score).isGreaterThanOrEqualTo(threshold));
        }
    }

    @Test
    void shouldKeepCorpusOrderForEqualScores() {
        // GIVEN
        PolicyRecord first = record("a", "solar subsidy");
        PolicyRecord second = record("b", "solar subsidy");
        PolicyRecord other = record("c", "coal tax");
        train(List.of(first, second, other));

        // WHEN
        List<SimilarityMatch> forward = search.findSimilar("solar subsidy", List.of(first, second, other), 0.5);
        List<SimilarityMatch> reversed = search.findSimilar("solar subsidy", List.of(second, first, other), 0.5);

        // THEN
        assertThat(forward).extracting(m -> m.record.id).containsExactly("a", "b");
        assertThat(reversed).extracting(m -> m.record.id).containsExactly("b", "a");
        assertThat(forward.get(0).score).isEqualTo(forward.get(1).score);
    }

    @Test
    void shouldScoreSelfSimilarityAsOne() {
        train(sampleCorpus());
        TermWeighting weighting = embeddings.weighting();

        for (PolicyRecord record : sampleCorpus()) {
            TermVector vector = weighting.vectorize(record.text);
            assertThat(search.cosineSimilarity(vector, weighting.vectorize(record.text)))
                .isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    void shouldScoreZeroWhenEveryTermIsUbiquitous() {
        // GIVEN every document has the same term set
        List<PolicyRecord> corpus = List.of(
            record("a", "alpha beta"), record("b", "beta alpha"), record("c", "alpha beta alpha"));
        train(corpus);

        // THEN
        assertThat(embeddings.weighting().inverseDocumentFrequency("alpha")).isZero();
        assertThat(embeddings.weighting().inverseDocumentFrequency("beta")).isZero();
        assertThat(search.findSimilar("alpha beta", corpus, 0.0)).allSatisfy(m -> assertThat(m.score).isZero());
        assertThat(search.findSimilar("alpha beta", corpus, 0.1)).isEmpty();
    }

    @Test
    void shouldComputeCosineOverSharedTerms() {
        TermVector a = new TermVector(List.of("x", "y"), Map.of("x", 1.0, "y", 1.0));
        TermVector b = new TermVector(List.of("x"), Map.of("x", 1.0));

        assertThat(search.cosineSimilarity(a, b)).isCloseTo(1 / Math.sqrt(2), within(1e-12));
        assertThat(search.cosineSimilarity(b, a)).isEqualTo(search.cosineSimilarity(a, b));
        assertThat(search.cosineSimilarity(a, TermVector.EMPTY)).isZero();
    }

    @Test
    void shouldPreferPrecomputedVectors() {
        // GIVEN a precomputed vector for the steel tariff that equals the query vector
        train(sampleCorpus());
        TermVector queryVector = embeddings.weighting().vectorize(RENEWABLE_CREDIT.text);
        Map<String, TermVector> precomputed = Map.of(STEEL_TARIFF.text, queryVector);

        // WHEN
        List<SimilarityMatch> matches = search.findSimilar(RENEWABLE_CREDIT.text, sampleCorpus(), 0.5,
            precomputed, SimilaritySearch.DEFAULT_BATCH_SIZE);

        // THEN
        assertThat(matches).extracting(m -> m.record.id).containsExactly("1", "2");
        assertThat(embeddings.isCached(STEEL_TARIFF.text)).isFalse();
        assertThat(embeddings.isCached(MINIMUM_WAGE.text)).isTrue();
    }

    @Test
    void shouldPrecomputeVectorsByText() {
        train(sampleCorpus());
        List<String> texts = List.of(STEEL_TARIFF.text, MINIMUM_WAGE.text);

        Map<String, TermVector> vectors = search.precompute(texts);

        assertThat(vectors).containsOnlyKeys(texts);
        assertThat(embeddings.isCached(STEEL_TARIFF.text)).isTrue();
    }

    @Test
    void shouldHoldRetrainUntilSearchFinishes() throws Exception {
        // GIVEN a retrain issued while the search is between the query and the corpus lookups
        embeddings.train(List.of("alpha beta gamma", "alpha delta"));
        PolicyRecord self = record("self", "alpha beta gamma");
        AtomicReference<CompletableFuture<Void>> retrain = new AtomicReference<>();
        Map<String, TermVector> precomputed = new HashMap<>() {
            @Override
            public boolean containsKey(Object key) {
                if (retrain.get() == null) {
                    CompletableFuture<Void> pending = CompletableFuture.runAsync(() ->
                        embeddings.train(List.of("alpha beta gamma", "beta epsilon", "gamma zeta eta")));
                    retrain.set(pending);
                    assertThatThrownBy(() -> pending.get(200, TimeUnit.MILLISECONDS))
                        .isInstanceOf(TimeoutException.class);
                }
                return super.containsKey(key);
            }
        };

        // WHEN
        List<SimilarityMatch> matches = search.findSimilar(self.text, List.of(self), 0.0,
            precomputed, SimilaritySearch.DEFAULT_BATCH_SIZE);

        // THEN both vectors came from the first table, and the retrain ran afterwards
        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).score).isCloseTo(1.0, within(1e-9));
        retrain.get().get(5, TimeUnit.SECONDS);
        assertThat(embeddings.isCached(self.text)).isFalse();
    }

    @Test
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> search.findSimilar("   ", sampleCorpus(), 0.5))
            .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> search.findSimilar("steel", sampleCorpus(), 1.5))
            .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> search.findSimilar("steel", sampleCorpus(), 0.5, null, 0))
            .isInstanceOf(InvalidInputException.class);
    }
}
