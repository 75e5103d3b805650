package com.policysonar.retrieval;

import com.policysonar.errors.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * SimilaritySearch - Ranks corpus records by cosine similarity to a query text.
 *
 * <p>Results are filtered by threshold and sorted by descending score with a stable sort,
 * so records with equal scores stay in corpus order.
 */
public class SimilaritySearch {

    private static final Logger log = LoggerFactory.getLogger(SimilaritySearch.class);

    public static final int DEFAULT_BATCH_SIZE = 50;
    public static final int DEFAULT_PRECOMPUTE_BATCH_SIZE = 100;

    private static final Comparator<SimilarityMatch> BY_SCORE_DESC =
        Comparator.comparingDouble((SimilarityMatch m) -> m.score).reversed();

    private final EmbeddingService embeddings;

    public SimilaritySearch(EmbeddingService embeddings) {
        this.embeddings = embeddings;
    }

    public double cosineSimilarity(TermVector a, TermVector b) {
        return VectorMath.cosine(a, b);
    }

    public List<SimilarityMatch> findSimilar(String queryText, List<PolicyRecord> corpus, double threshold) {
        return findSimilar(queryText, corpus, threshold, null, DEFAULT_BATCH_SIZE);
    }

    /**
     * @param precomputed optional vectors keyed by record text; records not found there are
     *                    embedded through the cache
     * @param batchSize   chunk size for embedding corpus records, throughput only
     */
    public List<SimilarityMatch> findSimilar(String queryText, List<PolicyRecord> corpus, double threshold,
                                             Map<String, TermVector> precomputed, int batchSize) {
        if (queryText == null || queryText.isBlank()) {
            throw new InvalidInputException("Query text must not be blank");
        }
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new InvalidInputException("Similarity threshold must be within [0, 1], got " + threshold);
        }
        if (batchSize <= 0) {
            throw new InvalidInputException("Batch size must be positive, got " + batchSize);
        }

        long started = System.nanoTime();
        List<SimilarityMatch> matches = embeddings.withReadLock(
            () -> rank(queryText, corpus, threshold, precomputed, batchSize));

        log.debug("Similarity search over {} records kept {} matches (threshold {}) in {} us",
            corpus.size(), matches.size(), threshold, (System.nanoTime() - started) / 1_000);
        return matches;
    }

    // query and corpus vectors must come from the same table
    private List<SimilarityMatch> rank(String queryText, List<PolicyRecord> corpus, double threshold,
                                       Map<String, TermVector> precomputed, int batchSize) {
        TermVector query = embeddings.embed(queryText);

        List<PolicyRecord> pending = new ArrayList<>();
        for (PolicyRecord record : corpus) {
            if (precomputed == null || !precomputed.containsKey(record.text)) {
                pending.add(record);
            }
        }
        Map<PolicyRecord, TermVector> embedded = new HashMap<>();
        if (!pending.isEmpty()) {
            List<String> texts = new ArrayList<>(pending.size());
            for (PolicyRecord record : pending) {
                texts.add(record.text);
            }
            List<TermVector> vectors = embeddings.embedBatch(texts, batchSize);
            for (int i = 0; i < pending.size(); i++) {
                embedded.put(pending.get(i), vectors.get(i));
            }
        }

        List<SimilarityMatch> matches = new ArrayList<>();
        for (PolicyRecord record : corpus) {
            TermVector vector = embedded.containsKey(record) ? embedded.get(record) : precomputed.get(record.text);
            double score = cosineSimilarity(query, vector);
            if (score >= threshold) {
                matches.add(new SimilarityMatch(record, score));
            }
        }
        matches.sort(BY_SCORE_DESC);
        return matches;
    }

    /**
     * Embed the given texts ahead of time, keyed by text, for reuse in {@link #findSimilar}.
     */
    public Map<String, TermVector> precompute(List<String> texts, int batchSize) {
        List<TermVector> vectors = embeddings.embedBatch(texts, batchSize);
        Map<String, TermVector> byText = new HashMap<>();
        for (int i = 0; i < texts.size(); i++) {
            byText.put(texts.get(i), vectors.get(i));
        }
        return byText;
    }

    public Map<String, TermVector> precompute(List<String> texts) {
        return precompute(texts, DEFAULT_PRECOMPUTE_BATCH_SIZE);
    }
}
