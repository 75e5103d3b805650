package com.policysonar.analog;

import com.policysonar.retrieval.EmbeddingService;
import com.policysonar.retrieval.PolicyCorpusStore;
import com.policysonar.retrieval.PolicyRecord;
import com.policysonar.retrieval.SimilarityMatch;
import com.policysonar.retrieval.SimilaritySearch;
import com.policysonar.retrieval.TermVector;
import com.policysonar.risk.RiskAssessment;
import com.policysonar.risk.RiskScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * PolicyAnalogService - Finds historical analogs for a policy text and scores their risk.
 *
 * <p>Loading a corpus retrains the embedding service on the corpus texts and precomputes the
 * corpus vectors; every match found is recorded in the analog repository.
 */
public class PolicyAnalogService {

    private static final Logger log = LoggerFactory.getLogger(PolicyAnalogService.class);

    private final EmbeddingService embeddings;
    private final SimilaritySearch search;
    private final RiskScorer riskScorer;
    private final AnalogRepository repository;
    private final Clock clock;

    // corpus and embedding table are swapped together under the write lock
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile Corpus corpus = new Corpus(List.of(), Map.of());

    public PolicyAnalogService(EmbeddingService embeddings, RiskScorer riskScorer, AnalogRepository repository) {
        this(embeddings, riskScorer, repository, Clock.systemUTC());
    }

    public PolicyAnalogService(EmbeddingService embeddings, RiskScorer riskScorer,
                               AnalogRepository repository, Clock clock) {
        this.embeddings = embeddings;
        this.search = new SimilaritySearch(embeddings);
        this.riskScorer = riskScorer;
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Replace the corpus, retrain on its texts and precompute its vectors.
     */
    public int loadCorpus(List<PolicyRecord> records) {
        List<String> texts = new ArrayList<>(records.size());
        for (PolicyRecord record : records) {
            texts.add(record.text);
        }
        lock.writeLock().lock();
        try {
            embeddings.train(texts);
            this.corpus = new Corpus(List.copyOf(records), search.precompute(texts));
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Loaded {} historical policies for analog search", records.size());
        return records.size();
    }

    public int loadCorpus(PolicyCorpusStore store) throws IOException {
        return loadCorpus(store.loadAll());
    }

    public List<SimilarityMatch> findHistoricalAnalogs(String policyText, double threshold) {
        return findHistoricalAnalogs(policyText, threshold, SimilaritySearch.DEFAULT_BATCH_SIZE);
    }

    public List<SimilarityMatch> findHistoricalAnalogs(String policyText, double threshold, int batchSize) {
        List<SimilarityMatch> matches;
        lock.readLock().lock();
        try {
            Corpus current = this.corpus;
            matches = search.findSimilar(policyText, current.records, threshold, current.vectors, batchSize);
        } finally {
            lock.readLock().unlock();
        }

        for (SimilarityMatch match : matches) {
            PolicyRecord record = match.record;
            repository.save(new PolicyAnalog(0L, policyText, record.id, record.text, match.score,
                record.riskFactors, record.outcomeNarrative, record.policyType, record.jurisdiction,
                record.year, clock.instant()));
        }
        return matches;
    }

    public AnalogReport assess(String policyText, double threshold) {
        return assess(policyText, threshold, SimilaritySearch.DEFAULT_BATCH_SIZE);
    }

    public AnalogReport assess(String policyText, double threshold, int batchSize) {
        List<SimilarityMatch> matches = findHistoricalAnalogs(policyText, threshold, batchSize);
        RiskAssessment assessment = riskScorer.assess(matches);
        log.debug("Assessed policy text against {} analogs: {}", matches.size(), assessment);
        return new AnalogReport(policyText, matches, assessment);
    }

    public List<PolicyRecord> corpus() {
        return corpus.records;
    }

    public EmbeddingService embeddings() {
        return embeddings;
    }

    private static final class Corpus {
        final List<PolicyRecord> records;
        final Map<String, TermVector> vectors;

        Corpus(List<PolicyRecord> records, Map<String, TermVector> vectors) {
            this.records = records;
            this.vectors = vectors;
        }
    }
}
