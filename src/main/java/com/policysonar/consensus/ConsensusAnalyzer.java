package com.policysonar.consensus;

import com.policysonar.errors.ExternalServiceException;
import com.policysonar.errors.InvalidInputException;
import com.policysonar.external.AnalysisResponse;
import com.policysonar.external.AnalysisSource;
import com.policysonar.external.PolicyAnalysisClient;
import com.policysonar.retrieval.BoundedLruCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * ConsensusAnalyzer - Summarizes where academic sources stand on a policy.
 *
 * <p>Sources above 0.7 sentiment support the policy, below 0.3 oppose it, the rest are neutral.
 * Confidence is the net support share rounded to two decimals. Results are memoized per
 * policy text.
 */
public class ConsensusAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ConsensusAnalyzer.class);

    public static final int MIN_TEXT_LENGTH = 50;
    public static final int RECENT_YEARS = 5;
    public static final int CACHE_SIZE = 100;

    private final PolicyAnalysisClient client;
    private final Clock clock;
    private final BoundedLruCache<String, ConsensusResult> cache = new BoundedLruCache<>(CACHE_SIZE);

    public ConsensusAnalyzer(PolicyAnalysisClient client) {
        this(client, Clock.systemUTC());
    }

    public ConsensusAnalyzer(PolicyAnalysisClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    public ConsensusResult academicConsensus(String policyText, Duration timeout) throws ExternalServiceException {
        if (policyText == null || policyText.strip().length() < MIN_TEXT_LENGTH) {
            throw new InvalidInputException("Policy text must be at least " + MIN_TEXT_LENGTH + " characters");
        }
        Optional<ConsensusResult> cached = cache.getIfPresent(policyText);
        if (cached.isPresent()) {
            return cached.get();
        }

        AnalysisResponse response;
        try {
            response = client.analyzePolicy(policyText, PolicyAnalysisClient.FOCUS_ACADEMIC, timeout);
        } catch (ExternalServiceException e) {
            log.error("Consensus analysis failed: {}", e.getMessage());
            throw e;
        }

        ConsensusResult result = summarize(response.sources);
        cache.put(policyText, result);
        return result;
    }

    ConsensusResult summarize(List<AnalysisSource> sources) {
        int support = 0;
        int oppose = 0;
        int neutral = 0;
        int recent = 0;
        int currentYear = LocalDate.now(clock).getYear();
        TreeSet<String> journals = new TreeSet<>();

        for (AnalysisSource source : sources) {
            if (source.sentiment > 0.7) {
                support++;
            } else if (source.sentiment < 0.3) {
                oppose++;
            } else {
                neutral++;
            }
            if (source.year != null && source.year >= currentYear - RECENT_YEARS) {
                recent++;
            }
            if (source.journal != null && !source.journal.isEmpty()) {
                journals.add(source.journal);
            }
        }

        int total = sources.size();
        double confidence = total == 0 ? 0.0 : Math.round((double) (support - oppose) / total * 100.0) / 100.0;
        double recency = total == 0 ? 0.0 : (double) recent / total;

        ConsensusMetrics metrics = new ConsensusMetrics(support, oppose, neutral, confidence, total, recency);
        return new ConsensusResult(metrics, new ArrayList<>(journals), sources);
    }
}
