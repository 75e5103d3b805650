package com.policysonar.retrieval;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * DocumentFrequencyTable - Corpus-wide document frequencies plus the IDF memo built on them.
 * Instances are immutable apart from the memo, and the memo lives and dies with its table,
 * so replacing the table resets both together.
 */
final class DocumentFrequencyTable {

    static final DocumentFrequencyTable EMPTY = new DocumentFrequencyTable(Map.of(), 0);

    private final Map<String, Integer> documentFrequencies;
    private final int docCount;
    private final Map<String, Double> idfMemo = new ConcurrentHashMap<>();

    DocumentFrequencyTable(Map<String, Integer> documentFrequencies, int docCount) {
        this.documentFrequencies = Collections.unmodifiableMap(documentFrequencies);
        this.docCount = docCount;
    }

    int docCount() {
        return docCount;
    }

    int documentFrequency(String term) {
        return documentFrequencies.getOrDefault(term, 0);
    }

    int vocabularySize() {
        return documentFrequencies.size();
    }

    /**
     * ln(docCount / df), or 0 for unseen terms and an untrained table.
     */
    double idf(String term) {
        Double cached = idfMemo.get(term);
        if (cached != null) {
            return cached;
        }
        int df = documentFrequency(term);
        if (df == 0 || docCount == 0) {
            return 0.0;
        }
        double idf = Math.log((double) docCount / df);
        idfMemo.put(term, idf);
        return idf;
    }
}
