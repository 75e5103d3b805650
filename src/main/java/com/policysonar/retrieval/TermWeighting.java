package com.policysonar.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TermWeighting - TF-IDF weighting against a trained document frequency table.
 *
 * <p>{@link #train(Collection)} builds a complete new table and publishes it in one volatile
 * write, so concurrent {@link #vectorize(String)} calls see either the old table or the new
 * one, never a table in the middle of a rebuild.
 */
public class TermWeighting {

    private static final Logger log = LoggerFactory.getLogger(TermWeighting.class);

    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private volatile DocumentFrequencyTable table = DocumentFrequencyTable.EMPTY;

    /**
     * Rebuild document frequencies from scratch. A term counts once per document
     * no matter how often it repeats inside it.
     */
    public void train(Collection<String> documents) {
        Map<String, Integer> frequencies = new HashMap<>();
        for (String doc : documents) {
            Set<String> unique = new HashSet<>(tokenize(doc));
            for (String term : unique) {
                frequencies.merge(term, 1, Integer::sum);
            }
        }
        this.table = new DocumentFrequencyTable(frequencies, documents.size());
        log.info("Trained term weighting on {} documents ({} distinct terms)",
            documents.size(), frequencies.size());
    }

    /**
     * Lowercase the text and return its maximal word-character runs in order.
     */
    public List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            tokens.add(m.group());
        }
        return tokens;
    }

    /**
     * Occurrences divided by total token count. Empty input yields an empty map.
     */
    public Map<String, Double> termFrequency(List<String> tokens) {
        Map<String, Double> tf = new LinkedHashMap<>();
        if (tokens.isEmpty()) {
            return tf;
        }
        double unit = 1.0 / tokens.size();
        for (String token : tokens) {
            tf.merge(token, unit, Double::sum);
        }
        return tf;
    }

    public double inverseDocumentFrequency(String term) {
        return table.idf(term);
    }

    public TermVector vectorize(String text) {
        DocumentFrequencyTable snapshot = this.table;
        List<String> tokens = tokenize(text);
        Map<String, Double> tf = termFrequency(tokens);

        Map<String, Double> weights = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : tf.entrySet()) {
            weights.put(entry.getKey(), entry.getValue() * snapshot.idf(entry.getKey()));
        }
        return new TermVector(tokens, weights);
    }

    public int docCount() {
        return table.docCount();
    }

    public int documentFrequency(String term) {
        return table.documentFrequency(term);
    }

    public int vocabularySize() {
        return table.vocabularySize();
    }
}
