package com.policysonar.retrieval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * TermVector - Sparse TF-IDF embedding of a text.
 * The norm is computed once from the weights, so a zero norm means no usable signal.
 */
public final class TermVector {

    public static final TermVector EMPTY = new TermVector(List.of(), Map.of());

    public final List<String> tokens;
    public final Map<String, Double> weights;
    public final double norm;

    public TermVector(List<String> tokens, Map<String, Double> weights) {
        this.tokens = List.copyOf(tokens);
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));

        double sumOfSquares = 0.0;
        for (double w : this.weights.values()) {
            sumOfSquares += w * w;
        }
        this.norm = Math.sqrt(sumOfSquares);
    }

    public boolean isZero() {
        return norm == 0.0;
    }

    public double weight(String term) {
        return weights.getOrDefault(term, 0.0);
    }

    @Override
    public String toString() {
        return String.format("TermVector{tokens=%d, terms=%d, norm=%.4f}",
            tokens.size(), weights.size(), norm);
    }
}
