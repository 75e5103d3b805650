package com.policysonar.retrieval;

import java.util.Map;

/**
 * VectorMath - Similarity arithmetic over sparse term vectors.
 */
public final class VectorMath {

    /**
     * Sum of a[term] * b[term] over shared terms. Iterates the smaller map;
     * terms missing on either side contribute nothing.
     */
    public static double dot(Map<String, Double> a, Map<String, Double> b) {
        Map<String, Double> small = a.size() <= b.size() ? a : b;
        Map<String, Double> large = small == a ? b : a;

        double dot = 0.0;
        for (Map.Entry<String, Double> entry : small.entrySet()) {
            Double other = large.get(entry.getKey());
            if (other != null) {
                dot += entry.getValue() * other;
            }
        }
        return dot;
    }

    /**
     * Cosine similarity, 0 when either vector has zero norm.
     * Capped at 1 to absorb rounding on identical vectors.
     */
    public static double cosine(TermVector a, TermVector b) {
        if (a.isZero() || b.isZero()) {
            return 0.0;
        }
        return Math.min(1.0, dot(a.weights, b.weights) / (a.norm * b.norm));
    }

    private VectorMath() {}
}
