package com.policysonar.risk;

import java.util.List;
import java.util.Locale;

/**
 * Keyword classification of a historical outcome narrative.
 * A narrative mentioning both directions is MIXED, as is one mentioning neither.
 */
public enum OutcomeClass {
    POSITIVE,
    NEGATIVE,
    MIXED;

    static final List<String> INCREASE_WORDS = List.of("increase", "growth", "improve");
    static final List<String> DECREASE_WORDS = List.of("decrease", "reduction", "decline");

    public static OutcomeClass classify(String narrative) {
        String lower = narrative == null ? "" : narrative.toLowerCase(Locale.ROOT);
        boolean up = containsAny(lower, INCREASE_WORDS);
        boolean down = containsAny(lower, DECREASE_WORDS);

        if (up && down) return MIXED;
        if (up) return POSITIVE;
        if (down) return NEGATIVE;
        return MIXED;
    }

    /**
     * Base risk score indexed by similarity band: above 0.85, above 0.70, otherwise.
     */
    public double baseScore(double similarity) {
        switch (this) {
            case NEGATIVE:
                return similarity > 0.85 ? 0.90 : similarity > 0.70 ? 0.70 : 0.50;
            case MIXED:
                return similarity > 0.85 ? 0.60 : similarity > 0.70 ? 0.40 : 0.30;
            default:
                return similarity > 0.85 ? 0.20 : similarity > 0.70 ? 0.10 : 0.05;
        }
    }

    private static boolean containsAny(String text, List<String> words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
