package com.policysonar.risk;

/**
 * Risk verdict derived from the aggregate score. Thresholds are strict lower bounds.
 */
public enum RiskLevel {
    INSUFFICIENT("Insufficient Data"),
    LOW("Low"),
    LOW_MEDIUM("Low-Medium"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static RiskLevel fromScore(double score) {
        if (score > 0.7) return HIGH;
        if (score > 0.5) return MEDIUM;
        if (score > 0.3) return LOW_MEDIUM;
        if (score > 0.1) return LOW;
        return INSUFFICIENT;
    }
}
