package com.policysonar.risk;

import java.util.List;

/**
 * Aggregate risk verdict for a policy, derived from its historical analogs.
 */
public final class RiskAssessment {
    public final RiskLevel level;
    public final double score;
    public final double confidence;
    public final List<RiskFactor> factors;
    public final List<String> recommendations;

    public RiskAssessment(RiskLevel level, double score, double confidence,
                          List<RiskFactor> factors, List<String> recommendations) {
        this.level = level;
        this.score = score;
        this.confidence = confidence;
        this.factors = List.copyOf(factors);
        this.recommendations = List.copyOf(recommendations);
    }

    public static RiskAssessment insufficient(String reason) {
        return new RiskAssessment(RiskLevel.INSUFFICIENT, 0.0, 0.0, List.of(), List.of(reason));
    }

    @Override
    public String toString() {
        return String.format("RiskAssessment{level=%s, score=%.3f, confidence=%.3f, factors=%d, recommendations=%d}",
            level.label(), score, confidence, factors.size(), recommendations.size());
    }
}
