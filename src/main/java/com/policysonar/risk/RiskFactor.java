package com.policysonar.risk;

/**
 * A historical analog whose outcome was not clearly positive.
 */
public final class RiskFactor {
    public final String policyId;
    public final String policyText;
    public final int year;
    public final String policyType;
    public final String outcomeNarrative;
    public final OutcomeClass outcomeClass;
    public final double similarity;

    public RiskFactor(String policyId, String policyText, int year, String policyType,
                      String outcomeNarrative, OutcomeClass outcomeClass, double similarity) {
        this.policyId = policyId;
        this.policyText = policyText;
        this.year = year;
        this.policyType = policyType;
        this.outcomeNarrative = outcomeNarrative;
        this.outcomeClass = outcomeClass;
        this.similarity = similarity;
    }

    @Override
    public String toString() {
        return String.format("RiskFactor{policy='%s', year=%d, type='%s', outcome=%s, similarity=%.3f}",
            policyId, year, policyType, outcomeClass, similarity);
    }
}
