package com.policysonar.analog;

import java.time.Instant;
import java.util.Set;

/**
 * A stored pairing of a queried policy text with one of its historical matches.
 */
public final class PolicyAnalog {
    public final long id;
    public final String policyText;
    public final String historicalPolicyId;
    public final String historicalMatch;
    public final double similarityScore;
    public final Set<String> riskFactors;
    public final String outcomeNarrative;
    public final String policyType;
    public final String jurisdiction;
    public final int year;
    public final Instant createdAt;

    public PolicyAnalog(long id, String policyText, String historicalPolicyId, String historicalMatch,
                        double similarityScore, Set<String> riskFactors, String outcomeNarrative,
                        String policyType, String jurisdiction, int year, Instant createdAt) {
        this.id = id;
        this.policyText = policyText;
        this.historicalPolicyId = historicalPolicyId;
        this.historicalMatch = historicalMatch;
        this.similarityScore = similarityScore;
        this.riskFactors = Set.copyOf(riskFactors);
        this.outcomeNarrative = outcomeNarrative;
        this.policyType = policyType;
        this.jurisdiction = jurisdiction;
        this.year = year;
        this.createdAt = createdAt;
    }

    @Override
    public String toString() {
        return String.format("PolicyAnalog{id=%d, match='%s', similarity=%.3f}", id, historicalPolicyId, similarityScore);
    }
}
