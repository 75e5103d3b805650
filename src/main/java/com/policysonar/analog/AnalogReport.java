package com.policysonar.analog;

import com.policysonar.retrieval.SimilarityMatch;
import com.policysonar.risk.RiskAssessment;

import java.util.List;

/**
 * Historical analogs of a policy text together with the risk they imply.
 */
public final class AnalogReport {
    public final String policyText;
    public final List<SimilarityMatch> matches;
    public final RiskAssessment assessment;

    public AnalogReport(String policyText, List<SimilarityMatch> matches, RiskAssessment assessment) {
        this.policyText = policyText;
        this.matches = List.copyOf(matches);
        this.assessment = assessment;
    }
}
