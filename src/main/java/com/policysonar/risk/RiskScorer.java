package com.policysonar.risk;

import com.policysonar.retrieval.PolicyRecord;
import com.policysonar.retrieval.SimilarityMatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * RiskScorer - Turns ranked historical analogs into a risk assessment.
 *
 * <p>Each match gets a base score from its outcome class and similarity band; the aggregate is
 * the similarity-weighted mean of those base scores. Recommendations repeat when several
 * factors trigger the same rule.
 */
public class RiskScorer {

    static final String NO_ANALOGS = "No historical analogs found for assessment";
    static final String NO_RISKS = "No significant risks identified based on historical analogs";

    public RiskAssessment assess(List<SimilarityMatch> matches) {
        if (matches == null || matches.isEmpty()) {
            return RiskAssessment.insufficient(NO_ANALOGS);
        }

        double weightedSum = 0.0;
        double similaritySum = 0.0;
        List<RiskFactor> factors = new ArrayList<>();

        for (SimilarityMatch match : matches) {
            PolicyRecord record = match.record;
            OutcomeClass outcome = OutcomeClass.classify(record.outcomeNarrative);

            weightedSum += outcome.baseScore(match.score) * match.score;
            similaritySum += match.score;

            if (outcome != OutcomeClass.POSITIVE) {
                factors.add(new RiskFactor(record.id, record.text, record.year, record.policyType,
                    record.outcomeNarrative, outcome, match.score));
            }
        }

        double score = similaritySum > 0 ? weightedSum / similaritySum : 0.0;
        double confidence = Math.min(similaritySum / matches.size(), 1.0);
        RiskLevel level = RiskLevel.fromScore(score);

        return new RiskAssessment(level, score, confidence, factors, recommend(level, factors));
    }

    List<String> recommend(RiskLevel level, List<RiskFactor> factors) {
        List<String> recommendations = new ArrayList<>();

        if (level == RiskLevel.HIGH) {
            recommendations.add("Strongly consider policy redesign or mitigation strategies");
            recommendations.add("Implement phased rollout with monitoring checkpoints");
        } else if (level == RiskLevel.MEDIUM) {
            recommendations.add("Consider targeted adjustments to high-risk aspects");
            recommendations.add("Establish monitoring framework for key indicators");
        }

        for (RiskFactor factor : factors) {
            String type = factor.policyType.toLowerCase(Locale.ROOT);
            String outcome = factor.outcomeNarrative.toLowerCase(Locale.ROOT);

            if (type.contains("trade")) {
                recommendations.add("Review trade agreements from " + factor.year + " for lessons");
            }
            if (outcome.contains("employment") && outcome.contains("reduction")) {
                recommendations.add("Develop workforce transition programs");
            }
            if (outcome.contains("price") && outcome.contains("increase")) {
                recommendations.add("Consider price stabilization measures");
            }
        }

        if (recommendations.isEmpty()) {
            recommendations.add(NO_RISKS);
        }
        return recommendations;
    }
}
