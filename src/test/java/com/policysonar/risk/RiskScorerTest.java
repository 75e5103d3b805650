package com.policysonar.risk;

import com.policysonar.retrieval.PolicyRecord;
import com.policysonar.retrieval.SimilarityMatch;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RiskScorerTest {

    private final RiskScorer scorer = new RiskScorer();

    private static SimilarityMatch match(String id, String type, int year, String narrative, double score) {
        return new SimilarityMatch(
            new PolicyRecord(id, "policy " + id, year, type, "National", Set.of(), narrative), score);
    }

    @Test
    void shouldReturnInsufficientForNoMatches() {
        RiskAssessment assessment = scorer.assess(List.of());

        assertThat(assessment.level).isEqualTo(RiskLevel.INSUFFICIENT);
        assertThat(assessment.confidence).isZero();
        assertThat(assessment.factors).isEmpty();
        assertThat(assessment.recommendations).containsExactly("No historical analogs found for assessment");
    }

    @Test
    void shouldRateCloseNegativeAnalogAsHigh() {
        // GIVEN a single analog at 0.9 similarity whose outcome declined
        List<SimilarityMatch> matches = List.of(match("p1", "Energy", 2012, "Manufacturing output decline", 0.9));

        // WHEN
        RiskAssessment assessment = scorer.assess(matches);

        // THEN
        assertThat(assessment.score).isCloseTo(0.90, within(1e-9));
        assertThat(assessment.confidence).isCloseTo(0.9, within(1e-9));
        assertThat(assessment.level).isEqualTo(RiskLevel.HIGH);
        assertThat(assessment.factors).singleElement()
            .satisfies(f -> assertThat(f.outcomeClass).isEqualTo(OutcomeClass.NEGATIVE));
        assertThat(assessment.recommendations).containsExactly(
            "Strongly consider policy redesign or mitigation strategies",
            "Implement phased rollout with monitoring checkpoints");
    }

    @Test
    void shouldWeightBaseScoresBySimilarity() {
        List<SimilarityMatch> matches = List.of(
            match("neg", "Energy", 2012, "output decline", 0.9),
            match("pos", "Energy", 2015, "strong growth", 0.6));

        RiskAssessment assessment = scorer.assess(matches);

        // (0.90 * 0.9 + 0.05 * 0.6) / 1.5
        assertThat(assessment.score).isCloseTo(0.56, within(1e-9));
        assertThat(assessment.confidence).isCloseTo(0.75, within(1e-9));
        assertThat(assessment.level).isEqualTo(RiskLevel.MEDIUM);
        assertThat(assessment.factors).extracting(f -> f.policyId).containsExactly("neg");
    }

    @Test
    void shouldAppendFactorRecommendations() {
        List<SimilarityMatch> matches = List.of(match("t", "International Trade", 2018,
            "2.6% price increase in construction, 2% reduction in employment", 0.9));

        RiskAssessment assessment = scorer.assess(matches);

        assertThat(assessment.level).isEqualTo(RiskLevel.MEDIUM);
        assertThat(assessment.recommendations).containsExactly(
            "Consider targeted adjustments to high-risk aspects",
            "Establish monitoring framework for key indicators",
            "Review trade agreements from 2018 for lessons",
            "Develop workforce transition programs",
            "Consider price stabilization measures");
    }

    @Test
    void shouldKeepDuplicateRecommendations() {
        List<SimilarityMatch> matches = List.of(
            match("a", "Trade", 2018, "exports decline", 0.6),
            match("b", "Trade", 2018, "imports decline", 0.6));

        RiskAssessment assessment = scorer.assess(matches);

        assertThat(assessment.recommendations)
            .filteredOn(r -> r.equals("Review trade agreements from 2018 for lessons"))
            .hasSize(2);
    }

    @Test
    void shouldFallBackWhenNothingIsRecommended() {
        RiskAssessment assessment = scorer.assess(List.of(match("p", "Energy", 2009, "12% growth", 0.9)));

        assertThat(assessment.level).isEqualTo(RiskLevel.LOW);
        assertThat(assessment.factors).isEmpty();
        assertThat(assessment.recommendations)
            .containsExactly("No significant risks identified based on historical analogs");
    }

    @Test
    void shouldScoreZeroWhenSimilaritiesSumToZero() {
        RiskAssessment assessment = scorer.assess(List.of(match("z", "Energy", 2001, "output decline", 0.0)));

        assertThat(assessment.score).isZero();
        assertThat(assessment.confidence).isZero();
        assertThat(assessment.level).isEqualTo(RiskLevel.INSUFFICIENT);
    }
}
