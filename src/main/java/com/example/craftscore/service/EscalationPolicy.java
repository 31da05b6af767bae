package com.example.craftscore.service;

import com.example.craftscore.model.EscalationDecision;
import com.example.craftscore.model.ScoringCriterion;

import java.util.List;

/**
 * Decides whether an automated score may stand on its own. Rules are checked in order and the
 * first one that fires gives the reason.
 */
public final class EscalationPolicy {

    public static final String LOW_OVERALL_CONFIDENCE = "Low overall confidence in AI assessment";
    public static final String LOW_CRITERION_CONFIDENCE = "Low confidence in specific criteria evaluation";
    public static final String INCONSISTENT_SCORES = "Inconsistent scoring across criteria";

    static final int MIN_OVERALL_CONFIDENCE = 70;
    static final int MIN_CRITERION_CONFIDENCE = 50;
    static final double MAX_SCORE_VARIANCE = 800.0;

    private EscalationPolicy() {
    }

    /** Mean of the criterion confidences, rounded half-up. */
    public static int overallConfidence(List<ScoringCriterion> criteria) {
        double mean = criteria.stream().mapToInt(ScoringCriterion::confidence).average().orElse(0.0);
        return (int) Math.round(mean);
    }

    public static EscalationDecision decide(List<ScoringCriterion> criteria, int overallConfidence) {
        if (overallConfidence < MIN_OVERALL_CONFIDENCE) {
            return EscalationDecision.escalate(LOW_OVERALL_CONFIDENCE);
        }
        if (criteria.stream().anyMatch(c -> c.confidence() < MIN_CRITERION_CONFIDENCE)) {
            return EscalationDecision.escalate(LOW_CRITERION_CONFIDENCE);
        }
        List<Integer> scores = criteria.stream().map(ScoringCriterion::score).toList();
        if (ScoringFramework.populationVariance(scores) > MAX_SCORE_VARIANCE) {
            return EscalationDecision.escalate(INCONSISTENT_SCORES);
        }
        return EscalationDecision.NONE;
    }
}
