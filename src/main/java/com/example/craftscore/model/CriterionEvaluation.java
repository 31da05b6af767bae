package com.example.craftscore.model;

/**
 * Raw result of evaluating one criterion, before weighting.
 *
 * @param score      0-100
 * @param feedback   Feedback text
 * @param confidence 0-100
 */
public record CriterionEvaluation(int score, String feedback, int confidence) {

    /** Neutral score used when the oracle could not evaluate a criterion. */
    public static final int FALLBACK_SCORE = 70;

    /** Confidence attached to fallback evaluations. */
    public static final int FALLBACK_CONFIDENCE = 40;

    public static CriterionEvaluation fallback(CriterionKind kind) {
        return new CriterionEvaluation(FALLBACK_SCORE, kind.displayName() + " evaluation unavailable",
                FALLBACK_CONFIDENCE);
    }

    public ScoringCriterion weighted(CriterionKind kind, double weight) {
        return new ScoringCriterion(kind, score, weight, feedback, confidence);
    }
}
