package com.example.craftscore.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Provenance and trust information attached to an automated score.
 *
 * @param confidence            Mean of the criterion confidences (0-100)
 * @param processingTimeMs      Wall-clock time spent scoring
 * @param timestamp             When the score was produced
 * @param needsHumanReview      Whether the score was escalated
 * @param reviewReason          Escalation reason, null when not escalated
 * @param modelVersion          Label of the oracle model that produced the score
 * @param craftTypeSpecific     Craft-specific focus used for the evaluation
 * @param documentationAnalysis Heuristic documentation signals
 */
public record AiScoringMetadata(
        int confidence,
        long processingTimeMs,
        Instant timestamp,
        boolean needsHumanReview,
        @JsonInclude(JsonInclude.Include.NON_NULL) String reviewReason,
        String modelVersion,
        CraftTypeSpecific craftTypeSpecific,
        DocumentationAnalysis documentationAnalysis
) {

    public Optional<String> findReviewReason() {
        return Optional.ofNullable(reviewReason);
    }

    /**
     * @param craftType        Craft evaluated
     * @param evaluationFocus  Aspects emphasised for the craft
     * @param commonChallenges Typical problems for the craft
     */
    public record CraftTypeSpecific(
            CraftType craftType,
            List<String> evaluationFocus,
            List<String> commonChallenges
    ) {
        public static CraftTypeSpecific of(CraftType craftType) {
            return new CraftTypeSpecific(craftType, craftType.evaluationFocus(), craftType.commonChallenges());
        }
    }
}
