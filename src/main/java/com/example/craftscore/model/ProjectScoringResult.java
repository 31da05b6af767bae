package com.example.craftscore.model;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Outcome of scoring one project submission. Immutable once produced; reviewers revise it
 * through a linked {@link ReviewRequest}, never in place.
 *
 * @param scoringId            Unique id of this scoring pass
 * @param projectId            Scored project
 * @param userId               Project author
 * @param individualSkillScore Weighted aggregate (0-100)
 * @param skillLevelCategory   Level matching {@code individualSkillScore}
 * @param criteria             One entry per {@link CriterionKind}, in declaration order
 * @param feedback             Narrative feedback
 * @param aiScoringMetadata    Confidence, escalation and provenance
 */
public record ProjectScoringResult(
        String scoringId,
        String projectId,
        String userId,
        int individualSkillScore,
        SkillLevel skillLevelCategory,
        List<ScoringCriterion> criteria,
        ProjectFeedback feedback,
        AiScoringMetadata aiScoringMetadata
) {
    public ProjectScoringResult {
        criteria = List.copyOf(criteria);
    }

    public ScoringCriterion criterion(CriterionKind kind) {
        return criteria.stream()
                .filter(c -> c.kind() == kind)
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("No criterion " + kind.key() + " in " + scoringId));
    }
}
