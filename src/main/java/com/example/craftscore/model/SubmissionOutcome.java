package com.example.craftscore.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Optional;

/**
 * What the author gets back after submitting a project.
 *
 * @param projectId   Submitted project
 * @param status      Whether a score was produced
 * @param message     Short human-readable status line
 * @param result      Score, null when scoring was unavailable
 * @param reviewId    Review request created for the score, null when none
 * @param skillUpdate Skill record change, null when the update did not happen
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubmissionOutcome(
        String projectId,
        Status status,
        String message,
        ProjectScoringResult result,
        String reviewId,
        SkillLevelUpdate skillUpdate
) {

    public static final String SCORING_UNAVAILABLE_MESSAGE = "Scoring unavailable, you can view your history later";

    public enum Status { SCORED, SCORING_UNAVAILABLE }

    public static SubmissionOutcome unavailable(String projectId) {
        return new SubmissionOutcome(projectId, Status.SCORING_UNAVAILABLE, SCORING_UNAVAILABLE_MESSAGE,
                null, null, null);
    }

    public Optional<ProjectScoringResult> findResult() {
        return Optional.ofNullable(result);
    }

    public Optional<String> findReviewId() {
        return Optional.ofNullable(reviewId);
    }

    public Optional<SkillLevelUpdate> findSkillUpdate() {
        return Optional.ofNullable(skillUpdate);
    }
}
