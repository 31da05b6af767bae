package com.example.craftscore.model;

import com.example.craftscore.exception.InvalidReviewTransitionException;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A scored project queued for human review.
 *
 * @param id                    Request id
 * @param projectId             Reviewed project
 * @param userId                Project author
 * @param scoringId             Scoring pass under review
 * @param originalScoringResult Automated result as it was when the request was created
 * @param reviewReason          Why the project is reviewed
 * @param status                Lifecycle state
 * @param priority              Queue priority
 * @param requestedAt           Creation time
 * @param assignedReviewerId    Reviewer working on it, null until assigned
 * @param assignedAt            Assignment time, null until assigned
 * @param completedAt           Completion or rejection time, null while open
 * @param reviewerNotes         Reviewer notes, null while open
 * @param revisedScore          Score overriding the automated one, null when not revised
 * @param revisedFeedback       Feedback overriding the automated one, null when not revised
 * @param userRequestedReview   Whether the author asked for the review
 * @param metadata              Context captured at submission
 */
@Document(collection = "review_requests")
public record ReviewRequest(
        @Id String id,
        String projectId,
        String userId,
        String scoringId,
        ProjectScoringResult originalScoringResult,
        String reviewReason,
        ReviewStatus status,
        ReviewPriority priority,
        Instant requestedAt,
        String assignedReviewerId,
        Instant assignedAt,
        Instant completedAt,
        String reviewerNotes,
        Integer revisedScore,
        ProjectFeedback revisedFeedback,
        boolean userRequestedReview,
        ReviewMetadata metadata
) {

    public Optional<String> findAssignedReviewerId() {
        return Optional.ofNullable(assignedReviewerId);
    }

    public Optional<Instant> findCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public Optional<Integer> findRevisedScore() {
        return Optional.ofNullable(revisedScore);
    }

    public Optional<ProjectFeedback> findRevisedFeedback() {
        return Optional.ofNullable(revisedFeedback);
    }

    /** Score the author should see: the reviewer's revision when there is one. */
    public int effectiveScore() {
        return findRevisedScore().orElse(originalScoringResult.individualSkillScore());
    }

    public ReviewRequest assignTo(String reviewerId, Instant at) {
        requireTransition(ReviewStatus.IN_REVIEW);
        return new ReviewRequest(id, projectId, userId, scoringId, originalScoringResult, reviewReason,
                ReviewStatus.IN_REVIEW, priority, requestedAt, reviewerId, at, completedAt, reviewerNotes,
                revisedScore, revisedFeedback, userRequestedReview, metadata);
    }

    public ReviewRequest complete(String notes, Integer newScore, ProjectFeedback newFeedback, Instant at) {
        requireTransition(ReviewStatus.COMPLETED);
        return new ReviewRequest(id, projectId, userId, scoringId, originalScoringResult, reviewReason,
                ReviewStatus.COMPLETED, priority, requestedAt, assignedReviewerId, assignedAt, at, notes,
                newScore, newFeedback, userRequestedReview, metadata);
    }

    public ReviewRequest reject(String notes, Instant at) {
        requireTransition(ReviewStatus.REJECTED);
        return new ReviewRequest(id, projectId, userId, scoringId, originalScoringResult, reviewReason,
                ReviewStatus.REJECTED, priority, requestedAt, assignedReviewerId, assignedAt, at, notes,
                revisedScore, revisedFeedback, userRequestedReview, metadata);
    }

    private void requireTransition(ReviewStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidReviewTransitionException(id, status, target);
        }
    }

    /**
     * @param originalConfidence Automated confidence at submission
     * @param flaggedCriteria    Keys of criteria with low confidence
     * @param modelVersion       Oracle model that produced the score
     * @param reviewType         How the review was triggered
     */
    public record ReviewMetadata(
            int originalConfidence,
            List<String> flaggedCriteria,
            String modelVersion,
            ReviewType reviewType
    ) {
        public ReviewMetadata {
            flaggedCriteria = flaggedCriteria != null ? List.copyOf(flaggedCriteria) : List.of();
        }
    }

    public enum ReviewType {
        AUTOMATIC,
        USER_REQUESTED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
