package com.example.craftscore.service;

import com.example.craftscore.exception.ReviewNotFoundException;
import com.example.craftscore.model.CriterionKind;
import com.example.craftscore.model.ProjectFeedback;
import com.example.craftscore.model.ProjectScoringResult;
import com.example.craftscore.model.ReviewPriority;
import com.example.craftscore.model.ReviewRequest;
import com.example.craftscore.model.ReviewStats;
import com.example.craftscore.model.ReviewStatus;
import com.example.craftscore.model.ScoringCriterion;
import com.example.craftscore.repository.ReviewRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PermissionDeniedDataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Human review queue for automated scores.
 * <p>
 * Requests move pending → in_review → completed, or pending → rejected. Any other move raises
 * {@link com.example.craftscore.exception.InvalidReviewTransitionException}.
 */
@Service
public class ManualReviewService {

    private static final Logger log = LoggerFactory.getLogger(ManualReviewService.class);

    /** Returned instead of a review id when the store refuses the write. */
    public static final String PERMISSION_DENIED = "permission-denied";

    static final int FLAGGED_CRITERION_CONFIDENCE = 60;

    private static final EnumSet<ReviewStatus> OPEN = EnumSet.of(ReviewStatus.PENDING, ReviewStatus.IN_REVIEW);

    /** Highest priority first, then oldest first. */
    private static final Comparator<ReviewRequest> QUEUE_ORDER = Comparator
            .comparing(ReviewRequest::priority, Comparator.reverseOrder())
            .thenComparing(ReviewRequest::requestedAt);

    private final ReviewRequestRepository repository;
    private final Clock clock;

    public ManualReviewService(ReviewRequestRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Queues a scored project for review.
     *
     * @param result        Automated result under review
     * @param userRequested Whether the author asked for the review
     * @param notes         Author's notes, may be null
     * @return the new request id, or {@link #PERMISSION_DENIED} when the store refused the write
     */
    public String submitForReview(ProjectScoringResult result, boolean userRequested, String notes) {
        ReviewPriority priority = priorityFor(result, userRequested);
        List<String> flagged = result.criteria().stream()
                .filter(c -> c.confidence() < FLAGGED_CRITERION_CONFIDENCE)
                .map(ScoringCriterion::kind)
                .map(CriterionKind::key)
                .toList();
        String reason = userRequested
                ? "User requested manual review: " + (notes != null && !notes.isBlank() ? notes : "No additional notes")
                : result.aiScoringMetadata().findReviewReason().orElse("AI flagged for review");

        ReviewRequest request = new ReviewRequest(
                UUID.randomUUID().toString(),
                result.projectId(),
                result.userId(),
                result.scoringId(),
                result,
                reason,
                ReviewStatus.PENDING,
                priority,
                clock.instant(),
                null, null, null, null, null, null,
                userRequested,
                new ReviewRequest.ReviewMetadata(
                        result.aiScoringMetadata().confidence(),
                        flagged,
                        result.aiScoringMetadata().modelVersion(),
                        userRequested ? ReviewRequest.ReviewType.USER_REQUESTED : ReviewRequest.ReviewType.AUTOMATIC));

        try {
            ReviewRequest saved = repository.save(request);
            log.info("Review {} queued for project {} with {} priority: {}",
                    saved.id(), saved.projectId(), priority.value(), reason);
            return saved.id();
        } catch (PermissionDeniedDataAccessException e) {
            log.warn("Review store refused request for project {}: {}", result.projectId(), e.getMessage());
            return PERMISSION_DENIED;
        }
    }

    static ReviewPriority priorityFor(ProjectScoringResult result, boolean userRequested) {
        if (userRequested) return ReviewPriority.HIGH;
        int confidence = result.aiScoringMetadata().confidence();
        int score = result.individualSkillScore();
        if (confidence < 50 || score < 30 || score > 95) return ReviewPriority.HIGH;
        if (confidence < 70) return ReviewPriority.MEDIUM;
        return ReviewPriority.LOW;
    }

    public ReviewRequest assignReview(String reviewId, String reviewerId) {
        if (reviewerId == null || reviewerId.isBlank()) {
            throw new IllegalArgumentException("Reviewer id is required");
        }
        ReviewRequest assigned = repository.save(find(reviewId).assignTo(reviewerId, clock.instant()));
        log.info("Review {} assigned to {}", reviewId, reviewerId);
        return assigned;
    }

    /**
     * Closes an in-review request with the reviewer's decision.
     *
     * @param revisedScore    Replacement score (0-100), null to keep the automated one
     * @param revisedFeedback Replacement feedback, null to keep the automated one
     */
    public ReviewRequest completeReview(String reviewId, String notes, Integer revisedScore,
                                        ProjectFeedback revisedFeedback) {
        if (revisedScore != null && (revisedScore < 0 || revisedScore > 100)) {
            throw new IllegalArgumentException("Revised score must be between 0 and 100, got " + revisedScore);
        }
        ReviewRequest completed = repository.save(
                find(reviewId).complete(notes, revisedScore, revisedFeedback, clock.instant()));
        log.info("Review {} completed{}", reviewId,
                completed.findRevisedScore().map(s -> " with revised score " + s).orElse(""));
        return completed;
    }

    public ReviewRequest rejectReview(String reviewId, String notes) {
        ReviewRequest rejected = repository.save(find(reviewId).reject(notes, clock.instant()));
        log.info("Review {} rejected", reviewId);
        return rejected;
    }

    /**
     * Open requests, highest priority first and oldest first within a priority.
     *
     * @param reviewerId restricts the list to this reviewer's assignments; null for the whole queue
     */
    public List<ReviewRequest> getPendingReviews(String reviewerId) {
        List<ReviewRequest> open = reviewerId == null
                ? repository.findByStatusIn(OPEN)
                : repository.findByAssignedReviewerIdAndStatusIn(reviewerId, OPEN);
        return open.stream().sorted(QUEUE_ORDER).toList();
    }

    /** Latest review request for a project. */
    public Optional<ReviewRequest> getReviewStatus(String projectId) {
        return repository.findFirstByProjectIdOrderByRequestedAtDesc(projectId);
    }

    public ReviewStats getReviewStats() {
        List<ReviewRequest> all = repository.findAll();
        Map<ReviewStatus, Long> byStatus = all.stream()
                .collect(Collectors.groupingBy(ReviewRequest::status, Collectors.counting()));
        Function<ReviewStatus, Long> count = status -> byStatus.getOrDefault(status, 0L);

        double averageMillis = all.stream()
                .filter(r -> r.status() == ReviewStatus.COMPLETED)
                .filter(r -> r.completedAt() != null && r.requestedAt() != null)
                .mapToLong(r -> Duration.between(r.requestedAt(), r.completedAt()).toMillis())
                .average()
                .orElse(0.0);
        long highPriority = all.stream().filter(r -> r.priority() == ReviewPriority.HIGH).count();

        return new ReviewStats(
                all.size(),
                count.apply(ReviewStatus.PENDING),
                count.apply(ReviewStatus.IN_REVIEW),
                count.apply(ReviewStatus.COMPLETED),
                count.apply(ReviewStatus.REJECTED),
                Math.round(averageMillis / Duration.ofMinutes(1).toMillis()),
                highPriority);
    }

    private ReviewRequest find(String reviewId) {
        return repository.findById(reviewId).orElseThrow(() -> new ReviewNotFoundException(reviewId));
    }
}
