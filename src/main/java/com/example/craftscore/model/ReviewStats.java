package com.example.craftscore.model;

/**
 * Snapshot of the review queue.
 *
 * @param total                    All review requests
 * @param pending                  Awaiting a reviewer
 * @param inReview                 Assigned to a reviewer
 * @param completed                Closed with a decision
 * @param rejected                 Closed without review
 * @param averageReviewTimeMinutes Mean request-to-completion time of completed reviews, whole minutes
 * @param highPriority             Requests with high priority
 */
public record ReviewStats(
        long total,
        long pending,
        long inReview,
        long completed,
        long rejected,
        long averageReviewTimeMinutes,
        long highPriority
) {}
