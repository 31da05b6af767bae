package com.example.craftscore.exception;

import com.example.craftscore.model.ReviewStatus;

/**
 * Thrown when a review request is moved along a transition its lifecycle does not allow.
 */
public class InvalidReviewTransitionException extends IllegalStateException {

    private final ReviewStatus from;
    private final ReviewStatus to;

    public InvalidReviewTransitionException(String reviewId, ReviewStatus from, ReviewStatus to) {
        super("Review " + reviewId + " cannot move from " + from.value() + " to " + to.value());
        this.from = from;
        this.to = to;
    }

    public ReviewStatus from() {
        return from;
    }

    public ReviewStatus to() {
        return to;
    }
}
