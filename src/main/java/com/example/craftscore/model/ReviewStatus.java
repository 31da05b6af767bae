package com.example.craftscore.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a review request: pending → in_review → completed, or pending → rejected.
 * Completed and rejected are terminal.
 */
public enum ReviewStatus {

    PENDING,
    IN_REVIEW,
    COMPLETED,
    REJECTED;

    public boolean canTransitionTo(ReviewStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }

    private Set<ReviewStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> Set.of(IN_REVIEW, REJECTED);
            case IN_REVIEW -> Set.of(COMPLETED);
            case COMPLETED, REJECTED -> Set.of();
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
