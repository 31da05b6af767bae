package com.example.craftscore.model;

import java.util.Optional;

/**
 * Whether an automated score must go to a human, and why.
 */
public record EscalationDecision(boolean needsHumanReview, String reason) {

    public static final EscalationDecision NONE = new EscalationDecision(false, null);

    public static EscalationDecision escalate(String reason) {
        return new EscalationDecision(true, reason);
    }

    public Optional<String> findReason() {
        return Optional.ofNullable(reason);
    }
}
