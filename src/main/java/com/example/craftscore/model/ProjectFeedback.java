package com.example.craftscore.model;

import java.util.List;

/**
 * Narrative feedback shown to the author, also used by reviewers for revised feedback.
 */
public record ProjectFeedback(
        String overallFeedback,
        List<String> strengths,
        List<String> improvementAreas,
        List<String> nextStepSuggestions
) {
    public ProjectFeedback {
        strengths = strengths != null ? List.copyOf(strengths) : List.of();
        improvementAreas = improvementAreas != null ? List.copyOf(improvementAreas) : List.of();
        nextStepSuggestions = nextStepSuggestions != null ? List.copyOf(nextStepSuggestions) : List.of();
    }
}
