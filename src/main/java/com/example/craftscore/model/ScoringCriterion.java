package com.example.craftscore.model;

/**
 * Scored outcome for one criterion of a project.
 *
 * @param kind       Criterion evaluated
 * @param score      Criterion score (0-100)
 * @param weight     Weight of the criterion in the aggregate for the project's craft
 * @param feedback   Oracle feedback (or fallback text)
 * @param confidence Confidence in this criterion's score (0-100)
 */
public record ScoringCriterion(
        CriterionKind kind,
        int score,
        double weight,
        String feedback,
        int confidence
) {}
