package com.example.craftscore.model;

import java.util.List;

/**
 * Result of recomputing a user's skill level from their scored projects.
 *
 * @param skillLevel         Level for the rounded average
 * @param averageScore       Recency-weighted average score
 * @param projectCount       Projects with a positive score
 * @param confidence         0-1, grows with project count and score consistency
 * @param progressionHistory Ledger as currently stored
 */
public record SkillLevelCalculation(
        SkillLevel skillLevel,
        double averageScore,
        int projectCount,
        double confidence,
        List<SkillProgressionEntry> progressionHistory
) {
    public SkillLevelCalculation {
        progressionHistory = progressionHistory != null ? List.copyOf(progressionHistory) : List.of();
    }

    public static SkillLevelCalculation empty(List<SkillProgressionEntry> history) {
        return new SkillLevelCalculation(SkillLevel.NOVICE, 0.0, 0, 0.0, history);
    }
}
