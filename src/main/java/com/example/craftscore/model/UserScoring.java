package com.example.craftscore.model;

import java.time.Instant;
import java.util.List;

/**
 * Scoring sub-document of a user. Written only by the skill-level service.
 *
 * @param averageProjectScore  Recency-weighted average of the user's project scores
 * @param calculatedSkillLevel Level derived from the average
 * @param projectCount         Number of scored projects
 * @param skillProgression     Level-change ledger, ordered by {@code achievedAt}
 * @param lastScoreUpdate      Time of the last recomputation, null before the first one
 */
public record UserScoring(
        double averageProjectScore,
        SkillLevel calculatedSkillLevel,
        int projectCount,
        List<SkillProgressionEntry> skillProgression,
        Instant lastScoreUpdate
) {
    public UserScoring {
        if (calculatedSkillLevel == null) calculatedSkillLevel = SkillLevel.NOVICE;
        skillProgression = skillProgression != null ? List.copyOf(skillProgression) : List.of();
    }

    public static UserScoring initial() {
        return new UserScoring(0.0, SkillLevel.NOVICE, 0, List.of(), null);
    }
}
