package com.example.craftscore.model;

import java.time.Instant;

/**
 * One entry of the append-only skill ledger, written when a user's level changes.
 *
 * @param skillLevel       Level reached
 * @param averageScore     Recency-weighted average that produced the level
 * @param achievedAt       When the level was reached
 * @param projectCount     Scored projects at the time of the change
 * @param triggerProjectId Project whose scoring caused the change
 */
public record SkillProgressionEntry(
        SkillLevel skillLevel,
        double averageScore,
        Instant achievedAt,
        int projectCount,
        String triggerProjectId
) {}
