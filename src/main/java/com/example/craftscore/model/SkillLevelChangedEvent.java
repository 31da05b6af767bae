package com.example.craftscore.model;

/**
 * Published after a user's stored level changed.
 */
public record SkillLevelChangedEvent(
        String userId,
        SkillLevel oldLevel,
        SkillLevel newLevel,
        double averageScore
) {}
