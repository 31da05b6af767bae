package com.example.craftscore.model;

import java.util.Optional;

/**
 * Outcome of folding a new project into a user's skill record.
 *
 * @param userId       User updated
 * @param levelChanged Whether a ledger entry was appended
 * @param oldLevel     Level stored before the update
 * @param newLevel     Level stored after the update
 * @param averageScore Recomputed average
 */
public record SkillLevelUpdate(
        String userId,
        boolean levelChanged,
        SkillLevel oldLevel,
        SkillLevel newLevel,
        double averageScore
) {

    /** Event to publish for this update, empty when the level did not move. */
    public Optional<SkillLevelChangedEvent> toEvent() {
        if (!levelChanged) return Optional.empty();
        return Optional.of(new SkillLevelChangedEvent(userId, oldLevel, newLevel, averageScore));
    }
}
