package com.example.craftscore.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A project submission as handed over by the post-creation flow.
 *
 * @param projectId        Project (post) identifier
 * @param userId           Author of the project
 * @param craftType        Craft the project belongs to
 * @param description      Free-text description written by the author
 * @param materials        Materials listed by the author (may be empty)
 * @param toolsUsed        Tools listed by the author (may be empty)
 * @param timeSpentMinutes Time tracked on the project, null when not recorded
 * @param imageUrls        Attached photos (may be empty)
 * @param userSkillLevel   Author's self-declared level, null when unknown
 * @param userProfile      Profile snippet used as oracle context, null when absent
 */
public record ProjectScoringRequest(
        String projectId,
        String userId,
        CraftType craftType,
        String description,
        List<String> materials,
        List<String> toolsUsed,
        Integer timeSpentMinutes,
        List<String> imageUrls,
        SkillLevel userSkillLevel,
        UserProfileSnippet userProfile
) {
    public ProjectScoringRequest {
        Objects.requireNonNull(projectId, "projectId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(craftType, "craftType");
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Project description must not be blank");
        }
        materials = materials != null ? List.copyOf(materials) : List.of();
        toolsUsed = toolsUsed != null ? List.copyOf(toolsUsed) : List.of();
        imageUrls = imageUrls != null ? List.copyOf(imageUrls) : List.of();
    }

    public Optional<Integer> findTimeSpentMinutes() {
        return Optional.ofNullable(timeSpentMinutes);
    }

    public Optional<SkillLevel> findUserSkillLevel() {
        return Optional.ofNullable(userSkillLevel);
    }

    public Optional<UserProfileSnippet> findUserProfile() {
        return Optional.ofNullable(userProfile);
    }

    /**
     * Profile details passed to the oracle as context.
     *
     * @param bio                  Free-text bio
     * @param craftSpecializations Crafts the user declared
     */
    public record UserProfileSnippet(String bio, List<CraftType> craftSpecializations) {
        public UserProfileSnippet {
            craftSpecializations = craftSpecializations != null ? List.copyOf(craftSpecializations) : List.of();
        }
    }
}
