package com.example.craftscore.model;

import java.util.List;
import java.util.Locale;

/**
 * Context shared by every oracle call of one scoring pass.
 */
public record ScoringContext(UserContext userProfile, ProjectContext currentProject) {

    private static final List<String> COMMON_TECHNIQUES =
            List.of("cutting", "sanding", "joining", "finishing", "measuring", "drilling");

    /**
     * Builds the context once per submission.
     */
    public static ScoringContext from(ProjectScoringRequest request) {
        List<CraftType> specializations = request.findUserProfile()
                .map(ProjectScoringRequest.UserProfileSnippet::craftSpecializations)
                .filter(list -> !list.isEmpty())
                .orElse(List.of(request.craftType()));
        String bio = request.findUserProfile().map(ProjectScoringRequest.UserProfileSnippet::bio).orElse(null);
        SkillLevel skillLevel = request.findUserSkillLevel().orElse(SkillLevel.APPRENTICE);

        String lowered = request.description().toLowerCase(Locale.ROOT);
        return new ScoringContext(
                new UserContext(specializations, skillLevel, bio),
                new ProjectContext(
                        request.description(),
                        request.craftType(),
                        estimateDifficulty(lowered),
                        request.materials(),
                        COMMON_TECHNIQUES.stream().filter(lowered::contains).toList()));
    }

    static String estimateDifficulty(String loweredDescription) {
        if (loweredDescription.contains("advanced") || loweredDescription.contains("complex")) return "advanced";
        if (loweredDescription.contains("intermediate") || loweredDescription.contains("moderate")) {
            return "intermediate";
        }
        return "beginner";
    }

    public record UserContext(List<CraftType> craftSpecializations, SkillLevel skillLevel, String bio) {}

    public record ProjectContext(
            String description,
            CraftType craftType,
            String difficulty,
            List<String> materials,
            List<String> techniques
    ) {}
}
