package com.example.craftscore.model;

import java.util.stream.Stream;

/**
 * Structural documentation signals extracted from a submission without the oracle.
 *
 * @param hasBeforeCue           Text mentions the starting state
 * @param hasProcessCue          Text walks through the process
 * @param hasAfterCue            Text mentions the finished result
 * @param hasDetailedDescription Description reaches the word-count threshold
 * @param hasMaterialsList       Materials list is non-empty
 * @param hasToolsList           Tools list is non-empty
 * @param hasTimeTracking        Time spent is recorded or mentioned
 * @param hasChallengesNoted     Text notes challenges or problems met
 * @param completenessScore      Share of signals present (0-100)
 */
public record DocumentationAnalysis(
        boolean hasBeforeCue,
        boolean hasProcessCue,
        boolean hasAfterCue,
        boolean hasDetailedDescription,
        boolean hasMaterialsList,
        boolean hasToolsList,
        boolean hasTimeTracking,
        boolean hasChallengesNoted,
        int completenessScore
) {
    public static final int SIGNAL_COUNT = 8;

    public static DocumentationAnalysis of(boolean hasBeforeCue, boolean hasProcessCue, boolean hasAfterCue,
                                           boolean hasDetailedDescription, boolean hasMaterialsList,
                                           boolean hasToolsList, boolean hasTimeTracking,
                                           boolean hasChallengesNoted) {
        long present = Stream.of(hasBeforeCue, hasProcessCue, hasAfterCue, hasDetailedDescription,
                        hasMaterialsList, hasToolsList, hasTimeTracking, hasChallengesNoted)
                .filter(Boolean::booleanValue)
                .count();
        int completeness = (int) Math.round(present * 100.0 / SIGNAL_COUNT);
        return new DocumentationAnalysis(hasBeforeCue, hasProcessCue, hasAfterCue, hasDetailedDescription,
                hasMaterialsList, hasToolsList, hasTimeTracking, hasChallengesNoted, completeness);
    }
}
