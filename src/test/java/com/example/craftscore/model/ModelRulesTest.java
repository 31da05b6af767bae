package com.example.craftscore.model;

import com.example.craftscore.exception.InvalidReviewTransitionException;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ModelRulesTest {

    @Test
    void reviewLifecycleAllowsOnlyForwardMoves() {
        assertTrue(ReviewStatus.PENDING.canTransitionTo(ReviewStatus.IN_REVIEW));
        assertTrue(ReviewStatus.PENDING.canTransitionTo(ReviewStatus.REJECTED));
        assertTrue(ReviewStatus.IN_REVIEW.canTransitionTo(ReviewStatus.COMPLETED));
        assertFalse(ReviewStatus.PENDING.canTransitionTo(ReviewStatus.COMPLETED));
        assertFalse(ReviewStatus.IN_REVIEW.canTransitionTo(ReviewStatus.REJECTED));
        assertFalse(ReviewStatus.IN_REVIEW.canTransitionTo(ReviewStatus.PENDING));
        assertTrue(ReviewStatus.COMPLETED.isTerminal());
        assertTrue(ReviewStatus.REJECTED.isTerminal());
        assertFalse(ReviewStatus.PENDING.isTerminal());
    }

    @Test
    void invalidTransitionNamesBothStates() {
        InvalidReviewTransitionException e = new InvalidReviewTransitionException("r1",
                ReviewStatus.COMPLETED, ReviewStatus.IN_REVIEW);

        assertEquals("Review r1 cannot move from completed to in_review", e.getMessage());
        assertEquals(ReviewStatus.COMPLETED, e.from());
        assertEquals(ReviewStatus.IN_REVIEW, e.to());
    }

    @Test
    void craftTypeParsesWireNames() {
        assertEquals(CraftType.GLASSBLOWING, CraftType.fromValue("glassblowing"));
        assertEquals(CraftType.JEWELRY, CraftType.fromValue(" Jewelry "));
        assertEquals("leathercraft", CraftType.LEATHERCRAFT.value());
        assertThrows(IllegalArgumentException.class, () -> CraftType.fromValue("origami"));
        assertThrows(IllegalArgumentException.class, () -> CraftType.fromValue(" "));
    }

    @Test
    void skillLevelsCoverZeroToHundredWithoutGaps() {
        int expectedMin = 0;
        for (SkillLevel level : SkillLevel.values()) {
            assertEquals(expectedMin, level.minScore(), level.name());
            expectedMin = level.maxScore() + 1;
        }
        assertEquals(101, expectedMin);
        assertEquals(Optional.of(SkillLevel.CRAFTSMAN), SkillLevel.JOURNEYMAN.next());
        assertEquals(Optional.empty(), SkillLevel.MASTER.next());
    }

    @Test
    void weightsMustCoverEveryCriterionAndSumToOne() {
        CriterionWeights weights = CriterionWeights.of(0.4, 0.3, 0.15, 0.1, 0.05);
        assertEquals(0.15, weights.weightOf(CriterionKind.TOOL_USAGE_APPROPRIATENESS));

        assertThrows(IllegalArgumentException.class, () -> CriterionWeights.of(0.4, 0.3, 0.15, 0.1, 0.1));
        assertThrows(IllegalArgumentException.class, () -> CriterionWeights.of(0.6, 0.3, 0.15, -0.1, 0.05));
        assertThrows(IllegalArgumentException.class,
                () -> new CriterionWeights(Map.of(CriterionKind.TECHNICAL_EXECUTION, 1.0)));
    }

    @Test
    void requestNormalisesOptionalLists() {
        ProjectScoringRequest request = new ProjectScoringRequest("p1", "u1", CraftType.POTTERY, "A bowl",
                null, null, null, null, null, null);

        assertTrue(request.materials().isEmpty());
        assertTrue(request.imageUrls().isEmpty());
        assertTrue(request.findTimeSpentMinutes().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new ProjectScoringRequest("p1", "u1",
                CraftType.POTTERY, "  ", null, null, null, null, null, null));
    }

    @Test
    void levelChangeBecomesEvent() {
        SkillLevelUpdate changed = new SkillLevelUpdate("u1", true, SkillLevel.NOVICE, SkillLevel.APPRENTICE, 25.0);
        SkillLevelUpdate same = new SkillLevelUpdate("u1", false, SkillLevel.NOVICE, SkillLevel.NOVICE, 15.0);

        assertEquals(Optional.of(new SkillLevelChangedEvent("u1", SkillLevel.NOVICE, SkillLevel.APPRENTICE, 25.0)),
                changed.toEvent());
        assertTrue(same.toEvent().isEmpty());
    }
}
