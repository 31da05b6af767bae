package com.example.craftscore.agent;

import com.example.craftscore.model.CriterionEvaluation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CriterionReplyParserTest {

    @Test
    void parsesWellFormedReply() {
        CriterionEvaluation evaluation = CriterionReplyParser.parse(
                "SCORE: 82 | FEEDBACK: Tight joints, clean finish. | CONFIDENCE: 77", 85);

        assertEquals(82, evaluation.score());
        assertEquals("Tight joints, clean finish.", evaluation.feedback());
        assertEquals(77, evaluation.confidence());
    }

    @Test
    void tagsAreCaseInsensitive() {
        CriterionEvaluation evaluation = CriterionReplyParser.parse(
                "score: 64 | feedback: Decent | confidence: 55", 85);

        assertEquals(64, evaluation.score());
        assertEquals("Decent", evaluation.feedback());
        assertEquals(55, evaluation.confidence());
    }

    @Test
    void missingScoreDefaultsToSeventy() {
        CriterionEvaluation evaluation = CriterionReplyParser.parse("FEEDBACK: Hard to judge | CONFIDENCE: 50", 85);

        assertEquals(70, evaluation.score());
        assertEquals(50, evaluation.confidence());
    }

    @Test
    void missingConfidenceUsesSelfReportedValue() {
        CriterionEvaluation evaluation = CriterionReplyParser.parse("SCORE: 90 | FEEDBACK: Great", 63);

        assertEquals(90, evaluation.score());
        assertEquals(63, evaluation.confidence());
    }

    @Test
    void missingFeedbackUsesStartOfReply() {
        String reply = "SCORE: 75 " + "x".repeat(300);

        CriterionEvaluation evaluation = CriterionReplyParser.parse(reply, 85);

        assertEquals(200, evaluation.feedback().length());
        assertTrue(reply.startsWith(evaluation.feedback()));
    }

    @Test
    void unstructuredReplyGetsAllDefaults() {
        CriterionEvaluation evaluation = CriterionReplyParser.parse("Looks like a lovely bowl.", 85);

        assertEquals(70, evaluation.score());
        assertEquals("Looks like a lovely bowl.", evaluation.feedback());
        assertEquals(85, evaluation.confidence());
    }

    @Test
    void numbersAreClamped() {
        CriterionEvaluation evaluation = CriterionReplyParser.parse(
                "SCORE: 140 | FEEDBACK: Wow | CONFIDENCE: 99999999999", 85);

        assertEquals(100, evaluation.score());
        assertEquals(100, evaluation.confidence());
    }
}
