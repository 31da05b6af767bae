package com.example.craftscore.agent;

import com.example.craftscore.TestFixtures;
import com.example.craftscore.exception.OracleUnavailableException;
import com.example.craftscore.model.CriterionKind;
import com.example.craftscore.model.ProjectFeedback;
import com.example.craftscore.model.ProjectScoringRequest;
import com.example.craftscore.model.ScoringContext;
import com.example.craftscore.model.ScoringCriterion;
import com.example.craftscore.oracle.CraftOracle;
import com.example.craftscore.oracle.OracleReply;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProjectFeedbackAgentTest {

    @Mock
    private CraftOracle oracle;

    private ProjectFeedbackAgent agent;
    private ProjectScoringRequest request;
    private ScoringContext context;

    @BeforeEach
    void setUp() {
        agent = new ProjectFeedbackAgent(oracle);
        request = TestFixtures.walnutTableRequest();
        context = ScoringContext.from(request);
    }

    @Test
    void readsJsonReply() {
        when(oracle.generate(anyString(), any())).thenReturn(new OracleReply("""
                Here you go:
                ```json
                {
                  "overallFeedback": "A sturdy, well finished table.",
                  "strengths": ["Joinery", "Finish", "Flatness",],
                  "improvementAreas": ['Photos'],
                  "nextStepSuggestions": ["Try drawbored joints"]
                }
                ```
                """, 85));

        ProjectFeedback feedback = agent.generate(request, context, criteria(80, 80, 80, 80, 80), 80);

        assertEquals("A sturdy, well finished table.", feedback.overallFeedback());
        assertEquals(List.of("Joinery", "Finish", "Flatness"), feedback.strengths());
        assertEquals(List.of("Photos"), feedback.improvementAreas());
        assertEquals(List.of("Try drawbored joints"), feedback.nextStepSuggestions());
    }

    @Test
    void fallsBackToLineParsing() {
        when(oracle.generate(anyString(), any())).thenReturn(new OracleReply("""
                Lovely table with confident hand work.
                1. Tight mortise and tenon joints
                2. Even oil finish
                3. Good wood selection
                - More photos
                - Note the dimensions
                - Describe the glue-up
                * Try a drawer
                * Try hand-cut dovetails
                * Build a matching chair
                """, 85));

        ProjectFeedback feedback = agent.generate(request, context, criteria(80, 80, 80, 80, 80), 80);

        assertEquals("Lovely table with confident hand work.", feedback.overallFeedback());
        assertEquals("Tight mortise and tenon joints", feedback.strengths().get(0));
        assertEquals(3, feedback.improvementAreas().size());
        assertEquals("More photos", feedback.improvementAreas().get(0));
        assertEquals("Build a matching chair", feedback.nextStepSuggestions().get(2));
    }

    @Test
    void failureNamesTheBestCriterion() {
        when(oracle.generate(anyString(), any())).thenThrow(new OracleUnavailableException("down"));

        ProjectFeedback feedback = agent.generate(request, context, criteria(60, 70, 90, 50, 40), 68);

        assertEquals(ProjectFeedbackAgent.FALLBACK_OVERALL, feedback.overallFeedback());
        assertEquals("Strong performance in tool usage appropriateness", feedback.strengths().get(0));
        assertEquals(3, feedback.improvementAreas().size());
        assertEquals(3, feedback.nextStepSuggestions().size());
    }

    @Test
    void fallbackTieGoesToEarlierCriterion() {
        ProjectFeedback feedback = ProjectFeedbackAgent.fallback(criteria(70, 70, 70, 70, 70));

        assertEquals("Strong performance in technical execution", feedback.strengths().get(0));
    }

    private static List<ScoringCriterion> criteria(int... scores) {
        List<ScoringCriterion> criteria = new ArrayList<>();
        for (CriterionKind kind : CriterionKind.values()) {
            criteria.add(new ScoringCriterion(kind, scores[kind.ordinal()], 0.2, "", 80));
        }
        return criteria;
    }
}
