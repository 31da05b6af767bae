package com.example.craftscore.agent;

import com.example.craftscore.model.CriterionKind;
import com.example.craftscore.model.ProjectFeedback;
import com.example.craftscore.model.ProjectScoringRequest;
import com.example.craftscore.model.ScoringContext;
import com.example.craftscore.model.ScoringCriterion;
import com.example.craftscore.oracle.CraftOracle;
import com.example.craftscore.oracle.OracleReply;
import com.example.craftscore.service.ResilientLlmCaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes the narrative feedback for a scored project through the feedback oracle.
 * <p>
 * The oracle is asked for a JSON object. A reply that is not JSON is read line by line instead,
 * and a failed call yields a fixed feedback built around the best criterion.
 */
@Service
public class ProjectFeedbackAgent {

    private static final Logger log = LoggerFactory.getLogger(ProjectFeedbackAgent.class);

    static final String DEFAULT_OVERALL = "Project shows good craft fundamentals with room for growth.";
    static final String FALLBACK_OVERALL =
            "This project demonstrates solid craft fundamentals with clear areas for continued development.";

    private static final String PROMPT = """
            Provide comprehensive feedback for this %s project:

            Project: %s

            Overall Score: %d/100

            Individual Scores:
            %s

            Provide:
            1. Overall feedback summary (2-3 sentences)
            2. Top 3 strengths demonstrated
            3. Top 3 areas for improvement
            4. 3 specific next-step suggestions for skill development

            Be encouraging while providing constructive guidance for improvement.
            Reply with a single JSON object and nothing else:
            {"overallFeedback": "...", "strengths": ["..."], "improvementAreas": ["..."], "nextStepSuggestions": ["..."]}
            """;

    private final CraftOracle oracle;

    public ProjectFeedbackAgent(@Qualifier("feedbackOracle") CraftOracle oracle) {
        this.oracle = oracle;
    }

    public ProjectFeedback generate(ProjectScoringRequest request, ScoringContext context,
                                    List<ScoringCriterion> criteria, int overallScore) {
        String scores = criteria.stream()
                .map(c -> "- " + c.kind().displayName() + ": " + c.score() + "/100")
                .collect(Collectors.joining("\n"));
        try {
            OracleReply reply = oracle.generate(
                    PROMPT.formatted(request.craftType().value(), request.description(), overallScore, scores),
                    context);
            if (reply == null || reply.text() == null || reply.text().isBlank()) {
                log.warn("ProjectFeedbackAgent: blank reply for project {}, using fallback", request.projectId());
                return fallback(criteria);
            }

            ProjectFeedback feedback = ResilientLlmCaller.parseLenient(reply.text(), ProjectFeedback.class)
                    .filter(f -> f.overallFeedback() != null && !f.overallFeedback().isBlank())
                    .orElseGet(() -> parseLines(reply.text()));
            log.info("ProjectFeedbackAgent: {} strengths, {} improvement areas for project {}",
                    feedback.strengths().size(), feedback.improvementAreas().size(), request.projectId());
            return feedback;

        } catch (Exception e) {
            log.warn("ProjectFeedbackAgent: feedback generation failed for project {}, using fallback: {}",
                    request.projectId(), e.getMessage());
            return fallback(criteria);
        }
    }

    /**
     * First non-blank line is the summary, the next three are strengths, then three improvement
     * areas, then three suggestions. List markers are stripped.
     */
    static ProjectFeedback parseLines(String text) {
        List<String> lines = Arrays.stream(text.split("\\R"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .map(line -> line.replaceFirst("^[\\d\\-*•.)\\s]+", ""))
                .filter(line -> !line.isEmpty())
                .toList();
        return new ProjectFeedback(
                lines.isEmpty() ? DEFAULT_OVERALL : lines.get(0),
                slice(lines, 1, 4),
                slice(lines, 4, 7),
                slice(lines, 7, 10));
    }

    /**
     * Fixed feedback naming the highest-scoring criterion; ties go to the earlier criterion.
     */
    static ProjectFeedback fallback(List<ScoringCriterion> criteria) {
        String top = criteria.stream()
                .max(Comparator.comparingInt(ScoringCriterion::score)
                        .thenComparing(ScoringCriterion::kind, Comparator.reverseOrder()))
                .map(c -> c.kind().displayName())
                .orElse(CriterionKind.TECHNICAL_EXECUTION.displayName());
        return new ProjectFeedback(
                FALLBACK_OVERALL,
                List.of("Strong performance in " + top,
                        "Good attention to craft fundamentals",
                        "Clear documentation of the process"),
                List.of("Enhanced documentation with more process photos",
                        "Expanded tool usage exploration",
                        "Increased focus on safety practices"),
                List.of("Try a similar project with increased complexity",
                        "Focus on documenting your process more thoroughly",
                        "Explore advanced techniques in your craft specialization"));
    }

    private static List<String> slice(List<String> lines, int from, int to) {
        if (from >= lines.size()) return List.of();
        return lines.subList(from, Math.min(to, lines.size()));
    }
}
