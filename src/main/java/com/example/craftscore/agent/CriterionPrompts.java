package com.example.craftscore.agent;

import com.example.craftscore.model.CraftType;
import com.example.craftscore.model.CriterionKind;
import com.example.craftscore.model.DocumentationAnalysis;
import com.example.craftscore.model.ProjectScoringRequest;
import com.example.craftscore.model.SkillLevel;
import com.example.craftscore.service.ScoringFramework;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the oracle task for each criterion.
 */
final class CriterionPrompts {

    static final String REPLY_FORMAT = "Format: SCORE: [number] | FEEDBACK: [detailed analysis] | CONFIDENCE: [number]";

    private CriterionPrompts() {
    }

    static String promptFor(CriterionKind kind, ProjectScoringRequest request, DocumentationAnalysis documentation) {
        CraftType craft = request.craftType();
        String header = """
                Evaluate the %s of this %s project (0-100 scale):

                Project Description: %s
                """.formatted(kind.displayName(), craft.value(), request.description());

        String specifics = switch (kind) {
            case TECHNICAL_EXECUTION -> """
                    Images Available: %d photos
                    Materials Used: %s
                    %s-specific quality indicators: %s
                    """.formatted(request.imageUrls().size(), listOrUnspecified(request.materials()),
                    craft.value(), String.join(", ", craft.qualityIndicators()));
            case DOCUMENTATION_COMPLETENESS -> """
                    Images: %d photos
                    Process Documentation: %s
                    Materials Listed: %s
                    Tools Listed: %s
                    Base Documentation Score: %d/100
                    Provide refined scoring considering the quality of documentation beyond just completeness.
                    """.formatted(request.imageUrls().size(), yesNo(documentation.hasProcessCue()),
                    yesNo(documentation.hasMaterialsList()), yesNo(documentation.hasToolsList()),
                    documentation.completenessScore());
            case TOOL_USAGE_APPROPRIATENESS -> """
                    Tools Used: %s
                    User Skill Level: %s
                    Consider whether the tools suit the craft, the user's skill level, the project
                    complexity and its safety requirements.
                    """.formatted(listOrUnspecified(request.toolsUsed()),
                    request.findUserSkillLevel().orElse(SkillLevel.APPRENTICE).value());
            case SAFETY_ADHERENCE -> """
                    Tools Used: %s
                    Images Available: %d photos
                    %s safety considerations: %s
                    Look for safety equipment, safe technique descriptions and risk mitigation.
                    """.formatted(listOrUnspecified(request.toolsUsed()), request.imageUrls().size(),
                    craft.value(), String.join(", ", craft.safetyConsiderations()));
            case INNOVATION_CREATIVITY -> """
                    Materials Used: %s
                    Look for novel approaches, creative material combinations and personal expression.
                    """.formatted(listOrUnspecified(request.materials()));
        };

        long weightPercent = Math.round(ScoringFramework.weightsFor(craft).weightOf(kind) * 100);
        String rubric = kind.evaluationPoints().stream()
                .map(point -> "- " + point)
                .collect(Collectors.joining("\n"));

        return header + specifics
                + "\nEvaluation Criteria (" + kind.description() + " - " + weightPercent + "% weight):\n"
                + rubric + "\n\n"
                + "Provide a score, specific feedback with strengths and improvements, and your confidence (0-100).\n"
                + REPLY_FORMAT;
    }

    private static String listOrUnspecified(List<String> values) {
        return values.isEmpty() ? "Not specified" : String.join(", ", values);
    }

    private static String yesNo(boolean value) {
        return value ? "Yes" : "No";
    }
}
