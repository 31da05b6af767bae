package com.example.craftscore.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * The five fixed evaluation dimensions of a project score.
 * Declaration order is also the tie-break order when criteria are ranked.
 */
public enum CriterionKind {

    TECHNICAL_EXECUTION("technicalExecution", "technical execution",
            "Quality of craftsmanship and technique execution",
            List.of("Precision and accuracy of work",
                    "Proper technique application",
                    "Consistency throughout project",
                    "Attention to detail",
                    "Finishing quality")),

    DOCUMENTATION_COMPLETENESS("documentationCompleteness", "documentation completeness",
            "Thoroughness of project documentation and process recording",
            List.of("Clear before/during/after photos",
                    "Detailed process description",
                    "Materials and tools documentation",
                    "Challenges and solutions noted",
                    "Learning outcomes shared")),

    TOOL_USAGE_APPROPRIATENESS("toolUsageAppropriateness", "tool usage appropriateness",
            "Appropriate selection and use of tools for the project",
            List.of("Correct tool selection for tasks",
                    "Proper tool handling and technique",
                    "Efficiency in tool usage",
                    "Tool maintenance awareness",
                    "Alternative tool considerations")),

    SAFETY_ADHERENCE("safetyAdherence", "safety adherence",
            "Demonstration of safety awareness and practices",
            List.of("Use of appropriate PPE (Personal Protective Equipment)",
                    "Safe work environment setup",
                    "Proper material handling",
                    "Risk awareness and mitigation",
                    "Emergency preparedness")),

    INNOVATION_CREATIVITY("innovationCreativity", "innovation and creativity",
            "Creative problem-solving and innovative approaches",
            List.of("Original design elements",
                    "Creative problem-solving",
                    "Adaptation of techniques",
                    "Unique material usage",
                    "Artistic expression"));

    private final String key;
    private final String displayName;
    private final String description;
    private final List<String> evaluationPoints;

    CriterionKind(String key, String displayName, String description, List<String> evaluationPoints) {
        this.key = key;
        this.displayName = displayName;
        this.description = description;
        this.evaluationPoints = evaluationPoints;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    public List<String> evaluationPoints() {
        return evaluationPoints;
    }
}
