package com.example.craftscore.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Weight of every criterion in the aggregate score. Always covers all five kinds and sums to 1.
 */
public record CriterionWeights(Map<CriterionKind, Double> weights) {

    static final double TOLERANCE = 1e-6;

    public CriterionWeights {
        EnumMap<CriterionKind, Double> copy = new EnumMap<>(CriterionKind.class);
        copy.putAll(weights);
        for (CriterionKind kind : CriterionKind.values()) {
            Double weight = copy.get(kind);
            if (weight == null || weight < 0) {
                throw new IllegalArgumentException("Missing or negative weight for " + kind.key());
            }
        }
        double sum = copy.values().stream().mapToDouble(Double::doubleValue).sum();
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException("Criterion weights must sum to 1.0 but sum to " + sum);
        }
        weights = Collections.unmodifiableMap(copy);
    }

    public static CriterionWeights of(double technical, double documentation, double toolUsage,
                                      double safety, double innovation) {
        return new CriterionWeights(Map.of(
                CriterionKind.TECHNICAL_EXECUTION, technical,
                CriterionKind.DOCUMENTATION_COMPLETENESS, documentation,
                CriterionKind.TOOL_USAGE_APPROPRIATENESS, toolUsage,
                CriterionKind.SAFETY_ADHERENCE, safety,
                CriterionKind.INNOVATION_CREATIVITY, innovation));
    }

    public double weightOf(CriterionKind kind) {
        return weights.get(kind);
    }
}
