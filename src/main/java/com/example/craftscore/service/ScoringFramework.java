package com.example.craftscore.service;

import com.example.craftscore.model.CraftType;
import com.example.craftscore.model.CriterionKind;
import com.example.craftscore.model.CriterionWeights;
import com.example.craftscore.model.DocumentationAnalysis;
import com.example.craftscore.model.ProjectScoringRequest;
import com.example.craftscore.model.ScoringCriterion;
import com.example.craftscore.model.SkillLevel;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic scoring rules: criterion weights per craft, aggregation, level mapping and the
 * documentation heuristic. Everything here is a pure function of its arguments.
 * <p>
 * Aggregation uses {@link BigDecimal} with {@link RoundingMode#HALF_UP} so that .5 boundaries
 * round the same way on every platform.
 */
public final class ScoringFramework {

    public static final CriterionWeights DEFAULT_WEIGHTS = CriterionWeights.of(0.40, 0.30, 0.15, 0.10, 0.05);

    /** Hot-work crafts trade technical weight for safety weight. */
    public static final CriterionWeights HOT_WORK_WEIGHTS = CriterionWeights.of(0.35, 0.30, 0.15, 0.15, 0.05);

    /** Blend between the oracle's documentation score and the heuristic one. */
    private static final BigDecimal ORACLE_SHARE = new BigDecimal("0.7");
    private static final BigDecimal HEURISTIC_SHARE = new BigDecimal("0.3");

    static final int DETAILED_DESCRIPTION_WORDS = 50;

    private static final List<String> BEFORE_CUES = List.of("before", "start");
    private static final List<String> PROCESS_CUES = List.of("process", "step", "during");
    private static final List<String> AFTER_CUES = List.of("after", "final", "finished");
    private static final List<String> TIME_CUES = List.of("time", "hour", "minute");
    private static final List<String> CHALLENGE_CUES = List.of("challenge", "problem", "mistake");

    private ScoringFramework() {
    }

    public static CriterionWeights weightsFor(CraftType craftType) {
        return switch (craftType) {
            case BLACKSMITHING, GLASSBLOWING -> HOT_WORK_WEIGHTS;
            case WOODWORKING, METALWORKING, LEATHERCRAFT, POTTERY, WEAVING, BUSHCRAFT, STONEMASONRY, JEWELRY,
                 GENERAL -> DEFAULT_WEIGHTS;
        };
    }

    /**
     * Weighted sum of the criterion scores using the craft's weights, rounded half-up and clamped to 0-100.
     *
     * @throws IllegalArgumentException if a criterion kind is missing
     */
    public static int aggregate(Collection<ScoringCriterion> criteria, CraftType craftType) {
        CriterionWeights weights = weightsFor(craftType);
        BigDecimal total = BigDecimal.ZERO;
        for (CriterionKind kind : CriterionKind.values()) {
            ScoringCriterion criterion = criteria.stream()
                    .filter(c -> c.kind() == kind)
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Missing criterion " + kind.key()));
            total = total.add(BigDecimal.valueOf(criterion.score())
                    .multiply(BigDecimal.valueOf(weights.weightOf(kind))));
        }
        return clamp(total.setScale(0, RoundingMode.HALF_UP).intValueExact());
    }

    /**
     * @throws IllegalArgumentException if {@code score} is outside 0-100
     */
    public static SkillLevel skillLevelFor(int score) {
        return Arrays.stream(SkillLevel.values())
                .filter(level -> level.contains(score))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Score out of range [0,100]: " + score));
    }

    public static DocumentationAnalysis documentationHeuristic(ProjectScoringRequest request) {
        String text = request.description().toLowerCase(Locale.ROOT);
        int words = request.description().trim().split("\\s+").length;
        return DocumentationAnalysis.of(
                mentionsAny(text, BEFORE_CUES),
                mentionsAny(text, PROCESS_CUES),
                mentionsAny(text, AFTER_CUES),
                words >= DETAILED_DESCRIPTION_WORDS,
                !request.materials().isEmpty(),
                !request.toolsUsed().isEmpty(),
                request.findTimeSpentMinutes().isPresent() || mentionsAny(text, TIME_CUES),
                mentionsAny(text, CHALLENGE_CUES));
    }

    /** {@code round(0.7 * oracle + 0.3 * heuristic)}, half-up. */
    public static int blendDocumentationScore(int oracleScore, int heuristicScore) {
        BigDecimal blended = BigDecimal.valueOf(oracleScore).multiply(ORACLE_SHARE)
                .add(BigDecimal.valueOf(heuristicScore).multiply(HEURISTIC_SHARE));
        return clamp(blended.setScale(0, RoundingMode.HALF_UP).intValueExact());
    }

    public static double populationVariance(Collection<Integer> scores) {
        if (scores.isEmpty()) return 0.0;
        double mean = scores.stream().mapToInt(Integer::intValue).average().orElse(0.0);
        return scores.stream()
                .mapToDouble(s -> (s - mean) * (s - mean))
                .sum() / scores.size();
    }

    public static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }

    private static boolean mentionsAny(String text, List<String> cues) {
        return cues.stream().anyMatch(text::contains);
    }
}
