package com.example.craftscore.orchestrator;

import com.example.craftscore.agent.CriterionEvaluator;
import com.example.craftscore.agent.ProjectFeedbackAgent;
import com.example.craftscore.config.ScoringProperties;
import com.example.craftscore.model.AiScoringMetadata;
import com.example.craftscore.model.CriterionEvaluation;
import com.example.craftscore.model.CriterionKind;
import com.example.craftscore.model.CriterionWeights;
import com.example.craftscore.model.DocumentationAnalysis;
import com.example.craftscore.model.EscalationDecision;
import com.example.craftscore.model.ProjectFeedback;
import com.example.craftscore.model.ProjectScoringRequest;
import com.example.craftscore.model.ProjectScoringResult;
import com.example.craftscore.model.ScoringContext;
import com.example.craftscore.model.ScoringCriterion;
import com.example.craftscore.model.SkillLevel;
import com.example.craftscore.service.EscalationPolicy;
import com.example.craftscore.service.ScoringFramework;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Scoring pipeline for one project submission:
 * 1. Shared oracle context
 * 2. Parallel evaluation of the five criteria
 * 3. Weighted aggregate and skill level
 * 4. Confidence and escalation
 * 5. Narrative feedback
 * <p>
 * Has no side effects besides oracle calls. Oracle failures never escape: every criterion
 * resolves to its fallback and feedback to its fixed text.
 */
@Service
public class ProjectScoringService {

    private static final Logger log = LoggerFactory.getLogger(ProjectScoringService.class);

    private final CriterionEvaluator criterionEvaluator;
    private final ProjectFeedbackAgent feedbackAgent;
    private final ExecutorService evaluationExecutor;
    private final ScoringProperties properties;
    private final Clock clock;

    public ProjectScoringService(CriterionEvaluator criterionEvaluator,
                                 ProjectFeedbackAgent feedbackAgent,
                                 @Qualifier("evaluationExecutor") ExecutorService evaluationExecutor,
                                 ScoringProperties properties,
                                 Clock clock) {
        this.criterionEvaluator = criterionEvaluator;
        this.feedbackAgent = feedbackAgent;
        this.evaluationExecutor = evaluationExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public ProjectScoringResult scoreProject(ProjectScoringRequest request) {
        Objects.requireNonNull(request, "request");
        long start = System.nanoTime();
        String scoringId = "scoring_" + UUID.randomUUID();
        log.info("Scoring project {} ({}) as {}", request.projectId(), request.craftType().value(), scoringId);

        // ── Step 1: Context ──
        ScoringContext context = ScoringContext.from(request);

        // ── Step 2: Parallel criterion evaluation ──
        log.info("[1/4] Evaluating {} criteria in parallel...", CriterionKind.values().length);
        List<ScoringCriterion> criteria = evaluateAll(request, context);

        // ── Step 3: Aggregate ──
        int score = ScoringFramework.aggregate(criteria, request.craftType());
        SkillLevel level = ScoringFramework.skillLevelFor(score);
        log.info("[2/4] Aggregate score {} ({})", score, level.value());

        // ── Step 4: Confidence and escalation ──
        int confidence = EscalationPolicy.overallConfidence(criteria);
        EscalationDecision escalation = EscalationPolicy.decide(criteria, confidence);
        log.info("[3/4] Confidence {}, human review: {}{}", confidence, escalation.needsHumanReview(),
                escalation.findReason().map(r -> " (" + r + ")").orElse(""));

        // ── Step 5: Feedback ──
        ProjectFeedback feedback = feedbackAgent.generate(request, context, criteria, score);
        log.info("[4/4] Feedback ready");

        DocumentationAnalysis documentation = ScoringFramework.documentationHeuristic(request);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        AiScoringMetadata metadata = new AiScoringMetadata(
                confidence,
                elapsedMs,
                clock.instant(),
                escalation.needsHumanReview(),
                escalation.reason(),
                properties.oracle().modelVersion(),
                AiScoringMetadata.CraftTypeSpecific.of(request.craftType()),
                documentation);

        log.info("Project {} scored {} in {}ms", request.projectId(), score, elapsedMs);
        return new ProjectScoringResult(scoringId, request.projectId(), request.userId(), score, level,
                criteria, feedback, metadata);
    }

    /**
     * Runs one evaluation per criterion on the shared executor and waits for all of them.
     * A child that times out or fails resolves to its fallback, and a timed-out child is interrupted.
     */
    private List<ScoringCriterion> evaluateAll(ProjectScoringRequest request, ScoringContext context) {
        Duration timeout = properties.evaluation().timeout();
        Map<CriterionKind, CompletableFuture<CriterionEvaluation>> futures = new EnumMap<>(CriterionKind.class);
        List<Future<?>> tasks = new ArrayList<>();
        for (CriterionKind kind : CriterionKind.values()) {
            CompletableFuture<CriterionEvaluation> evaluation = new CompletableFuture<>();
            Future<?> task = evaluationExecutor.submit(() -> {
                try {
                    evaluation.complete(criterionEvaluator.evaluate(request, context, kind));
                } catch (RuntimeException e) {
                    evaluation.completeExceptionally(e);
                }
            });
            tasks.add(task);
            futures.put(kind, evaluation
                    .completeOnTimeout(CriterionEvaluation.fallback(kind), timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(e -> {
                        log.warn("Evaluation of {} failed for project {}, using fallback: {}",
                                kind.key(), request.projectId(), e.getMessage());
                        return CriterionEvaluation.fallback(kind);
                    }));
        }
        CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new)).join();
        // frees threads still blocked on the oracle after their criterion timed out
        tasks.forEach(task -> task.cancel(true));

        CriterionWeights weights = ScoringFramework.weightsFor(request.craftType());
        return Stream.of(CriterionKind.values())
                .map(kind -> futures.get(kind).join().weighted(kind, weights.weightOf(kind)))
                .toList();
    }
}
