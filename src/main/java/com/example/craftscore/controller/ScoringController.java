package com.example.craftscore.controller;

import com.example.craftscore.model.LevelProgress;
import com.example.craftscore.model.ProjectScoringRequest;
import com.example.craftscore.model.SkillLevel;
import com.example.craftscore.model.SkillLevelCalculation;
import com.example.craftscore.model.SubmissionOutcome;
import com.example.craftscore.orchestrator.ProjectSubmissionPipeline;
import com.example.craftscore.service.ManualReviewService;
import com.example.craftscore.service.UserSkillLevelService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for project submissions and skill levels.
 */
@RestController
@RequestMapping("/api")
public class ScoringController {

    private static final Logger log = LoggerFactory.getLogger(ScoringController.class);

    private final ProjectSubmissionPipeline pipeline;
    private final UserSkillLevelService skillLevelService;

    public ScoringController(ProjectSubmissionPipeline pipeline, UserSkillLevelService skillLevelService) {
        this.pipeline = pipeline;
        this.skillLevelService = skillLevelService;
    }

    /**
     * Scores a submitted project and folds it into the author's skill record.
     * Answers 503 with the outcome body when scoring was unavailable.
     *
     * <p>Endpoint: POST /api/projects/score
     */
    @PostMapping("/projects/score")
    public ResponseEntity<SubmissionOutcome> score(@RequestBody ProjectScoringRequest request) {
        log.info("Received scoring request for project {} ({})", request.projectId(), request.craftType().value());
        SubmissionOutcome outcome = pipeline.submit(request);
        HttpStatus status = outcome.status() == SubmissionOutcome.Status.SCORED
                ? HttpStatus.OK
                : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(outcome);
    }

    /**
     * Asks for a human review of a scored project.
     *
     * <p>Endpoint: POST /api/projects/{projectId}/review
     */
    @PostMapping("/projects/{projectId}/review")
    public ResponseEntity<Map<String, String>> requestReview(@PathVariable String projectId,
                                                             @RequestBody(required = false) ReviewNotes body) {
        String reviewId = pipeline.requestReview(projectId, body != null ? body.notes() : null);
        if (ManualReviewService.PERMISSION_DENIED.equals(reviewId)) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(Map.of("error", "Review queue refused the request"));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("reviewId", reviewId));
    }

    /**
     * Current level of a user with the progress towards the next one.
     *
     * <p>Endpoint: GET /api/users/{userId}/skill-level
     */
    @GetMapping("/users/{userId}/skill-level")
    public SkillLevelOverview skillLevel(@PathVariable String userId) {
        SkillLevelCalculation calculation = skillLevelService.calculateUserSkillLevel(userId);
        LevelProgress progress = skillLevelService.calculateProgressToNextLevel(
                (int) Math.round(calculation.averageScore()), calculation.skillLevel());
        return new SkillLevelOverview(userId, calculation, progress,
                calculation.skillLevel().next().orElse(null));
    }

    public record ReviewNotes(String notes) {}

    /**
     * @param nextLevel null at master
     */
    public record SkillLevelOverview(
            String userId,
            SkillLevelCalculation calculation,
            LevelProgress progress,
            SkillLevel nextLevel
    ) {}
}
