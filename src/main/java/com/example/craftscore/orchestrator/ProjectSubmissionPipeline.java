package com.example.craftscore.orchestrator;

import com.example.craftscore.exception.ProjectNotFoundException;
import com.example.craftscore.model.ProjectScoringRequest;
import com.example.craftscore.model.ProjectScoringResult;
import com.example.craftscore.model.ScoredProject;
import com.example.craftscore.model.SkillLevelUpdate;
import com.example.craftscore.model.SubmissionOutcome;
import com.example.craftscore.repository.ScoredProjectRepository;
import com.example.craftscore.service.ManualReviewService;
import com.example.craftscore.service.UserSkillLevelService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;

/**
 * Submission flow around the scoring engine:
 * 1. Score the project
 * 2. Store the scored project
 * 3. Queue a review when the score was escalated
 * 4. Update the author's skill level
 * 5. Announce level changes
 * <p>
 * Only the store write in step 2 may fail the submission. A scoring failure yields a
 * "scoring unavailable" outcome; review and skill failures are logged and left out of the outcome.
 */
@Service
public class ProjectSubmissionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ProjectSubmissionPipeline.class);

    private final ProjectScoringService scoringService;
    private final ScoredProjectRepository projectRepository;
    private final ManualReviewService reviewService;
    private final UserSkillLevelService skillLevelService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ProjectSubmissionPipeline(ProjectScoringService scoringService,
                                     ScoredProjectRepository projectRepository,
                                     ManualReviewService reviewService,
                                     UserSkillLevelService skillLevelService,
                                     ApplicationEventPublisher eventPublisher,
                                     Clock clock) {
        this.scoringService = scoringService;
        this.projectRepository = projectRepository;
        this.reviewService = reviewService;
        this.skillLevelService = skillLevelService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public SubmissionOutcome submit(ProjectScoringRequest request) {
        Objects.requireNonNull(request, "request");
        log.info("═══════════════════════════════════════════════");
        log.info("Submission of project {} by {}", request.projectId(), request.userId());
        log.info("═══════════════════════════════════════════════");

        // ── Step 1: Scoring ──
        log.info("[1/5] Scoring...");
        ProjectScoringResult result;
        try {
            result = scoringService.scoreProject(request);
        } catch (RuntimeException e) {
            log.error("[1/5] Scoring failed for project {}", request.projectId(), e);
            return SubmissionOutcome.unavailable(request.projectId());
        }
        log.info("[1/5] Score {} ({})", result.individualSkillScore(), result.skillLevelCategory().value());

        // ── Step 2: Persist ──
        log.info("[2/5] Storing scored project...");
        projectRepository.save(new ScoredProject(request.projectId(), request.userId(), request.craftType(),
                clock.instant(), result));

        // ── Step 3: Escalation ──
        String reviewId = null;
        if (result.aiScoringMetadata().needsHumanReview()) {
            log.info("[3/5] Queueing automatic review...");
            reviewId = queueAutomaticReview(result);
        } else {
            log.info("[3/5] No review needed");
        }

        // ── Step 4: Skill level ──
        log.info("[4/5] Updating skill level of {}...", request.userId());
        SkillLevelUpdate skillUpdate = null;
        try {
            skillUpdate = skillLevelService.updateUserSkillLevel(request.userId(), request.projectId());
        } catch (RuntimeException e) {
            log.error("[4/5] Skill level update failed for user {}", request.userId(), e);
        }

        // ── Step 5: Events ──
        if (skillUpdate != null) {
            skillUpdate.toEvent().ifPresent(event -> {
                log.info("[5/5] Publishing level change {} -> {}", event.oldLevel().value(), event.newLevel().value());
                eventPublisher.publishEvent(event);
            });
        }

        return new SubmissionOutcome(request.projectId(), SubmissionOutcome.Status.SCORED, "Project scored",
                result, reviewId, skillUpdate);
    }

    /**
     * Queues a review the author asked for.
     *
     * @return the review id, or {@link ManualReviewService#PERMISSION_DENIED}
     * @throws ProjectNotFoundException if the project was never scored
     */
    public String requestReview(String projectId, String notes) {
        ScoredProject project = projectRepository.findById(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
        if (project.scoring() == null) {
            throw new ProjectNotFoundException(projectId);
        }
        log.info("User review requested for project {}", projectId);
        return reviewService.submitForReview(project.scoring(), true, notes);
    }

    private String queueAutomaticReview(ProjectScoringResult result) {
        try {
            String reviewId = reviewService.submitForReview(result, false, null);
            if (ManualReviewService.PERMISSION_DENIED.equals(reviewId)) {
                log.warn("[3/5] Review for project {} not queued: permission denied", result.projectId());
                return null;
            }
            return reviewId;
        } catch (RuntimeException e) {
            log.warn("[3/5] Review for project {} not queued: {}", result.projectId(), e.getMessage());
            return null;
        }
    }
}
