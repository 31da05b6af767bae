package com.example.craftscore.controller;

import com.example.craftscore.model.ProjectFeedback;
import com.example.craftscore.model.ReviewRequest;
import com.example.craftscore.model.ReviewStats;
import com.example.craftscore.service.ManualReviewService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the human review queue.
 */
@RestController
@RequestMapping("/api/reviews")
public class ReviewController {

    private final ManualReviewService reviewService;

    public ReviewController(ManualReviewService reviewService) {
        this.reviewService = reviewService;
    }

    @GetMapping("/pending")
    public List<ReviewRequest> pending(@RequestParam(required = false) String reviewerId) {
        return reviewService.getPendingReviews(reviewerId);
    }

    @GetMapping("/stats")
    public ReviewStats stats() {
        return reviewService.getReviewStats();
    }

    @GetMapping("/project/{projectId}")
    public ResponseEntity<?> forProject(@PathVariable String projectId) {
        return reviewService.getReviewStatus(projectId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(404)
                        .body(Map.of("error", "No review request for project " + projectId)));
    }

    @PostMapping("/{id}/assign")
    public ReviewRequest assign(@PathVariable String id, @RequestBody Assignment body) {
        return reviewService.assignReview(id, body.reviewerId());
    }

    @PostMapping("/{id}/complete")
    public ReviewRequest complete(@PathVariable String id, @RequestBody Decision body) {
        return reviewService.completeReview(id, body.notes(), body.revisedScore(), body.revisedFeedback());
    }

    @PostMapping("/{id}/reject")
    public ReviewRequest reject(@PathVariable String id, @RequestBody(required = false) Decision body) {
        return reviewService.rejectReview(id, body != null ? body.notes() : null);
    }

    public record Assignment(String reviewerId) {}

    /**
     * @param revisedScore    0-100, null to keep the automated score
     * @param revisedFeedback null to keep the automated feedback
     */
    public record Decision(String notes, Integer revisedScore, ProjectFeedback revisedFeedback) {}
}
