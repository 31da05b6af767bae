package com.example.craftscore.controller;

import com.example.craftscore.TestFixtures;
import com.example.craftscore.exception.InvalidReviewTransitionException;
import com.example.craftscore.exception.ReviewNotFoundException;
import com.example.craftscore.model.ProjectFeedback;
import com.example.craftscore.model.ProjectScoringResult;
import com.example.craftscore.model.ReviewPriority;
import com.example.craftscore.model.ReviewRequest;
import com.example.craftscore.model.ReviewStats;
import com.example.craftscore.model.ReviewStatus;
import com.example.craftscore.service.ManualReviewService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ReviewControllerTest {

    @Mock
    private ManualReviewService reviewService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ReviewController(reviewService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void pendingQueueIsListed() throws Exception {
        when(reviewService.getPendingReviews(null)).thenReturn(List.of(pending("r1")));

        mockMvc.perform(get("/api/reviews/pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("r1"))
                .andExpect(jsonPath("$[0].status").value("pending"))
                .andExpect(jsonPath("$[0].priority").value("high"))
                .andExpect(jsonPath("$[0].metadata.reviewType").value("user_requested"));
    }

    @Test
    void pendingQueueCanBeFilteredByReviewer() throws Exception {
        when(reviewService.getPendingReviews("reviewer-7")).thenReturn(List.of());

        mockMvc.perform(get("/api/reviews/pending").param("reviewerId", "reviewer-7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void statsAreReported() throws Exception {
        when(reviewService.getReviewStats()).thenReturn(new ReviewStats(5, 1, 1, 2, 1, 46, 2));

        mockMvc.perform(get("/api/reviews/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(5))
                .andExpect(jsonPath("$.averageReviewTimeMinutes").value(46));
    }

    @Test
    void projectWithoutReviewIsNotFound() throws Exception {
        when(reviewService.getReviewStatus("project-1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/reviews/project/project-1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void projectReviewIsReturned() throws Exception {
        when(reviewService.getReviewStatus("project-r1")).thenReturn(Optional.of(pending("r1")));

        mockMvc.perform(get("/api/reviews/project/project-r1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.projectId").value("project-r1"));
    }

    @Test
    void assignTakesReviewer() throws Exception {
        when(reviewService.assignReview("r1", "reviewer-7"))
                .thenReturn(pending("r1").assignTo("reviewer-7", TestFixtures.NOW));

        mockMvc.perform(post("/api/reviews/r1/assign").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewerId\": \"reviewer-7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("in_review"))
                .andExpect(jsonPath("$.assignedReviewerId").value("reviewer-7"));
    }

    @Test
    void blankReviewerIsBadRequest() throws Exception {
        when(reviewService.assignReview("r1", "")).thenThrow(new IllegalArgumentException("Reviewer id is required"));

        mockMvc.perform(post("/api/reviews/r1/assign").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewerId\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Reviewer id is required"));
    }

    @Test
    void completePassesDecisionThrough() throws Exception {
        ReviewRequest completed = pending("r1").assignTo("reviewer-7", TestFixtures.NOW)
                .complete("fine", 85, null, TestFixtures.NOW);
        when(reviewService.completeReview(eq("r1"), eq("fine"), eq(85), any(ProjectFeedback.class)))
                .thenReturn(completed);

        mockMvc.perform(post("/api/reviews/r1/complete").contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"notes": "fine", "revisedScore": 85,
                                 "revisedFeedback": {"overallFeedback": "Better than scored",
                                                     "strengths": ["joints"],
                                                     "improvementAreas": [],
                                                     "nextStepSuggestions": []}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.revisedScore").value(85));

        ArgumentCaptor<ProjectFeedback> feedback = ArgumentCaptor.forClass(ProjectFeedback.class);
        verify(reviewService).completeReview(eq("r1"), eq("fine"), eq(85), feedback.capture());
        assertEquals("Better than scored", feedback.getValue().overallFeedback());
    }

    @Test
    void invalidTransitionIsConflict() throws Exception {
        when(reviewService.completeReview("r1", "fine", null, null))
                .thenThrow(new InvalidReviewTransitionException("r1", ReviewStatus.PENDING, ReviewStatus.COMPLETED));

        mockMvc.perform(post("/api/reviews/r1/complete").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"notes\": \"fine\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Review r1 cannot move from pending to completed"));
    }

    @Test
    void rejectWithoutBodyHasNoNotes() throws Exception {
        when(reviewService.rejectReview(eq("r1"), isNull()))
                .thenReturn(pending("r1").reject(null, TestFixtures.NOW));

        mockMvc.perform(post("/api/reviews/r1/reject"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("rejected"));
    }

    @Test
    void unknownReviewIsNotFound() throws Exception {
        when(reviewService.rejectReview("missing", "dup")).thenThrow(new ReviewNotFoundException("missing"));

        mockMvc.perform(post("/api/reviews/missing/reject").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"notes\": \"dup\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Review request not found: missing"));
    }

    private static ReviewRequest pending(String id) {
        ProjectScoringResult result = TestFixtures.result("project-" + id, 60, 90);
        return new ReviewRequest(id, result.projectId(), result.userId(), result.scoringId(), result,
                "User requested manual review: No additional notes", ReviewStatus.PENDING, ReviewPriority.HIGH,
                TestFixtures.NOW, null, null, null, null, null, null, true,
                new ReviewRequest.ReviewMetadata(90, List.of(), "test-model", ReviewRequest.ReviewType.USER_REQUESTED));
    }
}
