package com.example.craftscore.controller;

import com.example.craftscore.TestFixtures;
import com.example.craftscore.exception.ProjectNotFoundException;
import com.example.craftscore.exception.UserNotFoundException;
import com.example.craftscore.model.LevelProgress;
import com.example.craftscore.model.ProjectScoringRequest;
import com.example.craftscore.model.SkillLevel;
import com.example.craftscore.model.SkillLevelCalculation;
import com.example.craftscore.model.SubmissionOutcome;
import com.example.craftscore.orchestrator.ProjectSubmissionPipeline;
import com.example.craftscore.service.ManualReviewService;
import com.example.craftscore.service.UserSkillLevelService;
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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ScoringControllerTest {

    private static final String SUBMISSION = """
            {
              "projectId": "project-1",
              "userId": "user-1",
              "craftType": "woodworking",
              "description": "Walnut side table with hand cut mortise and tenon joints.",
              "materials": ["walnut"],
              "toolsUsed": ["chisel"],
              "timeSpentMinutes": 600,
              "userSkillLevel": "journeyman"
            }
            """;

    @Mock
    private ProjectSubmissionPipeline pipeline;

    @Mock
    private UserSkillLevelService skillLevelService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ScoringController(pipeline, skillLevelService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void scoredSubmissionIsOk() throws Exception {
        when(pipeline.submit(any(ProjectScoringRequest.class))).thenReturn(new SubmissionOutcome("project-1",
                SubmissionOutcome.Status.SCORED, "Project scored", TestFixtures.result("project-1", 80, 85),
                null, null));

        mockMvc.perform(post("/api/projects/score").contentType(MediaType.APPLICATION_JSON).content(SUBMISSION))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SCORED"))
                .andExpect(jsonPath("$.result.individualSkillScore").value(80))
                .andExpect(jsonPath("$.result.skillLevelCategory").value("craftsman"))
                .andExpect(jsonPath("$.reviewId").doesNotExist());

        ArgumentCaptor<ProjectScoringRequest> submitted = ArgumentCaptor.forClass(ProjectScoringRequest.class);
        verify(pipeline).submit(submitted.capture());
        assertEquals(SkillLevel.JOURNEYMAN, submitted.getValue().userSkillLevel());
        assertEquals(List.of(), submitted.getValue().imageUrls());
    }

    @Test
    void unavailableScoringIsServiceUnavailable() throws Exception {
        when(pipeline.submit(any(ProjectScoringRequest.class))).thenReturn(SubmissionOutcome.unavailable("project-1"));

        mockMvc.perform(post("/api/projects/score").contentType(MediaType.APPLICATION_JSON).content(SUBMISSION))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("SCORING_UNAVAILABLE"))
                .andExpect(jsonPath("$.message").value(SubmissionOutcome.SCORING_UNAVAILABLE_MESSAGE));
    }

    @Test
    void reviewRequestIsCreated() throws Exception {
        when(pipeline.requestReview("project-1", "Joints are tighter than scored")).thenReturn("review-1");

        mockMvc.perform(post("/api/projects/project-1/review").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"notes\": \"Joints are tighter than scored\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.reviewId").value("review-1"));
    }

    @Test
    void reviewRequestWithoutBodyHasNoNotes() throws Exception {
        when(pipeline.requestReview(any(), isNull())).thenReturn("review-2");

        mockMvc.perform(post("/api/projects/project-1/review"))
                .andExpect(status().isCreated());
        verify(pipeline).requestReview("project-1", null);
    }

    @Test
    void refusedReviewRequestIsForbidden() throws Exception {
        when(pipeline.requestReview("project-1", null)).thenReturn(ManualReviewService.PERMISSION_DENIED);

        mockMvc.perform(post("/api/projects/project-1/review"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void reviewOfUnknownProjectIsNotFound() throws Exception {
        when(pipeline.requestReview("ghost", null)).thenThrow(new ProjectNotFoundException("ghost"));

        mockMvc.perform(post("/api/projects/ghost/review"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void skillLevelIncludesProgress() throws Exception {
        when(skillLevelService.calculateUserSkillLevel("user-1"))
                .thenReturn(new SkillLevelCalculation(SkillLevel.JOURNEYMAN, 49.6, 4, 0.5, List.of()));
        when(skillLevelService.calculateProgressToNextLevel(50, SkillLevel.JOURNEYMAN))
                .thenReturn(new LevelProgress(45, 11, 61));

        mockMvc.perform(get("/api/users/user-1/skill-level"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.calculation.skillLevel").value("journeyman"))
                .andExpect(jsonPath("$.progress.pointsToNext").value(11))
                .andExpect(jsonPath("$.nextLevel").value("craftsman"));
    }

    @Test
    void skillLevelOfUnknownUserIsNotFound() throws Exception {
        when(skillLevelService.calculateUserSkillLevel("ghost")).thenThrow(new UserNotFoundException("ghost"));

        mockMvc.perform(get("/api/users/ghost/skill-level"))
                .andExpect(status().isNotFound());
    }
}
