package com.example.craftscore.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A project post together with its automated score.
 */
@Document(collection = "scored_projects")
public record ScoredProject(
        @Id String projectId,
        String userId,
        CraftType craftType,
        Instant createdAt,
        ProjectScoringResult scoring
) {
    public int individualSkillScore() {
        return scoring != null ? scoring.individualSkillScore() : 0;
    }
}
