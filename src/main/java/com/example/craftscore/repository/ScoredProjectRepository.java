package com.example.craftscore.repository;

import com.example.craftscore.model.ScoredProject;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Project posts with their automated score (collection scored_projects).
 */
public interface ScoredProjectRepository extends MongoRepository<ScoredProject, String> {

    List<ScoredProject> findByUserIdOrderByCreatedAtDesc(String userId);
}
