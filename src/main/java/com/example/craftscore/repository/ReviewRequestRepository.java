package com.example.craftscore.repository;

import com.example.craftscore.model.ReviewRequest;
import com.example.craftscore.model.ReviewStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Human review queue (collection review_requests).
 */
public interface ReviewRequestRepository extends MongoRepository<ReviewRequest, String> {

    List<ReviewRequest> findByStatusIn(Collection<ReviewStatus> statuses);

    List<ReviewRequest> findByAssignedReviewerIdAndStatusIn(String reviewerId, Collection<ReviewStatus> statuses);

    Optional<ReviewRequest> findFirstByProjectIdOrderByRequestedAtDesc(String projectId);
}
