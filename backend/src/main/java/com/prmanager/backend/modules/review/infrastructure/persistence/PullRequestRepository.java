package com.prmanager.backend.modules.review.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import jakarta.persistence.LockModeType;

import com.prmanager.backend.modules.review.domain.PullRequest;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PullRequestRepository extends JpaRepository<PullRequest, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select pr from PullRequest pr where pr.id = :id")
    Optional<PullRequest> findByIdForUpdate(@Param("id") Long id);

    @Query("""
            select pr
              from ReviewerAssignment a
              join a.pullRequest pr
             where a.id.reviewerId = :reviewerId
             order by pr.id
            """)
    List<PullRequest> findReviewedBy(@Param("reviewerId") Long reviewerId);
}
