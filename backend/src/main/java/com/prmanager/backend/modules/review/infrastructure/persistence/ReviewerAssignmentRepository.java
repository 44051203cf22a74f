package com.prmanager.backend.modules.review.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

import com.prmanager.backend.modules.review.domain.ReviewerAssignment;
import com.prmanager.backend.modules.review.domain.ReviewerAssignmentId;
import com.prmanager.backend.modules.team.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ReviewerAssignmentRepository extends JpaRepository<ReviewerAssignment, ReviewerAssignmentId> {

    @Query("""
            select u
              from ReviewerAssignment a
              join a.reviewer u
             where a.id.pullRequestId = :pullRequestId
             order by u.id
            """)
    List<AppUser> findReviewers(@Param("pullRequestId") Long pullRequestId);

    @Query("""
            select a
              from ReviewerAssignment a
              join fetch a.reviewer u
             where a.id.pullRequestId in :pullRequestIds
             order by a.id.pullRequestId, u.id
            """)
    List<ReviewerAssignment> findWithReviewers(@Param("pullRequestIds") Collection<Long> pullRequestIds);

    @Modifying(flushAutomatically = true)
    @Query(value = """
            insert into pull_request_reviewer (pull_request_id, reviewer_id, assigned_at)
            values (:pullRequestId, :reviewerId, :assignedAt)
            on conflict (pull_request_id, reviewer_id) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("pullRequestId") Long pullRequestId,
            @Param("reviewerId") Long reviewerId,
            @Param("assignedAt") OffsetDateTime assignedAt
    );

    @Modifying(flushAutomatically = true)
    @Query("""
            delete from ReviewerAssignment a
             where a.id.pullRequestId = :pullRequestId
               and a.id.reviewerId = :reviewerId
            """)
    int deletePair(@Param("pullRequestId") Long pullRequestId, @Param("reviewerId") Long reviewerId);
}
