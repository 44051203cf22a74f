package com.prmanager.backend.modules.review.infrastructure.persistence;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.prmanager.backend.modules.review.application.ReviewStorage;
import com.prmanager.backend.modules.review.domain.PullRequest;
import com.prmanager.backend.modules.review.domain.ReviewerAssignment;
import com.prmanager.backend.modules.team.domain.AppUser;
import com.prmanager.backend.modules.team.infrastructure.persistence.AppUserRepository;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@Transactional
public class JpaReviewStorage implements ReviewStorage {

    private final AppUserRepository appUserRepository;
    private final PullRequestRepository pullRequestRepository;
    private final ReviewerAssignmentRepository reviewerAssignmentRepository;
    private final Clock clock;

    public JpaReviewStorage(
            AppUserRepository appUserRepository,
            PullRequestRepository pullRequestRepository,
            ReviewerAssignmentRepository reviewerAssignmentRepository,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.pullRequestRepository = pullRequestRepository;
        this.reviewerAssignmentRepository = reviewerAssignmentRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AppUser> findUser(Long userId) {
        return appUserRepository.findById(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AppUser> findActiveTeamMembers(Long teamId) {
        return appUserRepository.findActiveByTeamId(teamId);
    }

    @Override
    public PullRequest createPullRequest(String title, AppUser author) {
        return pullRequestRepository.saveAndFlush(new PullRequest(title, author));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PullRequest> findPullRequest(Long pullRequestId) {
        return pullRequestRepository.findById(pullRequestId);
    }

    @Override
    public Optional<PullRequest> findPullRequestForUpdate(Long pullRequestId) {
        return pullRequestRepository.findByIdForUpdate(pullRequestId);
    }

    @Override
    public PullRequest markMerged(PullRequest pullRequest) {
        pullRequest.markMerged();
        return pullRequestRepository.saveAndFlush(pullRequest);
    }

    @Override
    public void assignReviewers(Long pullRequestId, Collection<Long> reviewerIds) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        for (Long reviewerId : new LinkedHashSet<>(reviewerIds)) {
            reviewerAssignmentRepository.insertIfAbsent(pullRequestId, reviewerId, now);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<AppUser> findReviewers(Long pullRequestId) {
        return reviewerAssignmentRepository.findReviewers(pullRequestId);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<Long, List<AppUser>> findReviewersByPullRequest(Collection<Long> pullRequestIds) {
        if (pullRequestIds.isEmpty()) {
            return Map.of();
        }
        Map<Long, List<AppUser>> grouped = new LinkedHashMap<>();
        for (ReviewerAssignment assignment : reviewerAssignmentRepository.findWithReviewers(pullRequestIds)) {
            grouped.computeIfAbsent(assignment.getId().getPullRequestId(), id -> new ArrayList<>())
                    .add(assignment.getReviewer());
        }
        return grouped;
    }

    @Override
    public boolean replaceReviewer(Long pullRequestId, Long oldReviewerId, Long newReviewerId) {
        int removed = reviewerAssignmentRepository.deletePair(pullRequestId, oldReviewerId);
        if (removed == 0) {
            return false;
        }
        int added = reviewerAssignmentRepository.insertIfAbsent(pullRequestId, newReviewerId, OffsetDateTime.now(clock));
        if (added == 0) {
            // rolls back the delete so the reviewer count stays unchanged
            throw new DataIntegrityViolationException(
                    "reviewer %d is already assigned to pull request %d".formatted(newReviewerId, pullRequestId));
        }
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<PullRequest> findPullRequestsReviewedBy(Long userId) {
        return pullRequestRepository.findReviewedBy(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public long countAssignments() {
        return reviewerAssignmentRepository.count();
    }
}
