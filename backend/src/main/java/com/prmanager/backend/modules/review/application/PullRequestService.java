package com.prmanager.backend.modules.review.application;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.prmanager.backend.modules.review.domain.PullRequest;
import com.prmanager.backend.modules.review.domain.PullRequestLifecycle;
import com.prmanager.backend.modules.review.domain.ReviewerEligibility;
import com.prmanager.backend.modules.review.presentation.dto.PullRequestResponse;
import com.prmanager.backend.modules.team.domain.AppUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creation, reviewer reassignment and merge of pull requests.
 * Every flow re-reads the reviewer set from storage before answering.
 */
@Service
@Transactional
public class PullRequestService {

    static final int TARGET_REVIEWER_COUNT = 2;

    private static final Logger log = LoggerFactory.getLogger(PullRequestService.class);

    private final ReviewStorage reviewStorage;
    private final ReviewerSampler reviewerSampler;

    public PullRequestService(ReviewStorage reviewStorage, ReviewerSampler reviewerSampler) {
        this.reviewStorage = reviewStorage;
        this.reviewerSampler = reviewerSampler;
    }

    public PullRequestResponse createPullRequest(String title, Long authorId) {
        AppUser author = reviewStorage.findUser(authorId)
                .orElseThrow(() -> ReviewProblems.authorNotFound(authorId));
        if (!author.isActive()) {
            throw ReviewProblems.authorInactive(authorId);
        }

        PullRequest pullRequest = reviewStorage.createPullRequest(title, author);

        if (!author.hasTeam()) {
            log.info("Pull request {} created without reviewers; author {} has no team", pullRequest.getId(), authorId);
            return PullRequestResponse.of(pullRequest, List.of());
        }

        List<AppUser> candidates = ReviewerEligibility.forCreation(
                reviewStorage.findActiveTeamMembers(author.getTeamId()),
                authorId
        );
        int target = Math.min(TARGET_REVIEWER_COUNT, candidates.size());

        List<Long> chosenIds = List.of();
        if (target > 0) {
            int[] picked = reviewerSampler.sampleIndices(candidates.size(), target);
            chosenIds = Arrays.stream(picked)
                    .mapToObj(index -> candidates.get(index).getId())
                    .toList();
            reviewStorage.assignReviewers(pullRequest.getId(), chosenIds);
        }

        List<AppUser> reviewers = reviewStorage.findReviewers(pullRequest.getId());
        log.info("Pull request {} created by {} with reviewers {} (pool {})",
                pullRequest.getId(), authorId, chosenIds, candidates.size());
        return PullRequestResponse.of(pullRequest, reviewers);
    }

    public PullRequestResponse reassignReviewer(Long pullRequestId, Long oldReviewerId) {
        PullRequest pullRequest = reviewStorage.findPullRequestForUpdate(pullRequestId)
                .orElseThrow(() -> ReviewProblems.pullRequestNotFound(pullRequestId));
        PullRequestLifecycle.ensureReassignable(pullRequest);

        AppUser oldReviewer = reviewStorage.findUser(oldReviewerId)
                .orElseThrow(() -> ReviewProblems.userNotFound(oldReviewerId));
        if (!oldReviewer.hasTeam()) {
            throw ReviewProblems.reviewerWithoutTeam(pullRequestId, oldReviewerId);
        }

        Set<Long> currentReviewerIds = reviewStorage.findReviewers(pullRequestId).stream()
                .map(AppUser::getId)
                .collect(Collectors.toSet());
        if (!currentReviewerIds.contains(oldReviewerId)) {
            throw ReviewProblems.notAssigned(pullRequestId, oldReviewerId);
        }

        Long teamId = oldReviewer.getTeamId();
        List<AppUser> candidates = ReviewerEligibility.forReassignment(
                reviewStorage.findActiveTeamMembers(teamId),
                pullRequest.getAuthorId(),
                oldReviewerId,
                currentReviewerIds
        );
        if (candidates.isEmpty()) {
            throw ReviewProblems.noCandidate(pullRequestId, oldReviewerId, teamId);
        }

        AppUser replacement = candidates.get(reviewerSampler.pickIndex(candidates.size()));
        if (!reviewStorage.replaceReviewer(pullRequestId, oldReviewerId, replacement.getId())) {
            throw ReviewProblems.notAssigned(pullRequestId, oldReviewerId);
        }

        List<AppUser> reviewers = reviewStorage.findReviewers(pullRequestId);
        log.info("Pull request {} reviewer {} replaced by {} ({})",
                pullRequestId, oldReviewerId, replacement.getId(), replacement.getName());
        return PullRequestResponse.of(pullRequest, reviewers);
    }

    public PullRequestResponse mergePullRequest(Long pullRequestId) {
        PullRequest pullRequest = reviewStorage.findPullRequestForUpdate(pullRequestId)
                .orElseThrow(() -> ReviewProblems.pullRequestNotFound(pullRequestId));

        PullRequest result = switch (PullRequestLifecycle.decideMerge(pullRequest)) {
            case ALREADY_MERGED -> {
                log.info("Pull request {} already merged", pullRequestId);
                yield pullRequest;
            }
            case TRANSITION -> {
                PullRequest merged = reviewStorage.markMerged(pullRequest);
                log.info("Pull request {} merged", pullRequestId);
                yield merged;
            }
        };

        return PullRequestResponse.of(result, reviewStorage.findReviewers(pullRequestId));
    }
}
