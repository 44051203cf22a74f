package com.prmanager.backend.modules.review.application;

import java.util.List;
import java.util.Map;

import com.prmanager.backend.modules.review.domain.PullRequest;
import com.prmanager.backend.modules.review.presentation.dto.AssignmentStatsResponse;
import com.prmanager.backend.modules.review.presentation.dto.PullRequestResponse;
import com.prmanager.backend.modules.team.domain.AppUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class ReviewQueryService {

    private static final Logger log = LoggerFactory.getLogger(ReviewQueryService.class);

    private final ReviewStorage reviewStorage;

    public ReviewQueryService(ReviewStorage reviewStorage) {
        this.reviewStorage = reviewStorage;
    }

    public PullRequestResponse getPullRequest(Long pullRequestId) {
        PullRequest pullRequest = reviewStorage.findPullRequest(pullRequestId)
                .orElseThrow(() -> ReviewProblems.pullRequestNotFound(pullRequestId));
        return PullRequestResponse.of(pullRequest, reviewStorage.findReviewers(pullRequestId));
    }

    public List<PullRequestResponse> listAssignedPullRequests(Long userId) {
        if (reviewStorage.findUser(userId).isEmpty()) {
            throw ReviewProblems.userNotFound(userId);
        }
        List<PullRequest> pullRequests = reviewStorage.findPullRequestsReviewedBy(userId);
        Map<Long, List<AppUser>> reviewersByPullRequest = reviewStorage.findReviewersByPullRequest(
                pullRequests.stream().map(PullRequest::getId).toList());
        List<PullRequestResponse> result = pullRequests.stream()
                .map(pullRequest -> PullRequestResponse.of(
                        pullRequest, reviewersByPullRequest.getOrDefault(pullRequest.getId(), List.of())))
                .toList();
        log.debug("User {} reviews {} pull requests", userId, result.size());
        return result;
    }

    public AssignmentStatsResponse assignmentStats() {
        return new AssignmentStatsResponse(reviewStorage.countAssignments());
    }
}
