package com.prmanager.backend.modules.review.application;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.prmanager.backend.modules.review.domain.PullRequest;
import com.prmanager.backend.modules.team.domain.AppUser;

/**
 * Storage operations the reviewer assignment flows depend on.
 * Each call is atomic on its own; {@link #replaceReviewer} is the only multi-row write.
 * Failures surface as Spring {@code DataAccessException}s and are not interpreted here.
 */
public interface ReviewStorage {

    Optional<AppUser> findUser(Long userId);

    /**
     * Active members of the team, ordered by id.
     */
    List<AppUser> findActiveTeamMembers(Long teamId);

    PullRequest createPullRequest(String title, AppUser author);

    Optional<PullRequest> findPullRequest(Long pullRequestId);

    /**
     * Same as {@link #findPullRequest} but holds a row lock until the surrounding transaction
     * ends, so status checks and reviewer writes on one pull request do not interleave.
     */
    Optional<PullRequest> findPullRequestForUpdate(Long pullRequestId);

    PullRequest markMerged(PullRequest pullRequest);

    /**
     * Inserts the pairs; a pair that already exists is left alone.
     */
    void assignReviewers(Long pullRequestId, Collection<Long> reviewerIds);

    List<AppUser> findReviewers(Long pullRequestId);

    /**
     * Reviewers of several pull requests in one read, keyed by pull request id.
     * Pull requests without reviewers have no entry.
     */
    Map<Long, List<AppUser>> findReviewersByPullRequest(Collection<Long> pullRequestIds);

    /**
     * Removes (pullRequestId, oldReviewerId) and adds (pullRequestId, newReviewerId) in one
     * transaction.
     *
     * @return false when the old pair no longer exists; nothing is written in that case
     */
    boolean replaceReviewer(Long pullRequestId, Long oldReviewerId, Long newReviewerId);

    List<PullRequest> findPullRequestsReviewedBy(Long userId);

    long countAssignments();
}
