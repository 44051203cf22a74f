package com.prmanager.backend.modules.review.domain;

import java.util.Map;

import com.prmanager.backend.global.error.ErrorKind;
import com.prmanager.backend.global.error.ProblemException;

/**
 * Decides which operations the current status of a pull request allows.
 * Existence checks happen before the guard is consulted.
 */
public final class PullRequestLifecycle {

    public enum MergeDecision {
        TRANSITION,
        ALREADY_MERGED
    }

    private PullRequestLifecycle() {
    }

    public static boolean canReassign(PullRequestStatus status) {
        return status == PullRequestStatus.OPEN;
    }

    public static void ensureReassignable(PullRequest pullRequest) {
        if (!canReassign(pullRequest.getStatus())) {
            throw new ProblemException(
                    ErrorKind.PR_MERGED,
                    "PR_MERGED",
                    "pull request %d is merged; reviewers can no longer change".formatted(pullRequest.getId()),
                    Map.of("pullRequestId", pullRequest.getId())
            );
        }
    }

    public static MergeDecision decideMerge(PullRequest pullRequest) {
        PullRequestStatus status = pullRequest.getStatus();
        if (status == null) {
            throw new ProblemException(
                    ErrorKind.BAD_REQUEST,
                    "PR_STATUS_UNSUPPORTED",
                    "pull request %d has no recognised status; only OPEN pull requests can be merged".formatted(pullRequest.getId()),
                    Map.of("pullRequestId", pullRequest.getId())
            );
        }
        return switch (status) {
            case OPEN -> MergeDecision.TRANSITION;
            case MERGED -> MergeDecision.ALREADY_MERGED;
        };
    }
}
