package com.prmanager.backend.modules.review.application;

import java.util.Map;

import com.prmanager.backend.global.error.ErrorKind;
import com.prmanager.backend.global.error.ProblemException;

final class ReviewProblems {

    private ReviewProblems() {
    }

    static ProblemException authorNotFound(Long authorId) {
        return new ProblemException(ErrorKind.NOT_FOUND, "AUTHOR_NOT_FOUND",
                "author %d not found".formatted(authorId), Map.of("userId", authorId));
    }

    static ProblemException authorInactive(Long authorId) {
        return new ProblemException(ErrorKind.AUTHOR_INACTIVE, "AUTHOR_INACTIVE",
                "author %d is not active".formatted(authorId), Map.of("userId", authorId));
    }

    static ProblemException pullRequestNotFound(Long pullRequestId) {
        return new ProblemException(ErrorKind.NOT_FOUND, "PR_NOT_FOUND",
                "pull request %d not found".formatted(pullRequestId), Map.of("pullRequestId", pullRequestId));
    }

    static ProblemException userNotFound(Long userId) {
        return new ProblemException(ErrorKind.NOT_FOUND, "USER_NOT_FOUND",
                "user %d not found".formatted(userId), Map.of("userId", userId));
    }

    static ProblemException reviewerWithoutTeam(Long pullRequestId, Long userId) {
        return new ProblemException(ErrorKind.BAD_REQUEST, "REVIEWER_WITHOUT_TEAM",
                "reviewer %d has no team".formatted(userId),
                Map.of("pullRequestId", pullRequestId, "userId", userId));
    }

    static ProblemException notAssigned(Long pullRequestId, Long userId) {
        return new ProblemException(ErrorKind.NOT_ASSIGNED, "NOT_ASSIGNED",
                "user %d is not a reviewer of pull request %d".formatted(userId, pullRequestId),
                Map.of("pullRequestId", pullRequestId, "userId", userId));
    }

    static ProblemException noCandidate(Long pullRequestId, Long userId, Long teamId) {
        return new ProblemException(ErrorKind.NO_CANDIDATE, "NO_CANDIDATE",
                "no active replacement candidate in team %d".formatted(teamId),
                Map.of("pullRequestId", pullRequestId, "userId", userId, "teamId", teamId));
    }
}
