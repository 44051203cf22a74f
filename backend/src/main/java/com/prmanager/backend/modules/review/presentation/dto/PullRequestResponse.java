package com.prmanager.backend.modules.review.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.prmanager.backend.modules.review.domain.PullRequest;
import com.prmanager.backend.modules.review.domain.PullRequestStatus;
import com.prmanager.backend.modules.team.domain.AppUser;
import com.prmanager.backend.modules.team.presentation.dto.UserResponse;

public record PullRequestResponse(
        Long id,
        String title,
        Long authorId,
        PullRequestStatus status,
        OffsetDateTime createdAt,
        List<UserResponse> reviewers
) {

    public static PullRequestResponse of(PullRequest pullRequest, List<AppUser> reviewers) {
        List<UserResponse> reviewerViews = reviewers.stream()
                .map(UserResponse::from)
                .toList();
        return new PullRequestResponse(
                pullRequest.getId(),
                pullRequest.getTitle(),
                pullRequest.getAuthorId(),
                pullRequest.getStatus(),
                pullRequest.getCreatedAt(),
                reviewerViews
        );
    }
}
