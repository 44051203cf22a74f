package com.prmanager.backend.modules.review.domain;

import java.io.Serializable;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class ReviewerAssignmentId implements Serializable {

    @Column(name = "pull_request_id", nullable = false)
    private Long pullRequestId;

    @Column(name = "reviewer_id", nullable = false)
    private Long reviewerId;

    protected ReviewerAssignmentId() {
    }

    public ReviewerAssignmentId(Long pullRequestId, Long reviewerId) {
        this.pullRequestId = pullRequestId;
        this.reviewerId = reviewerId;
    }

    public Long getPullRequestId() {
        return pullRequestId;
    }

    public Long getReviewerId() {
        return reviewerId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReviewerAssignmentId that)) return false;
        return Objects.equals(pullRequestId, that.pullRequestId) && Objects.equals(reviewerId, that.reviewerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pullRequestId, reviewerId);
    }
}
