package com.prmanager.backend.modules.review.domain;

import java.time.OffsetDateTime;

import com.prmanager.backend.modules.team.domain.AppUser;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.MapsId;
import jakarta.persistence.Table;

/**
 * (pull request, reviewer) pair. The pair is the identity, so a user can hold at most one
 * assignment per pull request.
 */
@Entity
@Table(name = "pull_request_reviewer")
public class ReviewerAssignment {

    @EmbeddedId
    private ReviewerAssignmentId id;

    @MapsId("pullRequestId")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pull_request_id", nullable = false)
    private PullRequest pullRequest;

    @MapsId("reviewerId")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "reviewer_id", nullable = false)
    private AppUser reviewer;

    @Column(name = "assigned_at", nullable = false)
    private OffsetDateTime assignedAt;

    protected ReviewerAssignment() {
    }

    public ReviewerAssignmentId getId() {
        return id;
    }

    public PullRequest getPullRequest() {
        return pullRequest;
    }

    public AppUser getReviewer() {
        return reviewer;
    }

    public OffsetDateTime getAssignedAt() {
        return assignedAt;
    }
}
