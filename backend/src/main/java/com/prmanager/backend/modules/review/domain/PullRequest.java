package com.prmanager.backend.modules.review.domain;

import com.prmanager.backend.global.jpa.AbstractTimestampedEntity;
import com.prmanager.backend.modules.team.domain.AppUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

@Entity
@Table(name = "pull_request")
public class PullRequest extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "author_id", nullable = false, updatable = false)
    private AppUser author;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PullRequestStatus status = PullRequestStatus.OPEN;

    protected PullRequest() {
    }

    public PullRequest(String title, AppUser author) {
        this.title = title;
        this.author = author;
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public AppUser getAuthor() {
        return author;
    }

    public Long getAuthorId() {
        return author.getId();
    }

    public PullRequestStatus getStatus() {
        return status;
    }

    /**
     * Forward-only transition. Callers consult {@link PullRequestLifecycle#decideMerge} first.
     */
    public void markMerged() {
        if (status != PullRequestStatus.OPEN) {
            throw new IllegalStateException("Only OPEN pull requests can be merged, was " + status);
        }
        this.status = PullRequestStatus.MERGED;
    }
}
