package com.prmanager.backend.modules.review.domain;

/**
 * OPEN is the initial state, MERGED is terminal. There is no way back from MERGED.
 */
public enum PullRequestStatus {
    OPEN,
    MERGED
}
